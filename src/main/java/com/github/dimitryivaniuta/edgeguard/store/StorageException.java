package com.github.dimitryivaniuta.edgeguard.store;

public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
