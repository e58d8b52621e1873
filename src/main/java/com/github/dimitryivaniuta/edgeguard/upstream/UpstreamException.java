package com.github.dimitryivaniuta.edgeguard.upstream;

import lombok.Getter;

/**
 * Provider-side failure carrying what the provider reported: HTTP status and its own status code
 * (e.g. {@code RESOURCE_EXHAUSTED}). The message is raw provider text and must be sanitized before
 * it is echoed to a client.
 */
@Getter
public class UpstreamException extends RuntimeException {

    private final int status;
    private final String providerStatus;

    public UpstreamException(int status, String providerStatus, String message) {
        super(message);
        this.status = status;
        this.providerStatus = providerStatus;
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.providerStatus = null;
    }
}
