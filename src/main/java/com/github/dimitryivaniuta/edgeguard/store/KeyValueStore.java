package com.github.dimitryivaniuta.edgeguard.store;

import java.util.Optional;

/**
 * Minimal string key-value store behind the sync and push endpoints.
 *
 * <p>Implementations throw {@link StorageException} when the backend is unreachable.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void set(String key, String value);

    void delete(String key);
}
