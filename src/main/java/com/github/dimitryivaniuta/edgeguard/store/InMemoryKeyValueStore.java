package com.github.dimitryivaniuta.edgeguard.store;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local store, used when Redis is not enabled. Data does not survive a restart.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final ConcurrentMap<String, String> data = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(data.get(key));
    }

    @Override
    public void set(String key, String value) {
        data.put(key, Objects.requireNonNull(value, "value must not be null"));
    }

    @Override
    public void delete(String key) {
        data.remove(key);
    }
}
