package com.github.dimitryivaniuta.edgeguard.store;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Optional;

@RequiredArgsConstructor
public class RedisKeyValueStore implements KeyValueStore {

    private final StringRedisTemplate redis;

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redis.opsForValue().get(key));
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to read key " + key, ex);
        }
    }

    @Override
    public void set(String key, String value) {
        try {
            redis.opsForValue().set(key, value);
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to write key " + key, ex);
        }
    }

    @Override
    public void delete(String key) {
        try {
            redis.delete(key);
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to delete key " + key, ex);
        }
    }
}
