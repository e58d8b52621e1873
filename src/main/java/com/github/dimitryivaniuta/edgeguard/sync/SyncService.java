package com.github.dimitryivaniuta.edgeguard.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.edgeguard.store.KeyValueStore;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Last-write-wins storage of the encrypted sync document, keyed by the client's sync key hash.
 *
 * <p>Compare-and-write for one key is serialized inside this process through a fixed set of lock
 * stripes. The store itself only offers get/set/delete, so two instances writing the same key can
 * still interleave.
 */
@Slf4j
public class SyncService {

    static final String KEY_PREFIX = "sync_data:";
    private static final int STRIPES = 64;

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final Object[] locks = new Object[STRIPES];

    public SyncService(KeyValueStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new Object();
        }
    }

    public Optional<String> load(String keyHash) {
        return store.get(KEY_PREFIX + keyHash);
    }

    public SyncOutcome save(String keyHash, SyncPayload payload) {
        String key = KEY_PREFIX + keyHash;
        String document = serialize(payload);

        synchronized (lockFor(key)) {
            Optional<String> current = store.get(key);
            if (current.isEmpty()) {
                store.set(key, document);
                return SyncOutcome.stored();
            }

            BigDecimal storedTs = readLastModified(current.get());
            if (storedTs == null) {
                log.warn("Stored sync document is unreadable, overwriting it");
                store.set(key, document);
                return SyncOutcome.stored();
            }

            int cmp = payload.lastModified().compareTo(storedTs);
            if (cmp == 0) return SyncOutcome.notModified();
            if (cmp < 0) return SyncOutcome.conflict(current.get());

            store.set(key, document);
            return SyncOutcome.stored();
        }
    }

    // null when the stored value is corrupt or carries no usable timestamp
    private BigDecimal readLastModified(String stored) {
        try {
            JsonNode node = objectMapper.readTree(stored);
            if (node == null || !node.isObject()) return null;
            JsonNode ts = node.get("lastModified");
            if (ts == null) return null;
            if (ts.isNumber()) return ts.decimalValue();
            if (ts.isTextual()) return new BigDecimal(ts.textValue().trim());
            return null;
        } catch (JsonProcessingException | NumberFormatException ex) {
            return null;
        }
    }

    private String serialize(SyncPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload.document());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize sync payload", ex);
        }
    }

    private Object lockFor(String key) {
        return locks[Math.floorMod(key.hashCode(), STRIPES)];
    }
}
