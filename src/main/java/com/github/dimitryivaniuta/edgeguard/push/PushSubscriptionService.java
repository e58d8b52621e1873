package com.github.dimitryivaniuta.edgeguard.push;

import com.github.dimitryivaniuta.edgeguard.store.KeyValueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class PushSubscriptionService {

    static final String KEY_PREFIX = "push_sub:";

    private final KeyValueStore store;

    /**
     * Drops the stored subscription of this sync key. Idempotent: a missing subscription is not an error.
     */
    public void unsubscribe(String keyHash) {
        store.delete(KEY_PREFIX + keyHash);
        log.debug("Push subscription removed");
    }
}
