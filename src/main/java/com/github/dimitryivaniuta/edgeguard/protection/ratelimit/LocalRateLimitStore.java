package com.github.dimitryivaniuta.edgeguard.protection.ratelimit;

import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process fixed-window counters, one insertion-ordered map per namespace.
 *
 * <p>Each namespace map is bounded by the request's {@code localMaxEntries}: before a new key is
 * inserted into a full map, the single oldest-inserted key is evicted. This is a simple bounded
 * map, not LRU-by-access; a window restart keeps the key's original position.
 */
public final class LocalRateLimitStore implements RateLimitCounterStore {

    private final Clock clock;
    private final Map<String, LinkedHashMap<String, RateLimitWindow>> namespaces = new ConcurrentHashMap<>();

    public LocalRateLimitStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public RateLimitDecision hit(RateLimitRequest request) {
        LinkedHashMap<String, RateLimitWindow> store =
                namespaces.computeIfAbsent(request.namespace(), ns -> new LinkedHashMap<>());

        synchronized (store) {
            long now = clock.millis();
            RateLimitWindow window = store.get(request.key());

            if (window == null) {
                evictOldestIfFull(store, request.localMaxEntries());
                store.put(request.key(), new RateLimitWindow(now));
                return RateLimitDecision.allowed();
            }

            if (window.isExpired(now, request.windowMs())) {
                window.restart(now);
                return RateLimitDecision.allowed();
            }

            if (window.increment() > request.maxRequests()) {
                long resetAt = window.windowStartMs() + request.windowMs();
                return RateLimitDecision.limited(RateLimitDecision.secondsUntil(resetAt, now));
            }
            return RateLimitDecision.allowed();
        }
    }

    int size(String namespace) {
        LinkedHashMap<String, RateLimitWindow> store = namespaces.get(namespace);
        if (store == null) return 0;
        synchronized (store) {
            return store.size();
        }
    }

    boolean contains(String namespace, String key) {
        LinkedHashMap<String, RateLimitWindow> store = namespaces.get(namespace);
        if (store == null) return false;
        synchronized (store) {
            return store.containsKey(key);
        }
    }

    private static void evictOldestIfFull(LinkedHashMap<String, RateLimitWindow> store, int maxEntries) {
        while (store.size() >= maxEntries) {
            Iterator<String> it = store.keySet().iterator();
            if (!it.hasNext()) return;
            it.next();
            it.remove();
        }
    }
}
