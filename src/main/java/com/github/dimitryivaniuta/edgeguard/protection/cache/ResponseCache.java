package com.github.dimitryivaniuta.edgeguard.protection.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Policy;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Short-lived memo of upstream answers, keyed by {@link #fingerprint(String, String, String)}.
 *
 * <p>An entry is visible while {@code now - insertedAt <= ttl}; stale entries read as absent and are
 * dropped by Caffeine on access. Size is bounded by {@code maxEntries}: inserting a new key into a full
 * cache first drops expired entries, then the oldest-written ones. Reads never change that order.
 *
 * IMPORTANT:
 * The cache reads time from the injected {@link Clock} (through a Caffeine ticker), so the same clock
 * must drive tests and the rest of the protection layer.
 */
public final class ResponseCache {

    private final Cache<String, String> cache;
    private final Policy.FixedExpiration<String, String> writeOrder;
    private final int maxEntries;

    public ResponseCache(Clock clock, Duration ttl, int maxEntries) {
        this(clock, ttl, maxEntries, null);
    }

    /**
     * @param maintenanceExecutor executor for Caffeine's eviction work; {@code null} keeps the default
     */
    public ResponseCache(Clock clock, Duration ttl, int maxEntries, Executor maintenanceExecutor) {
        Objects.requireNonNull(clock, "clock must not be null");
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0");
        }

        // no maximumSize: its W-TinyLFU policy may evict the newest entry
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                // Caffeine expires at age >= ttl; entries stay visible through age == ttl
                .expireAfterWrite(ttl.plusMillis(1))
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()));
        if (maintenanceExecutor != null) {
            builder = builder.executor(maintenanceExecutor);
        }
        this.cache = builder.build();
        this.writeOrder = cache.policy().expireAfterWrite().orElseThrow();
        this.maxEntries = maxEntries;
    }

    public Optional<String> get(String key) {
        if (key == null) return Optional.empty();
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    public synchronized void set(String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        if (!cache.asMap().containsKey(key)) {
            makeRoomForOne();
        }
        cache.put(key, value);
    }

    private void makeRoomForOne() {
        if (cache.estimatedSize() < maxEntries) return;
        cache.cleanUp();
        long excess = cache.estimatedSize() - maxEntries + 1;
        if (excess > 0) {
            cache.invalidateAll(writeOrder.oldest((int) excess).keySet());
        }
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    /**
     * Stable SHA-256 hex digest over model, prompt and system instruction.
     * The key can be logged without exposing the prompt, but the hash is not content protection.
     */
    public static String fingerprint(String model, String prompt, String systemInstruction) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            // NUL separators keep ("ab","c") and ("a","bc") apart
            String material = nullToEmpty(model) + '\u0000' + nullToEmpty(prompt) + '\u0000' + nullToEmpty(systemInstruction);
            return HexFormat.of().formatHex(md.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
