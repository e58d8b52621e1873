package com.github.dimitryivaniuta.edgeguard.protection.ratelimit;

/**
 * One rate-limit check for the subject {@code key} inside {@code namespace}.
 *
 * @param disabled        bypass all checks (test / diagnostic deployments)
 * @param localMaxEntries bound of the in-memory window map for this namespace
 */
public record RateLimitRequest(
        String namespace,
        String key,
        long windowMs,
        int maxRequests,
        boolean disabled,
        int localMaxEntries
) {
    public RateLimitRequest {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        if (key == null) {
            throw new IllegalArgumentException("key must not be null");
        }
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs must be > 0");
        }
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be > 0");
        }
        if (localMaxEntries <= 0) {
            throw new IllegalArgumentException("localMaxEntries must be > 0");
        }
    }
}
