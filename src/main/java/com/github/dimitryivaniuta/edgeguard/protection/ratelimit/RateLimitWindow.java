package com.github.dimitryivaniuta.edgeguard.protection.ratelimit;

/**
 * Fixed-window counter for one (namespace, key). Mutated only under the owning store's lock.
 */
final class RateLimitWindow {

    private int count;
    private long windowStartMs;

    RateLimitWindow(long nowMs) {
        this.count = 1;
        this.windowStartMs = nowMs;
    }

    boolean isExpired(long nowMs, long windowMs) {
        return nowMs - windowStartMs > windowMs;
    }

    void restart(long nowMs) {
        // windowStartMs only ever moves forward
        if (nowMs > windowStartMs) {
            windowStartMs = nowMs;
        }
        count = 1;
    }

    int increment() {
        if (count < Integer.MAX_VALUE) {
            count++;
        }
        return count;
    }

    int count() {
        return count;
    }

    long windowStartMs() {
        return windowStartMs;
    }
}
