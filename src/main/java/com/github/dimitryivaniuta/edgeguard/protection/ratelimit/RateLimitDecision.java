package com.github.dimitryivaniuta.edgeguard.protection.ratelimit;

public record RateLimitDecision(boolean limited, long retryAfterSec) {

    private static final RateLimitDecision ALLOWED = new RateLimitDecision(false, 0);

    public static RateLimitDecision allowed() {
        return ALLOWED;
    }

    public static RateLimitDecision limited(long retryAfterSec) {
        return new RateLimitDecision(true, Math.max(1, retryAfterSec));
    }

    /**
     * Seconds until {@code resetAtMs}, rounded up and never below 1.
     */
    static long secondsUntil(long resetAtMs, long nowMs) {
        long remainingMs = Math.max(0, resetAtMs - nowMs);
        return Math.max(1, (remainingMs + 999) / 1000);
    }
}
