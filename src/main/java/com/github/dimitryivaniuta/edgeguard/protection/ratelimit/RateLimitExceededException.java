package com.github.dimitryivaniuta.edgeguard.protection.ratelimit;

import lombok.Getter;

/**
 * Throttled request: rate budget exhausted or upstream quota cooldown active. Mapped to 429 + Retry-After.
 */
@Getter
public class RateLimitExceededException extends RuntimeException {

    private final long retryAfterSeconds;
    private final String details;

    public RateLimitExceededException(String message, long retryAfterSeconds) {
        this(message, retryAfterSeconds, null);
    }

    public RateLimitExceededException(String message, long retryAfterSeconds, String details) {
        super(message);
        this.retryAfterSeconds = Math.max(1, retryAfterSeconds);
        this.details = details;
    }
}
