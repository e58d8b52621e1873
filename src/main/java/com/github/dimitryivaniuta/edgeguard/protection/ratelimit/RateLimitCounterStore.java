package com.github.dimitryivaniuta.edgeguard.protection.ratelimit;

/**
 * Backing store for fixed-window counters: counts one hit and decides.
 */
public interface RateLimitCounterStore {

    RateLimitDecision hit(RateLimitRequest request);
}
