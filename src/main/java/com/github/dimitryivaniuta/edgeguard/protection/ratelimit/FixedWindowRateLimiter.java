package com.github.dimitryivaniuta.edgeguard.protection.ratelimit;

import com.github.dimitryivaniuta.edgeguard.protection.metrics.EdgeProtectionMetrics;
import lombok.extern.slf4j.Slf4j;

/**
 * Fixed-window rate limiter keyed by (namespace, key).
 *
 * <p>Uses the distributed counter store when one is configured and the local store otherwise, or when
 * the distributed store fails. Fixed windows can admit up to {@code 2 x maxRequests} across a window
 * boundary; that is accepted for abuse prevention.
 */
@Slf4j
public class FixedWindowRateLimiter {

    private final LocalRateLimitStore localStore;
    private final RateLimitCounterStore distributedStore;
    private final EdgeProtectionMetrics metrics;

    public FixedWindowRateLimiter(LocalRateLimitStore localStore,
                                  RateLimitCounterStore distributedStore,
                                  EdgeProtectionMetrics metrics) {
        this.localStore = localStore;
        this.distributedStore = distributedStore; // nullable: local only
        this.metrics = metrics;
    }

    public RateLimitDecision check(RateLimitRequest request) {
        if (request.disabled()) return RateLimitDecision.allowed();

        RateLimitDecision decision = decide(request);
        if (decision.limited()) {
            metrics.rateLimitRejected(request.namespace());
        } else {
            metrics.rateLimitAllowed(request.namespace());
        }
        return decision;
    }

    private RateLimitDecision decide(RateLimitRequest request) {
        if (distributedStore == null) {
            return localStore.hit(request);
        }
        try {
            return distributedStore.hit(request);
        } catch (RuntimeException ex) {
            log.warn("Distributed rate-limit store failed for namespace={}, using local counters: {}",
                    request.namespace(), ex.toString());
            metrics.rateLimitStoreFallback(request.namespace());
            return localStore.hit(request);
        }
    }
}
