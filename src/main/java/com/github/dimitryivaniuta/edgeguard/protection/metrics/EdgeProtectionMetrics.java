package com.github.dimitryivaniuta.edgeguard.protection.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

public class EdgeProtectionMetrics {

    private final MeterRegistry registry;

    public EdgeProtectionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- Rate limiting ----
    public void rateLimitRejected(String namespace) {
        Counter.builder("edge_ratelimit_rejected_total")
                .tag("namespace", namespace)
                .register(registry)
                .increment();
    }

    public void rateLimitAllowed(String namespace) {
        Counter.builder("edge_ratelimit_allowed_total")
                .tag("namespace", namespace)
                .register(registry)
                .increment();
    }

    public void rateLimitStoreFallback(String namespace) {
        Counter.builder("edge_ratelimit_store_fallback_total")
                .tag("namespace", namespace)
                .register(registry)
                .increment();
    }

    // ---- CORS ----
    public void corsRejected() {
        Counter.builder("edge_cors_rejected_total")
                .register(registry)
                .increment();
    }

    // ---- Response cache ----
    public void cacheHit() {
        Counter.builder("edge_response_cache_hits_total")
                .register(registry)
                .increment();
    }

    public void cacheMiss() {
        Counter.builder("edge_response_cache_misses_total")
                .register(registry)
                .increment();
    }

    // ---- Quota breaker ----
    public void breakerTripped() {
        Counter.builder("edge_quota_breaker_tripped_total")
                .register(registry)
                .increment();
    }

    public void breakerShortCircuited() {
        Counter.builder("edge_quota_breaker_short_circuited_total")
                .register(registry)
                .increment();
    }

    // ---- Upstream ----
    public void recordUpstream(String outcome, long nanos) {
        Timer.builder("edge_upstream_duration_seconds")
                .tag("outcome", outcome) // success | quota_exhausted | timeout | other | rejected
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }
}
