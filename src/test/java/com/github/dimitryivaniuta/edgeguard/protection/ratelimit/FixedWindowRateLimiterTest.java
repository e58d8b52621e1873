package com.github.dimitryivaniuta.edgeguard.protection.ratelimit;

import com.github.dimitryivaniuta.edgeguard.infra.MutableClock;
import com.github.dimitryivaniuta.edgeguard.protection.metrics.EdgeProtectionMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class FixedWindowRateLimiterTest {

    private SimpleMeterRegistry registry;
    private EdgeProtectionMetrics metrics;
    private LocalRateLimitStore local;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new EdgeProtectionMetrics(registry);
        local = new LocalRateLimitStore(new MutableClock(0));
    }

    @Test
    void disabledAlwaysAllowsAndTouchesNoStore() {
        RateLimitCounterStore distributed = mock(RateLimitCounterStore.class);
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter(local, distributed, metrics);

        RateLimitRequest req = new RateLimitRequest("analyze", "ip", 60_000, 1, true, 10);
        for (int i = 0; i < 5; i++) {
            assertThat(limiter.check(req).limited()).isFalse();
        }
        verifyNoInteractions(distributed);
        assertThat(local.size("analyze")).isZero();
    }

    @Test
    void localOnlyCountsAndRecordsMetrics() {
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter(local, null, metrics);
        RateLimitRequest req = new RateLimitRequest("analyze", "ip", 60_000, 1, false, 10);

        assertThat(limiter.check(req).limited()).isFalse();
        assertThat(limiter.check(req).limited()).isTrue();

        assertThat(registry.counter("edge_ratelimit_allowed_total", "namespace", "analyze").count()).isEqualTo(1.0);
        assertThat(registry.counter("edge_ratelimit_rejected_total", "namespace", "analyze").count()).isEqualTo(1.0);
    }

    @Test
    void usesDistributedStoreWhenHealthy() {
        RateLimitCounterStore distributed = mock(RateLimitCounterStore.class);
        when(distributed.hit(any())).thenReturn(RateLimitDecision.limited(12));
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter(local, distributed, metrics);

        RateLimitDecision d = limiter.check(new RateLimitRequest("sync", "ip", 60_000, 5, false, 10));

        assertThat(d.limited()).isTrue();
        assertThat(d.retryAfterSec()).isEqualTo(12);
        assertThat(local.size("sync")).isZero();
    }

    @Test
    void fallsBackToLocalWhenDistributedStoreFails() {
        RateLimitCounterStore distributed = mock(RateLimitCounterStore.class);
        when(distributed.hit(any())).thenThrow(new RedisConnectionFailureException("down"));
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter(local, distributed, metrics);
        RateLimitRequest req = new RateLimitRequest("sync", "ip", 60_000, 1, false, 10);

        assertThat(limiter.check(req).limited()).isFalse();
        assertThat(limiter.check(req).limited()).isTrue();

        assertThat(local.contains("sync", "ip")).isTrue();
        assertThat(registry.counter("edge_ratelimit_store_fallback_total", "namespace", "sync").count()).isEqualTo(2.0);
    }
}
