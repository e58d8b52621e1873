package com.github.dimitryivaniuta.edgeguard.protection;

import com.github.dimitryivaniuta.edgeguard.protection.breaker.QuotaCooldownBreaker;
import com.github.dimitryivaniuta.edgeguard.protection.cache.ResponseCache;
import com.github.dimitryivaniuta.edgeguard.protection.ip.ClientIpResolver;
import com.github.dimitryivaniuta.edgeguard.protection.metrics.EdgeProtectionMetrics;
import com.github.dimitryivaniuta.edgeguard.protection.ratelimit.FixedWindowRateLimiter;

/**
 * The protection state of one process: limiter windows, response cache and quota breaker.
 * Built once at startup and shared by every request; tests build their own with a fake clock.
 */
public record EdgeProtectionContext(
        FixedWindowRateLimiter rateLimiter,
        ResponseCache responseCache,
        QuotaCooldownBreaker quotaBreaker,
        ClientIpResolver clientIpResolver,
        EdgeProtectionMetrics metrics
) {}
