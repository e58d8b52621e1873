package com.github.dimitryivaniuta.edgeguard.web;

import com.github.dimitryivaniuta.edgeguard.protection.EdgeProtectionContext;
import com.github.dimitryivaniuta.edgeguard.protection.EdgeProtectionProperties;
import com.github.dimitryivaniuta.edgeguard.protection.ratelimit.RateLimitDecision;
import com.github.dimitryivaniuta.edgeguard.protection.ratelimit.RateLimitExceededException;
import com.github.dimitryivaniuta.edgeguard.protection.ratelimit.RateLimitRequest;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Applies the per-endpoint fixed-window budget to the resolved client IP.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EndpointRateLimitGuard {

    private final EdgeProtectionContext protection;
    private final EdgeProtectionProperties properties;

    public void enforce(String namespace, HttpServletRequest request, EdgeProtectionProperties.EndpointLimit limit) {
        String clientIp = protection.clientIpResolver().getClientIp(request);

        RateLimitRequest rl = new RateLimitRequest(
                namespace,
                clientIp,
                limit.getWindow().toMillis(),
                limit.getMaxRequests(),
                properties.getRateLimit().isDisabled(),
                properties.getRateLimit().getLocalMaxEntries()
        );

        RateLimitDecision decision = protection.rateLimiter().check(rl);
        if (decision.limited()) {
            log.info("Rate limit exceeded: namespace={} retryAfter={}s", namespace, decision.retryAfterSec());
            throw new RateLimitExceededException("Too Many Requests", decision.retryAfterSec(),
                    "Rate limit exceeded. Try again later.");
        }
    }
}
