package com.github.dimitryivaniuta.edgeguard.protection.ratelimit;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.util.List;

/**
 * Fleet-wide fixed-window counters on Redis.
 *
 * <p>One Lua script per hit: {@code INCR}, then {@code PEXPIRE} whenever the key has no expiry
 * (first hit of a window, or a key left without TTL by an earlier partial failure), then the
 * remaining {@code PTTL} for the retry hint. A counter therefore always expires one window after
 * it was last (re)armed.
 *
 * <p>Failures surface as Spring {@code DataAccessException}s; {@link FixedWindowRateLimiter} falls back
 * to the local store.
 */
@RequiredArgsConstructor
public final class RedisRateLimitStore implements RateLimitCounterStore {

    static final String KEY_PREFIX = "rl:";

    static final String HIT_SCRIPT = """
            local count = redis.call('INCR', KEYS[1])
            local ttl = redis.call('PTTL', KEYS[1])
            if ttl < 0 then
                redis.call('PEXPIRE', KEYS[1], ARGV[1])
                ttl = tonumber(ARGV[1])
            end
            return {count, ttl}
            """;

    @SuppressWarnings("rawtypes") // DefaultRedisScript<List> is how Spring types multi-bulk replies
    private static final DefaultRedisScript<List> SCRIPT = new DefaultRedisScript<>(HIT_SCRIPT, List.class);

    private final StringRedisTemplate redis;

    @Override
    public RateLimitDecision hit(RateLimitRequest request) {
        String key = KEY_PREFIX + request.namespace() + ":" + request.key();

        List<?> reply = redis.execute(SCRIPT, List.of(key), String.valueOf(request.windowMs()));
        if (reply == null || reply.size() < 2) {
            throw new IllegalStateException("Rate-limit script returned no value for " + key);
        }
        long count = ((Number) reply.get(0)).longValue();
        long ttlMs = ((Number) reply.get(1)).longValue();

        if (count > request.maxRequests()) {
            long remaining = ttlMs < 0 ? request.windowMs() : ttlMs;
            return RateLimitDecision.limited(RateLimitDecision.secondsUntil(remaining, 0));
        }
        return RateLimitDecision.allowed();
    }
}
