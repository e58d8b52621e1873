package com.github.dimitryivaniuta.edgeguard.config;

import com.github.dimitryivaniuta.edgeguard.protection.EdgeProtectionContext;
import com.github.dimitryivaniuta.edgeguard.protection.EdgeProtectionProperties;
import com.github.dimitryivaniuta.edgeguard.protection.breaker.QuotaCooldownBreaker;
import com.github.dimitryivaniuta.edgeguard.protection.cache.ResponseCache;
import com.github.dimitryivaniuta.edgeguard.protection.ip.ClientIpResolver;
import com.github.dimitryivaniuta.edgeguard.protection.metrics.EdgeProtectionMetrics;
import com.github.dimitryivaniuta.edgeguard.protection.ratelimit.FixedWindowRateLimiter;
import com.github.dimitryivaniuta.edgeguard.protection.ratelimit.LocalRateLimitStore;
import com.github.dimitryivaniuta.edgeguard.protection.ratelimit.RedisRateLimitStore;
import com.github.dimitryivaniuta.edgeguard.web.BoundedBodyReader;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.util.concurrent.ExecutorService;

/**
 * Process-wide protection state. Everything time-based reads the single {@link Clock} bean.
 */
@Slf4j
@Configuration
public class ProtectionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EdgeProtectionMetrics edgeProtectionMetrics(MeterRegistry registry) {
        return new EdgeProtectionMetrics(registry);
    }

    // ---- Rate limiting ----

    @Bean
    public LocalRateLimitStore localRateLimitStore(Clock clock) {
        return new LocalRateLimitStore(clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "edge.redis", name = "enabled", havingValue = "true")
    public RedisRateLimitStore redisRateLimitStore(StringRedisTemplate redis) {
        return new RedisRateLimitStore(redis);
    }

    @Bean
    public FixedWindowRateLimiter fixedWindowRateLimiter(LocalRateLimitStore local,
                                                         ObjectProvider<RedisRateLimitStore> redisStore,
                                                         EdgeProtectionMetrics metrics) {
        RedisRateLimitStore distributed = redisStore.getIfAvailable();
        log.info("Rate-limit counters: {}", distributed == null ? "local" : "redis with local fallback");
        return new FixedWindowRateLimiter(local, distributed, metrics);
    }

    // ---- Cache / breaker / IP ----

    @Bean
    public ResponseCache responseCache(Clock clock, EdgeProtectionProperties props) {
        EdgeProtectionProperties.Analyze analyze = props.getAnalyze();
        return new ResponseCache(clock, analyze.getCacheTtl(), analyze.getCacheMaxEntries());
    }

    @Bean
    public QuotaCooldownBreaker quotaCooldownBreaker(Clock clock, EdgeProtectionProperties props) {
        return new QuotaCooldownBreaker(clock, props.getAnalyze().getQuotaCooldown());
    }

    @Bean
    public ClientIpResolver clientIpResolver(EdgeProtectionProperties props) {
        return new ClientIpResolver(props.getClientIp());
    }

    @Bean
    public EdgeProtectionContext edgeProtectionContext(FixedWindowRateLimiter rateLimiter,
                                                       ResponseCache responseCache,
                                                       QuotaCooldownBreaker quotaCooldownBreaker,
                                                       ClientIpResolver clientIpResolver,
                                                       EdgeProtectionMetrics metrics) {
        return new EdgeProtectionContext(rateLimiter, responseCache, quotaCooldownBreaker, clientIpResolver, metrics);
    }

    // ---- Body reads under wall-clock deadlines ----

    // a read blocked in socket I/O ignores cancel(true) and ends only at server.tomcat.connection-timeout
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService edgeBodyReadExecutor(EdgeProtectionProperties props) {
        return BoundedExecutors.newPool("edge-body-", props.getIo().getBodyRead());
    }

    @Bean
    public BoundedBodyReader boundedBodyReader(@Qualifier("edgeBodyReadExecutor") ExecutorService executor) {
        return new BoundedBodyReader(executor);
    }
}
