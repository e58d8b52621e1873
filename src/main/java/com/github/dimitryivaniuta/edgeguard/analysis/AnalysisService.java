package com.github.dimitryivaniuta.edgeguard.analysis;

import com.github.dimitryivaniuta.edgeguard.protection.EdgeProtectionContext;
import com.github.dimitryivaniuta.edgeguard.protection.breaker.QuotaCooldownBreaker;
import com.github.dimitryivaniuta.edgeguard.protection.cache.ResponseCache;
import com.github.dimitryivaniuta.edgeguard.protection.metrics.EdgeProtectionMetrics;
import com.github.dimitryivaniuta.edgeguard.protection.ratelimit.RateLimitExceededException;
import com.github.dimitryivaniuta.edgeguard.protection.support.ErrorDetails;
import com.github.dimitryivaniuta.edgeguard.upstream.GenerationRequest;
import com.github.dimitryivaniuta.edgeguard.upstream.LlmProvider;
import com.github.dimitryivaniuta.edgeguard.upstream.UpstreamErrorClassifier;
import com.github.dimitryivaniuta.edgeguard.upstream.UpstreamErrorKind;
import com.github.dimitryivaniuta.edgeguard.web.EdgeApiException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Cache, breaker and upstream part of the analyze flow. The caller has already applied CORS, the rate
 * limit and body validation.
 *
 * <p>Order matters: a cached answer is served even while the quota breaker is open, and the breaker
 * and the cache are only written after the upstream future has completed. A timed-out call leaves both
 * untouched.
 */
@Slf4j
public class AnalysisService {

    static final String CONFIGURATION_ERROR = "Server configuration error.";
    static final String QUOTA_DETAILS = "AI provider quota exhausted. Try again later.";

    private final ResponseCache cache;
    private final QuotaCooldownBreaker breaker;
    private final EdgeProtectionMetrics metrics;
    private final LlmProvider provider;
    private final TimeLimiter timeLimiter;
    private final ExecutorService upstreamExecutor;
    private final String model;

    public AnalysisService(EdgeProtectionContext protection,
                           LlmProvider provider,
                           TimeLimiter timeLimiter,
                           ExecutorService upstreamExecutor,
                           String model) {
        this.cache = protection.responseCache();
        this.breaker = protection.quotaBreaker();
        this.metrics = protection.metrics();
        this.provider = provider;
        this.timeLimiter = timeLimiter;
        this.upstreamExecutor = upstreamExecutor;
        this.model = model;
    }

    public AnalysisResult analyze(AnalyzeRequest request) {
        String cacheKey = ResponseCache.fingerprint(model, request.prompt(), request.systemInstruction());

        Optional<String> cached = cache.get(cacheKey);
        if (cached.isPresent()) {
            metrics.cacheHit();
            return new AnalysisResult(cached.get(), true);
        }
        metrics.cacheMiss();

        long remaining = breaker.remainingCooldownSeconds();
        if (remaining > 0) {
            metrics.breakerShortCircuited();
            throw new RateLimitExceededException("Too Many Requests", remaining, QUOTA_DETAILS);
        }

        if (!provider.isConfigured()) {
            log.error("LLM provider API key is not configured");
            throw EdgeApiException.internal(CONFIGURATION_ERROR);
        }

        String text = callUpstream(new GenerationRequest(model, request.prompt(), request.systemInstruction()));

        breaker.recordSuccess();
        cache.set(cacheKey, text);
        return new AnalysisResult(text, false);
    }

    private String callUpstream(GenerationRequest generation) {
        long start = System.nanoTime();
        try {
            String text = timeLimiter.executeFutureSupplier(
                    () -> CompletableFuture.supplyAsync(() -> provider.generate(generation), upstreamExecutor));
            metrics.recordUpstream("success", System.nanoTime() - start);
            return text;
        } catch (RejectedExecutionException ex) {
            metrics.recordUpstream("rejected", System.nanoTime() - start);
            log.warn("Upstream pool saturated; rejecting analysis for model={}", model);
            throw EdgeApiException.serviceUnavailable();
        } catch (Exception ex) {
            UpstreamErrorKind kind = UpstreamErrorClassifier.classify(ex);
            metrics.recordUpstream(kind.tag(), System.nanoTime() - start);
            throw toClientError(kind, ex);
        }
    }

    private RuntimeException toClientError(UpstreamErrorKind kind, Exception ex) {
        switch (kind) {
            case QUOTA_EXHAUSTED -> {
                breaker.trip();
                metrics.breakerTripped();
                return new RateLimitExceededException("Too Many Requests", breaker.remainingCooldownSeconds(), QUOTA_DETAILS);
            }
            case TIMEOUT -> {
                log.warn("Upstream call timed out for model={}", model);
                return EdgeApiException.gatewayTimeout();
            }
            default -> {
                Throwable cause = UpstreamErrorClassifier.unwrap(ex);
                log.error("Upstream call failed for model={}", model, cause);
                String details = ErrorDetails.sanitize(cause.getMessage());
                return EdgeApiException.internal(details.isEmpty() ? "Upstream provider error." : details);
            }
        }
    }
}
