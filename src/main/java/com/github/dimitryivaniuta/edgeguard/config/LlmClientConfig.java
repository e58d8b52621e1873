package com.github.dimitryivaniuta.edgeguard.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.edgeguard.analysis.AnalysisService;
import com.github.dimitryivaniuta.edgeguard.protection.EdgeProtectionContext;
import com.github.dimitryivaniuta.edgeguard.protection.EdgeProtectionProperties;
import com.github.dimitryivaniuta.edgeguard.upstream.GeminiLlmProvider;
import com.github.dimitryivaniuta.edgeguard.upstream.LlmProvider;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.util.concurrent.ExecutorService;

@Slf4j
@Configuration
public class LlmClientConfig {

    @Bean
    public LlmProvider llmProvider(RestClient.Builder builder, EdgeProtectionProperties props, ObjectMapper objectMapper) {
        EdgeProtectionProperties.Llm llm = props.getLlm();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(llm.getConnectTimeout());
        requestFactory.setReadTimeout(props.getAnalyze().getUpstreamTimeout());

        RestClient restClient = builder
                .baseUrl(llm.getBaseUrl())
                .requestFactory(requestFactory)
                .build();

        GeminiLlmProvider provider = new GeminiLlmProvider(restClient, llm.getApiKey(), objectMapper);
        if (!provider.isConfigured()) {
            log.warn("edge.llm.api-key is empty; /api/analyze will answer 500 until it is set");
        }
        return provider;
    }

    @Bean
    public TimeLimiter llmTimeLimiter(EdgeProtectionProperties props) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(props.getAnalyze().getUpstreamTimeout())
                .cancelRunningFuture(true)
                .build();
        return TimeLimiter.of("llm-upstream", config);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService edgeUpstreamExecutor(EdgeProtectionProperties props) {
        return BoundedExecutors.newPool("edge-llm-", props.getIo().getUpstream());
    }

    @Bean
    public AnalysisService analysisService(EdgeProtectionContext protection,
                                           LlmProvider llmProvider,
                                           TimeLimiter llmTimeLimiter,
                                           @Qualifier("edgeUpstreamExecutor") ExecutorService upstreamExecutor,
                                           EdgeProtectionProperties props) {
        return new AnalysisService(protection, llmProvider, llmTimeLimiter, upstreamExecutor, props.getLlm().getModel());
    }
}
