package com.github.dimitryivaniuta.edgeguard.infra;

import com.github.dimitryivaniuta.edgeguard.EdgeGuardApplication;
import com.github.dimitryivaniuta.edgeguard.upstream.LlmProvider;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;

/**
 * Full context over MockMvc with a mocked LLM provider and a hand-driven clock.
 * Limiter windows, cache and breaker are process state, so every test gets a fresh context.
 */
@SpringBootTest(
        classes = {EdgeGuardApplication.class, BaseEndpointTest.TestClockConfig.class},
        webEnvironment = SpringBootTest.WebEnvironment.MOCK
)
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestPropertySource(properties = {
        "management.endpoints.web.exposure.include=health,info,metrics,prometheus",
        "management.prometheus.metrics.export.enabled=true"
})
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
public abstract class BaseEndpointTest {

    public static final String ALLOWED_ORIGIN = "https://askesis.vercel.app";
    public static final String SYNC_HASH = "k3y-hash_0123456789abcdef";

    @Autowired protected MockMvc mvc;
    @Autowired protected MutableClock clock;

    @MockBean protected LlmProvider llmProvider;

    @BeforeEach
    void configuredProvider() {
        when(llmProvider.isConfigured()).thenReturn(true);
    }

    @TestConfiguration
    public static class TestClockConfig {

        @Bean
        @Primary
        public MutableClock testClock() {
            return new MutableClock(1_700_000_000_000L);
        }
    }
}
