package com.github.dimitryivaniuta.edgeguard.protection;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * All knobs of the edge protection layer, bound from the {@code edge.*} namespace.
 *
 * <p>{@code application.yml} maps the deployment's historical environment variables
 * (CORS_ALLOWED_ORIGINS, CORS_STRICT, DISABLE_RATE_LIMIT, AI_QUOTA_COOLDOWN_MS, API_KEY)
 * onto these properties.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "edge")
public class EdgeProtectionProperties {

    @Valid
    private Cors cors = new Cors();

    @Valid
    private ClientIp clientIp = new ClientIp();

    @Valid
    private RateLimit rateLimit = new RateLimit();

    @Valid
    private Analyze analyze = new Analyze();

    @Valid
    private Sync sync = new Sync();

    @Valid
    private Unsubscribe unsubscribe = new Unsubscribe();

    @Valid
    private Llm llm = new Llm();

    private Redis redis = new Redis();

    @Valid
    private Io io = new Io();

    @Getter
    @Setter
    public static class Cors {
        /**
         * Comma-separated origin rules. Empty means "no restriction configured".
         */
        private String allowedOrigins = "";
        /**
         * Reject (403) requests whose Origin header is present but not allowed.
         */
        private boolean strict = false;
        private String allowedMethods = "GET, POST, OPTIONS";
        private String allowedHeaders = "Content-Type, X-Sync-Key-Hash, X-Correlation-Id";
        private String exposedHeaders = "Retry-After, X-Cache, X-Correlation-Id";
        @Min(0)
        private long maxAgeSeconds = 3600;
    }

    @Getter
    @Setter
    public static class ClientIp {
        // set by the hosting edge only, so the end client cannot forge it
        @NotBlank
        private String platformHeader = "X-Vercel-Forwarded-For";
        @NotBlank
        private String realIpHeader = "X-Real-IP";
        @NotBlank
        private String forwardedForHeader = "X-Forwarded-For";
        @Min(1)
        private int maxLength = 64;
    }

    @Getter
    @Setter
    public static class RateLimit {
        private boolean disabled = false;
        @Min(1)
        private int localMaxEntries = 2000;
    }

    @Getter
    @Setter
    public static class EndpointLimit {
        @NotNull
        private Duration window = Duration.ofMinutes(1);
        @Min(1)
        private int maxRequests = 20;

        public EndpointLimit() {
        }

        public EndpointLimit(Duration window, int maxRequests) {
            this.window = window;
            this.maxRequests = maxRequests;
        }
    }

    @Getter
    @Setter
    public static class Analyze {
        @Valid
        private EndpointLimit rateLimit = new EndpointLimit(Duration.ofMinutes(1), 20);
        @NotNull
        private DataSize maxBodySize = DataSize.ofKilobytes(256);
        @NotNull
        private Duration bodyReadTimeout = Duration.ofSeconds(5);
        @NotNull
        private Duration upstreamTimeout = Duration.ofSeconds(25);
        @NotNull
        private Duration cacheTtl = Duration.ofMinutes(5);
        @Min(1)
        private int cacheMaxEntries = 200;
        @NotNull
        private Duration quotaCooldown = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class Sync {
        @Valid
        private EndpointLimit rateLimit = new EndpointLimit(Duration.ofMinutes(1), 60);
        @NotNull
        private DataSize maxBodySize = DataSize.ofMegabytes(1);
        @NotNull
        private Duration bodyReadTimeout = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Unsubscribe {
        @Valid
        private EndpointLimit rateLimit = new EndpointLimit(Duration.ofMinutes(1), 10);
        @NotNull
        private DataSize maxBodySize = DataSize.ofKilobytes(16);
        @NotNull
        private Duration bodyReadTimeout = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Llm {
        /**
         * Provider API key. Blank keeps the service up but analysis answers 500.
         */
        private String apiKey = "";
        @NotBlank
        private String model = "gemini-2.5-flash";
        @NotBlank
        private String baseUrl = "https://generativelanguage.googleapis.com";
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Redis {
        /**
         * Use Redis for the rate-limit counters and the key-value store instead of process memory.
         */
        private boolean enabled = false;
    }

    /**
     * Worker pools for blocking work run under a wall-clock deadline. A full pool rejects new work
     * with 503 instead of growing.
     */
    @Getter
    @Setter
    public static class Io {
        @Valid
        private Pool bodyRead = new Pool(32, 0);
        @Valid
        private Pool upstream = new Pool(16, 16);
    }

    @Getter
    @Setter
    public static class Pool {
        @Min(1)
        private int maxThreads;
        // 0 hands work straight to a thread
        @Min(0)
        private int queueCapacity;

        public Pool() {
        }

        public Pool(int maxThreads, int queueCapacity) {
            this.maxThreads = maxThreads;
            this.queueCapacity = queueCapacity;
        }
    }
}
