package com.github.dimitryivaniuta.edgeguard.upstream;

import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class UpstreamErrorClassifierTest {

    @Test
    void http429IsQuota() {
        assertThat(UpstreamErrorClassifier.classify(new UpstreamException(429, null, "slow down")))
                .isEqualTo(UpstreamErrorKind.QUOTA_EXHAUSTED);
    }

    @Test
    void providerStatusResourceExhaustedIsQuota() {
        assertThat(UpstreamErrorClassifier.classify(new UpstreamException(400, "RESOURCE_EXHAUSTED", "x")))
                .isEqualTo(UpstreamErrorKind.QUOTA_EXHAUSTED);
    }

    @Test
    void quotaMessageMarkersAreCaseInsensitive() {
        assertThat(UpstreamErrorClassifier.classify(new RuntimeException("RESOURCE_EXHAUSTED")))
                .isEqualTo(UpstreamErrorKind.QUOTA_EXHAUSTED);
        assertThat(UpstreamErrorClassifier.classify(new RuntimeException("You exceeded your current Quota")))
                .isEqualTo(UpstreamErrorKind.QUOTA_EXHAUSTED);
        assertThat(UpstreamErrorClassifier.classify(new RuntimeException("Too Many Requests")))
                .isEqualTo(UpstreamErrorKind.QUOTA_EXHAUSTED);
        assertThat(UpstreamErrorClassifier.classify(new RuntimeException("rate-limit hit")))
                .isEqualTo(UpstreamErrorKind.QUOTA_EXHAUSTED);
    }

    @Test
    void timeoutsAreRecognisedThroughWrappers() {
        assertThat(UpstreamErrorClassifier.classify(new TimeoutException()))
                .isEqualTo(UpstreamErrorKind.TIMEOUT);
        assertThat(UpstreamErrorClassifier.classify(new ExecutionException(new TimeoutException())))
                .isEqualTo(UpstreamErrorKind.TIMEOUT);
        assertThat(UpstreamErrorClassifier.classify(
                new UpstreamException("I/O", new RuntimeException(new SocketTimeoutException("Read timed out")))))
                .isEqualTo(UpstreamErrorKind.TIMEOUT);
    }

    @Test
    void wrappedQuotaErrorIsStillQuota() {
        Throwable wrapped = new CompletionException(new UpstreamException(429, null, "x"));

        assertThat(UpstreamErrorClassifier.classify(wrapped)).isEqualTo(UpstreamErrorKind.QUOTA_EXHAUSTED);
    }

    @Test
    void everythingElseIsOther() {
        assertThat(UpstreamErrorClassifier.classify(new UpstreamException(500, "INTERNAL", "boom")))
                .isEqualTo(UpstreamErrorKind.OTHER);
        assertThat(UpstreamErrorClassifier.classify(new IllegalStateException()))
                .isEqualTo(UpstreamErrorKind.OTHER);
        assertThat(UpstreamErrorClassifier.classify(null)).isEqualTo(UpstreamErrorKind.OTHER);
    }
}
