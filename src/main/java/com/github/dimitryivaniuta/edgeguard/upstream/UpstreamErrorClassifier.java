package com.github.dimitryivaniuta.edgeguard.upstream;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * The one place that decides what an upstream failure means.
 *
 * <p>Status codes are exact; message matching is fuzzy by nature, so every marker lives in
 * {@link #QUOTA_MARKERS}.
 */
public final class UpstreamErrorClassifier {

    static final int TOO_MANY_REQUESTS = 429;

    static final List<String> QUOTA_MARKERS = List.of(
            "resource_exhausted",
            "quota",
            "rate limit",
            "rate-limit",
            "ratelimit",
            "too many requests"
    );

    private UpstreamErrorClassifier() {
    }

    public static UpstreamErrorKind classify(Throwable error) {
        Throwable t = unwrap(error);
        if (t == null) return UpstreamErrorKind.OTHER;

        if (isTimeout(t)) return UpstreamErrorKind.TIMEOUT;

        if (t instanceof UpstreamException ue) {
            if (ue.getStatus() == TOO_MANY_REQUESTS) return UpstreamErrorKind.QUOTA_EXHAUSTED;
            if ("RESOURCE_EXHAUSTED".equalsIgnoreCase(ue.getProviderStatus())) return UpstreamErrorKind.QUOTA_EXHAUSTED;
        }

        return mentionsQuota(t.getMessage()) ? UpstreamErrorKind.QUOTA_EXHAUSTED : UpstreamErrorKind.OTHER;
    }

    /**
     * Strips executor wrappers so the provider's own exception is classified.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof ExecutionException || t instanceof CompletionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static boolean isTimeout(Throwable t) {
        Throwable cur = t;
        int depth = 0;
        while (cur != null && depth++ < 8) {
            if (cur instanceof TimeoutException
                    || cur instanceof SocketTimeoutException
                    || cur instanceof HttpTimeoutException) {
                return true;
            }
            if (cur.getCause() == cur) break;
            cur = cur.getCause();
        }
        return false;
    }

    private static boolean mentionsQuota(String message) {
        if (message == null || message.isBlank()) return false;
        String m = message.toLowerCase(Locale.ROOT);
        for (String marker : QUOTA_MARKERS) {
            if (m.contains(marker)) return true;
        }
        return false;
    }
}
