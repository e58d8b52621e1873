package com.github.dimitryivaniuta.edgeguard.upstream;

public enum UpstreamErrorKind {
    /**
     * Provider quota or rate limit exhausted; trips the quota breaker.
     */
    QUOTA_EXHAUSTED("quota_exhausted"),
    /**
     * Upstream did not answer within its budget.
     */
    TIMEOUT("timeout"),
    OTHER("other");

    private final String tag;

    UpstreamErrorKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
