package com.github.dimitryivaniuta.edgeguard.web;

public final class RequestContextKeys {
    private RequestContextKeys() {}

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CLIENT_IP_MDC_KEY = "clientIp";
    // request id stamped by the hosting edge
    public static final String PLATFORM_REQUEST_ID_HEADER = "X-Vercel-Id";

    public static final String SYNC_KEY_HASH_HEADER = "X-Sync-Key-Hash";
    public static final String CACHE_STATUS_HEADER = "X-Cache";
}
