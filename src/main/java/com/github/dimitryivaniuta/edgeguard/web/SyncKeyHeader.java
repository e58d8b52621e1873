package com.github.dimitryivaniuta.edgeguard.web;

import jakarta.servlet.http.HttpServletRequest;

import java.util.regex.Pattern;

/**
 * The client-derived sync key hash that namespaces a user's stored data.
 */
public final class SyncKeyHeader {

    public static final String MISSING = "Unauthorized: Missing sync key hash";
    public static final String INVALID = "Unauthorized: Invalid sync key hash";

    // opaque to the server, but must be safe to splice into a store key
    private static final Pattern VALID = Pattern.compile("^[A-Za-z0-9_-]{16,128}$");

    private SyncKeyHeader() {
    }

    public static String require(HttpServletRequest request) {
        String hash = request.getHeader(RequestContextKeys.SYNC_KEY_HASH_HEADER);
        if (hash == null || hash.isBlank()) {
            throw EdgeApiException.unauthorized(MISSING);
        }
        hash = hash.trim();
        if (!VALID.matcher(hash).matches()) {
            throw EdgeApiException.unauthorized(INVALID);
        }
        return hash;
    }
}
