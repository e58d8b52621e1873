package com.github.dimitryivaniuta.edgeguard.protection.ip;

import com.github.dimitryivaniuta.edgeguard.protection.EdgeProtectionProperties;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Resolves the client address used as the rate-limit subject.
 *
 * <p>Precedence, highest trust first:
 * <ol>
 *   <li>platform header (only the hosting edge can set it)</li>
 *   <li>real-IP header</li>
 *   <li>last hop of X-Forwarded-For. The first hop is whatever the client sent and is never used.</li>
 * </ol>
 * No usable header yields {@link #UNKNOWN}; callers treat it as one shared bucket, not as "no limit".
 */
public final class ClientIpResolver {

    public static final String UNKNOWN = "unknown";

    private final String platformHeader;
    private final String realIpHeader;
    private final String forwardedForHeader;
    private final int maxLength;

    public ClientIpResolver(EdgeProtectionProperties.ClientIp props) {
        this.platformHeader = props.getPlatformHeader();
        this.realIpHeader = props.getRealIpHeader();
        this.forwardedForHeader = props.getForwardedForHeader();
        this.maxLength = props.getMaxLength();
    }

    public String getClientIp(HttpServletRequest req) {
        String platform = normalize(req.getHeader(platformHeader));
        if (platform != null) return platform;

        String realIp = normalize(req.getHeader(realIpHeader));
        if (realIp != null) return realIp;

        String xff = req.getHeader(forwardedForHeader);
        if (xff != null) {
            String[] hops = xff.split(",");
            for (int i = hops.length - 1; i >= 0; i--) {
                String hop = normalize(hops[i]);
                if (hop != null) return hop;
            }
        }

        return UNKNOWN;
    }

    // caps length so forged headers cannot blow up limiter keys
    private String normalize(String value) {
        if (value == null) return null;
        String v = value.trim();
        if (v.isEmpty()) return null;
        return v.length() > maxLength ? v.substring(0, maxLength) : v;
    }
}
