package com.github.dimitryivaniuta.edgeguard.protection.origin;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;

import java.util.Arrays;
import java.util.List;

/**
 * Origin policy operations shared by the CORS filter and the endpoints.
 *
 * <p>An empty rule list means no restriction was configured (permissive), not "nothing allowed".
 */
public final class OriginRules {

    public static final String NULL_ORIGIN = "null";

    private OriginRules() {
    }

    public static List<OriginRule> parseAllowedOrigins(String raw) {
        if (raw == null || raw.isBlank()) return List.of();

        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(OriginRule::parse)
                .toList();
    }

    public static boolean matchesOriginRule(String origin, String rule) {
        return OriginRule.parse(rule).matches(origin);
    }

    public static boolean isOriginAllowed(HttpServletRequest request, String origin, List<OriginRule> rules) {
        if (rules.isEmpty()) return true;
        if (origin == null || origin.isBlank()) return false;

        for (OriginRule rule : rules) {
            if (rule.matches(origin)) return true;
        }
        return false;
    }

    /**
     * Value for {@code Access-Control-Allow-Origin}: the request origin when allowed (reflect-on-allow),
     * otherwise the literal {@code "null"} so the browser check fails closed. Never {@code *}.
     */
    public static String getCorsOrigin(HttpServletRequest request, List<OriginRule> rules) {
        String origin = request.getHeader(HttpHeaders.ORIGIN);
        if (origin == null || origin.isBlank()) return NULL_ORIGIN;

        return isOriginAllowed(request, origin, rules) ? origin : NULL_ORIGIN;
    }
}
