package com.github.dimitryivaniuta.edgeguard.protection.origin;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One configured origin pattern.
 *
 * <ul>
 *   <li>EXACT: {@code https://app.example.com}, matched by case-sensitive equality.</li>
 *   <li>WILDCARD: {@code https://*.example.com}, matches exactly one DNS label in front of the suffix.
 *       Neither the apex {@code https://example.com} nor {@code https://a.b.example.com} matches.</li>
 *   <li>INVALID: anything else containing {@code *}, or a wildcard with an unusable suffix. Never matches.</li>
 * </ul>
 */
public record OriginRule(String raw, Kind kind, String scheme, String suffix) {

    public enum Kind {
        EXACT,
        WILDCARD,
        INVALID
    }

    private static final Pattern WILDCARD = Pattern.compile("^([A-Za-z][A-Za-z0-9+.-]*)://\\*\\.(.+)$");
    private static final Pattern DNS_LABEL = Pattern.compile("^[a-z0-9](?:[a-z0-9-]{0,61}[a-z0-9])?$");

    public static OriginRule parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return invalid(raw);
        }
        String rule = raw.trim();

        Matcher m = WILDCARD.matcher(rule);
        if (m.matches()) {
            String suffix = m.group(2).toLowerCase(Locale.ROOT);
            if (!isUsableSuffix(suffix)) {
                return invalid(rule);
            }
            return new OriginRule(rule, Kind.WILDCARD, m.group(1).toLowerCase(Locale.ROOT), suffix);
        }

        if (rule.indexOf('*') >= 0) {
            return invalid(rule);
        }
        return new OriginRule(rule, Kind.EXACT, null, null);
    }

    public boolean matches(String origin) {
        if (origin == null || origin.isEmpty()) return false;

        return switch (kind) {
            case EXACT -> raw.equals(origin);
            case WILDCARD -> matchesWildcard(origin);
            case INVALID -> false;
        };
    }

    private boolean matchesWildcard(String origin) {
        String candidate = origin.toLowerCase(Locale.ROOT);
        String prefix = scheme + "://";
        String tail = "." + suffix;

        if (!candidate.startsWith(prefix) || !candidate.endsWith(tail)) return false;
        if (candidate.length() <= prefix.length() + tail.length()) return false;

        // everything between scheme and suffix must be a single label: no '.', '/', '@', ':' ...
        String label = candidate.substring(prefix.length(), candidate.length() - tail.length());
        return DNS_LABEL.matcher(label).matches();
    }

    private static boolean isUsableSuffix(String suffix) {
        if (suffix.isEmpty()) return false;
        if (suffix.startsWith(".") || suffix.endsWith(".")) return false;
        if (suffix.contains("..")) return false;
        return suffix.indexOf('*') < 0 && suffix.indexOf('/') < 0 && suffix.indexOf('@') < 0;
    }

    private static OriginRule invalid(String raw) {
        return new OriginRule(raw, Kind.INVALID, null, null);
    }
}
