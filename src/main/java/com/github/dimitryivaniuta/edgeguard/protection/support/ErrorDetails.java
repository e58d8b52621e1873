package com.github.dimitryivaniuta.edgeguard.protection.support;

/**
 * Turns raw failure text (provider errors, exception messages) into something safe to echo back.
 */
public final class ErrorDetails {

    public static final int MAX_LENGTH = 200;

    private ErrorDetails() {
    }

    /**
     * Drops control characters and markup/header-breaking characters, collapses whitespace and truncates
     * to {@link #MAX_LENGTH}. Returns an empty string for null input.
     */
    public static String sanitize(String raw) {
        if (raw == null || raw.isEmpty()) return "";

        StringBuilder sb = new StringBuilder(Math.min(raw.length(), MAX_LENGTH));
        boolean lastWasSpace = false;
        for (int i = 0; i < raw.length() && sb.length() < MAX_LENGTH; i++) {
            char c = raw.charAt(i);
            if (Character.isWhitespace(c) || Character.isISOControl(c)) {
                if (!lastWasSpace && sb.length() > 0) {
                    sb.append(' ');
                    lastWasSpace = true;
                }
                continue;
            }
            if (c == '<' || c == '>' || c == '"' || c == '\'' || c == '`' || c == '\\') {
                continue;
            }
            sb.append(c);
            lastWasSpace = false;
        }
        return sb.toString().trim();
    }
}
