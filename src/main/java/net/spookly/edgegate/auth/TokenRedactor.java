package net.spookly.edgegate.auth;

import java.util.Locale;

/**
 * Keeps secrets out of logs and printed configuration.
 */
public final class TokenRedactor {
    private static final String REDACTED = "REDACTED";

    private TokenRedactor() {
    }

    /**
     * @return {@code null} for {@code null}, empty for empty, otherwise {@code REDACTED}
     */
    public static String redact(String secret) {
        if (secret == null) {
            return null;
        }
        return secret.isEmpty() ? "" : REDACTED;
    }

    /**
     * Redact the credential of an {@code Authorization} header value but keep its scheme.
     */
    public static String redactAuthorization(String headerValue) {
        if (headerValue == null || headerValue.isEmpty()) {
            return headerValue;
        }
        int space = headerValue.indexOf(' ');
        if (space <= 0) {
            return REDACTED;
        }
        String scheme = headerValue.substring(0, space);
        if (!scheme.toLowerCase(Locale.ROOT).matches("[a-z][a-z0-9-]*")) {
            return REDACTED;
        }
        return scheme + " " + REDACTED;
    }
}
