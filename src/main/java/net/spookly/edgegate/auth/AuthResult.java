package net.spookly.edgegate.auth;

import lombok.AllArgsConstructor;

/**
 * Outcome of a credential check; {@code message} explains a rejection.
 */
@AllArgsConstructor
public final class AuthResult {
    public final boolean ok;
    public final String message;

    public static AuthResult ok() {
        return new AuthResult(true, null);
    }

    public static AuthResult error(String message) {
        return new AuthResult(false, message);
    }
}
