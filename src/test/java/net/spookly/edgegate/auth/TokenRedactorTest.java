package net.spookly.edgegate.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

class TokenRedactorTest {
    @Test
    void redactsSecrets() {
        assertNull(TokenRedactor.redact(null));
        assertEquals("", TokenRedactor.redact(""));
        assertEquals("REDACTED", TokenRedactor.redact("abc123"));
    }

    @Test
    void keepsAuthorizationScheme() {
        assertEquals("Bearer REDACTED", TokenRedactor.redactAuthorization("Bearer abc.def"));
        assertEquals("REDACTED", TokenRedactor.redactAuthorization("opaque-token"));
        assertNull(TokenRedactor.redactAuthorization(null));
    }
}
