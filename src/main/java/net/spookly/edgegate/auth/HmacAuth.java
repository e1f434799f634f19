package net.spookly.edgegate.auth;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

import lombok.AllArgsConstructor;

/**
 * HMAC request authentication for the status API.
 *
 * <p>The signature is Base64 HMAC-SHA256 over {@code method \n path \n timestamp \n nonce \n body}.</p>
 */
public final class HmacAuth {
    public static final String TIMESTAMP_HEADER = "X-Edgegate-Timestamp";
    public static final String NONCE_HEADER = "X-Edgegate-Nonce";
    public static final String SIGNATURE_HEADER = "X-Edgegate-Signature";
    public static final String CLIENT_HEADER = "X-Edgegate-Client";

    private HmacAuth() {
    }

    /**
     * Verify headers, timestamp skew, signature and nonce reuse, in that order.
     */
    public static AuthResult verify(SignedRequest request,
                                    String sharedKey,
                                    int nonceBytes,
                                    int clockSkewSeconds,
                                    NonceCache nonceCache,
                                    Clock clock) {
        if (sharedKey == null || sharedKey.isBlank()) {
            return AuthResult.error("shared key is missing");
        }
        if (request == null) {
            return AuthResult.error("auth data missing");
        }
        if (request.timestampSeconds == null) {
            return AuthResult.error("missing " + TIMESTAMP_HEADER + " header");
        }
        if (request.nonce == null || request.nonce.isBlank()) {
            return AuthResult.error("missing " + NONCE_HEADER + " header");
        }
        if (request.signature == null || request.signature.isBlank()) {
            return AuthResult.error("missing " + SIGNATURE_HEADER + " header");
        }
        if (request.clientId == null || request.clientId.isBlank()) {
            return AuthResult.error("missing " + CLIENT_HEADER + " header");
        }
        if (nonceBytes > 0 && request.nonce.length() < nonceBytes) {
            return AuthResult.error("nonce is shorter than expected");
        }
        long now = clock.instant().getEpochSecond();
        if (Math.abs(now - request.timestampSeconds) > clockSkewSeconds) {
            return AuthResult.error("timestamp outside allowed skew");
        }
        String expected = sign(request.method, request.path, request.timestampSeconds, request.nonce, request.body, sharedKey);
        if (!Hmac.constantTimeEquals(expected, request.signature)) {
            return AuthResult.error("invalid signature");
        }
        if (!nonceCache.register(request.clientId + ":" + request.nonce, clock.instant())) {
            return AuthResult.error("replayed nonce");
        }
        return AuthResult.ok();
    }

    public static String sign(String method, String path, long timestampSeconds, String nonce, byte[] body, String sharedKey) {
        String payload = body == null ? "" : new String(body, StandardCharsets.UTF_8);
        String canonical = method + "\n" + path + "\n" + timestampSeconds + "\n" + nonce + "\n" + payload;
        return Hmac.signBase64(canonical, sharedKey);
    }

    @AllArgsConstructor
    public static final class SignedRequest {
        public final String method;
        public final String path;
        public final Long timestampSeconds;
        public final String nonce;
        public final String signature;
        public final String clientId;
        public final byte[] body;
    }
}
