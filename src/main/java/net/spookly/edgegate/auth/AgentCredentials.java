package net.spookly.edgegate.auth;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;

/**
 * Short-lived agent credential tokens derived from an environment's edge key.
 *
 * <p>Format: {@code <epochSeconds>.<nonceHex>.<base64 HMAC-SHA256(edgeKey, environmentId \n epochSeconds \n nonce)>}.</p>
 */
public final class AgentCredentials {
    private static final int NONCE_BYTES = 16;
    private static final SecureRandom RANDOM = new SecureRandom();

    private AgentCredentials() {
    }

    public static String issue(String environmentId, String edgeKey, Clock clock) {
        byte[] raw = new byte[NONCE_BYTES];
        RANDOM.nextBytes(raw);
        String nonce = HexFormat.of().formatHex(raw);
        long timestamp = clock.instant().getEpochSecond();
        return timestamp + "." + nonce + "." + Hmac.signBase64(canonical(environmentId, timestamp, nonce), edgeKey);
    }

    public static AuthResult verify(String environmentId,
                                    String edgeKey,
                                    String token,
                                    int clockSkewSeconds,
                                    NonceCache nonceCache,
                                    Clock clock) {
        if (edgeKey == null || edgeKey.isBlank()) {
            return AuthResult.error("environment has no edge key");
        }
        if (token == null || token.isBlank()) {
            return AuthResult.error("credential is missing");
        }
        String[] parts = token.split("\\.", 3);
        if (parts.length != 3 || parts[1].isEmpty() || parts[2].isEmpty()) {
            return AuthResult.error("credential is malformed");
        }
        long timestamp;
        try {
            timestamp = Long.parseLong(parts[0]);
        } catch (NumberFormatException e) {
            return AuthResult.error("credential timestamp is not a number");
        }
        if (Math.abs(clock.instant().getEpochSecond() - timestamp) > clockSkewSeconds) {
            return AuthResult.error("credential timestamp outside allowed skew");
        }
        String expected = Hmac.signBase64(canonical(environmentId, timestamp, parts[1]), edgeKey);
        if (!Hmac.constantTimeEquals(expected, parts[2])) {
            return AuthResult.error("credential signature mismatch");
        }
        if (!nonceCache.register(environmentId + ":" + parts[1], clock.instant())) {
            return AuthResult.error("credential was already used");
        }
        return AuthResult.ok();
    }

    private static String canonical(String environmentId, long timestamp, String nonce) {
        return environmentId + "\n" + timestamp + "\n" + nonce;
    }
}
