package net.spookly.edgegate.auth;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import net.spookly.edgegate.config.EdgegateConfig;

/**
 * Accepts the API tokens listed in configuration, sent as {@code Authorization: Bearer <token>}
 * or {@code X-API-Key: <token>}.
 */
public final class StaticTokenAuthenticator implements ApiAuthenticator {
    public static final String API_KEY_HEADER = "X-API-Key";
    private static final String BEARER_PREFIX = "bearer ";

    private final List<EdgegateConfig.ApiTokenConfig> tokens;

    public StaticTokenAuthenticator(List<EdgegateConfig.ApiTokenConfig> tokens) {
        this.tokens = tokens == null ? List.of() : new ArrayList<>(tokens);
    }

    @Override
    public Optional<String> authenticate(HttpHeaders headers) {
        String presented = presentedToken(headers);
        if (presented == null || presented.isEmpty()) {
            return Optional.empty();
        }
        String principal = null;
        for (EdgegateConfig.ApiTokenConfig token : tokens) {
            // check every entry so timing does not reveal which token matched
            if (Hmac.constantTimeEquals(token.token, presented) && principal == null) {
                principal = token.name;
            }
        }
        return Optional.ofNullable(principal);
    }

    private static String presentedToken(HttpHeaders headers) {
        String authorization = headers.get(HttpHeaderNames.AUTHORIZATION);
        if (authorization != null && authorization.length() > BEARER_PREFIX.length()
                && authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return authorization.substring(BEARER_PREFIX.length()).trim();
        }
        String apiKey = headers.get(API_KEY_HEADER);
        return apiKey == null ? null : apiKey.trim();
    }
}
