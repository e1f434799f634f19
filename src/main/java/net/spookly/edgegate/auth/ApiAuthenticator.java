package net.spookly.edgegate.auth;

import java.util.Optional;

import io.netty.handler.codec.http.HttpHeaders;

/**
 * Identifies the caller of a proxied API request.
 */
@FunctionalInterface
public interface ApiAuthenticator {
    /**
     * @return the principal name, or empty when the request is not authenticated
     */
    Optional<String> authenticate(HttpHeaders headers);
}
