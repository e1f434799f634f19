package net.spookly.edgegate.tunnel;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import net.spookly.edgegate.environment.EndpointUrl;
import net.spookly.edgegate.error.ConfigInvalidException;
import net.spookly.edgegate.error.SubConnectionFailedException;
import net.spookly.edgegate.proxy.SocketConnector;
import net.spookly.edgegate.proxy.UpstreamConnection;
import net.spookly.edgegate.proxy.UpstreamReader;

/**
 * Dials TCP or unix socket targets for streams opened by the tunnel peer, restricted to an allowlist.
 */
public final class SocketStreamDialer implements StreamDialer {
    private final SocketConnector connector;
    private final String defaultTarget;
    private final Set<String> allowedTargets;

    /**
     * @param defaultTarget target used when the peer sends an empty one; may be null
     * @param allowedTargets targets the peer may name; empty allows only the default target
     */
    public SocketStreamDialer(SocketConnector connector, String defaultTarget, List<String> allowedTargets) {
        this.connector = Objects.requireNonNull(connector, "connector");
        this.defaultTarget = defaultTarget == null || defaultTarget.isBlank() ? null : defaultTarget.trim();
        this.allowedTargets = allowedTargets == null ? Set.of() : Set.copyOf(allowedTargets);
    }

    @Override
    public CompletableFuture<UpstreamConnection> dial(String target, UpstreamReader reader) {
        String resolved = target == null || target.isBlank() ? defaultTarget : target.trim();
        if (resolved == null) {
            return CompletableFuture.failedFuture(new SubConnectionFailedException("no target given and no default target configured"));
        }
        if (!resolved.equals(defaultTarget) && !allowedTargets.contains(resolved)) {
            return CompletableFuture.failedFuture(new SubConnectionFailedException("target not allowed: " + resolved));
        }
        EndpointUrl endpoint;
        try {
            endpoint = EndpointUrl.parse(resolved);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(new ConfigInvalidException("target " + e.getMessage(), e));
        }
        switch (endpoint.scheme()) {
            case UNIX:
                return connector.connectUnix(endpoint.path(), reader);
            case TCP:
            case HTTP:
                return connector.connectTcp(endpoint.connectHost(), endpoint.port(), null, reader);
            default:
                return CompletableFuture.failedFuture(new ConfigInvalidException(
                        "target protocol " + endpoint.scheme().prefix() + " is not supported for tunnel streams"));
        }
    }
}
