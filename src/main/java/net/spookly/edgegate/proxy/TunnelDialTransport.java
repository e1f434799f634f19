package net.spookly.edgegate.proxy;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import net.spookly.edgegate.environment.TransportType;
import net.spookly.edgegate.error.EnvironmentUnreachableException;
import net.spookly.edgegate.tunnel.Tunnel;
import net.spookly.edgegate.tunnel.TunnelStore;

/**
 * Opens a stream on the environment's current tunnel for every request. The tunnel is looked up
 * per request, so a reconnected agent is picked up without rebuilding the handler.
 */
public final class TunnelDialTransport implements Transport {
    private final String environmentId;
    private final TunnelStore tunnels;
    private final String target;
    private final long openTimeoutMs;

    TunnelDialTransport(String environmentId, TunnelStore tunnels, String target, long openTimeoutMs) {
        this.environmentId = Objects.requireNonNull(environmentId, "environmentId");
        this.tunnels = Objects.requireNonNull(tunnels, "tunnels");
        this.target = target == null ? "" : target;
        this.openTimeoutMs = openTimeoutMs;
    }

    @Override
    public TransportType type() {
        return TransportType.TUNNEL;
    }

    @Override
    public CompletableFuture<UpstreamConnection> open(UpstreamReader reader) {
        Optional<Tunnel> tunnel = tunnels.active(environmentId);
        if (tunnel.isEmpty()) {
            return CompletableFuture.failedFuture(
                    new EnvironmentUnreachableException("environment " + environmentId + " has no active tunnel"));
        }
        return tunnel.get().multiplexer()
                .openStream(target, reader, openTimeoutMs)
                .thenApply(stream -> stream);
    }

    @Override
    public String hostHeader() {
        return "localhost";
    }
}
