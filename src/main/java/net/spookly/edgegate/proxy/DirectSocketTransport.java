package net.spookly.edgegate.proxy;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import net.spookly.edgegate.environment.TransportType;

/**
 * Unix domain socket connection per request.
 */
public final class DirectSocketTransport implements Transport {
    private final SocketConnector connector;
    private final String socketPath;

    DirectSocketTransport(SocketConnector connector, String socketPath) {
        this.connector = Objects.requireNonNull(connector, "connector");
        this.socketPath = Objects.requireNonNull(socketPath, "socketPath");
    }

    @Override
    public TransportType type() {
        return TransportType.DIRECT_SOCKET;
    }

    @Override
    public CompletableFuture<UpstreamConnection> open(UpstreamReader reader) {
        return connector.connectUnix(socketPath, reader);
    }

    @Override
    public String hostHeader() {
        return "localhost";
    }

    String socketPath() {
        return socketPath;
    }
}
