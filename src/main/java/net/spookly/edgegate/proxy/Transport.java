package net.spookly.edgegate.proxy;

import java.util.concurrent.CompletableFuture;

import net.spookly.edgegate.environment.TransportType;

/**
 * How bytes reach an environment. One variant is chosen per handler build.
 */
public sealed interface Transport permits DirectHttpTransport, DirectSocketTransport, TunnelDialTransport {
    TransportType type();

    /**
     * Open a fresh upstream connection for one request.
     */
    CompletableFuture<UpstreamConnection> open(UpstreamReader reader);

    /**
     * Host header value to send upstream.
     */
    String hostHeader();

    /**
     * Path prefix the backend is mounted under; empty for none.
     */
    default String basePath() {
        return "";
    }
}
