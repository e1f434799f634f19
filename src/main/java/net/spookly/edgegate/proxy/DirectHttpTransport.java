package net.spookly.edgegate.proxy;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import io.netty.handler.ssl.SslContext;
import net.spookly.edgegate.environment.EndpointUrl;
import net.spookly.edgegate.environment.TransportType;

/**
 * TCP connection per request, TLS when the endpoint asks for it.
 */
public final class DirectHttpTransport implements Transport {
    private final SocketConnector connector;
    private final EndpointUrl endpoint;
    private final SslContext sslContext;

    DirectHttpTransport(SocketConnector connector, EndpointUrl endpoint, SslContext sslContext) {
        this.connector = Objects.requireNonNull(connector, "connector");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.sslContext = sslContext;
    }

    @Override
    public TransportType type() {
        return TransportType.DIRECT_HTTP;
    }

    @Override
    public CompletableFuture<UpstreamConnection> open(UpstreamReader reader) {
        return connector.connectTcp(endpoint.connectHost(), endpoint.port(), sslContext, reader);
    }

    @Override
    public String hostHeader() {
        return endpoint.hostHeader();
    }

    @Override
    public String basePath() {
        return endpoint.path() == null ? "" : endpoint.path();
    }

    boolean tls() {
        return sslContext != null;
    }
}
