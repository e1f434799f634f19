package net.spookly.edgegate.proxy;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Objects;

import javax.net.ssl.SSLException;

import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import lombok.extern.slf4j.Slf4j;
import net.spookly.edgegate.environment.EndpointUrl;
import net.spookly.edgegate.environment.Environment;
import net.spookly.edgegate.environment.TlsSettings;
import net.spookly.edgegate.environment.TransportType;
import net.spookly.edgegate.error.ConfigInvalidException;
import net.spookly.edgegate.tunnel.TunnelStore;

/**
 * Builds handlers by choosing the transport that matches the environment kind.
 */
@Slf4j
public final class TransportBuilder implements ProxyHandlerBuilder {
    private final SocketConnector connector;
    private final TunnelStore tunnels;
    private final ProxySettings settings;

    public TransportBuilder(SocketConnector connector, TunnelStore tunnels, ProxySettings settings) {
        this.connector = Objects.requireNonNull(connector, "connector");
        this.tunnels = Objects.requireNonNull(tunnels, "tunnels");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public ProxyHandler build(Environment environment) {
        Transport transport = buildTransport(environment);
        RequestRewriter rewriter = RequestRewriter.forEnvironment(environment, transport.type() == TransportType.TUNNEL);
        log.debug("Built {} handler for environment {}", transport.type(), environment.id());
        return new ProxyHandler(environment, transport, rewriter, settings, connector.group());
    }

    Transport buildTransport(Environment environment) {
        TransportType type = environment.kind().transportType();
        if (type == TransportType.TUNNEL) {
            return new TunnelDialTransport(environment.id(), tunnels, environment.url(), settings.openTimeoutMs());
        }
        EndpointUrl endpoint = parseEndpoint(environment);
        if (!environment.kind().accepts(endpoint.scheme())) {
            throw new ConfigInvalidException("environment " + environment.id() + " of kind "
                    + environment.kind().configName() + " cannot use " + endpoint.scheme().prefix() + " endpoints");
        }
        if (type == TransportType.DIRECT_SOCKET) {
            if (endpoint.scheme() == EndpointUrl.Scheme.NPIPE) {
                throw new ConfigInvalidException("environment " + environment.id()
                        + ": named pipe endpoints are not supported on this platform");
            }
            if (!Files.exists(Paths.get(endpoint.path()))) {
                throw new ConfigInvalidException("environment " + environment.id()
                        + ": socket " + endpoint.path() + " does not exist");
            }
            return new DirectSocketTransport(connector, endpoint.path());
        }
        TlsSettings tls = environment.tls() == null ? TlsSettings.DISABLED : environment.tls();
        boolean useTls = endpoint.scheme() == EndpointUrl.Scheme.HTTPS || tls.enabled();
        return new DirectHttpTransport(connector, endpoint, useTls ? clientSslContext(environment.id(), tls) : null);
    }

    private static EndpointUrl parseEndpoint(Environment environment) {
        try {
            return EndpointUrl.parse(environment.url());
        } catch (IllegalArgumentException e) {
            throw new ConfigInvalidException("environment " + environment.id() + " url " + e.getMessage(), e);
        }
    }

    static SslContext clientSslContext(String environmentId, TlsSettings tls) {
        boolean hasCert = tls.certPath() != null && !tls.certPath().isBlank();
        boolean hasKey = tls.keyPath() != null && !tls.keyPath().isBlank();
        if (hasCert != hasKey) {
            throw new ConfigInvalidException("environment " + environmentId + ": tls cert and key must be set together");
        }
        try {
            SslContextBuilder builder = SslContextBuilder.forClient();
            if (tls.skipVerify()) {
                builder.trustManager(InsecureTrustManagerFactory.INSTANCE);
            } else if (tls.caCertPath() != null && !tls.caCertPath().isBlank()) {
                builder.trustManager(new File(tls.caCertPath()));
            }
            if (hasCert) {
                builder.keyManager(new File(tls.certPath()), new File(tls.keyPath()));
            }
            return builder.build();
        } catch (SSLException | IllegalArgumentException e) {
            throw new ConfigInvalidException("environment " + environmentId + ": invalid TLS material: " + e.getMessage(), e);
        }
    }
}
