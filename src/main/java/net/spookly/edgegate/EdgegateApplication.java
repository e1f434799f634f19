package net.spookly.edgegate;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import net.spookly.edgegate.auth.HmacAgentCredentialVerifier;
import net.spookly.edgegate.auth.StaticTokenAuthenticator;
import net.spookly.edgegate.auth.TokenScopeAccessPolicy;
import net.spookly.edgegate.config.ConfigDefaults;
import net.spookly.edgegate.config.EdgegateConfig;
import net.spookly.edgegate.environment.EnvironmentAuditLogger;
import net.spookly.edgegate.environment.EnvironmentSeeder;
import net.spookly.edgegate.environment.EnvironmentService;
import net.spookly.edgegate.environment.InMemoryEnvironmentStore;
import net.spookly.edgegate.frontend.ApiProxyServer;
import net.spookly.edgegate.proxy.ProxyFactory;
import net.spookly.edgegate.proxy.ProxySettings;
import net.spookly.edgegate.proxy.SocketConnector;
import net.spookly.edgegate.proxy.TransportBuilder;
import net.spookly.edgegate.routing.EndpointProxyRouter;
import net.spookly.edgegate.snapshot.ProxyEnvironmentProbe;
import net.spookly.edgegate.snapshot.SnapshotScheduler;
import net.spookly.edgegate.snapshot.SnapshotSettings;
import net.spookly.edgegate.status.StatusServer;
import net.spookly.edgegate.tunnel.SocketStreamDialer;
import net.spookly.edgegate.tunnel.TunnelAuditLogger;
import net.spookly.edgegate.tunnel.TunnelServer;
import net.spookly.edgegate.tunnel.TunnelServerSettings;
import net.spookly.edgegate.tunnel.TunnelStore;
import net.spookly.edgegate.util.ListenAddress;

/**
 * Server-side process: environment registry, tunnel listener, API proxy, snapshot loop and status API,
 * wired from one loaded config.
 */
@Slf4j
@Getter
@Accessors(fluent = true)
public final class EdgegateApplication implements AutoCloseable {
    private final EnvironmentService environments;
    private final TunnelStore tunnels;
    private final ProxyFactory proxyFactory;
    private final EndpointProxyRouter router;
    private final SnapshotScheduler snapshotScheduler;
    private final TunnelServer tunnelServer;
    private final ApiProxyServer apiServer;
    private final StatusServer statusServer;
    @Getter(AccessLevel.NONE)
    private final EventLoopGroup upstreamGroup;
    @Getter(AccessLevel.NONE)
    private final SocketConnector connector;
    private volatile boolean stopped;

    public EdgegateApplication(EdgegateConfig config, Clock clock) {
        Objects.requireNonNull(config, "config");
        Clock effectiveClock = clock == null ? Clock.systemUTC() : clock;
        ProxySettings proxySettings = ProxySettings.fromConfig(config);

        this.environments = new EnvironmentService(new InMemoryEnvironmentStore(), effectiveClock);
        this.environments.addListener(EnvironmentAuditLogger.INSTANCE);
        this.tunnels = new TunnelStore();
        this.upstreamGroup = new NioEventLoopGroup();
        this.connector = new SocketConnector(upstreamGroup, proxySettings.connectTimeoutMs());

        this.proxyFactory = new ProxyFactory(
                environments,
                new TransportBuilder(connector, tunnels, proxySettings),
                Duration.ofSeconds(proxySettings.cacheIdleSeconds()),
                effectiveClock);
        this.environments.addListener(proxyFactory);
        this.router = new EndpointProxyRouter(environments, proxyFactory);

        if (config.tunnel != null && Boolean.TRUE.equals(config.tunnel.enabled)) {
            TunnelServerSettings tunnelSettings = TunnelServerSettings.fromConfig(config.tunnel);
            int clockSkew = config.tunnel.auth == null
                    ? ConfigDefaults.CLOCK_SKEW_SECONDS
                    : ConfigDefaults.orDefault(config.tunnel.auth.clockSkewSeconds, ConfigDefaults.CLOCK_SKEW_SECONDS);
            List<String> openTargets = tunnelSettings.agentOpenTargets();
            this.tunnelServer = new TunnelServer(
                    tunnelSettings,
                    environments,
                    tunnels,
                    new HmacAgentCredentialVerifier(clockSkew, effectiveClock),
                    TunnelAuditLogger.INSTANCE,
                    openTargets.isEmpty() ? null : new SocketStreamDialer(connector, null, openTargets),
                    effectiveClock);
            this.environments.addListener(tunnelServer);
        } else {
            this.tunnelServer = null;
        }

        this.snapshotScheduler = new SnapshotScheduler(
                SnapshotSettings.fromConfig(config.snapshot),
                environments,
                tunnels,
                new ProxyEnvironmentProbe(proxyFactory),
                effectiveClock);
        this.environments.addListener(snapshotScheduler);

        EdgegateConfig.ApiConfig api = config.api;
        this.apiServer = new ApiProxyServer(
                ListenAddress.of(api.listen.host, api.listen.port),
                ConfigDefaults.orDefault(api.maxHeaderBytes, ConfigDefaults.API_MAX_HEADER_BYTES),
                router,
                new StaticTokenAuthenticator(api.auth.tokens),
                new TokenScopeAccessPolicy(api.auth.tokens));

        if (config.status != null && Boolean.TRUE.equals(config.status.enabled)) {
            this.statusServer = new StatusServer(config.status, environments, tunnels,
                    snapshotScheduler::lastSnapshot, effectiveClock);
        } else {
            this.statusServer = null;
        }

        EnvironmentSeeder.seed(config, environments);
    }

    /**
     * Bind every listener and start the background loops.
     */
    public void start() {
        proxyFactory.start();
        if (tunnelServer != null) {
            tunnelServer.start();
        }
        apiServer.start();
        if (statusServer != null) {
            statusServer.start();
        }
        snapshotScheduler.start();
        log.info("Edgegate started with {} environment(s)", environments.list().size());
    }

    public InetSocketAddress apiAddress() {
        return apiServer.boundAddress();
    }

    public InetSocketAddress tunnelAddress() {
        return tunnelServer == null ? null : tunnelServer.boundAddress();
    }

    public InetSocketAddress statusAddress() {
        return statusServer == null ? null : statusServer.boundAddress();
    }

    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        snapshotScheduler.stop();
        if (statusServer != null) {
            statusServer.stop();
        }
        apiServer.stop();
        if (tunnelServer != null) {
            tunnelServer.stop();
        }
        proxyFactory.close();
        connector.close();
        upstreamGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        log.info("Edgegate stopped");
    }

    @Override
    public void close() {
        stop();
    }
}
