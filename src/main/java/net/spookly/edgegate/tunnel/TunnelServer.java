package net.spookly.edgegate.tunnel;

import java.io.File;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import javax.net.ssl.SSLException;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.timeout.ReadTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import net.spookly.edgegate.auth.AgentCredentialVerifier;
import net.spookly.edgegate.environment.EnvironmentEvent;
import net.spookly.edgegate.environment.EnvironmentEventListener;
import net.spookly.edgegate.environment.EnvironmentEventType;
import net.spookly.edgegate.environment.EnvironmentService;
import net.spookly.edgegate.error.ConfigInvalidException;
import net.spookly.edgegate.util.CidrMatcher;

/**
 * Accepts agent connections, authenticates them and keeps {@link TunnelStore} current.
 */
@Slf4j
public final class TunnelServer implements EnvironmentEventListener {
    private final TunnelServerSettings settings;
    private final EnvironmentService environments;
    private final TunnelStore store;
    private final AgentCredentialVerifier verifier;
    private final TunnelEventListener eventListener;
    private final Clock clock;
    private final StreamDialer inboundDialer;
    private final TunnelConnectionLimiter limiter;
    private final CidrMatcher allowedNetworks;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel channel;

    /**
     * @param inboundDialer serves streams the agents open towards this side; null refuses them
     */
    public TunnelServer(TunnelServerSettings settings,
                        EnvironmentService environments,
                        TunnelStore store,
                        AgentCredentialVerifier verifier,
                        TunnelEventListener eventListener,
                        StreamDialer inboundDialer,
                        Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.environments = Objects.requireNonNull(environments, "environments");
        this.store = Objects.requireNonNull(store, "store");
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        this.eventListener = eventListener == null ? TunnelEventListener.NOOP : eventListener;
        this.inboundDialer = inboundDialer;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.limiter = new TunnelConnectionLimiter(settings.handshakesPerMinutePerIp(), settings.concurrentPerIp(), this.clock);
        this.allowedNetworks = CidrMatcher.from(settings.allowedNetworks());
    }

    /**
     * Bind the tunnel listener.
     */
    public synchronized void start() {
        if (channel != null) {
            return;
        }
        SslContext sslContext = settings.tlsEnabled() ? buildSslContext() : null;
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast("guard", new TunnelConnectionGuard(allowedNetworks, limiter));
                        if (sslContext != null) {
                            pipeline.addLast("tls", sslContext.newHandler(ch.alloc()));
                        }
                        pipeline.addLast(TunnelHandshakeHandler.HANDSHAKE_TIMEOUT,
                                new ReadTimeoutHandler(settings.handshakeTimeoutMs(), TimeUnit.MILLISECONDS));
                        TunnelFrameCodec.install(pipeline, settings.maxFrameBytes());
                        pipeline.addLast("handshake", new TunnelHandshakeHandler(TunnelServer.this));
                    }
                });
        InetSocketAddress address = settings.listen().toSocketAddress();
        try {
            channel = bootstrap.bind(address).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            throw new IllegalStateException("Tunnel server bind interrupted", e);
        }
        log.info("Tunnel server listening on {}{}", boundAddress(), sslContext == null ? "" : " (tls)");
    }

    public synchronized void stop() {
        if (channel != null) {
            channel.close().syncUninterruptibly();
            channel = null;
        }
        for (Tunnel tunnel : store.list()) {
            tunnel.channel().close();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
            bossGroup = null;
        }
    }

    public synchronized InetSocketAddress boundAddress() {
        return channel == null ? null : (InetSocketAddress) channel.localAddress();
    }

    @Override
    public void onEvent(EnvironmentEvent event) {
        if (event.type() != EnvironmentEventType.DELETED) {
            return;
        }
        store.current(event.environmentId()).ifPresent(tunnel -> {
            log.info("Closing tunnel for deleted environment {}", event.environmentId());
            tunnel.channel().close();
        });
    }

    private SslContext buildSslContext() {
        try {
            return SslContextBuilder.forServer(new File(settings.tlsCert()), new File(settings.tlsKey())).build();
        } catch (SSLException | IllegalArgumentException e) {
            throw new ConfigInvalidException("tunnel.tls: " + e.getMessage(), e);
        }
    }

    TunnelServerSettings settings() {
        return settings;
    }

    EnvironmentService environments() {
        return environments;
    }

    TunnelStore store() {
        return store;
    }

    AgentCredentialVerifier verifier() {
        return verifier;
    }

    TunnelConnectionLimiter limiter() {
        return limiter;
    }

    StreamDialer inboundDialer() {
        return inboundDialer;
    }

    Clock clock() {
        return clock;
    }

    void emit(TunnelEvent event) {
        try {
            eventListener.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("Tunnel event listener failed for {}", event.type(), e);
        }
    }
}
