package net.spookly.edgegate.agent;

import java.io.File;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import javax.net.ssl.SSLException;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.handler.timeout.IdleStateHandler;
import lombok.extern.slf4j.Slf4j;
import net.spookly.edgegate.auth.AgentCredentials;
import net.spookly.edgegate.error.ConfigInvalidException;
import net.spookly.edgegate.error.SubConnectionFailedException;
import net.spookly.edgegate.proxy.SocketConnector;
import net.spookly.edgegate.tunnel.HandshakeRejectedException;
import net.spookly.edgegate.tunnel.RejectReason;
import net.spookly.edgegate.tunnel.SocketStreamDialer;
import net.spookly.edgegate.tunnel.StreamDialer;
import net.spookly.edgegate.tunnel.TunnelFrame;
import net.spookly.edgegate.tunnel.TunnelFrameCodec;
import net.spookly.edgegate.tunnel.TunnelFrameType;
import net.spookly.edgegate.tunnel.TunnelMessages;
import net.spookly.edgegate.tunnel.TunnelMultiplexer;

/**
 * Edge agent: keeps one tunnel to the server open, heartbeats, and serves the streams the server opens
 * by dialing local targets.
 */
@Slf4j
public final class TunnelAgent implements AutoCloseable {
    private static final int IDLE_INTERVALS_BEFORE_RECONNECT = 3;
    private static final double BACKOFF_MULTIPLIER = 2.0;

    private final AgentSettings settings;
    private final Clock clock;
    private final EventLoopGroup group;
    private final SocketConnector connector;
    private final StreamDialer dialer;
    private final ExponentialBackoff backoff;
    private final SslContext sslContext;
    private final CompletableFuture<Void> established = new CompletableFuture<>();
    private volatile boolean heartbeatsPaused;
    private volatile boolean closed;
    private volatile Channel channel;
    private volatile boolean connected;

    public TunnelAgent(AgentSettings settings, Clock clock) {
        this(settings, clock, null);
    }

    /**
     * @param dialer serves server-opened streams; null uses a {@link SocketStreamDialer} over the configured targets
     */
    public TunnelAgent(AgentSettings settings, Clock clock, StreamDialer dialer) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.group = new NioEventLoopGroup(1);
        this.connector = new SocketConnector(group, settings.connectTimeoutMs());
        this.dialer = dialer != null
                ? dialer
                : new SocketStreamDialer(connector, settings.defaultTarget(), settings.allowedTargets());
        this.backoff = new ExponentialBackoff(settings.reconnectMinMs(), settings.reconnectMaxMs(), BACKOFF_MULTIPLIER);
        this.sslContext = settings.tls() ? buildSslContext(settings.serverCa()) : null;
    }

    public void start() {
        connect();
    }

    /**
     * Completes on the first accepted handshake, or exceptionally with {@link HandshakeRejectedException}
     * when the first handshake is refused.
     */
    public CompletableFuture<Void> established() {
        return established;
    }

    public boolean isConnected() {
        Channel current = channel;
        return connected && current != null && current.isActive();
    }

    /**
     * Stop sending PINGs without closing the connection, as if the network silently dropped them.
     */
    public void pauseHeartbeats(boolean paused) {
        this.heartbeatsPaused = paused;
    }

    @Override
    public void close() {
        closed = true;
        Channel current = channel;
        if (current != null) {
            current.close().syncUninterruptibly();
        }
        connector.close();
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }

    private void connect() {
        if (closed) {
            return;
        }
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, settings.connectTimeoutMs())
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        if (sslContext != null) {
                            pipeline.addLast("tls", sslContext.newHandler(ch.alloc(), settings.host(), settings.port()));
                        }
                        TunnelFrameCodec.install(pipeline, settings.maxFrameBytes());
                        pipeline.addLast("agent", new AgentSessionHandler());
                    }
                });
        bootstrap.connect(settings.host(), settings.port()).addListener(future -> {
            if (!future.isSuccess()) {
                log.warn("Tunnel connect to {}:{} failed: {}", settings.host(), settings.port(),
                        future.cause() == null ? "cancelled" : future.cause().getMessage());
                scheduleReconnect();
            }
        });
    }

    private void scheduleReconnect() {
        if (closed || !settings.reconnect() || group.isShuttingDown()) {
            return;
        }
        long delay = backoff.nextBackoff();
        log.info("Reconnecting tunnel for {} in {}ms", settings.environmentId(), delay);
        group.schedule(this::connect, delay, TimeUnit.MILLISECONDS);
    }

    private static SslContext buildSslContext(String serverCa) {
        try {
            SslContextBuilder builder = SslContextBuilder.forClient();
            if (serverCa != null && !serverCa.isBlank()) {
                builder.trustManager(new File(serverCa));
            }
            return builder.build();
        } catch (SSLException | IllegalArgumentException e) {
            throw new ConfigInvalidException("agent.serverCa: " + e.getMessage(), e);
        }
    }

    private final class AgentSessionHandler extends SimpleChannelInboundHandler<TunnelFrame> {
        private TunnelMultiplexer multiplexer;
        private ScheduledFuture<?> heartbeat;

        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception {
            channel = ctx.channel();
            TunnelMessages.Hello hello = new TunnelMessages.Hello();
            hello.environmentId = settings.environmentId();
            hello.credentialToken = AgentCredentials.issue(settings.environmentId(), settings.edgeKey(), clock);
            hello.agentVersion = settings.agentVersion();
            ctx.writeAndFlush(TunnelMessages.hello(hello));
            super.channelActive(ctx);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, TunnelFrame frame) {
            if (multiplexer == null) {
                handleAck(ctx, frame);
                return;
            }
            switch (frame.type()) {
                case PING:
                    ctx.writeAndFlush(TunnelFrame.control(TunnelFrameType.PONG));
                    break;
                case PONG:
                    break;
                case GOAWAY:
                    log.info("Tunnel server asked the agent to go away");
                    ctx.close();
                    break;
                case HELLO:
                case HELLO_ACK:
                    break;
                default:
                    multiplexer.handleFrame(frame);
            }
        }

        private void handleAck(ChannelHandlerContext ctx, TunnelFrame frame) {
            if (frame.type() != TunnelFrameType.HELLO_ACK) {
                log.warn("Expected HELLO_ACK from tunnel server, got {}", frame.type());
                ctx.close();
                return;
            }
            TunnelMessages.HelloAck ack;
            try {
                ack = TunnelMessages.decode(frame.content(), TunnelMessages.HelloAck.class);
            } catch (IllegalArgumentException e) {
                log.warn("Unreadable HELLO_ACK from tunnel server: {}", e.getMessage());
                ctx.close();
                return;
            }
            if (!ack.accepted) {
                log.warn("Tunnel handshake for {} rejected: {} ({})", settings.environmentId(), ack.reason, ack.message);
                established.completeExceptionally(new HandshakeRejectedException(
                        ack.reason == null ? RejectReason.MALFORMED : ack.reason, ack.message));
                ctx.close();
                return;
            }
            long interval = ack.heartbeatIntervalMs != null && ack.heartbeatIntervalMs > 0
                    ? ack.heartbeatIntervalMs
                    : settings.heartbeatIntervalMs();
            multiplexer = new TunnelMultiplexer(ctx.channel(), TunnelMultiplexer.Side.AGENT, dialer, settings.maxFrameBytes());
            ctx.pipeline().addFirst("idle",
                    new IdleStateHandler(interval * IDLE_INTERVALS_BEFORE_RECONNECT, 0, 0, TimeUnit.MILLISECONDS));
            heartbeat = ctx.executor().scheduleAtFixedRate(() -> {
                if (!heartbeatsPaused) {
                    ctx.writeAndFlush(TunnelFrame.control(TunnelFrameType.PING));
                }
            }, interval, interval, TimeUnit.MILLISECONDS);
            connected = true;
            backoff.reset();
            log.info("Tunnel for {} established with {}:{} (heartbeat {}ms)",
                    settings.environmentId(), settings.host(), settings.port(), interval);
            established.complete(null);
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
            if (evt instanceof IdleStateEvent && ((IdleStateEvent) evt).state() == IdleState.READER_IDLE) {
                if (!heartbeatsPaused) {
                    log.warn("Tunnel server silent for {} intervals, reconnecting", IDLE_INTERVALS_BEFORE_RECONNECT);
                    ctx.close();
                }
                return;
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            connected = false;
            if (heartbeat != null) {
                heartbeat.cancel(false);
            }
            if (multiplexer != null) {
                multiplexer.closeAll(new SubConnectionFailedException("tunnel closed"));
            }
            log.info("Tunnel for {} closed", settings.environmentId());
            scheduleReconnect();
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.debug("Tunnel transport error", cause);
            ctx.close();
        }
    }
}
