package net.spookly.edgegate.tunnel;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.handler.timeout.ReadTimeoutException;
import lombok.extern.slf4j.Slf4j;
import net.spookly.edgegate.auth.AuthResult;
import net.spookly.edgegate.environment.Environment;
import net.spookly.edgegate.environment.EnvironmentStatus;
import net.spookly.edgegate.error.SubConnectionFailedException;

/**
 * Authenticates the agent's HELLO and, on success, turns the connection into a live tunnel.
 */
@Slf4j
final class TunnelHandshakeHandler extends SimpleChannelInboundHandler<TunnelFrame> {
    static final String HANDSHAKE_TIMEOUT = "handshakeTimeout";

    private final TunnelServer server;
    private boolean handled;

    TunnelHandshakeHandler(TunnelServer server) {
        this.server = Objects.requireNonNull(server, "server");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TunnelFrame frame) {
        if (handled) {
            return;
        }
        if (frame.type() != TunnelFrameType.HELLO) {
            reject(ctx, null, RejectReason.MALFORMED, "expected HELLO, got " + frame.type());
            return;
        }
        String address = remoteHost(ctx.channel().remoteAddress());
        if (!server.limiter().tryAcquireHandshake(address)) {
            reject(ctx, null, RejectReason.RATE_LIMITED, "too many handshakes");
            return;
        }
        TunnelMessages.Hello hello;
        try {
            hello = TunnelMessages.decode(frame.content(), TunnelMessages.Hello.class);
        } catch (IllegalArgumentException e) {
            reject(ctx, null, RejectReason.MALFORMED, e.getMessage());
            return;
        }
        if (hello.environmentId == null || hello.environmentId.isBlank()) {
            reject(ctx, null, RejectReason.MALFORMED, "environmentId is required");
            return;
        }
        Optional<Environment> found = server.environments().find(hello.environmentId);
        if (found.isEmpty()) {
            reject(ctx, hello.environmentId, RejectReason.UNKNOWN_ENVIRONMENT, "unknown environment");
            return;
        }
        Environment environment = found.get();
        if (!environment.kind().isEdge()) {
            reject(ctx, hello.environmentId, RejectReason.NOT_TUNNEL_ENVIRONMENT, "environment is not tunnel-routed");
            return;
        }
        handled = true;
        ctx.channel().config().setAutoRead(false);
        CompletableFuture<AuthResult> verification;
        try {
            verification = server.verifier().verify(environment, hello.credentialToken);
        } catch (RuntimeException e) {
            verification = CompletableFuture.failedFuture(e);
        }
        verification.whenComplete((result, error) -> ctx.executor().execute(() -> {
            if (!ctx.channel().isActive()) {
                return;
            }
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
                log.warn("Credential verification for environment {} failed", hello.environmentId, cause);
                reject(ctx, hello.environmentId, RejectReason.BAD_CREDENTIAL, "credential verification failed");
                return;
            }
            if (result == null || !result.ok) {
                reject(ctx, hello.environmentId, RejectReason.BAD_CREDENTIAL,
                        result == null ? "credential rejected" : result.message);
                return;
            }
            establish(ctx, hello);
        }));
    }

    private void establish(ChannelHandlerContext ctx, TunnelMessages.Hello hello) {
        TunnelServerSettings settings = server.settings();
        TunnelMultiplexer multiplexer = new TunnelMultiplexer(
                ctx.channel(), TunnelMultiplexer.Side.SERVER, server.inboundDialer(), settings.maxFrameBytes());
        Tunnel tunnel = new Tunnel(hello.environmentId, ctx.channel(), multiplexer, server.clock().instant(), hello.agentVersion);

        ctx.writeAndFlush(TunnelMessages.helloAck(TunnelMessages.HelloAck.accepted(settings.heartbeatIntervalMs())));
        if (ctx.pipeline().get(HANDSHAKE_TIMEOUT) != null) {
            ctx.pipeline().remove(HANDSHAKE_TIMEOUT);
        }
        ctx.pipeline().addFirst("heartbeat",
                new IdleStateHandler(settings.heartbeatIntervalMs(), 0, 0, TimeUnit.MILLISECONDS));
        ctx.pipeline().replace(this, "session", new TunnelSessionHandler(server, tunnel));

        Optional<Tunnel> replaced = server.store().install(tunnel);
        replaced.ifPresent(previous -> {
            server.emit(TunnelEvent.of(TunnelEventType.REPLACED, previous, "replaced by " + tunnel.remoteAddress(),
                    server.clock().instant()));
            previous.multiplexer().closeAll(new SubConnectionFailedException("tunnel was replaced"));
            previous.channel().close();
        });
        server.environments().updateStatus(hello.environmentId, EnvironmentStatus.UP, "tunnel established");
        server.emit(TunnelEvent.of(TunnelEventType.ESTABLISHED, tunnel,
                hello.agentVersion == null ? null : "agentVersion=" + hello.agentVersion, server.clock().instant()));
        ctx.channel().config().setAutoRead(true);
    }

    private void reject(ChannelHandlerContext ctx, String environmentId, RejectReason reason, String message) {
        handled = true;
        log.debug("Rejecting tunnel handshake from {}: {} ({})", ctx.channel().remoteAddress(), reason, message);
        server.emit(TunnelEvent.rejected(environmentId, ctx.channel().remoteAddress(), reason, server.clock().instant()));
        ctx.writeAndFlush(TunnelMessages.helloAck(TunnelMessages.HelloAck.rejected(reason, message)))
                .addListener(ChannelFutureListener.CLOSE);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof ReadTimeoutException) {
            log.debug("Tunnel handshake from {} timed out", ctx.channel().remoteAddress());
        } else if (!handled) {
            reject(ctx, null, RejectReason.MALFORMED, String.valueOf(cause.getMessage()));
            return;
        } else {
            log.debug("Tunnel handshake from {} failed", ctx.channel().remoteAddress(), cause);
        }
        ctx.close();
    }

    private static String remoteHost(SocketAddress address) {
        if (address instanceof InetSocketAddress && ((InetSocketAddress) address).getAddress() != null) {
            return ((InetSocketAddress) address).getAddress().getHostAddress();
        }
        return null;
    }
}
