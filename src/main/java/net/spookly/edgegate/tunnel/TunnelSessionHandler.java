package net.spookly.edgegate.tunnel;

import java.util.Objects;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import lombok.extern.slf4j.Slf4j;
import net.spookly.edgegate.environment.EnvironmentStatus;
import net.spookly.edgegate.error.SubConnectionFailedException;

/**
 * Drives an established tunnel: answers heartbeats, dispatches stream frames and tears the tunnel
 * down on heartbeat loss or transport failure.
 */
@Slf4j
final class TunnelSessionHandler extends SimpleChannelInboundHandler<TunnelFrame> {
    private final TunnelServer server;
    private final Tunnel tunnel;
    private int missedIntervals;
    private boolean tornDown;

    TunnelSessionHandler(TunnelServer server, Tunnel tunnel) {
        this.server = Objects.requireNonNull(server, "server");
        this.tunnel = Objects.requireNonNull(tunnel, "tunnel");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TunnelFrame frame) {
        missedIntervals = 0;
        tunnel.touch(server.clock().instant());
        switch (frame.type()) {
            case PING:
                ctx.writeAndFlush(TunnelFrame.control(TunnelFrameType.PONG));
                break;
            case PONG:
                break;
            case GOAWAY:
                tearDown(false, "agent sent GOAWAY");
                break;
            case HELLO:
            case HELLO_ACK:
                log.debug("Ignoring {} on established tunnel for {}", frame.type(), tunnel.environmentId());
                break;
            default:
                tunnel.multiplexer().handleFrame(frame);
        }
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent && ((IdleStateEvent) evt).state() == IdleState.READER_IDLE) {
            missedIntervals++;
            log.debug("Tunnel for {} missed heartbeat interval {}/{}", tunnel.environmentId(),
                    missedIntervals, server.settings().heartbeatLossThreshold());
            if (missedIntervals >= server.settings().heartbeatLossThreshold()) {
                tearDown(true, "missed " + missedIntervals + " heartbeat intervals");
            }
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        tearDown(false, "connection closed");
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.debug("Tunnel transport error for {}", tunnel.environmentId(), cause);
        tearDown(false, "transport error: " + cause.getMessage());
    }

    /**
     * @param heartbeatLost true when the peer stopped heartbeating; only then is the environment marked DOWN
     */
    private void tearDown(boolean heartbeatLost, String reason) {
        if (tornDown) {
            return;
        }
        tornDown = true;
        boolean wasCurrent = server.store().remove(tunnel);
        if (wasCurrent && heartbeatLost) {
            server.environments().updateStatus(tunnel.environmentId(), EnvironmentStatus.DOWN, reason);
            server.emit(TunnelEvent.of(TunnelEventType.LOST, tunnel, reason, server.clock().instant()));
        } else {
            server.emit(TunnelEvent.of(TunnelEventType.CLOSED, tunnel, reason, server.clock().instant()));
        }
        tunnel.multiplexer().closeAll(new SubConnectionFailedException("tunnel closed: " + reason));
        tunnel.channel().close();
    }
}
