package net.spookly.edgegate.tunnel;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import lombok.extern.slf4j.Slf4j;
import net.spookly.edgegate.util.CidrMatcher;

/**
 * First handler of every tunnel connection: drops peers outside the allowed networks and enforces
 * the per-address connection cap.
 */
@Slf4j
final class TunnelConnectionGuard extends ChannelInboundHandlerAdapter {
    private final CidrMatcher allowedNetworks;
    private final TunnelConnectionLimiter limiter;
    private String acquiredFor;

    TunnelConnectionGuard(CidrMatcher allowedNetworks, TunnelConnectionLimiter limiter) {
        this.allowedNetworks = Objects.requireNonNull(allowedNetworks, "allowedNetworks");
        this.limiter = Objects.requireNonNull(limiter, "limiter");
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        SocketAddress remote = ctx.channel().remoteAddress();
        if (!(remote instanceof InetSocketAddress)) {
            super.channelActive(ctx);
            return;
        }
        InetSocketAddress address = (InetSocketAddress) remote;
        if (address.getAddress() == null || !allowedNetworks.isAllowed(address.getAddress())) {
            log.warn("Dropping tunnel connection from {}: address not allowed", remote);
            ctx.close();
            return;
        }
        String host = address.getAddress().getHostAddress();
        if (!limiter.tryOpenConnection(host)) {
            log.warn("Dropping tunnel connection from {}: too many concurrent connections", remote);
            ctx.close();
            return;
        }
        acquiredFor = host;
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (acquiredFor != null) {
            limiter.releaseConnection(acquiredFor);
            acquiredFor = null;
        }
        super.channelInactive(ctx);
    }
}
