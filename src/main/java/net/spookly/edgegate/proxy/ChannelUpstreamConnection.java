package net.spookly.edgegate.proxy;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;

/**
 * Last handler of a backend socket pipeline; exposes the channel as an {@link UpstreamConnection}.
 */
final class ChannelUpstreamConnection extends ChannelInboundHandlerAdapter implements UpstreamConnection {
    private final UpstreamReader reader;
    private final AtomicBoolean closedNotified = new AtomicBoolean(false);
    private volatile Channel channel;

    ChannelUpstreamConnection(UpstreamReader reader) {
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        channel = ctx.channel();
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (!(msg instanceof ByteBuf) || closedNotified.get()) {
            ReferenceCountUtil.release(msg);
            return;
        }
        reader.onData((ByteBuf) msg);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        notifyClosed(null);
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        notifyClosed(cause);
        ctx.close();
    }

    @Override
    public void write(ByteBuf data) {
        Channel current = channel;
        if (current == null || !current.isActive()) {
            ReferenceCountUtil.release(data);
            return;
        }
        current.writeAndFlush(data);
    }

    @Override
    public void close() {
        Channel current = channel;
        if (current != null) {
            current.close();
        }
    }

    @Override
    public boolean isOpen() {
        Channel current = channel;
        return current != null && current.isActive();
    }

    private void notifyClosed(Throwable cause) {
        if (closedNotified.compareAndSet(false, true)) {
            reader.onClosed(cause);
        }
    }
}
