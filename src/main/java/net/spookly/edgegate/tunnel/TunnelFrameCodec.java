package net.spookly.edgegate.tunnel;

import java.util.List;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.handler.codec.MessageToMessageCodec;

/**
 * Converts between length-delimited frame bodies ({@code type:int8, streamId:int32, payload}) and {@link TunnelFrame}s.
 */
public final class TunnelFrameCodec extends MessageToMessageCodec<ByteBuf, TunnelFrame> {
    public static final int HEADER_BYTES = 5;

    /**
     * Install length framing plus this codec at the end of {@code pipeline}.
     */
    public static void install(ChannelPipeline pipeline, int maxFrameBytes) {
        pipeline.addLast("frameDecoder", new LengthFieldBasedFrameDecoder(maxFrameBytes, 0, 4, 0, 4));
        pipeline.addLast("framePrepender", new LengthFieldPrepender(4));
        pipeline.addLast("frameCodec", new TunnelFrameCodec());
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, TunnelFrame frame, List<Object> out) {
        ByteBuf header = ctx.alloc().buffer(HEADER_BYTES);
        header.writeByte(frame.type().code());
        header.writeInt(frame.streamId());
        ByteBuf payload = frame.content();
        if (!payload.isReadable()) {
            out.add(header);
            return;
        }
        out.add(Unpooled.wrappedBuffer(header, payload.retain()));
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf body, List<Object> out) {
        if (body.readableBytes() < HEADER_BYTES) {
            throw new CorruptedFrameException("tunnel frame shorter than header: " + body.readableBytes());
        }
        int code = body.readUnsignedByte();
        TunnelFrameType type = TunnelFrameType.fromCode(code);
        if (type == null) {
            throw new CorruptedFrameException("unknown tunnel frame type: " + code);
        }
        int streamId = body.readInt();
        out.add(new TunnelFrame(type, streamId, body.readRetainedSlice(body.readableBytes())));
    }
}
