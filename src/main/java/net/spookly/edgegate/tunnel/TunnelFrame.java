package net.spookly.edgegate.tunnel;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.DefaultByteBufHolder;
import io.netty.buffer.Unpooled;

/**
 * One decoded tunnel frame. The payload is reference counted and released with the frame.
 */
public final class TunnelFrame extends DefaultByteBufHolder {
    private final TunnelFrameType type;
    private final int streamId;

    public TunnelFrame(TunnelFrameType type, int streamId, ByteBuf payload) {
        super(payload == null ? Unpooled.EMPTY_BUFFER : payload);
        this.type = Objects.requireNonNull(type, "type");
        this.streamId = streamId;
    }

    public static TunnelFrame control(TunnelFrameType type) {
        return new TunnelFrame(type, 0, Unpooled.EMPTY_BUFFER);
    }

    public static TunnelFrame text(TunnelFrameType type, int streamId, String text) {
        ByteBuf payload = text == null || text.isEmpty()
                ? Unpooled.EMPTY_BUFFER
                : Unpooled.copiedBuffer(text, StandardCharsets.UTF_8);
        return new TunnelFrame(type, streamId, payload);
    }

    public TunnelFrameType type() {
        return type;
    }

    public int streamId() {
        return streamId;
    }

    public String payloadText() {
        return content().toString(StandardCharsets.UTF_8);
    }

    @Override
    public TunnelFrame replace(ByteBuf content) {
        return new TunnelFrame(type, streamId, content);
    }

    @Override
    public TunnelFrame retain() {
        super.retain();
        return this;
    }

    @Override
    public String toString() {
        return "TunnelFrame(" + type + ", stream=" + streamId + ", bytes=" + content().readableBytes() + ")";
    }
}
