package net.spookly.edgegate.tunnel;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.EventLoop;
import lombok.extern.slf4j.Slf4j;
import net.spookly.edgegate.error.SubConnectionFailedException;
import net.spookly.edgegate.proxy.UpstreamConnection;
import net.spookly.edgegate.proxy.UpstreamReader;

/**
 * Carries many independent streams over one tunnel channel.
 *
 * <p>The server side allocates odd stream ids and the agent side even ones, so both ends can open
 * streams without coordinating. Frame handling runs on the channel's event loop.</p>
 */
@Slf4j
public final class TunnelMultiplexer {
    public enum Side {
        SERVER,
        AGENT
    }

    private final Channel channel;
    private final Side side;
    private final StreamDialer inboundDialer;
    private final int maxPayloadBytes;
    private final AtomicInteger nextStreamId;
    private final Map<Integer, TunnelStream> streams = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * @param inboundDialer dials streams opened by the peer; null rejects every peer open
     */
    public TunnelMultiplexer(Channel channel, Side side, StreamDialer inboundDialer, int maxFrameBytes) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.side = Objects.requireNonNull(side, "side");
        this.inboundDialer = inboundDialer;
        this.maxPayloadBytes = Math.max(1, maxFrameBytes - TunnelFrameCodec.HEADER_BYTES);
        this.nextStreamId = new AtomicInteger(side == Side.SERVER ? 1 : 2);
    }

    public Side side() {
        return side;
    }

    public EventLoop eventLoop() {
        return channel.eventLoop();
    }

    public int streamCount() {
        return streams.size();
    }

    /**
     * Open a stream towards {@code target} on the peer. The future completes once the peer acknowledges,
     * and fails with {@link SubConnectionFailedException} on reset, timeout or tunnel loss.
     */
    public CompletableFuture<TunnelStream> openStream(String target, UpstreamReader reader, long openTimeoutMs) {
        Objects.requireNonNull(reader, "reader");
        if (closed.get() || !channel.isActive()) {
            return CompletableFuture.failedFuture(new SubConnectionFailedException("tunnel is closed"));
        }
        int id = nextStreamId.getAndAdd(2);
        TunnelStream stream = new TunnelStream(this, id, target, reader);
        streams.put(id, stream);
        if (closed.get()) {
            stream.onRemoteClose(new SubConnectionFailedException("tunnel is closed"));
            return stream.opened();
        }
        send(TunnelFrame.text(TunnelFrameType.OPEN, id, stream.target()));
        if (openTimeoutMs > 0) {
            ScheduledFuture<?> timer = channel.eventLoop().schedule(
                    () -> stream.openTimedOut(openTimeoutMs), openTimeoutMs, TimeUnit.MILLISECONDS);
            stream.opened().whenComplete((ignored, error) -> timer.cancel(false));
        }
        return stream.opened();
    }

    /**
     * Dispatch one stream frame. The caller keeps ownership of {@code frame}.
     */
    public void handleFrame(TunnelFrame frame) {
        int id = frame.streamId();
        switch (frame.type()) {
            case OPEN:
                handleOpen(id, frame.payloadText());
                break;
            case OPEN_ACK: {
                TunnelStream stream = streams.get(id);
                if (stream == null) {
                    sendReset(id, "unknown stream");
                } else {
                    stream.onOpenAck();
                }
                break;
            }
            case DATA: {
                TunnelStream stream = streams.get(id);
                if (stream != null) {
                    stream.onData(frame.content().retain());
                }
                break;
            }
            case CLOSE: {
                TunnelStream stream = streams.get(id);
                if (stream != null) {
                    stream.onRemoteClose(null);
                }
                break;
            }
            case RESET: {
                TunnelStream stream = streams.get(id);
                if (stream != null) {
                    String reason = frame.payloadText();
                    stream.onRemoteClose(new SubConnectionFailedException(
                            reason.isEmpty() ? "stream reset by peer" : "stream reset by peer: " + reason));
                }
                break;
            }
            default:
                log.debug("Ignoring unexpected {} frame on stream {}", frame.type(), id);
        }
    }

    /**
     * Fail every live stream with {@code cause}; later opens fail immediately.
     */
    public void closeAll(Throwable cause) {
        closed.set(true);
        List<TunnelStream> live = new ArrayList<>(streams.values());
        streams.clear();
        for (TunnelStream stream : live) {
            stream.onRemoteClose(cause);
        }
    }

    private void handleOpen(int id, String target) {
        if (!isPeerStreamId(id) || streams.containsKey(id)) {
            sendReset(id, "invalid stream id");
            return;
        }
        if (inboundDialer == null || closed.get()) {
            sendReset(id, "stream open not permitted");
            return;
        }
        TunnelStream stream = new TunnelStream(this, id, target, null);
        streams.put(id, stream);
        CompletableFuture<UpstreamConnection> dial;
        try {
            dial = inboundDialer.dial(target, new UpstreamReader() {
                @Override
                public void onData(ByteBuf data) {
                    stream.write(data);
                }

                @Override
                public void onClosed(Throwable cause) {
                    if (cause == null) {
                        stream.close();
                    } else {
                        stream.reset(String.valueOf(cause.getMessage()));
                    }
                }
            });
        } catch (RuntimeException e) {
            dial = CompletableFuture.failedFuture(e);
        }
        dial.whenComplete((local, error) -> channel.eventLoop().execute(() -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause()
                        : error;
                log.debug("Dial for stream {} to '{}' failed: {}", id, target, cause.getMessage());
                stream.reset(String.valueOf(cause.getMessage()));
                return;
            }
            boolean accepted = stream.accept(new UpstreamReader() {
                @Override
                public void onData(ByteBuf data) {
                    local.write(data);
                }

                @Override
                public void onClosed(Throwable cause) {
                    local.close();
                }
            });
            if (!accepted) {
                local.close();
            }
        }));
    }

    private boolean isPeerStreamId(int id) {
        if (id <= 0) {
            return false;
        }
        boolean even = id % 2 == 0;
        return side == Side.SERVER ? even : !even;
    }

    void sendData(int id, ByteBuf data) {
        while (data.readableBytes() > maxPayloadBytes) {
            send(new TunnelFrame(TunnelFrameType.DATA, id, data.readRetainedSlice(maxPayloadBytes)));
        }
        send(new TunnelFrame(TunnelFrameType.DATA, id, data));
    }

    void sendOpenAck(int id) {
        send(new TunnelFrame(TunnelFrameType.OPEN_ACK, id, null));
    }

    void sendClose(int id) {
        send(new TunnelFrame(TunnelFrameType.CLOSE, id, null));
    }

    void sendReset(int id, String reason) {
        send(TunnelFrame.text(TunnelFrameType.RESET, id, reason));
    }

    void forget(int id, TunnelStream stream) {
        streams.remove(id, stream);
    }

    private void send(TunnelFrame frame) {
        if (!channel.isActive()) {
            frame.release();
            return;
        }
        channel.writeAndFlush(frame);
    }
}
