package net.spookly.edgegate.tunnel;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import io.netty.buffer.ByteBuf;
import net.spookly.edgegate.error.SubConnectionFailedException;
import net.spookly.edgegate.proxy.UpstreamConnection;
import net.spookly.edgegate.proxy.UpstreamReader;

/**
 * One logical sub-connection inside a tunnel.
 *
 * <p>Writes made before the stream is acknowledged are queued and flushed in order on open. Reader
 * callbacks are delivered on the tunnel's event loop and never while the stream lock is held.</p>
 */
public final class TunnelStream implements UpstreamConnection {
    private enum State {
        OPENING,
        OPEN,
        CLOSED
    }

    private final TunnelMultiplexer multiplexer;
    private final int id;
    private final String target;
    private final CompletableFuture<TunnelStream> opened = new CompletableFuture<>();
    private final Object lock = new Object();
    private final List<ByteBuf> pendingOutbound = new ArrayList<>();
    private final List<ByteBuf> pendingInbound = new ArrayList<>();
    private UpstreamReader reader;
    private State state = State.OPENING;

    TunnelStream(TunnelMultiplexer multiplexer, int id, String target, UpstreamReader reader) {
        this.multiplexer = Objects.requireNonNull(multiplexer, "multiplexer");
        this.id = id;
        this.target = target == null ? "" : target;
        this.reader = reader;
    }

    public int id() {
        return id;
    }

    public String target() {
        return target;
    }

    CompletableFuture<TunnelStream> opened() {
        return opened;
    }

    @Override
    public void write(ByteBuf data) {
        synchronized (lock) {
            if (state == State.OPENING) {
                pendingOutbound.add(data);
                return;
            }
            if (state == State.CLOSED) {
                data.release();
                return;
            }
            multiplexer.sendData(id, data);
        }
    }

    @Override
    public void close() {
        if (markClosed()) {
            multiplexer.sendClose(id);
            opened.completeExceptionally(new SubConnectionFailedException("stream " + id + " closed before it opened"));
        }
    }

    /**
     * Abort the stream and tell the peer why.
     */
    void reset(String reason) {
        if (markClosed()) {
            multiplexer.sendReset(id, reason);
            opened.completeExceptionally(new SubConnectionFailedException("stream " + id + " reset: " + reason));
        }
    }

    @Override
    public boolean isOpen() {
        synchronized (lock) {
            return state == State.OPEN;
        }
    }

    void onOpenAck() {
        synchronized (lock) {
            if (state != State.OPENING) {
                return;
            }
            state = State.OPEN;
            flushOutbound();
        }
        opened.complete(this);
    }

    /**
     * Bind the local end of a peer-opened stream and acknowledge it.
     *
     * @return false when the stream was closed in the meantime
     */
    boolean accept(UpstreamReader localReader) {
        List<ByteBuf> buffered;
        synchronized (lock) {
            if (state != State.OPENING) {
                return false;
            }
            reader = localReader;
            state = State.OPEN;
            multiplexer.sendOpenAck(id);
            flushOutbound();
            buffered = new ArrayList<>(pendingInbound);
            pendingInbound.clear();
        }
        for (ByteBuf data : buffered) {
            localReader.onData(data);
        }
        opened.complete(this);
        return true;
    }

    void onData(ByteBuf data) {
        UpstreamReader current;
        synchronized (lock) {
            if (state == State.CLOSED) {
                data.release();
                return;
            }
            current = reader;
            if (current == null) {
                pendingInbound.add(data);
                return;
            }
        }
        current.onData(data);
    }

    void onRemoteClose(Throwable cause) {
        UpstreamReader current;
        synchronized (lock) {
            if (state == State.CLOSED) {
                return;
            }
            state = State.CLOSED;
            current = reader;
            releasePending();
        }
        multiplexer.forget(id, this);
        opened.completeExceptionally(cause != null
                ? cause
                : new SubConnectionFailedException("stream " + id + " closed before it opened"));
        if (current != null) {
            current.onClosed(cause);
        }
    }

    void openTimedOut(long timeoutMs) {
        synchronized (lock) {
            if (state != State.OPENING) {
                return;
            }
        }
        reset("open timed out after " + timeoutMs + "ms");
    }

    private boolean markClosed() {
        synchronized (lock) {
            if (state == State.CLOSED) {
                return false;
            }
            state = State.CLOSED;
            releasePending();
        }
        multiplexer.forget(id, this);
        return true;
    }

    private void flushOutbound() {
        for (ByteBuf data : pendingOutbound) {
            multiplexer.sendData(id, data);
        }
        pendingOutbound.clear();
    }

    private void releasePending() {
        for (ByteBuf data : pendingOutbound) {
            data.release();
        }
        pendingOutbound.clear();
        for (ByteBuf data : pendingInbound) {
            data.release();
        }
        pendingInbound.clear();
    }
}
