package net.spookly.edgegate.proxy;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.CompositeByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.EventLoopGroup;
import io.netty.util.ReferenceCountUtil;
import lombok.extern.slf4j.Slf4j;
import net.spookly.edgegate.error.EnvironmentUnreachableException;
import net.spookly.edgegate.error.ProxyException;
import net.spookly.edgegate.error.UpgradeFailedException;
import net.spookly.edgegate.error.UpstreamProtocolException;

/**
 * One proxied exchange over one upstream connection.
 *
 * <p>Request bytes written before the upstream is connected are queued. The response is relayed
 * verbatim; after a {@code 101} both directions become a raw relay that ends when either side closes
 * or the session is cancelled.</p>
 */
@Slf4j
final class ForwardingSession implements ProxySession, UpstreamReader {
    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] LAST_CHUNK = "0\r\n\r\n".getBytes(StandardCharsets.US_ASCII);

    private final String environmentId;
    private final ProxyRequest request;
    private final ResponseSink sink;
    private final byte[] requestHead;
    private final ProxySettings settings;
    private final CompletableFuture<Void> completion = new CompletableFuture<>();
    private final Object lock = new Object();
    private final List<ByteBuf> pendingBody = new ArrayList<>();
    private UpstreamConnection upstream;
    private boolean bodyEnded;
    private boolean closed;
    private volatile boolean upgraded;
    private ScheduledFuture<?> headTimeout;

    // guarded by headLock; released from any thread once the session closes
    private final Object headLock = new Object();
    private CompositeByteBuf headBuffer;
    // touched only from the upstream's reader callbacks
    private boolean headReceived;
    private long bodyRemaining = -1;

    ForwardingSession(String environmentId,
                      ProxyRequest request,
                      ResponseSink sink,
                      byte[] requestHead,
                      ProxySettings settings) {
        this.environmentId = Objects.requireNonNull(environmentId, "environmentId");
        this.request = Objects.requireNonNull(request, "request");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.requestHead = Objects.requireNonNull(requestHead, "requestHead");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    void start(Transport transport, EventLoopGroup timers) {
        int timeoutMs = settings.requestTimeoutMs();
        if (timeoutMs > 0) {
            ScheduledFuture<?> timer = timers.next().schedule(() -> fail(new EnvironmentUnreachableException(
                    "environment " + environmentId + " sent no response within " + timeoutMs + "ms")),
                    timeoutMs, TimeUnit.MILLISECONDS);
            synchronized (lock) {
                headTimeout = timer;
            }
        }
        CompletableFuture<UpstreamConnection> connecting;
        try {
            connecting = transport.open(this);
        } catch (RuntimeException e) {
            connecting = CompletableFuture.failedFuture(e);
        }
        connecting.whenComplete(this::onConnected);
    }

    private void onConnected(UpstreamConnection connection, Throwable error) {
        if (error != null) {
            fail(asProxyException(error, "connect to environment " + environmentId + " failed"));
            return;
        }
        synchronized (lock) {
            if (closed) {
                connection.close();
                return;
            }
            upstream = connection;
            connection.write(Unpooled.wrappedBuffer(requestHead));
            for (ByteBuf chunk : pendingBody) {
                writeBody(connection, chunk);
            }
            pendingBody.clear();
            if (bodyEnded) {
                writeBodyEnd(connection);
            }
        }
    }

    @Override
    public void sendBody(ByteBuf data) {
        synchronized (lock) {
            if (closed) {
                data.release();
                return;
            }
            if (upstream == null) {
                pendingBody.add(data);
                return;
            }
            writeBody(upstream, data);
        }
    }

    @Override
    public void endBody() {
        synchronized (lock) {
            if (closed || bodyEnded) {
                return;
            }
            bodyEnded = true;
            if (upstream != null) {
                writeBodyEnd(upstream);
            }
        }
    }

    @Override
    public void cancel() {
        if (markClosed()) {
            closeUpstream();
            releaseHeadBuffer();
            completion.cancel(false);
        }
    }

    @Override
    public CompletableFuture<Void> completion() {
        return completion;
    }

    @Override
    public void onData(ByteBuf data) {
        if (isClosed()) {
            data.release();
            releaseHeadBuffer();
            return;
        }
        if (headReceived) {
            relay(data);
            return;
        }
        synchronized (headLock) {
            readHead(data);
        }
    }

    private void readHead(ByteBuf data) {
        if (isClosed()) {
            data.release();
            return;
        }
        if (headBuffer == null) {
            headBuffer = Unpooled.compositeBuffer();
        }
        headBuffer.addComponent(true, data);
        while (headBuffer != null) {
            ResponseHead head;
            try {
                head = ResponseHeadParser.tryParse(headBuffer, settings.maxResponseHeadBytes());
            } catch (UpstreamProtocolException e) {
                fail(e);
                return;
            }
            if (head == null) {
                return;
            }
            if (head.isInformational() && !head.isSwitchingProtocols()) {
                // interim response, the final head follows
                sink.onInterimResponse(headBuffer.readRetainedSlice(head.headLength()));
                continue;
            }
            onFinalHead(head);
        }
    }

    private void onFinalHead(ResponseHead head) {
        ProxyException rejection = checkUpgrade(head);
        if (rejection != null) {
            fail(rejection);
            return;
        }
        headReceived = true;
        cancelHeadTimeout();
        ByteBuf buffered = headBuffer;
        headBuffer = null;
        int bodyBytes = buffered.readableBytes() - head.headLength();
        if (head.isSwitchingProtocols()) {
            upgraded = true;
        } else if (request.isHead() || head.status() == 204 || head.status() == 304) {
            bodyRemaining = 0;
        } else {
            long declared = head.contentLength();
            bodyRemaining = declared < 0 ? -1 : declared - bodyBytes;
        }
        sink.onResponseHead(head);
        sink.onData(buffered);
        if (!upgraded && bodyRemaining == 0) {
            finish();
        }
    }

    private ProxyException checkUpgrade(ResponseHead head) {
        if (!request.isUpgrade()) {
            return head.isSwitchingProtocols()
                    ? new UpstreamProtocolException("upstream switched protocols without an upgrade request")
                    : null;
        }
        if (!head.isSwitchingProtocols()) {
            return new UpgradeFailedException("upgrade to " + request.upgradeProtocol()
                    + " was answered with status " + head.status());
        }
        String granted = head.headers().get("Upgrade");
        if (granted == null || !granted.trim().equalsIgnoreCase(request.upgradeProtocol())) {
            return new UpgradeFailedException("upgrade to " + request.upgradeProtocol()
                    + " was answered with protocol " + granted);
        }
        return null;
    }

    private void relay(ByteBuf data) {
        int length = data.readableBytes();
        sink.onData(data);
        if (bodyRemaining > 0) {
            bodyRemaining -= length;
            if (bodyRemaining <= 0) {
                finish();
            }
        }
    }

    @Override
    public void onClosed(Throwable cause) {
        releaseHeadBuffer();
        if (!headReceived) {
            fail(cause != null
                    ? asProxyException(cause, "upstream failed before sending a response head")
                    : new UpstreamProtocolException("upstream closed before sending a response head"));
            return;
        }
        if (cause != null && !upgraded) {
            fail(asProxyException(cause, "upstream failed while streaming the response"));
            return;
        }
        finish();
    }

    private void finish() {
        if (!markClosed()) {
            return;
        }
        closeUpstream();
        sink.onComplete();
        completion.complete(null);
    }

    private void fail(ProxyException error) {
        if (!markClosed()) {
            return;
        }
        closeUpstream();
        releaseHeadBuffer();
        log.debug("Request {} to environment {} failed: {}", request, environmentId, error.getMessage());
        sink.onError(error);
        completion.completeExceptionally(error);
    }

    /**
     * @return true when this call closed the session
     */
    private boolean markClosed() {
        List<ByteBuf> dropped;
        synchronized (lock) {
            if (closed) {
                return false;
            }
            closed = true;
            if (headTimeout != null) {
                headTimeout.cancel(false);
            }
            dropped = new ArrayList<>(pendingBody);
            pendingBody.clear();
        }
        for (ByteBuf chunk : dropped) {
            ReferenceCountUtil.release(chunk);
        }
        return true;
    }

    private void closeUpstream() {
        UpstreamConnection connection;
        synchronized (lock) {
            connection = upstream;
        }
        if (connection != null) {
            connection.close();
        }
    }

    private void releaseHeadBuffer() {
        synchronized (headLock) {
            if (headBuffer != null) {
                headBuffer.release();
                headBuffer = null;
            }
        }
    }

    private boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    private void cancelHeadTimeout() {
        synchronized (lock) {
            if (headTimeout != null) {
                headTimeout.cancel(false);
            }
        }
    }

    private void writeBody(UpstreamConnection connection, ByteBuf data) {
        if (upgraded || !request.isChunked()) {
            connection.write(data);
            return;
        }
        if (!data.isReadable()) {
            data.release();
            return;
        }
        byte[] size = Integer.toHexString(data.readableBytes()).getBytes(StandardCharsets.US_ASCII);
        connection.write(Unpooled.wrappedBuffer(Unpooled.wrappedBuffer(size), Unpooled.wrappedBuffer(CRLF),
                data, Unpooled.wrappedBuffer(CRLF)));
    }

    private void writeBodyEnd(UpstreamConnection connection) {
        if (!upgraded && request.isChunked()) {
            connection.write(Unpooled.wrappedBuffer(LAST_CHUNK));
        }
    }

    private static ProxyException asProxyException(Throwable error, String message) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof ProxyException) {
            return (ProxyException) cause;
        }
        return new EnvironmentUnreachableException(message + ": " + cause.getMessage(), cause);
    }
}
