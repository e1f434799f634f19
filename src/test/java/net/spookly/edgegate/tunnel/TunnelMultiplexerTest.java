package net.spookly.edgegate.tunnel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.util.ReferenceCountUtil;
import net.spookly.edgegate.error.SubConnectionFailedException;
import net.spookly.edgegate.proxy.UpstreamConnection;
import net.spookly.edgegate.proxy.UpstreamReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TunnelMultiplexerTest {
    private final EmbeddedChannel channel = new EmbeddedChannel();

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    @Test
    void serverStreamsUseOddIdsAndQueueWritesUntilAcknowledged() {
        TunnelMultiplexer multiplexer = new TunnelMultiplexer(channel, TunnelMultiplexer.Side.SERVER, null, 1024);
        RecordingReader reader = new RecordingReader();

        CompletableFuture<TunnelStream> opened = multiplexer.openStream("", reader, 0);
        TunnelFrame open = channel.readOutbound();
        assertEquals(TunnelFrameType.OPEN, open.type());
        assertEquals(1, open.streamId());
        open.release();

        TunnelStream pending = multiplexer.openStream("tcp://127.0.0.1:2375", new RecordingReader(), 0).getNow(null);
        assertNull(pending);
        TunnelFrame second = channel.readOutbound();
        assertEquals(3, second.streamId());
        assertEquals("tcp://127.0.0.1:2375", second.payloadText());
        second.release();

        assertFalse(opened.isDone());
        multiplexer.handleFrame(new TunnelFrame(TunnelFrameType.OPEN_ACK, 1, null));
        TunnelStream stream = opened.join();
        stream.write(Unpooled.copiedBuffer("GET /_ping", StandardCharsets.UTF_8));

        TunnelFrame data = channel.readOutbound();
        assertEquals(TunnelFrameType.DATA, data.type());
        assertEquals("GET /_ping", data.payloadText());
        data.release();
    }

    @Test
    void deliversPeerDataAndClose() {
        TunnelMultiplexer multiplexer = new TunnelMultiplexer(channel, TunnelMultiplexer.Side.SERVER, null, 1024);
        RecordingReader reader = new RecordingReader();
        CompletableFuture<TunnelStream> opened = multiplexer.openStream("", reader, 0);
        releaseOutbound();
        multiplexer.handleFrame(new TunnelFrame(TunnelFrameType.OPEN_ACK, 1, null));

        TunnelFrame data = TunnelFrame.text(TunnelFrameType.DATA, 1, "HTTP/1.1 200 OK\r\n");
        multiplexer.handleFrame(data);
        data.release();
        multiplexer.handleFrame(new TunnelFrame(TunnelFrameType.CLOSE, 1, null));

        assertTrue(opened.isDone());
        assertEquals("HTTP/1.1 200 OK\r\n", reader.text());
        assertNull(reader.closed.join());
        assertEquals(0, multiplexer.streamCount());
    }

    @Test
    void resetFailsOnlyTheAffectedStream() {
        TunnelMultiplexer multiplexer = new TunnelMultiplexer(channel, TunnelMultiplexer.Side.SERVER, null, 1024);
        RecordingReader first = new RecordingReader();
        RecordingReader second = new RecordingReader();
        multiplexer.openStream("", first, 0);
        multiplexer.openStream("", second, 0);
        releaseOutbound();
        multiplexer.handleFrame(new TunnelFrame(TunnelFrameType.OPEN_ACK, 1, null));
        multiplexer.handleFrame(new TunnelFrame(TunnelFrameType.OPEN_ACK, 3, null));

        TunnelFrame reset = TunnelFrame.text(TunnelFrameType.RESET, 1, "connection refused");
        multiplexer.handleFrame(reset);
        reset.release();
        TunnelFrame data = TunnelFrame.text(TunnelFrameType.DATA, 3, "still here");
        multiplexer.handleFrame(data);
        data.release();

        Throwable cause = first.closed.join();
        assertInstanceOf(SubConnectionFailedException.class, cause);
        assertTrue(cause.getMessage().contains("connection refused"));
        assertFalse(second.closed.isDone());
        assertEquals("still here", second.text());
        assertEquals(1, multiplexer.streamCount());
    }

    @Test
    void closingLocallySendsCloseFrame() {
        TunnelMultiplexer multiplexer = new TunnelMultiplexer(channel, TunnelMultiplexer.Side.SERVER, null, 1024);
        CompletableFuture<TunnelStream> opened = multiplexer.openStream("", new RecordingReader(), 0);
        releaseOutbound();
        multiplexer.handleFrame(new TunnelFrame(TunnelFrameType.OPEN_ACK, 1, null));

        opened.join().close();

        TunnelFrame close = channel.readOutbound();
        assertEquals(TunnelFrameType.CLOSE, close.type());
        assertEquals(1, close.streamId());
        close.release();
        assertEquals(0, multiplexer.streamCount());
    }

    @Test
    void splitsLargeWritesIntoFrameSizedChunks() {
        TunnelMultiplexer multiplexer = new TunnelMultiplexer(channel, TunnelMultiplexer.Side.SERVER, null, 16);
        CompletableFuture<TunnelStream> opened = multiplexer.openStream("", new RecordingReader(), 0);
        releaseOutbound();
        multiplexer.handleFrame(new TunnelFrame(TunnelFrameType.OPEN_ACK, 1, null));

        opened.join().write(Unpooled.wrappedBuffer(new byte[30]));

        List<Integer> sizes = new ArrayList<>();
        for (TunnelFrame frame = channel.readOutbound(); frame != null; frame = channel.readOutbound()) {
            sizes.add(frame.content().readableBytes());
            frame.release();
        }
        assertEquals(List.of(11, 11, 8), sizes);
    }

    @Test
    void rejectsPeerOpensWithoutDialerOrWithWrongParity() {
        TunnelMultiplexer multiplexer = new TunnelMultiplexer(channel, TunnelMultiplexer.Side.SERVER, null, 1024);

        multiplexer.handleFrame(TunnelFrame.text(TunnelFrameType.OPEN, 5, ""));
        TunnelFrame wrongParity = channel.readOutbound();
        multiplexer.handleFrame(TunnelFrame.text(TunnelFrameType.OPEN, 6, ""));
        TunnelFrame notPermitted = channel.readOutbound();

        assertEquals(TunnelFrameType.RESET, wrongParity.type());
        assertEquals("invalid stream id", wrongParity.payloadText());
        assertEquals(TunnelFrameType.RESET, notPermitted.type());
        assertEquals("stream open not permitted", notPermitted.payloadText());
        wrongParity.release();
        notPermitted.release();
    }

    @Test
    void servesPeerOpenedStreamsThroughDialer() {
        RecordingConnection local = new RecordingConnection();
        List<String> dialed = new ArrayList<>();
        List<UpstreamReader> localReaders = new ArrayList<>();
        StreamDialer dialer = (target, reader) -> {
            dialed.add(target);
            localReaders.add(reader);
            return CompletableFuture.completedFuture(local);
        };
        TunnelMultiplexer multiplexer = new TunnelMultiplexer(channel, TunnelMultiplexer.Side.AGENT, dialer, 1024);

        TunnelFrame open = TunnelFrame.text(TunnelFrameType.OPEN, 1, "unix:///var/run/docker.sock");
        multiplexer.handleFrame(open);
        open.release();
        TunnelFrame early = TunnelFrame.text(TunnelFrameType.DATA, 1, "GET /_ping HTTP/1.1\r\n\r\n");
        multiplexer.handleFrame(early);
        early.release();
        channel.runPendingTasks();

        TunnelFrame ack = channel.readOutbound();
        assertEquals(TunnelFrameType.OPEN_ACK, ack.type());
        assertEquals(1, ack.streamId());
        ack.release();
        assertEquals(List.of("unix:///var/run/docker.sock"), dialed);
        assertEquals("GET /_ping HTTP/1.1\r\n\r\n", local.text());

        localReaders.get(0).onData(Unpooled.copiedBuffer("OK", StandardCharsets.UTF_8));
        TunnelFrame reply = channel.readOutbound();
        assertEquals(TunnelFrameType.DATA, reply.type());
        assertEquals("OK", reply.payloadText());
        reply.release();

        multiplexer.handleFrame(new TunnelFrame(TunnelFrameType.CLOSE, 1, null));
        assertTrue(local.closed);
    }

    @Test
    void failedDialResetsStream() {
        StreamDialer dialer = (target, reader) ->
                CompletableFuture.failedFuture(new SubConnectionFailedException("target not allowed: " + target));
        TunnelMultiplexer multiplexer = new TunnelMultiplexer(channel, TunnelMultiplexer.Side.AGENT, dialer, 1024);

        TunnelFrame open = TunnelFrame.text(TunnelFrameType.OPEN, 1, "tcp://10.0.0.1:22");
        multiplexer.handleFrame(open);
        open.release();
        channel.runPendingTasks();

        TunnelFrame reset = channel.readOutbound();
        assertEquals(TunnelFrameType.RESET, reset.type());
        assertEquals("target not allowed: tcp://10.0.0.1:22", reset.payloadText());
        reset.release();
        assertEquals(0, multiplexer.streamCount());
    }

    @Test
    void closeAllFailsPendingAndFutureOpens() {
        TunnelMultiplexer multiplexer = new TunnelMultiplexer(channel, TunnelMultiplexer.Side.SERVER, null, 1024);
        CompletableFuture<TunnelStream> pending = multiplexer.openStream("", new RecordingReader(), 0);
        releaseOutbound();

        multiplexer.closeAll(new SubConnectionFailedException("tunnel closed: heartbeat lost"));

        CompletionException failure = assertThrows(CompletionException.class, pending::join);
        assertInstanceOf(SubConnectionFailedException.class, failure.getCause());
        assertTrue(multiplexer.openStream("", new RecordingReader(), 0).isCompletedExceptionally());
    }

    @Test
    void openTimesOutWhenPeerNeverAnswers() throws Exception {
        TunnelMultiplexer multiplexer = new TunnelMultiplexer(channel, TunnelMultiplexer.Side.SERVER, null, 1024);
        CompletableFuture<TunnelStream> opened = multiplexer.openStream("", new RecordingReader(), 5);
        releaseOutbound();

        Thread.sleep(50);
        channel.runScheduledPendingTasks();

        assertTrue(opened.isCompletedExceptionally());
        TunnelFrame reset = channel.readOutbound();
        assertEquals(TunnelFrameType.RESET, reset.type());
        assertTrue(reset.payloadText().startsWith("open timed out"));
        reset.release();
    }

    private void releaseOutbound() {
        for (Object message = channel.readOutbound(); message != null; message = channel.readOutbound()) {
            ReferenceCountUtil.release(message);
        }
    }

    private static final class RecordingConnection implements UpstreamConnection {
        private final StringBuilder written = new StringBuilder();
        private volatile boolean closed;

        @Override
        public void write(ByteBuf data) {
            written.append(data.toString(StandardCharsets.UTF_8));
            data.release();
        }

        @Override
        public void close() {
            closed = true;
        }

        @Override
        public boolean isOpen() {
            return !closed;
        }

        String text() {
            return written.toString();
        }
    }
}
