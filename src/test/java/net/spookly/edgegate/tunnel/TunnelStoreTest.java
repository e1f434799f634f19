package net.spookly.edgegate.tunnel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

class TunnelStoreTest {

    @Test
    void installReplacesPreviousTunnel() {
        TunnelStore store = new TunnelStore();
        Tunnel first = tunnel("edge-1");
        Tunnel second = tunnel("edge-1");

        assertTrue(store.install(first).isEmpty());
        Optional<Tunnel> replaced = store.install(second);

        assertSame(first, replaced.orElseThrow());
        assertEquals(TunnelState.CLOSING, first.state());
        assertSame(second, store.active("edge-1").orElseThrow());
        assertEquals(1, store.size());
    }

    @Test
    void removeIgnoresStaleTunnel() {
        TunnelStore store = new TunnelStore();
        Tunnel first = tunnel("edge-1");
        Tunnel second = tunnel("edge-1");
        store.install(first);
        store.install(second);

        assertFalse(store.remove(first));
        assertSame(second, store.active("edge-1").orElseThrow());

        assertTrue(store.remove(second));
        assertTrue(store.active("edge-1").isEmpty());
        assertTrue(store.current("edge-1").isEmpty());
    }

    @Test
    void closedChannelIsNotActive() {
        TunnelStore store = new TunnelStore();
        Tunnel tunnel = tunnel("edge-1");
        store.install(tunnel);

        tunnel.channel().close();

        assertTrue(store.active("edge-1").isEmpty());
        assertSame(tunnel, store.current("edge-1").orElseThrow());
        assertTrue(store.active(null).isEmpty());
    }

    @Test
    void concurrentInstallsLeaveExactlyOneActiveTunnel() throws Exception {
        TunnelStore store = new TunnelStore();
        int callers = 32;
        List<Tunnel> tunnels = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            tunnels.add(tunnel("edge-1"));
        }
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (Tunnel tunnel : tunnels) {
                executor.submit(() -> {
                    start.await();
                    return store.install(tunnel);
                });
            }
            start.countDown();
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        }

        Tunnel winner = store.active("edge-1").orElseThrow();
        long active = tunnels.stream().filter(t -> t.state() == TunnelState.ACTIVE).count();
        assertEquals(1, active);
        assertEquals(TunnelState.ACTIVE, winner.state());
        assertEquals(1, store.list().size());
    }

    @Test
    void listIsSortedByEnvironment() {
        TunnelStore store = new TunnelStore();
        store.install(tunnel("edge-b"));
        store.install(tunnel("edge-a"));

        assertEquals(List.of("edge-a", "edge-b"), store.list().stream().map(Tunnel::environmentId).toList());
    }

    private static Tunnel tunnel(String environmentId) {
        EmbeddedChannel channel = new EmbeddedChannel();
        TunnelMultiplexer multiplexer = new TunnelMultiplexer(channel, TunnelMultiplexer.Side.SERVER, null, 1024);
        return new Tunnel(environmentId, channel, multiplexer, Instant.EPOCH, "test");
    }
}
