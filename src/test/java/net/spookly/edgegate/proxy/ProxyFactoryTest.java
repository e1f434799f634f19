package net.spookly.edgegate.proxy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.netty.channel.nio.NioEventLoopGroup;
import net.spookly.edgegate.environment.Environment;
import net.spookly.edgegate.environment.EnvironmentKind;
import net.spookly.edgegate.environment.EnvironmentService;
import net.spookly.edgegate.environment.EnvironmentStatus;
import net.spookly.edgegate.environment.InMemoryEnvironmentStore;
import net.spookly.edgegate.error.ConfigInvalidException;
import net.spookly.edgegate.error.EnvironmentNotFoundException;
import net.spookly.edgegate.testing.MutableClock;
import net.spookly.edgegate.tunnel.TunnelStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProxyFactoryTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final NioEventLoopGroup group = new NioEventLoopGroup(1);
    private final TunnelStore tunnels = new TunnelStore();
    private final AtomicInteger builds = new AtomicInteger();
    private EnvironmentService environments;
    private ProxyFactory factory;

    @BeforeEach
    void setUp() {
        environments = new EnvironmentService(new InMemoryEnvironmentStore(), clock);
        environments.save(edge("edge-1"));
        factory = new ProxyFactory(environments, this::countingBuild, Duration.ofMinutes(5), clock);
        environments.addListener(factory);
    }

    @AfterEach
    void tearDown() {
        factory.close();
        group.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
    }

    @Test
    void concurrentCallersAfterInvalidationShareOneBuild() throws Exception {
        ProxyHandler stale = factory.getHandler("edge-1");
        factory.invalidate("edge-1");
        int callers = 50;
        ExecutorService executor = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ProxyHandler>> results = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return factory.getHandler("edge-1");
                }));
            }
            start.countDown();
            Set<ProxyHandler> distinct = ConcurrentHashMap.newKeySet();
            for (Future<ProxyHandler> result : results) {
                distinct.add(result.get(5, TimeUnit.SECONDS));
            }
            assertEquals(1, distinct.size());
            assertFalse(distinct.contains(stale));
            assertEquals(2, builds.get());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void changedConfigurationRebuildsAndRetiresPreviousHandler() {
        ProxyHandler first = factory.getHandler("edge-1");

        environments.save(edge("edge-1").toBuilder().url("tcp://10.0.0.9:2375").build());
        ProxyHandler second = factory.getHandler("edge-1");

        assertNotSame(first, second);
        assertTrue(first.isClosed());
        assertFalse(second.isClosed());
        assertEquals(2, builds.get());
    }

    @Test
    void statusChangeDoesNotRebuild() {
        ProxyHandler first = factory.getHandler("edge-1");

        environments.updateStatus("edge-1", EnvironmentStatus.UP, "probe");

        assertSame(first, factory.getHandler("edge-1"));
        assertEquals(1, builds.get());
    }

    @Test
    void retiredHandlerStaysOpenWhileLeased() {
        ProxyLease lease = factory.lease("edge-1");
        ProxyHandler leased = lease.handler();

        factory.invalidate("edge-1");
        assertFalse(leased.isClosed());

        lease.close();
        assertTrue(leased.isClosed());
    }

    @Test
    void idleEntriesAreEvicted() {
        ProxyHandler handler = factory.getHandler("edge-1");

        clock.advance(Duration.ofMinutes(4));
        factory.sweepIdle();
        assertEquals(1, factory.cachedCount());

        clock.advance(Duration.ofMinutes(2));
        factory.sweepIdle();
        assertEquals(0, factory.cachedCount());
        assertTrue(handler.isClosed());
    }

    @Test
    void leasedEntryIsNotEvicted() {
        try (ProxyLease lease = factory.lease("edge-1")) {
            clock.advance(Duration.ofMinutes(10));
            factory.sweepIdle();

            assertEquals(1, factory.cachedCount());
            assertFalse(lease.handler().isClosed());
        }
    }

    @Test
    void deletingEnvironmentInvalidatesHandler() {
        ProxyHandler handler = factory.getHandler("edge-1");

        environments.delete("edge-1");

        assertEquals(0, factory.cachedCount());
        assertTrue(handler.isClosed());
        assertThrows(EnvironmentNotFoundException.class, () -> factory.getHandler("edge-1"));
    }

    @Test
    void failedBuildIsNotCached() {
        environments.save(Environment.builder()
                .id("broken")
                .kind(EnvironmentKind.DOCKER_SOCKET)
                .url("npipe:////./pipe/docker_engine")
                .build());

        assertThrows(ConfigInvalidException.class, () -> factory.getHandler("broken"));
        assertThrows(ConfigInvalidException.class, () -> factory.getHandler("broken"));
        assertEquals(0, factory.cachedCount());
    }

    private ProxyHandler countingBuild(Environment environment) {
        if (environment.kind() == EnvironmentKind.DOCKER_SOCKET) {
            throw new ConfigInvalidException("environment " + environment.id() + ": named pipe endpoints are not supported");
        }
        builds.incrementAndGet();
        Transport transport = new TunnelDialTransport(environment.id(), tunnels, environment.url(), 1_000);
        return new ProxyHandler(environment, transport, RequestRewriter.forEnvironment(environment, true),
                ProxySettings.builder().build(), group);
    }

    private static Environment edge(String id) {
        return Environment.builder()
                .id(id)
                .kind(EnvironmentKind.DOCKER_EDGE)
                .edgeKey("0123456789abcdef0123456789abcdef")
                .build();
    }
}
