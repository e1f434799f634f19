package net.spookly.edgegate.routing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.netty.channel.nio.NioEventLoopGroup;
import net.spookly.edgegate.environment.Environment;
import net.spookly.edgegate.environment.EnvironmentKind;
import net.spookly.edgegate.environment.EnvironmentService;
import net.spookly.edgegate.environment.EnvironmentStatus;
import net.spookly.edgegate.environment.InMemoryEnvironmentStore;
import net.spookly.edgegate.error.EnvironmentNotFoundException;
import net.spookly.edgegate.error.EnvironmentUnreachableException;
import net.spookly.edgegate.error.ProxyErrorCode;
import net.spookly.edgegate.error.ProxyException;
import net.spookly.edgegate.proxy.ProxyFactory;
import net.spookly.edgegate.proxy.ProxyRequest;
import net.spookly.edgegate.proxy.ProxySession;
import net.spookly.edgegate.proxy.ProxySettings;
import net.spookly.edgegate.proxy.SocketConnector;
import net.spookly.edgegate.proxy.TransportBuilder;
import net.spookly.edgegate.testing.FakeDockerBackend;
import net.spookly.edgegate.testing.RecordingSink;
import net.spookly.edgegate.tunnel.TunnelStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EndpointProxyRouterTest {
    private final NioEventLoopGroup group = new NioEventLoopGroup(2);
    private final AtomicInteger builds = new AtomicInteger();
    private FakeDockerBackend backend;
    private EnvironmentService environments;
    private ProxyFactory factory;
    private EndpointProxyRouter router;

    @BeforeEach
    void setUp() throws Exception {
        backend = new FakeDockerBackend();
        environments = new EnvironmentService(new InMemoryEnvironmentStore(), Clock.systemUTC());
        environments.save(Environment.builder()
                .id("local")
                .kind(EnvironmentKind.DOCKER_HTTP)
                .url(backend.tcpUrl())
                .build());
        environments.save(Environment.builder()
                .id("edge-1")
                .kind(EnvironmentKind.DOCKER_EDGE)
                .edgeKey("0123456789abcdef0123456789abcdef")
                .build());
        TransportBuilder transports = new TransportBuilder(new SocketConnector(group, 1_000), new TunnelStore(),
                ProxySettings.builder().requestTimeoutMs(5_000).build());
        factory = new ProxyFactory(environments, environment -> {
            builds.incrementAndGet();
            return transports.build(environment);
        }, Duration.ofMinutes(5), Clock.systemUTC());
        router = new EndpointProxyRouter(environments, factory);
    }

    @AfterEach
    void tearDown() throws Exception {
        factory.close();
        backend.close();
        group.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
    }

    @Test
    void forwardsToDirectEndpoint() throws Exception {
        RecordingSink sink = new RecordingSink();

        ProxySession session = router.route("local", ProxyRequest.get("/containers/json"), sink);

        assertNull(sink.done().get(5, TimeUnit.SECONDS));
        assertEquals(200, sink.head().get().status());
        assertEquals("[]", sink.body());
        session.completion().get(5, TimeUnit.SECONDS);
        assertEquals("/containers/json", backend.requests().get(0).path());
    }

    @Test
    void unknownEnvironmentIsNotFound() {
        EnvironmentNotFoundException failure = assertThrows(EnvironmentNotFoundException.class,
                () -> router.route("missing", ProxyRequest.get("/_ping"), new RecordingSink()));

        assertEquals(404, failure.httpStatus());
        assertEquals(0, builds.get());
    }

    @Test
    void downEnvironmentFailsFastWithoutDialing() {
        environments.updateStatus("local", EnvironmentStatus.DOWN, "probe failed");

        EnvironmentUnreachableException failure = assertThrows(EnvironmentUnreachableException.class,
                () -> router.route("local", ProxyRequest.get("/containers/json"), new RecordingSink()));

        assertEquals(ProxyErrorCode.ENVIRONMENT_UNREACHABLE, failure.code());
        assertEquals(503, failure.httpStatus());
        assertEquals(0, builds.get());
        assertTrue(backend.requests().isEmpty());
    }

    @Test
    void edgeEnvironmentWithoutTunnelIsUnreachable() throws Exception {
        RecordingSink sink = new RecordingSink();

        router.route("edge-1", ProxyRequest.get("/_ping"), sink);

        ProxyException error = sink.done().get(5, TimeUnit.SECONDS);
        assertInstanceOf(EnvironmentUnreachableException.class, error);
        assertEquals(EnvironmentStatus.UNKNOWN, environments.require("edge-1").status());
    }

    @Test
    void refusedConnectionIsUnreachableAndLeavesStatusAlone() throws Exception {
        backend.close();
        environments.updateStatus("local", EnvironmentStatus.UP, "probe ok");
        RecordingSink sink = new RecordingSink();

        router.route("local", ProxyRequest.get("/_ping"), sink);

        assertEquals(ProxyErrorCode.ENVIRONMENT_UNREACHABLE, sink.done().get(5, TimeUnit.SECONDS).code());
        assertEquals(EnvironmentStatus.UP, environments.require("local").status());
    }

    @Test
    void handlerIsReusedAcrossRequests() throws Exception {
        for (int i = 0; i < 3; i++) {
            RecordingSink sink = new RecordingSink();
            router.route("local", ProxyRequest.get("/_ping"), sink);
            assertNull(sink.done().get(5, TimeUnit.SECONDS));
            assertEquals("OK", sink.body());
        }
        assertEquals(1, builds.get());
    }
}
