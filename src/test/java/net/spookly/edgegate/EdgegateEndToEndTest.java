package net.spookly.edgegate;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.spookly.edgegate.agent.AgentSettings;
import net.spookly.edgegate.agent.TunnelAgent;
import net.spookly.edgegate.config.EdgegateConfig;
import net.spookly.edgegate.environment.EnvironmentStatus;
import net.spookly.edgegate.testing.FakeDockerBackend;
import net.spookly.edgegate.tunnel.Tunnel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EdgegateEndToEndTest {
    private static final String API_TOKEN = "e2e-api-token-0123456789abcdef";
    private static final String EDGE_KEY = "0123456789abcdef0123456789abcdef";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private FakeDockerBackend backend;
    private EdgegateApplication application;
    private TunnelAgent agent;

    @BeforeEach
    void setUp() throws Exception {
        backend = new FakeDockerBackend();
        application = new EdgegateApplication(config(backend.tcpUrl()), Clock.systemUTC());
        application.start();
        agent = new TunnelAgent(AgentSettings.builder()
                .host("127.0.0.1")
                .port(application.tunnelAddress().getPort())
                .environmentId("edge-1")
                .edgeKey(EDGE_KEY)
                .defaultTarget(backend.tcpUrl())
                .reconnect(false)
                .build(), Clock.systemUTC());
        agent.start();
        agent.established().get(5, TimeUnit.SECONDS);
        await().atMost(Duration.ofSeconds(5))
                .until(() -> application.environments().require("edge-1").status() == EnvironmentStatus.UP);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (agent != null) {
            agent.close();
        }
        if (application != null) {
            application.close();
        }
        if (backend != null) {
            backend.close();
        }
    }

    @Test
    void tunneledRequestReachesAgentBackendAndFailsFastOnceHeartbeatsStop() throws Exception {
        String response = get("/api/endpoints/edge-1/docker/containers/json");
        assertTrue(response.startsWith("HTTP/1.1 200 OK\r\n"), response);
        assertEquals("[]", body(response));
        assertEquals("/containers/json", backend.requests().get(0).path());

        agent.pauseHeartbeats(true);
        await().atMost(Duration.ofSeconds(5))
                .until(() -> application.environments().require("edge-1").status() == EnvironmentStatus.DOWN);
        int requestsBefore = backend.requests().size();

        String refused = get("/api/endpoints/edge-1/docker/containers/json");
        assertTrue(refused.startsWith("HTTP/1.1 503 "), refused);
        JsonNode error = MAPPER.readTree(body(refused));
        assertEquals("ENVIRONMENT_UNREACHABLE", error.get("code").asText());
        assertEquals(requestsBefore, backend.requests().size());
    }

    @Test
    void directAndTunneledResponsesAreByteIdentical() throws Exception {
        String direct = get("/api/endpoints/local/docker/_ping");
        String tunneled = get("/api/endpoints/edge-1/docker/_ping");

        assertTrue(direct.startsWith("HTTP/1.1 200 OK\r\n"), direct);
        assertEquals(direct, tunneled);

        String directEvents = get("/api/endpoints/local/docker/events");
        String tunneledEvents = get("/api/endpoints/edge-1/docker/events");
        assertTrue(directEvents.contains("Transfer-Encoding: chunked"), directEvents);
        assertEquals(directEvents, tunneledEvents);
    }

    @Test
    void clientCredentialsAreReplacedBeforeReachingBackend() throws Exception {
        get("/api/endpoints/local/docker/containers/json");

        FakeDockerBackend.RecordedRequest recorded = backend.requests().get(0);
        assertEquals("close", recorded.headers().get("connection"));
        assertNull(recorded.headers().get("authorization"));
    }

    @Test
    void missingTokenIsUnauthorizedAndUnknownEnvironmentIsNotFound() throws Exception {
        String unauthorized = exchange("GET /api/endpoints/edge-1/docker/_ping HTTP/1.1\r\nHost: edgegate\r\n\r\n");
        String missing = get("/api/endpoints/nope/docker/_ping");

        assertTrue(unauthorized.startsWith("HTTP/1.1 401 "), unauthorized);
        assertTrue(missing.startsWith("HTTP/1.1 404 "), missing);
        assertEquals("ENVIRONMENT_NOT_FOUND", MAPPER.readTree(body(missing)).get("code").asText());
        assertTrue(backend.requests().isEmpty());
    }

    @Test
    void cancellingOneSessionLeavesSiblingStreamsRunning() throws Exception {
        Tunnel tunnel = application.tunnels().active("edge-1").orElseThrow();
        try (Socket attach = connect(); Socket hanging = connect()) {
            write(attach, "POST /api/endpoints/edge-1/docker/containers/abc/attach?stream=1 HTTP/1.1\r\n"
                    + "Host: edgegate\r\n"
                    + "Authorization: Bearer " + API_TOKEN + "\r\n"
                    + "Connection: Upgrade\r\n"
                    + "Upgrade: tcp\r\n"
                    + "Content-Length: 0\r\n\r\n");
            String upgradeHead = readHead(attach.getInputStream());
            assertTrue(upgradeHead.startsWith("HTTP/1.1 101 UPGRADED"), upgradeHead);

            write(hanging, "GET /api/endpoints/edge-1/docker/hang HTTP/1.1\r\n"
                    + "Host: edgegate\r\n"
                    + "Authorization: Bearer " + API_TOKEN + "\r\n\r\n");
            assertTrue(backend.hangStarted().await(5, TimeUnit.SECONDS));

            hanging.close();
            assertTrue(backend.hangClosed().await(5, TimeUnit.SECONDS));

            write(attach, "hello\n");
            byte[] echoed = attach.getInputStream().readNBytes(6);
            assertEquals("hello\n", new String(echoed, StandardCharsets.US_ASCII));
        }
        assertSame(tunnel, application.tunnels().active("edge-1").orElseThrow());
        assertEquals(EnvironmentStatus.UP, application.environments().require("edge-1").status());
        assertTrue(get("/api/endpoints/edge-1/docker/_ping").startsWith("HTTP/1.1 200 OK\r\n"));
    }

    @Test
    void postBodyIsForwardedThroughTunnel() throws Exception {
        String payload = "{\"Image\":\"alpine\"}";
        String response = exchange("POST /api/endpoints/edge-1/docker/containers/create HTTP/1.1\r\n"
                + "Host: edgegate\r\n"
                + "Authorization: Bearer " + API_TOKEN + "\r\n"
                + "Content-Type: application/json\r\n"
                + "Content-Length: " + payload.length() + "\r\n\r\n"
                + payload);

        assertTrue(response.startsWith("HTTP/1.1 201 Created\r\n"), response);
        assertEquals(payload, body(response));
        assertEquals(payload, backend.requests().get(0).body());
    }

    @Test
    void interimContinueIsRelayedBeforeFinalResponse() throws Exception {
        String payload = "{\"Image\":\"busybox\"}";
        for (String environment : List.of("local", "edge-1")) {
            String response = exchange("POST /api/endpoints/" + environment + "/docker/containers/create HTTP/1.1\r\n"
                    + "Host: edgegate\r\n"
                    + "Authorization: Bearer " + API_TOKEN + "\r\n"
                    + "Expect: 100-continue\r\n"
                    + "Content-Type: application/json\r\n"
                    + "Content-Length: " + payload.length() + "\r\n\r\n"
                    + payload);

            assertTrue(response.startsWith("HTTP/1.1 100 Continue\r\n\r\nHTTP/1.1 201 Created\r\n"), response);
            assertTrue(response.endsWith(payload), response);
        }
        assertEquals(2, backend.requests().size());
    }

    private String get(String path) throws IOException {
        return exchange("GET " + path + " HTTP/1.1\r\n"
                + "Host: edgegate\r\n"
                + "Authorization: Bearer " + API_TOKEN + "\r\n\r\n");
    }

    private String exchange(String request) throws IOException {
        try (Socket socket = connect()) {
            write(socket, request);
            return new String(socket.getInputStream().readAllBytes(), StandardCharsets.ISO_8859_1);
        }
    }

    private Socket connect() throws IOException {
        Socket socket = new Socket(InetAddress.getLoopbackAddress(), application.apiAddress().getPort());
        socket.setSoTimeout(5_000);
        return socket;
    }

    private static void write(Socket socket, String text) throws IOException {
        OutputStream out = socket.getOutputStream();
        out.write(text.getBytes(StandardCharsets.ISO_8859_1));
        out.flush();
    }

    private static String readHead(InputStream in) throws IOException {
        ByteArrayOutputStream head = new ByteArrayOutputStream();
        while (true) {
            int next = in.read();
            if (next < 0) {
                break;
            }
            head.write(next);
            String text = head.toString(StandardCharsets.ISO_8859_1);
            if (text.endsWith("\r\n\r\n")) {
                return text;
            }
        }
        return head.toString(StandardCharsets.ISO_8859_1);
    }

    private static String body(String response) {
        int end = response.indexOf("\r\n\r\n");
        return end < 0 ? "" : response.substring(end + 4);
    }

    private static EdgegateConfig config(String backendUrl) {
        EdgegateConfig config = new EdgegateConfig();
        config.api = new EdgegateConfig.ApiConfig();
        config.api.listen = listen(0);
        config.api.auth = new EdgegateConfig.ApiAuthConfig();
        EdgegateConfig.ApiTokenConfig token = new EdgegateConfig.ApiTokenConfig();
        token.name = "e2e";
        token.token = API_TOKEN;
        config.api.auth.tokens = List.of(token);

        config.proxy = new EdgegateConfig.ProxyConfig();
        config.proxy.requestTimeoutMs = 10_000;

        config.tunnel = new EdgegateConfig.TunnelConfig();
        config.tunnel.enabled = true;
        config.tunnel.listen = listen(0);
        config.tunnel.heartbeatIntervalMs = 100;
        config.tunnel.heartbeatLossThreshold = 3;

        config.snapshot = new EdgegateConfig.SnapshotConfig();
        config.snapshot.intervalSeconds = 0;

        EdgegateConfig.EnvironmentConfig edge = new EdgegateConfig.EnvironmentConfig();
        edge.id = "edge-1";
        edge.kind = "docker-edge";
        edge.edgeKey = EDGE_KEY;
        EdgegateConfig.EnvironmentConfig local = new EdgegateConfig.EnvironmentConfig();
        local.id = "local";
        local.kind = "docker-http";
        local.url = backendUrl;
        config.environments = List.of(edge, local);
        return config;
    }

    private static EdgegateConfig.ListenConfig listen(int port) {
        EdgegateConfig.ListenConfig listen = new EdgegateConfig.ListenConfig();
        listen.host = "127.0.0.1";
        listen.port = port;
        return listen;
    }
}
