package net.spookly.edgegate.status;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import lombok.extern.slf4j.Slf4j;
import net.spookly.edgegate.auth.AuthResult;
import net.spookly.edgegate.auth.HmacAuth;
import net.spookly.edgegate.auth.NonceCache;
import net.spookly.edgegate.config.ConfigDefaults;
import net.spookly.edgegate.config.EdgegateConfig;
import net.spookly.edgegate.environment.Environment;
import net.spookly.edgegate.environment.EnvironmentService;
import net.spookly.edgegate.frontend.ApiResponse;
import net.spookly.edgegate.snapshot.EnvironmentSnapshot;
import net.spookly.edgegate.tunnel.Tunnel;
import net.spookly.edgegate.tunnel.TunnelStore;
import net.spookly.edgegate.util.CidrMatcher;
import net.spookly.edgegate.util.ListenAddress;

/**
 * Read-only HTTP view of environment status and live tunnels for operators.
 *
 * <p>Every request must come from an allowed network and carry a valid HMAC signature.</p>
 */
@Slf4j
public final class StatusServer {
    static final String ENVIRONMENTS_PATH = "/v1/environments";
    static final String TUNNELS_PATH = "/v1/tunnels";
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int DEFAULT_CLOCK_SKEW_SECONDS = 10;

    private final EnvironmentService environments;
    private final TunnelStore tunnels;
    private final Function<String, Optional<EnvironmentSnapshot>> snapshots;
    private final CidrMatcher networkMatcher;
    private final String sharedKey;
    private final int nonceBytes;
    private final int clockSkewSeconds;
    private final NonceCache nonceCache;
    private final Clock clock;
    private final HttpServer server;
    private final ExecutorService executor;

    public StatusServer(EdgegateConfig.StatusConfig config,
                        EnvironmentService environments,
                        TunnelStore tunnels,
                        Function<String, Optional<EnvironmentSnapshot>> snapshots,
                        Clock clock) {
        Objects.requireNonNull(config, "config");
        this.environments = Objects.requireNonNull(environments, "environments");
        this.tunnels = Objects.requireNonNull(tunnels, "tunnels");
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.networkMatcher = CidrMatcher.from(config.allowedNetworks);
        EdgegateConfig.StatusAuthConfig auth = config.auth == null ? new EdgegateConfig.StatusAuthConfig() : config.auth;
        this.sharedKey = auth.sharedKey;
        this.nonceBytes = ConfigDefaults.orDefault(auth.nonceBytes, 0);
        this.clockSkewSeconds = ConfigDefaults.orDefault(auth.clockSkewSeconds, DEFAULT_CLOCK_SKEW_SECONDS);
        this.nonceCache = new NonceCache(Math.max(1, clockSkewSeconds * 2L + 1));
        InetSocketAddress address = ListenAddress.parse(config.listen).toSocketAddress();
        try {
            this.server = HttpServer.create(address, 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to bind status listener on " + config.listen, e);
        }
        this.executor = Executors.newFixedThreadPool(2);
        this.server.setExecutor(executor);
        this.server.createContext(ENVIRONMENTS_PATH, new EnvironmentsHandler());
        this.server.createContext(TUNNELS_PATH, new TunnelsHandler());
    }

    public void start() {
        server.start();
        log.info("Status API listening on {}", boundAddress());
    }

    public void stop() {
        server.stop(0);
        executor.shutdownNow();
    }

    public InetSocketAddress boundAddress() {
        return server.getAddress();
    }

    private abstract class BaseHandler implements HttpHandler {
        @Override
        public final void handle(HttpExchange exchange) throws IOException {
            try {
                if (!networkMatcher.isAllowed(exchange.getRemoteAddress().getAddress())) {
                    writeResponse(exchange, 403, ApiResponse.error("FORBIDDEN", "remote address not allowed"));
                    return;
                }
                if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                    writeResponse(exchange, 405, ApiResponse.error("METHOD_NOT_ALLOWED", "method not allowed"));
                    return;
                }
                drain(exchange);
                AuthResult result = verify(exchange);
                if (!result.ok) {
                    writeResponse(exchange, 401, ApiResponse.error("UNAUTHORIZED", result.message));
                    return;
                }
                writeResponse(exchange, 200, ApiResponse.ok(render(exchange)));
            } catch (IllegalArgumentException e) {
                writeResponse(exchange, 400, ApiResponse.error("BAD_REQUEST", e.getMessage()));
            } catch (RuntimeException e) {
                log.warn("Status request {} failed", exchange.getRequestURI(), e);
                writeResponse(exchange, 500, ApiResponse.error("INTERNAL", "internal error"));
            } finally {
                exchange.close();
            }
        }

        protected abstract Object render(HttpExchange exchange);
    }

    private final class EnvironmentsHandler extends BaseHandler {
        @Override
        protected Object render(HttpExchange exchange) {
            String path = exchange.getRequestURI().getPath();
            if (path.length() > ENVIRONMENTS_PATH.length() + 1) {
                String id = path.substring(ENVIRONMENTS_PATH.length() + 1);
                Environment environment = environments.find(id)
                        .orElseThrow(() -> new IllegalArgumentException("unknown environment: " + id));
                return environmentView(environment);
            }
            List<Map<String, Object>> views = new ArrayList<>();
            for (Environment environment : environments.list()) {
                views.add(environmentView(environment));
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("count", views.size());
            data.put("environments", views);
            return data;
        }
    }

    private final class TunnelsHandler extends BaseHandler {
        @Override
        protected Object render(HttpExchange exchange) {
            List<Map<String, Object>> views = new ArrayList<>();
            for (Tunnel tunnel : tunnels.list()) {
                Map<String, Object> view = new LinkedHashMap<>();
                view.put("environmentId", tunnel.environmentId());
                view.put("state", tunnel.state().name());
                view.put("remoteAddress", String.valueOf(tunnel.remoteAddress()));
                view.put("agentVersion", tunnel.agentVersion());
                view.put("establishedAt", tunnel.establishedAt().toString());
                view.put("lastActivityAt", tunnel.lastActivityAt().toString());
                view.put("streams", tunnel.multiplexer().streamCount());
                views.add(view);
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("count", views.size());
            data.put("tunnels", views);
            return data;
        }
    }

    private Map<String, Object> environmentView(Environment environment) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", environment.id());
        view.put("name", environment.displayName());
        view.put("kind", environment.kind().configName());
        view.put("transport", environment.kind().transportType().name());
        view.put("status", environment.status().name());
        view.put("lastProbeAt", environment.lastProbeAt() == null ? null : environment.lastProbeAt().toString());
        view.put("lastStatusChangeAt",
                environment.lastStatusChangeAt() == null ? null : environment.lastStatusChangeAt().toString());
        if (environment.kind().isEdge()) {
            view.put("tunnelActive", tunnels.active(environment.id()).isPresent());
        }
        snapshots.apply(environment.id()).ifPresent(snapshot -> {
            Map<String, Object> last = new LinkedHashMap<>();
            last.put("probedAt", snapshot.probedAt().toString());
            last.put("success", snapshot.success());
            last.put("latencyMs", snapshot.latencyMs());
            last.put("detail", snapshot.detail());
            last.put("consecutiveFailures", snapshot.consecutiveFailures());
            view.put("lastSnapshot", last);
        });
        return view;
    }

    private AuthResult verify(HttpExchange exchange) {
        Headers headers = exchange.getRequestHeaders();
        Long timestamp = null;
        String timestampRaw = headers.getFirst(HmacAuth.TIMESTAMP_HEADER);
        if (timestampRaw != null) {
            try {
                timestamp = Long.parseLong(timestampRaw.trim());
            } catch (NumberFormatException e) {
                return AuthResult.error("invalid " + HmacAuth.TIMESTAMP_HEADER + " header");
            }
        }
        HmacAuth.SignedRequest request = new HmacAuth.SignedRequest(
                exchange.getRequestMethod().toUpperCase(Locale.ROOT),
                rawPath(exchange.getRequestURI()),
                timestamp,
                headers.getFirst(HmacAuth.NONCE_HEADER),
                headers.getFirst(HmacAuth.SIGNATURE_HEADER),
                headers.getFirst(HmacAuth.CLIENT_HEADER),
                new byte[0]);
        return HmacAuth.verify(request, sharedKey, nonceBytes, clockSkewSeconds, nonceCache, clock);
    }

    private static void drain(HttpExchange exchange) throws IOException {
        try (InputStream input = exchange.getRequestBody()) {
            if (input != null && input.read() != -1) {
                throw new IllegalArgumentException("request body not allowed");
            }
        }
    }

    private static String rawPath(URI uri) {
        String query = uri.getRawQuery();
        return query == null || query.isEmpty() ? uri.getRawPath() : uri.getRawPath() + "?" + query;
    }

    private static void writeResponse(HttpExchange exchange, int status, ApiResponse response) throws IOException {
        byte[] payload = MAPPER.writeValueAsBytes(response);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream output = exchange.getResponseBody()) {
            output.write(payload);
        }
    }
}
