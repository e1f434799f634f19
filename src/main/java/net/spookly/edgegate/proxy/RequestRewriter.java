package net.spookly.edgegate.proxy;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import io.netty.handler.codec.http.HttpHeaderNames;
import net.spookly.edgegate.environment.ApiFamily;
import net.spookly.edgegate.environment.Environment;

/**
 * Turns a client request into the request head sent upstream, per API family.
 *
 * <p>Hop-by-hop headers and client credentials never pass through. The environment's own access token
 * is injected instead, and the upstream connection is always one-shot ({@code Connection: close}) unless
 * the client asked for a protocol upgrade.</p>
 */
public abstract sealed class RequestRewriter permits DockerRequestRewriter, KubernetesRequestRewriter {
    private static final Set<String> STRIPPED_HEADERS = Set.of(
            "connection",
            "keep-alive",
            "proxy-authenticate",
            "proxy-authorization",
            "proxy-connection",
            "te",
            "trailer",
            "transfer-encoding",
            "upgrade",
            "host",
            "authorization",
            "cookie"
    );

    private final String accessToken;

    protected RequestRewriter(Environment environment) {
        Objects.requireNonNull(environment, "environment");
        this.accessToken = environment.accessToken();
    }

    public static RequestRewriter forEnvironment(Environment environment, boolean tunneled) {
        return environment.kind().apiFamily() == ApiFamily.KUBERNETES
                ? new KubernetesRequestRewriter(environment, tunneled)
                : new DockerRequestRewriter(environment);
    }

    /**
     * Path as the backend expects it, before the transport's base path is applied.
     */
    protected abstract String rewritePath(String path);

    public final byte[] requestHead(ProxyRequest request, String hostHeader, String basePath) {
        String path = (basePath == null ? "" : basePath) + rewritePath(request.path());
        StringBuilder head = new StringBuilder(256)
                .append(request.method().name()).append(' ').append(path).append(" HTTP/1.1\r\n");
        appendHeader(head, "Host", hostHeader);
        Set<String> connectionTokens = connectionTokens(request);
        for (Map.Entry<String, String> header : request.headers()) {
            String name = header.getKey().toLowerCase(Locale.ROOT);
            if (STRIPPED_HEADERS.contains(name) || connectionTokens.contains(name)) {
                continue;
            }
            appendHeader(head, header.getKey(), header.getValue());
        }
        if (request.isChunked()) {
            appendHeader(head, "Transfer-Encoding", "chunked");
        }
        if (accessToken != null && !accessToken.isBlank()) {
            appendHeader(head, "Authorization", "Bearer " + accessToken);
        }
        if (request.isUpgrade()) {
            appendHeader(head, "Connection", "Upgrade");
            appendHeader(head, "Upgrade", request.upgradeProtocol());
        } else {
            appendHeader(head, "Connection", "close");
        }
        head.append("\r\n");
        return head.toString().getBytes(StandardCharsets.ISO_8859_1);
    }

    private static Set<String> connectionTokens(ProxyRequest request) {
        Set<String> tokens = new HashSet<>();
        for (String value : request.headers().getAll(HttpHeaderNames.CONNECTION)) {
            for (String token : value.split(",")) {
                String trimmed = token.trim().toLowerCase(Locale.ROOT);
                if (!trimmed.isEmpty()) {
                    tokens.add(trimmed);
                }
            }
        }
        return tokens;
    }

    private static void appendHeader(StringBuilder head, String name, String value) {
        // a CR or LF would split the head
        if (value.indexOf('\r') >= 0 || value.indexOf('\n') >= 0) {
            return;
        }
        head.append(name).append(": ").append(value).append("\r\n");
    }
}
