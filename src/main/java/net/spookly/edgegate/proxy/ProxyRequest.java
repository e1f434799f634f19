package net.spookly.edgegate.proxy;

import java.util.Locale;
import java.util.Objects;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Request head as seen by the router: method, path relative to the environment API root (with query),
 * and the client's headers. The body follows through {@link ProxySession#sendBody}.
 */
@Getter
@Accessors(fluent = true)
public final class ProxyRequest {
    private final HttpMethod method;
    private final String path;
    private final HttpHeaders headers;

    private ProxyRequest(HttpMethod method, String path, HttpHeaders headers) {
        this.method = Objects.requireNonNull(method, "method");
        this.path = path == null || path.isEmpty() ? "/" : (path.startsWith("/") ? path : "/" + path);
        this.headers = headers == null ? new DefaultHttpHeaders() : headers;
    }

    public static ProxyRequest of(HttpMethod method, String path, HttpHeaders headers) {
        return new ProxyRequest(method, path, headers);
    }

    public static ProxyRequest get(String path) {
        return new ProxyRequest(HttpMethod.GET, path, new DefaultHttpHeaders());
    }

    /**
     * True for {@code Connection: Upgrade} with an {@code Upgrade} protocol.
     */
    public boolean isUpgrade() {
        String upgrade = headers.get(HttpHeaderNames.UPGRADE);
        return upgrade != null && !upgrade.isBlank()
                && headers.containsValue(HttpHeaderNames.CONNECTION, HttpHeaderValues.UPGRADE, true);
    }

    public String upgradeProtocol() {
        String upgrade = headers.get(HttpHeaderNames.UPGRADE);
        return upgrade == null ? null : upgrade.trim();
    }

    /**
     * True when the client sent a chunked body, which has to be re-chunked upstream.
     */
    public boolean isChunked() {
        return headers.containsValue(HttpHeaderNames.TRANSFER_ENCODING, HttpHeaderValues.CHUNKED, true);
    }

    public boolean isHead() {
        return HttpMethod.HEAD.equals(method);
    }

    @Override
    public String toString() {
        return method.name().toUpperCase(Locale.ROOT) + " " + path;
    }
}
