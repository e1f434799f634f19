package net.spookly.edgegate.environment;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Parsed environment endpoint: {@code tcp://host:port}, {@code http(s)://host[:port][/base]},
 * {@code unix:///path/to.sock}, {@code npipe:////./pipe/name} or a bare {@code host:port}.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class EndpointUrl {
    private final Scheme scheme;
    private final String host;
    private final int port;
    /**
     * Socket or pipe path for local schemes, base path (possibly empty) for HTTP schemes.
     */
    private final String path;

    @Getter
    @Accessors(fluent = true)
    public enum Scheme {
        TCP("tcp://"),
        HTTP("http://"),
        HTTPS("https://"),
        UNIX("unix://"),
        NPIPE("npipe://");

        private final String prefix;

        Scheme(String prefix) {
            this.prefix = prefix;
        }
    }

    public static EndpointUrl parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("endpoint is required");
        }
        String value = raw.trim();
        String lower = value.toLowerCase(Locale.ROOT);
        for (Scheme scheme : Scheme.values()) {
            if (lower.startsWith(scheme.prefix)) {
                return parseWithScheme(scheme, value, value.substring(scheme.prefix.length()));
            }
        }
        if (value.contains("://")) {
            throw new IllegalArgumentException("uses an unsupported protocol (expected unix://, npipe://, tcp://, http:// or https://): " + raw);
        }
        return parseWithScheme(Scheme.TCP, "tcp://" + value, value);
    }

    private static EndpointUrl parseWithScheme(Scheme scheme, String full, String rest) {
        if (scheme == Scheme.UNIX || scheme == Scheme.NPIPE) {
            if (rest.isBlank()) {
                throw new IllegalArgumentException("is missing the socket path: " + full);
            }
            return new EndpointUrl(scheme, null, -1, rest);
        }
        URI uri;
        try {
            uri = new URI(full);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("is not a valid address: " + full, e);
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("is missing a host: " + full);
        }
        int port = uri.getPort();
        if (port < 0) {
            if (scheme == Scheme.TCP) {
                throw new IllegalArgumentException("is missing a port: " + full);
            }
            port = scheme == Scheme.HTTPS ? 443 : 80;
        }
        String basePath = uri.getRawPath() == null ? "" : uri.getRawPath();
        while (basePath.endsWith("/")) {
            basePath = basePath.substring(0, basePath.length() - 1);
        }
        if (scheme == Scheme.TCP && !basePath.isEmpty()) {
            throw new IllegalArgumentException("must not carry a path: " + full);
        }
        return new EndpointUrl(scheme, host, port, basePath);
    }

    public boolean isLocalSocket() {
        return scheme == Scheme.UNIX || scheme == Scheme.NPIPE;
    }

    /**
     * Host name or literal address suitable for a socket connect.
     */
    public String connectHost() {
        if (host != null && host.startsWith("[") && host.endsWith("]")) {
            return host.substring(1, host.length() - 1);
        }
        return host;
    }

    /**
     * Value for the {@code Host} header when talking HTTP over this endpoint.
     */
    public String hostHeader() {
        if (isLocalSocket()) {
            return "localhost";
        }
        boolean defaultPort = (scheme == Scheme.HTTP && port == 80) || (scheme == Scheme.HTTPS && port == 443);
        String renderedHost = host.indexOf(':') >= 0 && !host.startsWith("[") ? "[" + host + "]" : host;
        return defaultPort ? renderedHost : renderedHost + ":" + port;
    }

    @Override
    public String toString() {
        return isLocalSocket() ? scheme.prefix + path : scheme.prefix + hostHeader() + path;
    }
}
