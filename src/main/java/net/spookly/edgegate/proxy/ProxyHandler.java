package net.spookly.edgegate.proxy;

import java.util.Objects;

import io.netty.channel.EventLoopGroup;
import lombok.extern.slf4j.Slf4j;
import net.spookly.edgegate.environment.Environment;
import net.spookly.edgegate.environment.TransportType;

/**
 * Forwards requests to one environment as it was configured when the handler was built.
 */
@Slf4j
public final class ProxyHandler {
    private final Environment environment;
    private final Transport transport;
    private final RequestRewriter rewriter;
    private final ProxySettings settings;
    private final EventLoopGroup timers;
    private volatile boolean closed;

    public ProxyHandler(Environment environment,
                        Transport transport,
                        RequestRewriter rewriter,
                        ProxySettings settings,
                        EventLoopGroup timers) {
        this.environment = Objects.requireNonNull(environment, "environment");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.rewriter = Objects.requireNonNull(rewriter, "rewriter");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.timers = Objects.requireNonNull(timers, "timers");
    }

    public Environment environment() {
        return environment;
    }

    public TransportType transportType() {
        return transport.type();
    }

    Transport transport() {
        return transport;
    }

    /**
     * Start forwarding {@code request}. Failures to connect or to read a response reach {@code sink}
     * and the session's completion.
     */
    public ProxySession forward(ProxyRequest request, ResponseSink sink) {
        byte[] head = rewriter.requestHead(request, transport.hostHeader(), transport.basePath());
        ForwardingSession session = new ForwardingSession(environment.id(), request, sink, head, settings);
        session.start(transport, timers);
        return session;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Called once the handler is retired and unused. Per-request connections are already closed by their sessions.
     */
    public void close() {
        if (!closed) {
            closed = true;
            log.debug("Closed proxy handler for environment {} ({})", environment.id(), transport.type());
        }
    }
}
