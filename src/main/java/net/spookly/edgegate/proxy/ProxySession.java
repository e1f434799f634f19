package net.spookly.edgegate.proxy;

import java.util.concurrent.CompletableFuture;

import io.netty.buffer.ByteBuf;

/**
 * Caller side of one proxied exchange. After an upgrade the body methods carry the client-to-upstream
 * half of the relay.
 */
public interface ProxySession {
    /**
     * Ownership of {@code data} passes to the session.
     */
    void sendBody(ByteBuf data);

    /**
     * No more request body follows. Ignored for upgraded sessions, which end with {@link #cancel()}.
     */
    void endBody();

    /**
     * Abort the exchange and close the upstream connection. The sink is not called afterwards.
     */
    void cancel();

    /**
     * Completes normally on success, exceptionally on failure, and is cancelled by {@link #cancel()}.
     */
    CompletableFuture<Void> completion();
}
