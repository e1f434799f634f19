package net.spookly.edgegate.proxy;

import io.netty.buffer.ByteBuf;

/**
 * Byte pipe toward a backend: a direct socket or a logical stream inside a tunnel.
 */
public interface UpstreamConnection {
    /**
     * Send bytes toward the backend. Ownership of {@code data} passes to the connection.
     */
    void write(ByteBuf data);

    void close();

    boolean isOpen();
}
