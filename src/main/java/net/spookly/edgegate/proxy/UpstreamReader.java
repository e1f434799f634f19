package net.spookly.edgegate.proxy;

import io.netty.buffer.ByteBuf;

/**
 * Receives bytes coming back from a backend. Callbacks for one connection are never concurrent.
 */
public interface UpstreamReader {
    /**
     * Ownership of {@code data} passes to the reader.
     */
    void onData(ByteBuf data);

    /**
     * Called once when the connection ends; {@code cause} is null for an orderly close.
     */
    void onClosed(Throwable cause);
}
