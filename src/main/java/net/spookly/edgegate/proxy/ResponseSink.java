package net.spookly.edgegate.proxy;

import io.netty.buffer.ByteBuf;
import net.spookly.edgegate.error.ProxyException;

/**
 * Receives a proxied response. Exactly one of {@link #onComplete()} or {@link #onError} ends the exchange,
 * unless the session is cancelled first.
 */
public interface ResponseSink {
    /**
     * The final response head (never a 1xx other than 101). Called before the head bytes reach {@link #onData}.
     */
    void onResponseHead(ResponseHead head);

    /**
     * Raw upstream bytes, head included, exactly as the backend sent them. Ownership passes to the sink.
     * After a 101 this carries the upgraded stream.
     */
    void onData(ByteBuf data);

    /**
     * An interim 1xx head other than 101, exactly as the backend sent it. Arrives before
     * {@link #onResponseHead}; ownership passes to the sink.
     */
    default void onInterimResponse(ByteBuf data) {
        onData(data);
    }

    void onComplete();

    /**
     * The exchange failed. Called at most once, possibly after a head was already delivered.
     */
    void onError(ProxyException error);
}
