package net.spookly.edgegate.tunnel;

import java.util.Objects;

/**
 * An agent handshake was refused. Never escapes to proxied requests.
 */
public class HandshakeRejectedException extends RuntimeException {
    private final RejectReason reason;

    public HandshakeRejectedException(RejectReason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public RejectReason reason() {
        return reason;
    }
}
