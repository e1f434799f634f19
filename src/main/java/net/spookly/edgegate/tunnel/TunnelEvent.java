package net.spookly.edgegate.tunnel;

import java.net.SocketAddress;
import java.time.Instant;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Tunnel lifecycle change for audit logging.
 */
@Value
@Accessors(fluent = true)
public class TunnelEvent {
    TunnelEventType type;
    Instant timestamp;
    String environmentId;
    SocketAddress remoteAddress;
    RejectReason rejectReason;
    String detail;

    public static TunnelEvent of(TunnelEventType type, Tunnel tunnel, String detail, Instant timestamp) {
        return new TunnelEvent(type, timestamp, tunnel.environmentId(), tunnel.remoteAddress(), null, detail);
    }

    public static TunnelEvent rejected(String environmentId,
                                       SocketAddress remoteAddress,
                                       RejectReason reason,
                                       Instant timestamp) {
        return new TunnelEvent(TunnelEventType.REJECTED, timestamp, environmentId, remoteAddress, reason, null);
    }
}
