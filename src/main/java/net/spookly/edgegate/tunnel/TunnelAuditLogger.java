package net.spookly.edgegate.tunnel;

import lombok.extern.slf4j.Slf4j;

/**
 * Emits one {@code tunnel_event} line per lifecycle change.
 */
@Slf4j
public final class TunnelAuditLogger implements TunnelEventListener {
    public static final TunnelAuditLogger INSTANCE = new TunnelAuditLogger();

    private TunnelAuditLogger() {
    }

    @Override
    public void onEvent(TunnelEvent event) {
        StringBuilder builder = new StringBuilder("tunnel_event");
        append(builder, "type", event.type());
        append(builder, "environmentId", event.environmentId());
        append(builder, "remote", event.remoteAddress());
        append(builder, "rejectReason", event.rejectReason());
        append(builder, "detail", event.detail());
        append(builder, "timestamp", event.timestamp());
        if (event.type() == TunnelEventType.REJECTED || event.type() == TunnelEventType.LOST) {
            log.warn("{}", builder);
        } else {
            log.info("{}", builder);
        }
    }

    private void append(StringBuilder builder, String key, Object value) {
        if (value == null) {
            return;
        }
        builder.append(' ').append(key).append('=').append(value);
    }
}
