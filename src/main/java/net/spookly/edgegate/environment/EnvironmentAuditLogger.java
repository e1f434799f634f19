package net.spookly.edgegate.environment;

import lombok.extern.slf4j.Slf4j;

/**
 * Default environment audit logger that emits one line per event.
 */
@Slf4j
public final class EnvironmentAuditLogger implements EnvironmentEventListener {
    public static final EnvironmentAuditLogger INSTANCE = new EnvironmentAuditLogger();

    private EnvironmentAuditLogger() {
    }

    @Override
    public void onEvent(EnvironmentEvent event) {
        StringBuilder builder = new StringBuilder("environment_event");
        append(builder, "type", event.type());
        append(builder, "environmentId", event.environmentId());
        append(builder, "kind", event.kind());
        append(builder, "previousStatus", event.previousStatus());
        append(builder, "status", event.status());
        append(builder, "reason", event.reason());
        append(builder, "timestamp", event.timestamp());
        log.info("{}", builder);
    }

    private void append(StringBuilder builder, String key, Object value) {
        if (value == null) {
            return;
        }
        builder.append(' ').append(key).append('=').append(value);
    }
}
