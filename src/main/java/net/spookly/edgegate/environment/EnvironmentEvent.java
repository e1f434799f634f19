package net.spookly.edgegate.environment;

import lombok.Value;
import lombok.experimental.Accessors;

import java.time.Instant;

/**
 * Snapshot of an environment state change for audit logging and cache invalidation.
 */
@Value
@Accessors(fluent = true)
public class EnvironmentEvent {
    EnvironmentEventType type;
    Instant timestamp;
    String environmentId;
    EnvironmentKind kind;
    EnvironmentStatus previousStatus;
    EnvironmentStatus status;
    String reason;

    public static EnvironmentEvent saved(Environment environment, Instant timestamp) {
        return new EnvironmentEvent(EnvironmentEventType.SAVED, timestamp, environment.id(), environment.kind(),
                null, environment.status(), null);
    }

    public static EnvironmentEvent deleted(Environment environment, Instant timestamp) {
        return new EnvironmentEvent(EnvironmentEventType.DELETED, timestamp, environment.id(), environment.kind(),
                environment.status(), null, null);
    }

    public static EnvironmentEvent statusChanged(Environment previous, Environment current, String reason, Instant timestamp) {
        return new EnvironmentEvent(EnvironmentEventType.STATUS_CHANGED, timestamp, current.id(), current.kind(),
                previous.status(), current.status(), reason);
    }
}
