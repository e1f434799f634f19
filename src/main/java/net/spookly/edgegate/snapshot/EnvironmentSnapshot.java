package net.spookly.edgegate.snapshot;

import java.time.Instant;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Outcome of the latest probe of one environment.
 */
@Value
@Accessors(fluent = true)
public class EnvironmentSnapshot {
    String environmentId;
    Instant probedAt;
    boolean success;
    long latencyMs;
    String detail;
    int consecutiveFailures;
}
