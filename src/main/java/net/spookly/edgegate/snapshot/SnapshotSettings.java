package net.spookly.edgegate.snapshot;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;
import net.spookly.edgegate.config.ConfigDefaults;
import net.spookly.edgegate.config.EdgegateConfig;

@Value
@Accessors(fluent = true)
@Builder
public class SnapshotSettings {
    @Builder.Default
    int intervalSeconds = ConfigDefaults.SNAPSHOT_INTERVAL_SECONDS;
    @Builder.Default
    int probeTimeoutMs = ConfigDefaults.PROBE_TIMEOUT_MS;
    @Builder.Default
    int workers = ConfigDefaults.SNAPSHOT_WORKERS;
    @Builder.Default
    int failureThreshold = ConfigDefaults.FAILURE_THRESHOLD;

    public static SnapshotSettings fromConfig(EdgegateConfig.SnapshotConfig snapshot) {
        EdgegateConfig.SnapshotConfig source = snapshot == null ? new EdgegateConfig.SnapshotConfig() : snapshot;
        return SnapshotSettings.builder()
                .intervalSeconds(ConfigDefaults.orDefault(source.intervalSeconds, ConfigDefaults.SNAPSHOT_INTERVAL_SECONDS))
                .probeTimeoutMs(ConfigDefaults.orDefault(source.probeTimeoutMs, ConfigDefaults.PROBE_TIMEOUT_MS))
                .workers(ConfigDefaults.orDefault(source.workers, ConfigDefaults.SNAPSHOT_WORKERS))
                .failureThreshold(ConfigDefaults.orDefault(source.failureThreshold, ConfigDefaults.FAILURE_THRESHOLD))
                .build();
    }
}
