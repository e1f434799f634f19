package net.spookly.edgegate.tunnel;

import java.util.List;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;
import net.spookly.edgegate.config.ConfigDefaults;
import net.spookly.edgegate.config.EdgegateConfig;
import net.spookly.edgegate.util.ListenAddress;

/**
 * Resolved tunnel listener settings with defaults applied.
 */
@Value
@Accessors(fluent = true)
@Builder
public class TunnelServerSettings {
    ListenAddress listen;
    String tlsCert;
    String tlsKey;
    @Builder.Default
    int handshakeTimeoutMs = ConfigDefaults.HANDSHAKE_TIMEOUT_MS;
    @Builder.Default
    int heartbeatIntervalMs = ConfigDefaults.HEARTBEAT_INTERVAL_MS;
    @Builder.Default
    int heartbeatLossThreshold = ConfigDefaults.HEARTBEAT_LOSS_THRESHOLD;
    @Builder.Default
    int maxFrameBytes = ConfigDefaults.MAX_FRAME_BYTES;
    @Builder.Default
    List<String> allowedNetworks = List.of();
    Integer handshakesPerMinutePerIp;
    Integer concurrentPerIp;
    @Builder.Default
    List<String> agentOpenTargets = List.of();

    public boolean tlsEnabled() {
        return tlsCert != null && !tlsCert.isBlank();
    }

    public static TunnelServerSettings fromConfig(EdgegateConfig.TunnelConfig tunnel) {
        EdgegateConfig.LimitsConfig limits = tunnel.limits;
        return TunnelServerSettings.builder()
                .listen(ListenAddress.of(tunnel.listen.host, tunnel.listen.port))
                .tlsCert(tunnel.tls == null ? null : tunnel.tls.cert)
                .tlsKey(tunnel.tls == null ? null : tunnel.tls.key)
                .handshakeTimeoutMs(ConfigDefaults.orDefault(tunnel.handshakeTimeoutMs, ConfigDefaults.HANDSHAKE_TIMEOUT_MS))
                .heartbeatIntervalMs(ConfigDefaults.orDefault(tunnel.heartbeatIntervalMs, ConfigDefaults.HEARTBEAT_INTERVAL_MS))
                .heartbeatLossThreshold(ConfigDefaults.orDefault(tunnel.heartbeatLossThreshold, ConfigDefaults.HEARTBEAT_LOSS_THRESHOLD))
                .maxFrameBytes(ConfigDefaults.orDefault(tunnel.maxFrameBytes, ConfigDefaults.MAX_FRAME_BYTES))
                .allowedNetworks(tunnel.allowedNetworks == null ? List.of() : List.copyOf(tunnel.allowedNetworks))
                .handshakesPerMinutePerIp(limits == null ? null : limits.handshakesPerMinutePerIp)
                .concurrentPerIp(limits == null ? null : limits.concurrentPerIp)
                .agentOpenTargets(tunnel.agentOpenTargets == null ? List.of() : List.copyOf(tunnel.agentOpenTargets))
                .build();
    }
}
