package net.spookly.edgegate.agent;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.experimental.Accessors;
import net.spookly.edgegate.config.ConfigDefaults;
import net.spookly.edgegate.config.EdgegateConfig;
import net.spookly.edgegate.util.ListenAddress;

@Value
@Accessors(fluent = true)
@Builder(toBuilder = true)
public class AgentSettings {
    @NonNull
    String host;
    int port;
    @NonNull
    String environmentId;
    @ToString.Exclude
    @NonNull
    String edgeKey;
    boolean tls;
    String serverCa;
    @Builder.Default
    int connectTimeoutMs = ConfigDefaults.CONNECT_TIMEOUT_MS;
    /**
     * Used until the server announces its own interval.
     */
    @Builder.Default
    int heartbeatIntervalMs = ConfigDefaults.HEARTBEAT_INTERVAL_MS;
    @Builder.Default
    int reconnectMinMs = ConfigDefaults.RECONNECT_MIN_MS;
    @Builder.Default
    int reconnectMaxMs = ConfigDefaults.RECONNECT_MAX_MS;
    @Builder.Default
    boolean reconnect = true;
    @Builder.Default
    int maxFrameBytes = ConfigDefaults.MAX_FRAME_BYTES;
    String defaultTarget;
    @Builder.Default
    List<String> allowedTargets = List.of();
    @Builder.Default
    String agentVersion = "edgegate-agent";

    public static AgentSettings fromConfig(EdgegateConfig.AgentConfig agent) {
        ListenAddress server = ListenAddress.parse(agent.server);
        return AgentSettings.builder()
                .host(server.host())
                .port(server.port())
                .environmentId(agent.environmentId)
                .edgeKey(agent.edgeKey)
                .tls(Boolean.TRUE.equals(agent.tls))
                .serverCa(agent.serverCa)
                .connectTimeoutMs(ConfigDefaults.orDefault(agent.connectTimeoutMs, ConfigDefaults.CONNECT_TIMEOUT_MS))
                .heartbeatIntervalMs(ConfigDefaults.orDefault(agent.heartbeatIntervalMs, ConfigDefaults.HEARTBEAT_INTERVAL_MS))
                .reconnectMinMs(ConfigDefaults.orDefault(agent.reconnectMinMs, ConfigDefaults.RECONNECT_MIN_MS))
                .reconnectMaxMs(ConfigDefaults.orDefault(agent.reconnectMaxMs, ConfigDefaults.RECONNECT_MAX_MS))
                .defaultTarget(agent.defaultTarget)
                .allowedTargets(agent.allowedTargets == null ? List.of() : List.copyOf(agent.allowedTargets))
                .build();
    }
}
