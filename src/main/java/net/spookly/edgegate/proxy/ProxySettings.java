package net.spookly.edgegate.proxy;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;
import net.spookly.edgegate.config.ConfigDefaults;
import net.spookly.edgegate.config.EdgegateConfig;

@Value
@Accessors(fluent = true)
@Builder
public class ProxySettings {
    @Builder.Default
    int connectTimeoutMs = ConfigDefaults.CONNECT_TIMEOUT_MS;
    /**
     * Time allowed from dispatch until the response head arrives.
     */
    @Builder.Default
    int requestTimeoutMs = ConfigDefaults.REQUEST_TIMEOUT_MS;
    @Builder.Default
    int cacheIdleSeconds = ConfigDefaults.CACHE_IDLE_SECONDS;
    @Builder.Default
    int maxResponseHeadBytes = ConfigDefaults.MAX_RESPONSE_HEAD_BYTES;
    @Builder.Default
    int openTimeoutMs = ConfigDefaults.OPEN_TIMEOUT_MS;

    public static ProxySettings fromConfig(EdgegateConfig config) {
        EdgegateConfig.ProxyConfig proxy = config.proxy == null ? new EdgegateConfig.ProxyConfig() : config.proxy;
        Integer openTimeout = config.tunnel == null ? null : config.tunnel.openTimeoutMs;
        return ProxySettings.builder()
                .connectTimeoutMs(ConfigDefaults.orDefault(proxy.connectTimeoutMs, ConfigDefaults.CONNECT_TIMEOUT_MS))
                .requestTimeoutMs(ConfigDefaults.orDefault(proxy.requestTimeoutMs, ConfigDefaults.REQUEST_TIMEOUT_MS))
                .cacheIdleSeconds(ConfigDefaults.orDefault(proxy.cacheIdleSeconds, ConfigDefaults.CACHE_IDLE_SECONDS))
                .maxResponseHeadBytes(ConfigDefaults.orDefault(proxy.maxResponseHeadBytes, ConfigDefaults.MAX_RESPONSE_HEAD_BYTES))
                .openTimeoutMs(ConfigDefaults.orDefault(openTimeout, ConfigDefaults.OPEN_TIMEOUT_MS))
                .build();
    }
}
