package net.spookly.edgegate.config;

import java.util.List;

public class EdgegateConfig {
    public ApiConfig api;
    public ProxyConfig proxy;
    public TunnelConfig tunnel;
    public SnapshotConfig snapshot;
    public StatusConfig status;
    public AgentConfig agent;
    public List<EnvironmentConfig> environments;

    public static class ListenConfig {
        public String host;
        public Integer port;
    }

    public static class ApiConfig {
        public ListenConfig listen;
        public Integer maxHeaderBytes;
        public ApiAuthConfig auth;
    }

    public static class ApiAuthConfig {
        public List<ApiTokenConfig> tokens;
    }

    public static class ApiTokenConfig {
        public String name;
        public String token;
        /**
         * Environment ids this token may reach; empty or absent means every environment.
         */
        public List<String> environments;
    }

    public static class ProxyConfig {
        public Integer connectTimeoutMs;
        public Integer requestTimeoutMs;
        public Integer cacheIdleSeconds;
        public Integer maxResponseHeadBytes;
    }

    public static class TunnelConfig {
        public Boolean enabled;
        public ListenConfig listen;
        public TlsConfig tls;
        public Integer handshakeTimeoutMs;
        public Integer heartbeatIntervalMs;
        public Integer heartbeatLossThreshold;
        public Integer openTimeoutMs;
        public Integer maxFrameBytes;
        public List<String> allowedNetworks;
        public LimitsConfig limits;
        public TunnelAuthConfig auth;
        /**
         * Targets agents may open streams to on the server side ({@code host:port}).
         */
        public List<String> agentOpenTargets;
    }

    public static class TlsConfig {
        public String cert;
        public String key;
    }

    public static class LimitsConfig {
        public Integer handshakesPerMinutePerIp;
        public Integer concurrentPerIp;
    }

    public static class TunnelAuthConfig {
        public Integer clockSkewSeconds;
    }

    public static class SnapshotConfig {
        public Integer intervalSeconds;
        public Integer probeTimeoutMs;
        public Integer workers;
        public Integer failureThreshold;
    }

    public static class StatusConfig {
        public Boolean enabled;
        public String listen;
        public List<String> allowedNetworks;
        public StatusAuthConfig auth;
    }

    public static class StatusAuthConfig {
        public String sharedKey;
        public Integer nonceBytes;
        public Integer clockSkewSeconds;
    }

    public static class AgentConfig {
        public Boolean enabled;
        public String server;
        public String environmentId;
        public String edgeKey;
        public Boolean tls;
        public String serverCa;
        public Integer heartbeatIntervalMs;
        public Integer reconnectMinMs;
        public Integer reconnectMaxMs;
        public Integer connectTimeoutMs;
        public String defaultTarget;
        public List<String> allowedTargets;
    }

    public static class EnvironmentConfig {
        public String id;
        public String name;
        /**
         * One of docker-socket, docker-http, docker-edge, kubernetes-socket, kubernetes-http, kubernetes-edge.
         */
        public String kind;
        public String url;
        public String accessToken;
        public String apiVersion;
        public String edgeKey;
        public EnvironmentTlsConfig tls;
    }

    public static class EnvironmentTlsConfig {
        public Boolean enabled;
        public Boolean skipVerify;
        public String ca;
        public String cert;
        public String key;
    }
}
