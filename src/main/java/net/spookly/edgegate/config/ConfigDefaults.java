package net.spookly.edgegate.config;

/**
 * Default configuration template written when no config file exists.
 */
public final class ConfigDefaults {
    public static final int CONNECT_TIMEOUT_MS = 5_000;
    public static final int REQUEST_TIMEOUT_MS = 60_000;
    public static final int CACHE_IDLE_SECONDS = 600;
    public static final int MAX_RESPONSE_HEAD_BYTES = 64 * 1024;
    public static final int API_MAX_HEADER_BYTES = 16 * 1024;
    public static final int HANDSHAKE_TIMEOUT_MS = 10_000;
    public static final int HEARTBEAT_INTERVAL_MS = 10_000;
    public static final int HEARTBEAT_LOSS_THRESHOLD = 2;
    public static final int OPEN_TIMEOUT_MS = 10_000;
    public static final int MAX_FRAME_BYTES = 1024 * 1024;
    public static final int CLOCK_SKEW_SECONDS = 60;
    public static final int SNAPSHOT_INTERVAL_SECONDS = 300;
    public static final int PROBE_TIMEOUT_MS = 5_000;
    public static final int SNAPSHOT_WORKERS = 8;
    public static final int FAILURE_THRESHOLD = 3;
    public static final int RECONNECT_MIN_MS = 1_000;
    public static final int RECONNECT_MAX_MS = 60_000;

    private static final String DEFAULT_YAML_TEMPLATE = """
            # Generated default Edgegate config.
            # The API token is stored at %s and the status API key at %s. Keep both secret.
            api:
              listen:
                host: 0.0.0.0
                port: 9000
              auth:
                tokens:
                  - name: admin
                    token: path:%s

            proxy:
              connectTimeoutMs: 5000
              requestTimeoutMs: 60000
              cacheIdleSeconds: 600

            tunnel:
              enabled: true
              listen:
                host: 0.0.0.0
                port: 8000
              handshakeTimeoutMs: 10000
              heartbeatIntervalMs: 10000
              heartbeatLossThreshold: 2
              openTimeoutMs: 10000
              limits:
                handshakesPerMinutePerIp: 60
                concurrentPerIp: 4
              auth:
                clockSkewSeconds: 60

            snapshot:
              intervalSeconds: 300
              probeTimeoutMs: 5000
              workers: 8
              failureThreshold: 3

            status:
              enabled: false
              listen: 127.0.0.1:9001
              allowedNetworks: ["127.0.0.1/32"]
              auth:
                sharedKey: path:%s
                nonceBytes: 16
                clockSkewSeconds: 10

            environments:
              - id: local
                name: local
                kind: docker-socket
                url: unix:///var/run/docker.sock
            """;

    private ConfigDefaults() {
    }

    /**
     * Return {@code value} when set, otherwise {@code fallback}.
     */
    public static int orDefault(Integer value, int fallback) {
        return value == null ? fallback : value;
    }

    /**
     * Render the default configuration template.
     */
    public static String defaultYaml(String apiTokenPath, String statusKeyPath) {
        if (apiTokenPath == null || apiTokenPath.isBlank()) {
            throw new ConfigException("API token path is required for the default config");
        }
        if (statusKeyPath == null || statusKeyPath.isBlank()) {
            throw new ConfigException("Status key path is required for the default config");
        }
        return DEFAULT_YAML_TEMPLATE.formatted(apiTokenPath, statusKeyPath, apiTokenPath, statusKeyPath);
    }
}
