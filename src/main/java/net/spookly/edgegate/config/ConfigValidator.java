package net.spookly.edgegate.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import net.spookly.edgegate.environment.EndpointUrl;
import net.spookly.edgegate.environment.EnvironmentKind;
import net.spookly.edgegate.util.CidrMatcher;
import net.spookly.edgegate.util.ListenAddress;

public final class ConfigValidator {
    private static final int MIN_FRAME_BYTES = 1024;
    private static final int MIN_FAILURE_THRESHOLD = 2;

    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException on any violations.
     */
    public static void validate(EdgegateConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        if (isTrue(config.agent == null ? null : config.agent.enabled)) {
            validateAgent(config.agent, errors);
        } else {
            validateApi(config, errors);
            validateProxy(config, errors);
            validateTunnel(config, errors);
            validateSnapshot(config, errors);
            validateStatus(config, errors);
            validateEnvironments(config, errors);
        }

        throwIfErrors(errors);
    }

    private static void validateApi(EdgegateConfig config, List<String> errors) {
        EdgegateConfig.ApiConfig api = config.api;
        if (api == null) {
            errors.add("api section is required");
            return;
        }
        requireListen(errors, api.listen, "api.listen");
        if (api.maxHeaderBytes != null && api.maxHeaderBytes < 1024) {
            errors.add("api.maxHeaderBytes must be at least 1024");
        }
        if (api.auth == null || api.auth.tokens == null || api.auth.tokens.isEmpty()) {
            errors.add("api.auth.tokens must include at least one token");
            return;
        }
        Set<String> names = new HashSet<>();
        for (EdgegateConfig.ApiTokenConfig token : api.auth.tokens) {
            if (token == null) {
                errors.add("api.auth.tokens must not include empty entries");
                continue;
            }
            requireNonBlank(errors, token.name, "api.auth.tokens.name");
            requireNonBlank(errors, token.token, "api.auth.tokens.token");
            if (!isBlank(token.name) && !names.add(token.name)) {
                errors.add("api.auth.tokens.name must be unique: " + token.name);
            }
        }
    }

    private static void validateProxy(EdgegateConfig config, List<String> errors) {
        EdgegateConfig.ProxyConfig proxy = config.proxy;
        if (proxy == null) {
            return;
        }
        requirePositiveIfSet(errors, proxy.connectTimeoutMs, "proxy.connectTimeoutMs");
        requirePositiveIfSet(errors, proxy.requestTimeoutMs, "proxy.requestTimeoutMs");
        requirePositiveIfSet(errors, proxy.cacheIdleSeconds, "proxy.cacheIdleSeconds");
        if (proxy.maxResponseHeadBytes != null && proxy.maxResponseHeadBytes < 1024) {
            errors.add("proxy.maxResponseHeadBytes must be at least 1024");
        }
    }

    private static void validateTunnel(EdgegateConfig config, List<String> errors) {
        EdgegateConfig.TunnelConfig tunnel = config.tunnel;
        if (tunnel == null || !isTrue(tunnel.enabled)) {
            return;
        }
        requireListen(errors, tunnel.listen, "tunnel.listen");
        if (tunnel.tls != null) {
            requireNonBlank(errors, tunnel.tls.cert, "tunnel.tls.cert");
            requireNonBlank(errors, tunnel.tls.key, "tunnel.tls.key");
        }
        requirePositiveIfSet(errors, tunnel.handshakeTimeoutMs, "tunnel.handshakeTimeoutMs");
        requirePositiveIfSet(errors, tunnel.heartbeatIntervalMs, "tunnel.heartbeatIntervalMs");
        requirePositiveIfSet(errors, tunnel.heartbeatLossThreshold, "tunnel.heartbeatLossThreshold");
        requirePositiveIfSet(errors, tunnel.openTimeoutMs, "tunnel.openTimeoutMs");
        if (tunnel.maxFrameBytes != null && tunnel.maxFrameBytes < MIN_FRAME_BYTES) {
            errors.add("tunnel.maxFrameBytes must be at least " + MIN_FRAME_BYTES);
        }
        requireCidrs(errors, tunnel.allowedNetworks, "tunnel.allowedNetworks");
        if (tunnel.limits != null) {
            requirePositiveIfSet(errors, tunnel.limits.handshakesPerMinutePerIp, "tunnel.limits.handshakesPerMinutePerIp");
            requirePositiveIfSet(errors, tunnel.limits.concurrentPerIp, "tunnel.limits.concurrentPerIp");
        }
        if (tunnel.auth != null) {
            requirePositiveIfSet(errors, tunnel.auth.clockSkewSeconds, "tunnel.auth.clockSkewSeconds");
        }
        if (tunnel.agentOpenTargets != null) {
            for (String target : tunnel.agentOpenTargets) {
                requireAddress(errors, target, "tunnel.agentOpenTargets");
            }
        }
    }

    private static void validateSnapshot(EdgegateConfig config, List<String> errors) {
        EdgegateConfig.SnapshotConfig snapshot = config.snapshot;
        if (snapshot == null) {
            return;
        }
        requirePositiveIfSet(errors, snapshot.intervalSeconds, "snapshot.intervalSeconds");
        requirePositiveIfSet(errors, snapshot.probeTimeoutMs, "snapshot.probeTimeoutMs");
        requirePositiveIfSet(errors, snapshot.workers, "snapshot.workers");
        if (snapshot.failureThreshold != null && snapshot.failureThreshold < MIN_FAILURE_THRESHOLD) {
            errors.add("snapshot.failureThreshold must be at least " + MIN_FAILURE_THRESHOLD);
        }
        int probeTimeout = ConfigDefaults.orDefault(snapshot.probeTimeoutMs, ConfigDefaults.PROBE_TIMEOUT_MS);
        int requestTimeout = ConfigDefaults.orDefault(
                config.proxy == null ? null : config.proxy.requestTimeoutMs,
                ConfigDefaults.REQUEST_TIMEOUT_MS
        );
        if (probeTimeout >= requestTimeout) {
            errors.add("snapshot.probeTimeoutMs must be shorter than proxy.requestTimeoutMs");
        }
    }

    private static void validateStatus(EdgegateConfig config, List<String> errors) {
        EdgegateConfig.StatusConfig status = config.status;
        if (status == null || !isTrue(status.enabled)) {
            return;
        }
        requireAddress(errors, status.listen, "status.listen");
        requireCidrs(errors, status.allowedNetworks, "status.allowedNetworks");
        if (status.auth == null) {
            errors.add("status.auth is required when status.enabled is true");
            return;
        }
        requireNonBlank(errors, status.auth.sharedKey, "status.auth.sharedKey");
        requirePositiveIfSet(errors, status.auth.clockSkewSeconds, "status.auth.clockSkewSeconds");
        if (status.auth.nonceBytes != null && status.auth.nonceBytes < 0) {
            errors.add("status.auth.nonceBytes must not be negative");
        }
    }

    private static void validateEnvironments(EdgegateConfig config, List<String> errors) {
        if (config.environments == null) {
            return;
        }
        Set<String> ids = new HashSet<>();
        for (EdgegateConfig.EnvironmentConfig environment : config.environments) {
            if (environment == null) {
                errors.add("environments must not include empty entries");
                continue;
            }
            String label = "environments[" + (environment.id == null ? "?" : environment.id) + "]";
            if (isBlank(environment.id)) {
                errors.add("environments.id is required");
            } else if (!ids.add(environment.id)) {
                errors.add("environments.id must be unique: " + environment.id);
            }
            EnvironmentKind kind;
            try {
                kind = EnvironmentKind.fromConfig(environment.kind);
            } catch (IllegalArgumentException e) {
                errors.add(label + ".kind " + e.getMessage());
                continue;
            }
            validateEndpointUrl(errors, kind, environment.url, label);
            if (kind.isEdge()) {
                requireNonBlank(errors, environment.edgeKey, label + ".edgeKey");
            }
            EdgegateConfig.EnvironmentTlsConfig tls = environment.tls;
            if (tls != null && isBlank(tls.cert) != isBlank(tls.key)) {
                errors.add(label + ".tls.cert and " + label + ".tls.key must be set together");
            }
        }
    }

    private static void validateEndpointUrl(List<String> errors, EnvironmentKind kind, String url, String label) {
        if (kind.isEdge() && isBlank(url)) {
            return;
        }
        if (isBlank(url)) {
            errors.add(label + ".url is required");
            return;
        }
        try {
            EndpointUrl endpoint = EndpointUrl.parse(url);
            if (!kind.accepts(endpoint.scheme())) {
                errors.add(label + ".url protocol " + endpoint.scheme().prefix() + " is not valid for kind " + kind.configName());
            }
        } catch (IllegalArgumentException e) {
            errors.add(label + ".url " + e.getMessage());
        }
    }

    private static void validateAgent(EdgegateConfig.AgentConfig agent, List<String> errors) {
        requireAddress(errors, agent.server, "agent.server");
        requireNonBlank(errors, agent.environmentId, "agent.environmentId");
        requireNonBlank(errors, agent.edgeKey, "agent.edgeKey");
        requirePositiveIfSet(errors, agent.heartbeatIntervalMs, "agent.heartbeatIntervalMs");
        requirePositiveIfSet(errors, agent.reconnectMinMs, "agent.reconnectMinMs");
        requirePositiveIfSet(errors, agent.reconnectMaxMs, "agent.reconnectMaxMs");
        requirePositiveIfSet(errors, agent.connectTimeoutMs, "agent.connectTimeoutMs");
        int min = ConfigDefaults.orDefault(agent.reconnectMinMs, ConfigDefaults.RECONNECT_MIN_MS);
        int max = ConfigDefaults.orDefault(agent.reconnectMaxMs, ConfigDefaults.RECONNECT_MAX_MS);
        if (min > max) {
            errors.add("agent.reconnectMinMs must not exceed agent.reconnectMaxMs");
        }
        if (!isBlank(agent.defaultTarget)) {
            try {
                EndpointUrl.parse(agent.defaultTarget);
            } catch (IllegalArgumentException e) {
                errors.add("agent.defaultTarget " + e.getMessage());
            }
        }
    }

    private static void requireListen(List<String> errors, EdgegateConfig.ListenConfig listen, String field) {
        if (listen == null) {
            errors.add(field + " is required");
            return;
        }
        requireNonBlank(errors, listen.host, field + ".host");
        if (listen.port == null || listen.port < 0 || listen.port > 65535) {
            errors.add(field + ".port must be between 0 and 65535");
        }
    }

    private static void requireAddress(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
            return;
        }
        try {
            ListenAddress.parse(value);
        } catch (IllegalArgumentException e) {
            errors.add(field + " " + e.getMessage());
        }
    }

    private static void requireCidrs(List<String> errors, List<String> cidrs, String field) {
        try {
            CidrMatcher.from(cidrs);
        } catch (IllegalArgumentException e) {
            errors.add(field + " " + e.getMessage());
        }
    }

    private static void requireNonBlank(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
        }
    }

    private static void requirePositiveIfSet(List<String> errors, Integer value, String field) {
        if (value != null && value <= 0) {
            errors.add(field + " must be greater than 0");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static boolean isTrue(Boolean value) {
        return value != null && value;
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            StringBuilder builder = new StringBuilder("Invalid config:\n");
            for (String error : errors) {
                builder.append("- ").append(error).append('\n');
            }
            throw new ConfigException(builder.toString());
        }
    }
}
