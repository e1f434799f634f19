package net.spookly.edgegate.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves relative certificate and key paths against the config directory.
 */
final class ConfigPathResolver {
    private ConfigPathResolver() {
    }

    static void resolve(EdgegateConfig config, Path baseDir) {
        if (config == null || baseDir == null) {
            return;
        }
        EdgegateConfig.TunnelConfig tunnel = config.tunnel;
        if (tunnel != null && tunnel.tls != null) {
            tunnel.tls.cert = resolvePath(baseDir, tunnel.tls.cert);
            tunnel.tls.key = resolvePath(baseDir, tunnel.tls.key);
        }
        EdgegateConfig.AgentConfig agent = config.agent;
        if (agent != null) {
            agent.serverCa = resolvePath(baseDir, agent.serverCa);
        }
        if (config.environments != null) {
            for (EdgegateConfig.EnvironmentConfig environment : config.environments) {
                if (environment == null || environment.tls == null) {
                    continue;
                }
                environment.tls.ca = resolvePath(baseDir, environment.tls.ca);
                environment.tls.cert = resolvePath(baseDir, environment.tls.cert);
                environment.tls.key = resolvePath(baseDir, environment.tls.key);
            }
        }
    }

    private static String resolvePath(Path baseDir, String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return rawValue;
        }
        try {
            Path path = Paths.get(rawValue);
            if (!path.isAbsolute()) {
                path = baseDir.resolve(path).normalize();
            }
            return path.toString();
        } catch (InvalidPathException e) {
            throw new ConfigException("Invalid path value: " + rawValue, e);
        }
    }
}
