package net.spookly.edgegate.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.List;

import lombok.extern.slf4j.Slf4j;
import net.spookly.edgegate.util.CidrMatcher;

/**
 * Non-fatal findings about a loaded configuration: readable key files and weakened transport security.
 */
@Slf4j
public final class ConfigWarnings {
    static final int MIN_TOKEN_LENGTH = 16;

    private ConfigWarnings() {
    }

    public static List<String> collect(EdgegateConfig config, Path configPath) {
        List<String> warnings = new ArrayList<>();
        if (config == null) {
            return warnings;
        }
        Path baseDir = configPath == null ? null : configPath.toAbsolutePath().getParent();
        EdgegateConfig.TunnelConfig tunnel = config.tunnel;
        if (tunnel != null && Boolean.TRUE.equals(tunnel.enabled)) {
            if (tunnel.tls == null || tunnel.tls.cert == null) {
                warnings.add("tunnel listener runs without TLS; agent traffic is sent in clear text");
            } else {
                warnIfWorldReadable(warnings, "tunnel.tls.key", tunnel.tls.key, baseDir);
            }
            if (allowsAnyAddress(tunnel.allowedNetworks)) {
                warnings.add("tunnel.allowedNetworks is empty; agents may connect from any address");
            }
        }
        if (config.api != null && config.api.auth != null && config.api.auth.tokens != null) {
            for (EdgegateConfig.ApiTokenConfig token : config.api.auth.tokens) {
                if (token != null && token.token != null && token.token.length() < MIN_TOKEN_LENGTH) {
                    warnings.add("api token '" + token.name + "' is shorter than " + MIN_TOKEN_LENGTH + " characters");
                }
            }
        }
        if (config.status != null && Boolean.TRUE.equals(config.status.enabled)
                && allowsAnyAddress(config.status.allowedNetworks)) {
            warnings.add("status.allowedNetworks is empty; the status API is reachable from any address");
        }
        if (config.environments != null) {
            for (EdgegateConfig.EnvironmentConfig environment : config.environments) {
                if (environment == null || environment.tls == null) {
                    continue;
                }
                String prefix = "environments[" + environment.id + "].tls";
                if (Boolean.TRUE.equals(environment.tls.skipVerify)) {
                    warnings.add(prefix + ".skipVerify is set; the server certificate is not checked");
                }
                warnIfWorldReadable(warnings, prefix + ".key", environment.tls.key, baseDir);
            }
        }
        return warnings;
    }

    private static boolean allowsAnyAddress(List<String> cidrs) {
        try {
            return CidrMatcher.from(cidrs).isUnrestricted();
        } catch (IllegalArgumentException e) {
            log.debug("Skipping allowlist warning: {}", e.getMessage());
            return false;
        }
    }

    private static void warnIfWorldReadable(List<String> warnings, String label, String value, Path baseDir) {
        if (value == null || value.isBlank()) {
            return;
        }
        Path resolved;
        try {
            Path path = Paths.get(value.trim());
            resolved = baseDir != null && !path.isAbsolute() ? baseDir.resolve(path).normalize() : path;
        } catch (InvalidPathException e) {
            log.debug("Skipping permission check for {}: {}", label, e.getMessage());
            return;
        }
        if (!Files.isRegularFile(resolved)) {
            return;
        }
        PosixFileAttributeView view = Files.getFileAttributeView(resolved, PosixFileAttributeView.class);
        if (view == null) {
            return;
        }
        try {
            if (view.readAttributes().permissions().contains(PosixFilePermission.OTHERS_READ)) {
                warnings.add(label + " is world-readable: " + resolved);
            }
        } catch (IOException e) {
            log.debug("Could not read permissions of {}", resolved, e);
        }
    }
}
