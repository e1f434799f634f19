package net.spookly.edgegate.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.security.SecureRandom;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.Set;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.Yaml;

@Slf4j
public final class ConfigLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    static final String DEFAULT_API_TOKEN_PATH = "secret/api_token";
    static final String DEFAULT_STATUS_KEY_PATH = "secret/status_hmac";
    private static final int DEFAULT_SECRET_BYTES = 32;

    private ConfigLoader() {
    }

    /**
     * Load and validate the Edgegate YAML configuration.
     */
    public static EdgegateConfig load(Path path) {
        if (path == null) {
            throw new ConfigException("Config path is required");
        }
        if (!Files.exists(path)) {
            writeDefaultConfig(path);
            throw new ConfigException("Config file did not exist, generated default at: " + path);
        }
        Object raw;
        Yaml yaml = new Yaml();
        try (Reader reader = Files.newBufferedReader(path)) {
            raw = yaml.load(reader);
        } catch (IOException e) {
            throw new ConfigException("Failed to read config: " + path, e);
        }
        if (raw == null) {
            throw new ConfigException("Config file is empty: " + path);
        }
        Path baseDir = path.toAbsolutePath().getParent();
        Object expanded = EnvExpander.expand(raw, baseDir);
        EdgegateConfig config;
        try {
            config = MAPPER.convertValue(expanded, EdgegateConfig.class);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Failed to parse config: " + path, e);
        }
        ConfigPathResolver.resolve(config, baseDir);
        ConfigValidator.validate(config);
        return config;
    }

    private static void writeDefaultConfig(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            ensureSecret(resolveRelativePath(parent, DEFAULT_API_TOKEN_PATH));
            ensureSecret(resolveRelativePath(parent, DEFAULT_STATUS_KEY_PATH));
            Files.writeString(
                    path,
                    ConfigDefaults.defaultYaml(DEFAULT_API_TOKEN_PATH, DEFAULT_STATUS_KEY_PATH),
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW
            );
            log.info("Wrote default config to {}", path);
        } catch (IOException e) {
            throw new ConfigException("Failed to write default config: " + path, e);
        }
    }

    private static void ensureSecret(Path secretPath) throws IOException {
        if (Files.exists(secretPath)) {
            return;
        }
        Path parent = secretPath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(secretPath, generateSecret(), StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
        setOwnerOnlyPermissions(secretPath);
    }

    private static String generateSecret() {
        SecureRandom random = new SecureRandom();
        byte[] bytes = new byte[DEFAULT_SECRET_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private static void setOwnerOnlyPermissions(Path secretPath) {
        if (Files.getFileAttributeView(secretPath, PosixFileAttributeView.class) == null) {
            return;
        }
        Set<PosixFilePermission> permissions = EnumSet.of(
                PosixFilePermission.OWNER_READ,
                PosixFilePermission.OWNER_WRITE
        );
        try {
            Files.setPosixFilePermissions(secretPath, permissions);
        } catch (IOException | UnsupportedOperationException e) {
            log.warn("Could not restrict permissions on {}: {}", secretPath, e.getMessage());
        }
    }

    private static Path resolveRelativePath(Path baseDir, String rawValue) {
        Path relative = Path.of(rawValue);
        if (baseDir != null && !relative.isAbsolute()) {
            return baseDir.resolve(relative).normalize();
        }
        return relative;
    }
}
