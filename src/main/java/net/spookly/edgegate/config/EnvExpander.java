package net.spookly.edgegate.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Expands {@code env:NAME}, {@code env:NAME:-fallback} and {@code path:relative/file} string values
 * anywhere in the raw YAML tree.
 */
final class EnvExpander {
    private static final String ENV_PREFIX = "env:";
    private static final String PATH_PREFIX = "path:";
    private static final String FALLBACK_SEPARATOR = ":-";

    private EnvExpander() {
    }

    static Object expand(Object value, Path baseDir) {
        return expand(value, baseDir, System::getenv);
    }

    static Object expand(Object value, Path baseDir, Function<String, String> environment) {
        if (value instanceof Map) {
            Map<?, ?> raw = (Map<?, ?>) value;
            Map<Object, Object> expanded = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : raw.entrySet()) {
                expanded.put(entry.getKey(), expand(entry.getValue(), baseDir, environment));
            }
            return expanded;
        }
        if (value instanceof List) {
            List<?> raw = (List<?>) value;
            List<Object> expanded = new ArrayList<>(raw.size());
            for (Object item : raw) {
                expanded.add(expand(item, baseDir, environment));
            }
            return expanded;
        }
        if (value instanceof String) {
            String raw = (String) value;
            if (raw.startsWith(ENV_PREFIX)) {
                return expandEnv(raw.substring(ENV_PREFIX.length()), environment);
            }
            if (raw.startsWith(PATH_PREFIX)) {
                return readPath(baseDir, raw.substring(PATH_PREFIX.length()));
            }
        }
        return value;
    }

    private static String expandEnv(String reference, Function<String, String> environment) {
        String key = reference;
        String fallback = null;
        int separator = reference.indexOf(FALLBACK_SEPARATOR);
        if (separator >= 0) {
            key = reference.substring(0, separator);
            fallback = reference.substring(separator + FALLBACK_SEPARATOR.length());
        }
        if (key.isBlank()) {
            throw new ConfigException("Environment variable name is empty: env:" + reference);
        }
        String resolved = environment.apply(key);
        if (resolved != null) {
            return resolved;
        }
        if (fallback != null) {
            return fallback;
        }
        throw new ConfigException("Missing required environment variable: " + key);
    }

    private static String readPath(Path baseDir, String location) {
        if (location.isBlank()) {
            throw new ConfigException("Path value is empty");
        }
        Path resolved;
        try {
            Path path = Paths.get(location);
            resolved = baseDir != null && !path.isAbsolute() ? baseDir.resolve(path).normalize() : path;
        } catch (InvalidPathException e) {
            throw new ConfigException("Invalid path value: " + location, e);
        }
        String content;
        try {
            content = Files.readString(resolved, StandardCharsets.UTF_8).stripTrailing();
        } catch (IOException e) {
            throw new ConfigException("Failed to read config path: " + resolved, e);
        }
        if (content.isEmpty()) {
            throw new ConfigException("Path value is empty: " + resolved);
        }
        return content;
    }
}
