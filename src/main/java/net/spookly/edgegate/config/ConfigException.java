package net.spookly.edgegate.config;

/**
 * Raised when the configuration file cannot be read, parsed, or validated.
 */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
