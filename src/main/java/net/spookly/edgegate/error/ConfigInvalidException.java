package net.spookly.edgegate.error;

/**
 * The environment descriptor cannot be turned into a transport.
 */
public class ConfigInvalidException extends ProxyException {
    public ConfigInvalidException(String message) {
        super(ProxyErrorCode.CONFIG_INVALID, message);
    }

    public ConfigInvalidException(String message, Throwable cause) {
        super(ProxyErrorCode.CONFIG_INVALID, message, cause);
    }
}
