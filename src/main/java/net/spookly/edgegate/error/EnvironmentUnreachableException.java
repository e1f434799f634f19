package net.spookly.edgegate.error;

/**
 * The environment is marked down or has no usable connection.
 */
public class EnvironmentUnreachableException extends ProxyException {
    public EnvironmentUnreachableException(String message) {
        super(ProxyErrorCode.ENVIRONMENT_UNREACHABLE, message);
    }

    public EnvironmentUnreachableException(String message, Throwable cause) {
        super(ProxyErrorCode.ENVIRONMENT_UNREACHABLE, message, cause);
    }
}
