package net.spookly.edgegate.error;

public class EnvironmentNotFoundException extends ProxyException {
    public EnvironmentNotFoundException(String message) {
        super(ProxyErrorCode.ENVIRONMENT_NOT_FOUND, message);
    }

    public EnvironmentNotFoundException(String message, Throwable cause) {
        super(ProxyErrorCode.ENVIRONMENT_NOT_FOUND, message, cause);
    }
}
