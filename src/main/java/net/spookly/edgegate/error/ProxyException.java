package net.spookly.edgegate.error;

import java.util.Objects;

/**
 * Base type for failures that surface to a proxied request.
 */
public abstract class ProxyException extends RuntimeException {
    private final ProxyErrorCode code;

    protected ProxyException(ProxyErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    protected ProxyException(ProxyErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ProxyErrorCode code() {
        return code;
    }

    public int httpStatus() {
        return code.httpStatus();
    }
}
