package net.spookly.edgegate.error;

/**
 * A single logical stream inside a tunnel failed; the tunnel itself may be healthy.
 */
public class SubConnectionFailedException extends ProxyException {
    public SubConnectionFailedException(String message) {
        super(ProxyErrorCode.SUB_CONNECTION_FAILED, message);
    }

    public SubConnectionFailedException(String message, Throwable cause) {
        super(ProxyErrorCode.SUB_CONNECTION_FAILED, message, cause);
    }
}
