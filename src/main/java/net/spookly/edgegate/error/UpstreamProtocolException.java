package net.spookly.edgegate.error;

/**
 * The backend answered with something that is not a usable HTTP/1.1 response.
 */
public class UpstreamProtocolException extends ProxyException {
    public UpstreamProtocolException(String message) {
        super(ProxyErrorCode.UPSTREAM_PROTOCOL_ERROR, message);
    }

    public UpstreamProtocolException(String message, Throwable cause) {
        super(ProxyErrorCode.UPSTREAM_PROTOCOL_ERROR, message, cause);
    }
}
