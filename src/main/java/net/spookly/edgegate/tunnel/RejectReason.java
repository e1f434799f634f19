package net.spookly.edgegate.tunnel;

/**
 * Why the tunnel server refused an agent handshake. Sent to the agent in {@code HELLO_ACK}.
 */
public enum RejectReason {
    MALFORMED,
    RATE_LIMITED,
    UNKNOWN_ENVIRONMENT,
    NOT_TUNNEL_ENVIRONMENT,
    BAD_CREDENTIAL
}
