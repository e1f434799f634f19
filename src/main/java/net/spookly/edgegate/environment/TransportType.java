package net.spookly.edgegate.environment;

/**
 * How the control plane physically reaches an environment's API.
 */
public enum TransportType {
    DIRECT_HTTP,
    DIRECT_SOCKET,
    TUNNEL
}
