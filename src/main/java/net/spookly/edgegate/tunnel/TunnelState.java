package net.spookly.edgegate.tunnel;

public enum TunnelState {
    ACTIVE,
    CLOSING
}
