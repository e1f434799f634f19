package net.spookly.edgegate.tunnel;

public enum TunnelEventType {
    ESTABLISHED,
    REPLACED,
    REJECTED,
    LOST,
    CLOSED
}
