package net.spookly.edgegate.tunnel;

@FunctionalInterface
public interface TunnelEventListener {
    TunnelEventListener NOOP = event -> {
    };

    void onEvent(TunnelEvent event);
}
