package net.spookly.edgegate.environment;

/**
 * Listener for environment audit events.
 */
@FunctionalInterface
public interface EnvironmentEventListener {
    EnvironmentEventListener NOOP = event -> {
    };

    void onEvent(EnvironmentEvent event);
}
