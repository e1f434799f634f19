package net.spookly.edgegate.environment;

public enum EnvironmentEventType {
    SAVED,
    DELETED,
    STATUS_CHANGED
}
