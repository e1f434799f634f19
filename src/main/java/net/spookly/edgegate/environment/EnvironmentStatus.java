package net.spookly.edgegate.environment;

public enum EnvironmentStatus {
    UP,
    DOWN,
    UNKNOWN
}
