package net.spookly.edgegate.environment;

public enum ApiFamily {
    DOCKER,
    KUBERNETES
}
