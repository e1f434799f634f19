package net.spookly.edgegate.proxy;

import net.spookly.edgegate.environment.Environment;

/**
 * Kubernetes API: agents expose the cluster API under {@code /kubernetes}, direct endpoints at the root.
 */
public final class KubernetesRequestRewriter extends RequestRewriter {
    static final String AGENT_PREFIX = "/kubernetes";

    private final boolean tunneled;

    KubernetesRequestRewriter(Environment environment, boolean tunneled) {
        super(environment);
        this.tunneled = tunneled;
    }

    @Override
    protected String rewritePath(String path) {
        return tunneled ? AGENT_PREFIX + path : path;
    }
}
