package net.spookly.edgegate.proxy;

import net.spookly.edgegate.environment.Environment;

@FunctionalInterface
public interface ProxyHandlerBuilder {
    /**
     * @throws net.spookly.edgegate.error.ConfigInvalidException when the environment cannot be reached as configured
     */
    ProxyHandler build(Environment environment);
}
