package net.spookly.edgegate.routing;

import java.util.Objects;

import lombok.extern.slf4j.Slf4j;
import net.spookly.edgegate.environment.Environment;
import net.spookly.edgegate.environment.EnvironmentStatus;
import net.spookly.edgegate.environment.EnvironmentService;
import net.spookly.edgegate.error.EnvironmentUnreachableException;
import net.spookly.edgegate.proxy.ProxyFactory;
import net.spookly.edgegate.proxy.ProxyLease;
import net.spookly.edgegate.proxy.ProxyRequest;
import net.spookly.edgegate.proxy.ProxySession;
import net.spookly.edgegate.proxy.ResponseSink;

/**
 * Entry point for proxied API calls: resolves the environment, refuses environments known to be down,
 * and forwards through a leased handler. Never changes environment status.
 */
@Slf4j
public final class EndpointProxyRouter {
    private final EnvironmentService environments;
    private final ProxyFactory proxyFactory;

    public EndpointProxyRouter(EnvironmentService environments, ProxyFactory proxyFactory) {
        this.environments = Objects.requireNonNull(environments, "environments");
        this.proxyFactory = Objects.requireNonNull(proxyFactory, "proxyFactory");
    }

    /**
     * @throws net.spookly.edgegate.error.EnvironmentNotFoundException when the environment does not exist
     * @throws EnvironmentUnreachableException when the environment is marked down; nothing is dialed
     * @throws net.spookly.edgegate.error.ConfigInvalidException when no handler can be built
     */
    public ProxySession route(String environmentId, ProxyRequest request, ResponseSink sink) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(sink, "sink");
        Environment environment = environments.require(environmentId);
        if (environment.status() == EnvironmentStatus.DOWN) {
            log.debug("Refusing {} for environment {}: marked down", request, environmentId);
            throw new EnvironmentUnreachableException("environment " + environmentId + " is down");
        }
        ProxyLease lease = proxyFactory.lease(environment);
        ProxySession session;
        try {
            session = lease.handler().forward(request, sink);
        } catch (RuntimeException e) {
            lease.close();
            throw e;
        }
        session.completion().whenComplete((ignored, error) -> lease.close());
        return session;
    }
}
