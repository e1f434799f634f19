package net.spookly.edgegate.snapshot;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import io.netty.buffer.ByteBuf;
import net.spookly.edgegate.environment.ApiFamily;
import net.spookly.edgegate.environment.Environment;
import net.spookly.edgegate.error.ProxyException;
import net.spookly.edgegate.proxy.ProxyFactory;
import net.spookly.edgegate.proxy.ProxyLease;
import net.spookly.edgegate.proxy.ProxyRequest;
import net.spookly.edgegate.proxy.ProxySession;
import net.spookly.edgegate.proxy.ResponseHead;
import net.spookly.edgegate.proxy.ResponseSink;

/**
 * Probes through the same cached handlers as proxied traffic: {@code GET /_ping} for Docker and
 * {@code GET /healthz} for Kubernetes. Any 2xx or 3xx answer counts as up.
 */
public final class ProxyEnvironmentProbe implements EnvironmentProbe {
    static final String DOCKER_PATH = "/_ping";
    static final String KUBERNETES_PATH = "/healthz";

    private final ProxyFactory proxyFactory;

    public ProxyEnvironmentProbe(ProxyFactory proxyFactory) {
        this.proxyFactory = Objects.requireNonNull(proxyFactory, "proxyFactory");
    }

    @Override
    public CompletableFuture<Boolean> probe(Environment environment, int timeoutMs) {
        String path = environment.kind().apiFamily() == ApiFamily.KUBERNETES ? KUBERNETES_PATH : DOCKER_PATH;
        CompletableFuture<Boolean> result = new CompletableFuture<>();
        ProxyLease lease;
        try {
            lease = proxyFactory.lease(environment);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        ProxySession session;
        try {
            session = lease.handler().forward(ProxyRequest.get(path), new ResponseSink() {
                @Override
                public void onResponseHead(ResponseHead head) {
                    result.complete(head.status() >= 200 && head.status() < 400);
                }

                @Override
                public void onData(ByteBuf data) {
                    data.release();
                }

                @Override
                public void onComplete() {
                    result.complete(false);
                }

                @Override
                public void onError(ProxyException error) {
                    result.completeExceptionally(error);
                }
            });
        } catch (RuntimeException e) {
            lease.close();
            return CompletableFuture.failedFuture(e);
        }
        session.completion().whenComplete((ignored, error) -> lease.close());
        if (timeoutMs > 0) {
            result.orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
        }
        result.whenComplete((ok, error) -> session.cancel());
        return result;
    }
}
