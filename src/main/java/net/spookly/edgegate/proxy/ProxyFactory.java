package net.spookly.edgegate.proxy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import lombok.Value;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import net.spookly.edgegate.environment.Environment;
import net.spookly.edgegate.environment.EnvironmentEvent;
import net.spookly.edgegate.environment.EnvironmentEventListener;
import net.spookly.edgegate.environment.EnvironmentEventType;
import net.spookly.edgegate.environment.EnvironmentService;

/**
 * Caches one {@link ProxyHandler} per environment, keyed by the environment's configuration fingerprint.
 *
 * <p>Concurrent callers that find a missing or stale entry share a single build per
 * (environment, fingerprint). A superseded entry is retired and its handler closed once its last lease
 * is released. Entries unused for the idle timeout are evicted by a background sweep.</p>
 */
@Slf4j
public final class ProxyFactory implements EnvironmentEventListener, AutoCloseable {
    private static final long MAX_SWEEP_INTERVAL_MS = 60_000L;

    private final EnvironmentService environments;
    private final ProxyHandlerBuilder builder;
    private final Duration idleTimeout;
    private final Clock clock;
    private final Map<String, ProxyHandlerCacheEntry> entries = new ConcurrentHashMap<>();
    private final Map<BuildKey, CompletableFuture<ProxyHandlerCacheEntry>> builds = new ConcurrentHashMap<>();
    private ScheduledExecutorService sweeper;

    public ProxyFactory(EnvironmentService environments, ProxyHandlerBuilder builder, Duration idleTimeout, Clock clock) {
        this.environments = Objects.requireNonNull(environments, "environments");
        this.builder = Objects.requireNonNull(builder, "builder");
        this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout");
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Start the idle sweep.
     */
    public synchronized void start() {
        if (sweeper != null || idleTimeout.isZero() || idleTimeout.isNegative()) {
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "edgegate-proxy-cache-sweep");
            thread.setDaemon(true);
            return thread;
        });
        long interval = Math.max(1_000L, Math.min(MAX_SWEEP_INTERVAL_MS, idleTimeout.toMillis() / 2));
        sweeper.scheduleWithFixedDelay(this::sweepIdle, interval, interval, TimeUnit.MILLISECONDS);
    }

    /**
     * Current handler for the environment, without holding it. Use {@link #lease} around forwarding.
     */
    public ProxyHandler getHandler(String environmentId) {
        try (ProxyLease lease = lease(environmentId)) {
            return lease.handler();
        }
    }

    /**
     * @throws net.spookly.edgegate.error.EnvironmentNotFoundException when the environment does not exist
     * @throws net.spookly.edgegate.error.ConfigInvalidException when no handler can be built for it
     */
    public ProxyLease lease(String environmentId) {
        return lease(environments.require(environmentId));
    }

    public ProxyLease lease(Environment environment) {
        Objects.requireNonNull(environment, "environment");
        String fingerprint = environment.fingerprint();
        while (true) {
            ProxyHandlerCacheEntry cached = entries.get(environment.id());
            if (cached != null && cached.fingerprint().equals(fingerprint) && cached.tryAcquire()) {
                return new ProxyLease(cached);
            }
            ProxyHandlerCacheEntry built = obtain(environment, fingerprint);
            if (built.tryAcquire()) {
                return new ProxyLease(built);
            }
            // retired between build and acquire, go round again
        }
    }

    private ProxyHandlerCacheEntry obtain(Environment environment, String fingerprint) {
        BuildKey key = new BuildKey(environment.id(), fingerprint);
        CompletableFuture<ProxyHandlerCacheEntry> mine = new CompletableFuture<>();
        CompletableFuture<ProxyHandlerCacheEntry> inFlight = builds.putIfAbsent(key, mine);
        if (inFlight != null) {
            return await(inFlight);
        }
        try {
            ProxyHandlerCacheEntry current = entries.get(environment.id());
            if (current != null && current.fingerprint().equals(fingerprint) && !current.isRetired()) {
                mine.complete(current);
                return current;
            }
            ProxyHandler handler = builder.build(environment);
            ProxyHandlerCacheEntry entry = new ProxyHandlerCacheEntry(environment.id(), fingerprint, handler, clock);
            ProxyHandlerCacheEntry previous = entries.put(environment.id(), entry);
            if (previous != null) {
                log.debug("Configuration of environment {} changed, retiring previous handler", environment.id());
                previous.retire();
            }
            mine.complete(entry);
            return entry;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            builds.remove(key, mine);
        }
    }

    private static ProxyHandlerCacheEntry await(CompletableFuture<ProxyHandlerCacheEntry> inFlight) {
        try {
            return inFlight.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    /**
     * Drop the cached handler for an environment; in-flight leases keep working until released.
     */
    public void invalidate(String environmentId) {
        ProxyHandlerCacheEntry removed = entries.remove(environmentId);
        if (removed != null) {
            removed.retire();
        }
    }

    void sweepIdle() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        for (ProxyHandlerCacheEntry entry : new ArrayList<>(entries.values())) {
            if (entry.isIdleSince(cutoff) && entries.remove(entry.environmentId(), entry)) {
                log.debug("Evicting idle proxy handler for environment {}", entry.environmentId());
                entry.retire();
            }
        }
    }

    public int cachedCount() {
        return entries.size();
    }

    @Override
    public void onEvent(EnvironmentEvent event) {
        if (event.type() == EnvironmentEventType.DELETED) {
            invalidate(event.environmentId());
        }
    }

    @Override
    public synchronized void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
            sweeper = null;
        }
        List<ProxyHandlerCacheEntry> all = new ArrayList<>(entries.values());
        entries.clear();
        for (ProxyHandlerCacheEntry entry : all) {
            entry.retire();
        }
    }

    @Value
    @Accessors(fluent = true)
    private static class BuildKey {
        String environmentId;
        String fingerprint;
    }
}
