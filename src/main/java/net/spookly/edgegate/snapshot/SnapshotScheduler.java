package net.spookly.edgegate.snapshot;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import lombok.extern.slf4j.Slf4j;
import net.spookly.edgegate.environment.Environment;
import net.spookly.edgegate.environment.EnvironmentEvent;
import net.spookly.edgegate.environment.EnvironmentEventListener;
import net.spookly.edgegate.environment.EnvironmentEventType;
import net.spookly.edgegate.environment.EnvironmentService;
import net.spookly.edgegate.environment.EnvironmentStatus;
import net.spookly.edgegate.environment.TransportType;
import net.spookly.edgegate.tunnel.TunnelStore;

/**
 * Periodically probes every environment and maintains its UP/DOWN status.
 *
 * <p>A success marks the environment UP. Failures only mark it DOWN after {@code failureThreshold}
 * consecutive misses; heartbeat loss is applied by the tunnel session itself. A probe result is not
 * applied when the status changed while the probe was running. An environment whose previous probe is
 * still running is skipped.</p>
 */
@Slf4j
public final class SnapshotScheduler implements EnvironmentEventListener, AutoCloseable {
    private final SnapshotSettings settings;
    private final EnvironmentService environments;
    private final TunnelStore tunnels;
    private final EnvironmentProbe probe;
    private final Clock clock;
    private final ProbeHistoryTracker history = new ProbeHistoryTracker();
    private final Map<String, EnvironmentSnapshot> snapshots = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private ScheduledFuture<?> scheduledTask;

    public SnapshotScheduler(SnapshotSettings settings,
                             EnvironmentService environments,
                             TunnelStore tunnels,
                             EnvironmentProbe probe,
                             Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.environments = Objects.requireNonNull(environments, "environments");
        this.tunnels = Objects.requireNonNull(tunnels, "tunnels");
        this.probe = Objects.requireNonNull(probe, "probe");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory("edgegate-snapshot"));
        this.workers = Executors.newFixedThreadPool(Math.max(1, settings.workers()), threadFactory("edgegate-snapshot-worker"));
    }

    public synchronized void start() {
        if (stopped.get() || scheduledTask != null || settings.intervalSeconds() <= 0) {
            return;
        }
        scheduledTask = scheduler.scheduleAtFixedRate(this::runOnceSafely, 0, settings.intervalSeconds(), TimeUnit.SECONDS);
        log.info("Snapshot scheduler started: every {}s, {} workers, failure threshold {}",
                settings.intervalSeconds(), settings.workers(), settings.failureThreshold());
    }

    public synchronized void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
            scheduledTask = null;
        }
        scheduler.shutdownNow();
        workers.shutdownNow();
        try {
            probe.close();
        } catch (Exception e) {
            log.warn("Failed to close environment probe: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        stop();
    }

    public Optional<EnvironmentSnapshot> lastSnapshot(String environmentId) {
        return Optional.ofNullable(snapshots.get(environmentId));
    }

    /**
     * Queue one probe per environment that is not already being probed.
     *
     * @return futures for the probes queued by this round
     */
    List<CompletableFuture<Void>> runOnce() {
        List<CompletableFuture<Void>> queued = new ArrayList<>();
        if (stopped.get()) {
            return queued;
        }
        for (Environment environment : environments.list()) {
            String id = environment.id();
            if (!inFlight.add(id)) {
                log.debug("Skipping probe of {}: previous probe still running", id);
                continue;
            }
            try {
                queued.add(CompletableFuture.runAsync(() -> {
                    try {
                        probeOne(environment);
                    } finally {
                        inFlight.remove(id);
                    }
                }, workers));
            } catch (RejectedExecutionException e) {
                inFlight.remove(id);
                log.debug("Snapshot workers stopped, abandoning round");
                break;
            }
        }
        return queued;
    }

    private void runOnceSafely() {
        try {
            runOnce();
        } catch (RuntimeException e) {
            log.warn("Snapshot round failed", e);
        }
    }

    private void probeOne(Environment environment) {
        int timeoutMs = settings.probeTimeoutMs();
        long observedVersion = environments.statusVersion(environment.id());
        long startedNanos = System.nanoTime();
        boolean success = false;
        String detail;
        CompletableFuture<Boolean> outcome = null;
        try {
            outcome = probe.probe(environment, timeoutMs);
            success = Boolean.TRUE.equals(outcome.get(timeoutMs, TimeUnit.MILLISECONDS));
            detail = success ? "ok" : "unexpected response";
        } catch (TimeoutException e) {
            outcome.cancel(true);
            detail = "timed out after " + timeoutMs + "ms";
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            detail = cause instanceof TimeoutException ? "timed out after " + timeoutMs + "ms" : String.valueOf(cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        } catch (RuntimeException e) {
            detail = String.valueOf(e.getMessage());
        }
        long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
        record(environment, success, detail, latencyMs, observedVersion);
    }

    private void record(Environment environment, boolean success, String detail, long latencyMs, long observedVersion) {
        String id = environment.id();
        Instant now = clock.instant();
        int failures;
        if (success) {
            history.recordSuccess(id);
            failures = 0;
            environments.recordProbe(id, EnvironmentStatus.UP, "probe succeeded", now, observedVersion);
        } else {
            failures = history.recordFailure(id);
            if (environment.kind().transportType() == TransportType.TUNNEL && tunnels.active(id).isEmpty()) {
                detail = "no active tunnel: " + detail;
            }
            EnvironmentStatus next = failures >= settings.failureThreshold() ? EnvironmentStatus.DOWN : null;
            log.debug("Probe of {} failed ({}), streak {}", id, detail, failures);
            environments.recordProbe(id, next, "probe failed " + failures + "x: " + detail, now, observedVersion);
        }
        snapshots.put(id, new EnvironmentSnapshot(id, now, success, latencyMs, detail, failures));
    }

    @Override
    public void onEvent(EnvironmentEvent event) {
        if (event.type() == EnvironmentEventType.DELETED) {
            history.forget(event.environmentId());
            snapshots.remove(event.environmentId());
        }
    }

    private static ThreadFactory threadFactory(String name) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
