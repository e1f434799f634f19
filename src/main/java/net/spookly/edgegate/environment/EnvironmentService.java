package net.spookly.edgegate.environment;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import lombok.extern.slf4j.Slf4j;
import net.spookly.edgegate.error.EnvironmentNotFoundException;
import net.spookly.edgegate.util.KeyedLocks;

/**
 * Read-mostly cached view over the {@link EnvironmentStore} and the only writer of environment status.
 *
 * <p>All writes for one environment are serialized on a per-id lock, so status transitions are
 * linearizable per environment while unrelated environments never contend.</p>
 */
@Slf4j
public final class EnvironmentService {
    private final EnvironmentStore store;
    private final Clock clock;
    private final Map<String, Environment> cache = new ConcurrentHashMap<>();
    private final KeyedLocks locks = new KeyedLocks();
    private final Map<String, Long> statusVersions = new ConcurrentHashMap<>();
    private final List<EnvironmentEventListener> listeners = new CopyOnWriteArrayList<>();

    public EnvironmentService(EnvironmentStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        reload();
    }

    public void addListener(EnvironmentEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Replace the cached view with the current store contents.
     */
    public void reload() {
        List<Environment> records = store.list();
        cache.clear();
        for (Environment environment : records) {
            cache.put(environment.id(), environment);
        }
    }

    public Optional<Environment> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        Environment cached = cache.get(id);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<Environment> stored = store.get(id);
        stored.ifPresent(environment -> cache.putIfAbsent(id, environment));
        return stored.map(environment -> cache.getOrDefault(id, environment));
    }

    public Environment require(String id) {
        return find(id).orElseThrow(() -> new EnvironmentNotFoundException("environment not found: " + id));
    }

    public List<Environment> list() {
        List<Environment> result = new ArrayList<>(cache.values());
        result.sort(Comparator.comparing(Environment::id));
        return result;
    }

    /**
     * Insert or replace an environment record. The caller's status fields are ignored; an existing
     * environment keeps its current status and a new one starts as UNKNOWN.
     */
    public Environment save(Environment environment) {
        Objects.requireNonNull(environment, "environment");
        String id = environment.id();
        Environment saved = locks.withLock(id, () -> {
            Optional<Environment> existing = find(id);
            Environment merged = environment.toBuilder()
                    .status(existing.map(Environment::status).orElse(EnvironmentStatus.UNKNOWN))
                    .lastProbeAt(existing.map(Environment::lastProbeAt).orElse(null))
                    .lastStatusChangeAt(existing.map(Environment::lastStatusChangeAt).orElse(null))
                    .build();
            store.put(merged);
            cache.put(id, merged);
            return merged;
        });
        emit(EnvironmentEvent.saved(saved, clock.instant()));
        return saved;
    }

    public boolean delete(String id) {
        if (id == null) {
            return false;
        }
        Environment removed = locks.withLock(id, () -> {
            Optional<Environment> existing = find(id);
            if (existing.isEmpty()) {
                return null;
            }
            store.delete(id);
            cache.remove(id);
            statusVersions.remove(id);
            return existing.get();
        });
        if (removed == null) {
            return false;
        }
        locks.discard(id);
        emit(EnvironmentEvent.deleted(removed, clock.instant()));
        return true;
    }

    /**
     * Counter bumped on every status transition of an environment; 0 before the first one.
     */
    public long statusVersion(String id) {
        return id == null ? 0L : statusVersions.getOrDefault(id, 0L);
    }

    /**
     * Set the status of an environment. Returns the updated view, or empty when the environment no longer exists.
     */
    public Optional<Environment> updateStatus(String id, EnvironmentStatus status, String reason) {
        Objects.requireNonNull(status, "status");
        return write(id, status, reason, null, -1L);
    }

    /**
     * Record a probe outcome: always stamps the probe time, and changes status only when {@code status} is non-null.
     */
    public Optional<Environment> recordProbe(String id, EnvironmentStatus status, String reason, Instant probedAt) {
        Objects.requireNonNull(probedAt, "probedAt");
        return write(id, status, reason, probedAt, -1L);
    }

    /**
     * Like {@link #recordProbe(String, EnvironmentStatus, String, Instant)}, but the status change is dropped
     * when the environment transitioned after {@code observedVersion} was read. The probe time is still stamped.
     */
    public Optional<Environment> recordProbe(String id, EnvironmentStatus status, String reason, Instant probedAt,
                                             long observedVersion) {
        Objects.requireNonNull(probedAt, "probedAt");
        return write(id, status, reason, probedAt, observedVersion);
    }

    private Optional<Environment> write(String id, EnvironmentStatus status, String reason, Instant probedAt,
                                        long observedVersion) {
        if (id == null) {
            return Optional.empty();
        }
        Environment[] transition = new Environment[2];
        Environment result = locks.withLock(id, () -> {
            Environment current = cache.get(id);
            if (current == null) {
                return null;
            }
            boolean statusChanges = status != null && status != current.status();
            if (statusChanges && observedVersion >= 0 && statusVersion(id) != observedVersion) {
                log.debug("Dropping stale {} for {}: status changed to {} meanwhile", status, id, current.status());
                statusChanges = false;
            }
            if (!statusChanges && probedAt == null) {
                return current;
            }
            Environment.EnvironmentBuilder builder = current.toBuilder();
            if (probedAt != null) {
                builder.lastProbeAt(probedAt);
            }
            if (statusChanges) {
                builder.status(status).lastStatusChangeAt(clock.instant());
            }
            Environment next = builder.build();
            store.put(next);
            cache.put(id, next);
            if (statusChanges) {
                statusVersions.merge(id, 1L, Long::sum);
                transition[0] = current;
                transition[1] = next;
            }
            return next;
        });
        if (transition[0] != null) {
            log.debug("Environment {} status {} -> {} ({})", id, transition[0].status(), transition[1].status(), reason);
            emit(EnvironmentEvent.statusChanged(transition[0], transition[1], reason, clock.instant()));
        }
        return Optional.ofNullable(result);
    }

    private void emit(EnvironmentEvent event) {
        for (EnvironmentEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Environment event listener failed for {} {}", event.type(), event.environmentId(), e);
            }
        }
    }
}
