package net.spookly.edgegate.tunnel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds at most one active tunnel per environment.
 *
 * <p>Installing a tunnel atomically displaces any previous one, which is marked CLOSING and handed
 * back so the caller can tear it down outside the store.</p>
 */
public final class TunnelStore {
    private final Map<String, Tunnel> tunnels = new ConcurrentHashMap<>();

    /**
     * @return the tunnel that was displaced, if any
     */
    public Optional<Tunnel> install(Tunnel tunnel) {
        Objects.requireNonNull(tunnel, "tunnel");
        Tunnel[] replaced = new Tunnel[1];
        tunnels.compute(tunnel.environmentId(), (id, previous) -> {
            if (previous != null && previous != tunnel) {
                previous.markClosing();
                replaced[0] = previous;
            }
            return tunnel;
        });
        return Optional.ofNullable(replaced[0]);
    }

    /**
     * The current tunnel for {@code environmentId}, if it is still usable.
     */
    public Optional<Tunnel> active(String environmentId) {
        if (environmentId == null) {
            return Optional.empty();
        }
        Tunnel tunnel = tunnels.get(environmentId);
        return tunnel != null && tunnel.isActive() ? Optional.of(tunnel) : Optional.empty();
    }

    public Optional<Tunnel> current(String environmentId) {
        return environmentId == null ? Optional.empty() : Optional.ofNullable(tunnels.get(environmentId));
    }

    /**
     * Remove {@code expected} only if it is still the current tunnel for its environment.
     *
     * @return true when it was removed
     */
    public boolean remove(Tunnel expected) {
        Objects.requireNonNull(expected, "expected");
        boolean removed = tunnels.remove(expected.environmentId(), expected);
        expected.markClosing();
        return removed;
    }

    public int size() {
        return tunnels.size();
    }

    public List<Tunnel> list() {
        List<Tunnel> snapshot = new ArrayList<>(tunnels.values());
        snapshot.sort(Comparator.comparing(Tunnel::environmentId));
        return snapshot;
    }
}
