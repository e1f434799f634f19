package net.spookly.edgegate.auth;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers recently used nonces so signed requests and agent credentials cannot be replayed.
 */
public final class NonceCache {
    private final Map<String, Instant> seen = new ConcurrentHashMap<>();
    private final long ttlSeconds;

    /**
     * @param ttlSeconds how long a nonce stays remembered; should cover twice the allowed clock skew
     */
    public NonceCache(long ttlSeconds) {
        this.ttlSeconds = ttlSeconds;
    }

    /**
     * @return false when {@code key} was already used inside the retention window
     */
    public boolean register(String key, Instant timestamp) {
        Instant cutoff = timestamp.minusSeconds(ttlSeconds);
        seen.values().removeIf(seenAt -> seenAt.isBefore(cutoff));
        return seen.putIfAbsent(key, timestamp) == null;
    }

    int size() {
        return seen.size();
    }
}
