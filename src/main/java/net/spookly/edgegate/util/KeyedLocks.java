package net.spookly.edgegate.util;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One re-entrant lock per key; unrelated keys never contend.
 */
public final class KeyedLocks {
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(key, ignored -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop the lock for a key that no longer exists. Holders keep their reference until they unlock.
     */
    public void discard(String key) {
        locks.remove(key);
    }
}
