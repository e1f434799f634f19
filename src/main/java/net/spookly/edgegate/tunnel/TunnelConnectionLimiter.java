package net.spookly.edgegate.tunnel;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per source address limits on tunnel handshakes per minute and concurrent tunnel connections.
 * A null or non-positive limit disables that check.
 */
public final class TunnelConnectionLimiter {
    private static final long WINDOW_MILLIS = 60_000L;

    private final Clock clock;
    private final Integer handshakesPerMinute;
    private final Integer concurrentConnections;
    private final Map<String, Deque<Long>> handshakesByAddress = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> connectionsByAddress = new ConcurrentHashMap<>();

    public TunnelConnectionLimiter(Integer handshakesPerMinute, Integer concurrentConnections, Clock clock) {
        this.handshakesPerMinute = positiveOrNull(handshakesPerMinute);
        this.concurrentConnections = positiveOrNull(concurrentConnections);
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public boolean tryAcquireHandshake(String address) {
        if (handshakesPerMinute == null || address == null) {
            return true;
        }
        Deque<Long> window = handshakesByAddress.computeIfAbsent(address, ignored -> new ArrayDeque<>());
        long now = clock.millis();
        synchronized (window) {
            while (!window.isEmpty() && window.peekFirst() < now - WINDOW_MILLIS) {
                window.removeFirst();
            }
            if (window.size() >= handshakesPerMinute) {
                return false;
            }
            window.addLast(now);
            return true;
        }
    }

    public boolean tryOpenConnection(String address) {
        if (concurrentConnections == null || address == null) {
            return true;
        }
        AtomicInteger count = connectionsByAddress.computeIfAbsent(address, ignored -> new AtomicInteger());
        if (count.incrementAndGet() > concurrentConnections) {
            count.decrementAndGet();
            dropIfIdle(address, count);
            return false;
        }
        return true;
    }

    public void releaseConnection(String address) {
        if (concurrentConnections == null || address == null) {
            return;
        }
        AtomicInteger count = connectionsByAddress.get(address);
        if (count != null && count.decrementAndGet() <= 0) {
            dropIfIdle(address, count);
        }
    }

    private void dropIfIdle(String address, AtomicInteger count) {
        if (count.get() <= 0) {
            connectionsByAddress.remove(address, count);
        }
    }

    private static Integer positiveOrNull(Integer value) {
        return value == null || value <= 0 ? null : value;
    }
}
