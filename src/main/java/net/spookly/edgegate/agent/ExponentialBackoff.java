package net.spookly.edgegate.agent;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Reconnect delay that grows by {@code multiplier} after every failure, capped at {@code maxIntervalMs}.
 */
public final class ExponentialBackoff {
    private final long minIntervalMs;
    private final long maxIntervalMs;
    private final double multiplier;
    private final AtomicLong currentIntervalMs;

    public ExponentialBackoff(long minIntervalMs, long maxIntervalMs, double multiplier) {
        if (minIntervalMs <= 0 || maxIntervalMs < minIntervalMs) {
            throw new IllegalArgumentException("backoff needs 0 < min <= max, got " + minIntervalMs + ".." + maxIntervalMs);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("backoff multiplier must be at least 1");
        }
        this.minIntervalMs = minIntervalMs;
        this.maxIntervalMs = maxIntervalMs;
        this.multiplier = multiplier;
        this.currentIntervalMs = new AtomicLong(minIntervalMs);
    }

    /**
     * @return the delay to wait now; the following call returns the next larger step
     */
    public long nextBackoff() {
        return currentIntervalMs.getAndUpdate(current -> Math.min((long) (current * multiplier), maxIntervalMs));
    }

    public long currentInterval() {
        return currentIntervalMs.get();
    }

    /**
     * Back to the minimum; call after a successful connection.
     */
    public void reset() {
        currentIntervalMs.set(minIntervalMs);
    }

    @Override
    public String toString() {
        return "ExponentialBackoff{" + minIntervalMs + ".." + maxIntervalMs + "ms x" + multiplier
                + ", current=" + currentIntervalMs.get() + "ms}";
    }
}
