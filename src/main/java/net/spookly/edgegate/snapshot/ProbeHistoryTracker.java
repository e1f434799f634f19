package net.spookly.edgegate.snapshot;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Consecutive probe failures per environment.
 */
public final class ProbeHistoryTracker {
    private final Map<String, Integer> consecutiveFailures = new ConcurrentHashMap<>();

    public void recordSuccess(String environmentId) {
        consecutiveFailures.remove(environmentId);
    }

    /**
     * @return the failure streak including this failure
     */
    public int recordFailure(String environmentId) {
        return consecutiveFailures.merge(environmentId, 1, Integer::sum);
    }

    public void forget(String environmentId) {
        consecutiveFailures.remove(environmentId);
    }
}
