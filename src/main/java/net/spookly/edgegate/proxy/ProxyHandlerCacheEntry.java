package net.spookly.edgegate.proxy;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * A cached handler with its in-flight user count. A retired entry accepts no new users and closes
 * its handler once the last user releases it.
 */
public final class ProxyHandlerCacheEntry {
    private final String environmentId;
    private final String fingerprint;
    private final ProxyHandler handler;
    private final Clock clock;
    private int references;
    private boolean retired;
    private Instant lastUsedAt;

    ProxyHandlerCacheEntry(String environmentId, String fingerprint, ProxyHandler handler, Clock clock) {
        this.environmentId = Objects.requireNonNull(environmentId, "environmentId");
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.lastUsedAt = clock.instant();
    }

    public String environmentId() {
        return environmentId;
    }

    public String fingerprint() {
        return fingerprint;
    }

    public ProxyHandler handler() {
        return handler;
    }

    synchronized boolean tryAcquire() {
        if (retired) {
            return false;
        }
        references++;
        lastUsedAt = clock.instant();
        return true;
    }

    void release() {
        boolean closeNow;
        synchronized (this) {
            references--;
            lastUsedAt = clock.instant();
            closeNow = retired && references == 0;
        }
        if (closeNow) {
            handler.close();
        }
    }

    void retire() {
        boolean closeNow;
        synchronized (this) {
            if (retired) {
                return;
            }
            retired = true;
            closeNow = references == 0;
        }
        if (closeNow) {
            handler.close();
        }
    }

    public synchronized boolean isRetired() {
        return retired;
    }

    public synchronized int references() {
        return references;
    }

    synchronized boolean isIdleSince(Instant cutoff) {
        return references == 0 && !lastUsedAt.isAfter(cutoff);
    }
}
