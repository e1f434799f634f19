package net.spookly.edgegate.proxy;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Use of a cached handler. Closing the lease releases the handler; closing twice is harmless.
 */
public final class ProxyLease implements AutoCloseable {
    private final ProxyHandlerCacheEntry entry;
    private final AtomicBoolean released = new AtomicBoolean(false);

    ProxyLease(ProxyHandlerCacheEntry entry) {
        this.entry = Objects.requireNonNull(entry, "entry");
    }

    public ProxyHandler handler() {
        return entry.handler();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            entry.release();
        }
    }
}
