package net.spookly.dimensions.registry;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mutable runtime counters for one destination.
 */
public final class ServerDetails {
    private final AtomicInteger clientCount = new AtomicInteger();
    private final AtomicInteger failedConnAttempts = new AtomicInteger();
    private volatile boolean disabled;

    public int clientCount() {
        return clientCount.get();
    }

    public int incrementClients() {
        return clientCount.incrementAndGet();
    }

    /**
     * Decrement the client count, never going below zero.
     */
    public int decrementClients() {
        return clientCount.updateAndGet(current -> current > 0 ? current - 1 : 0);
    }

    public int failedConnAttempts() {
        return failedConnAttempts.get();
    }

    public int recordFailedConnection() {
        return failedConnAttempts.incrementAndGet();
    }

    public void recordSuccessfulConnection() {
        failedConnAttempts.set(0);
    }

    public boolean disabled() {
        return disabled;
    }

    public void setDisabled(boolean disabled) {
        this.disabled = disabled;
    }
}
