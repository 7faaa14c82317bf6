package com.ombudsman.connpool.metrics;

import java.util.concurrent.atomic.AtomicLong;

import static com.ombudsman.connpool.util.ClockSource.currentTime;
import static com.ombudsman.connpool.util.ClockSource.plusMillis;

/**
 * Connection counts read by metrics back ends. Values are refreshed from the pool through
 * {@link #update()} at most once per {@code timeoutMs}, so frequent scrapes do not contend
 * for the pool's lock.
 */
public abstract class PoolGauges {

    private final AtomicLong reloadAt;
    private final long timeoutMs;

    protected volatile int totalConnections;
    protected volatile int idleConnections;
    protected volatile int activeConnections;
    protected volatile int pendingThreads;
    protected volatile int maxConnections;
    protected volatile int minConnections;

    protected PoolGauges(long timeoutMs) {
        this.timeoutMs = timeoutMs;
        reloadAt = new AtomicLong(currentTime());
    }

    public int getTotalConnections() {
        if (shouldLoad()) {
            update();
        }
        return totalConnections;
    }

    public int getIdleConnections() {
        if (shouldLoad()) {
            update();
        }
        return idleConnections;
    }

    public int getActiveConnections() {
        if (shouldLoad()) {
            update();
        }
        return activeConnections;
    }

    public int getPendingThreads() {
        if (shouldLoad()) {
            update();
        }
        return pendingThreads;
    }

    public int getMaxConnections() {
        if (shouldLoad()) {
            update();
        }
        return maxConnections;
    }

    public int getMinConnections() {
        if (shouldLoad()) {
            update();
        }
        return minConnections;
    }

    protected abstract void update();

    private boolean shouldLoad() {
        for (; ; ) {
            long now = currentTime();
            long reloadTime = reloadAt.get();

            if (reloadTime - now > 0) {
                return false;
            } else if (reloadAt.compareAndSet(reloadTime, plusMillis(now, timeoutMs))) {
                return true;
            }
        }
    }
}
