package com.ombudsman.connpool;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link RawConnection} whose health can be switched from a test.
 */
public class FakeConnection implements RawConnection {

    private final int id;
    private final AtomicInteger closeCount = new AtomicInteger();
    private final AtomicInteger probeCount = new AtomicInteger();
    private volatile boolean healthy = true;
    private volatile boolean probeFails;
    private volatile Error probeError;

    public FakeConnection(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    public void setHealthy(boolean healthy) {
        this.healthy = healthy;
    }

    public void setProbeFails(boolean probeFails) {
        this.probeFails = probeFails;
    }

    public void setProbeError(Error probeError) {
        this.probeError = probeError;
    }

    public int getCloseCount() {
        return closeCount.get();
    }

    public int getProbeCount() {
        return probeCount.get();
    }

    public boolean isClosed() {
        return closeCount.get() > 0;
    }

    @Override
    public boolean healthProbe() throws IOException {
        probeCount.incrementAndGet();

        if (probeError != null) {
            throw probeError;
        }

        if (probeFails) {
            throw new IOException("connection reset");
        }
        return healthy && !isClosed();
    }

    @Override
    public void close() {
        closeCount.incrementAndGet();
    }

    @Override
    public String toString() {
        return "FakeConnection-" + id;
    }
}
