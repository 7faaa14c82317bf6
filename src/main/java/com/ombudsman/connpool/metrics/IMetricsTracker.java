package com.ombudsman.connpool.metrics;

/**
 * Receives timing and event notifications from a pool. Every method has a no-op default so that
 * a back end only implements what it records.
 */
public interface IMetricsTracker extends AutoCloseable {

    default void recordConnectionCreatedMillis(long connectionCreatedMillis) {
    }

    default void recordConnectionAcquiredNanos(long elapsedAcquiredNanos) {
    }

    default void recordConnectionUsageMillis(long elapsedBorrowedMillis) {
    }

    default void recordConnectionTimeout() {
    }

    /**
     * A connection was closed by the pool rather than by shutdown: stale, failed its probe, or evicted.
     */
    default void recordConnectionEvicted() {
    }

    @Override
    default void close() {
    }
}
