package com.ombudsman.connpool.metrics;

public interface MetricsTrackerFactory {

    /**
     * Create an instance of an IMetricsTracker.
     *
     * @param poolName   the name of the pool
     * @param poolGauges a PoolGauges instance to use
     * @return a IMetricsTracker implementation instance
     */
    IMetricsTracker create(String poolName, PoolGauges poolGauges);
}
