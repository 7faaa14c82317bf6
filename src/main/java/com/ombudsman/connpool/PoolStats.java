package com.ombudsman.connpool;

import lombok.Value;

/**
 * A point-in-time snapshot of one pool, taken under the pool's lock so that every field
 * describes the same instant.
 */
@Value
public class PoolStats {

    String name;

    /**
     * Number of idle connections.
     */
    int poolSize;
    int activeConnections;

    /**
     * The configured maximum size.
     */
    int totalCapacity;
    int minSize;
    Counters counters;

    /**
     * @return the total number of connections held by the pool, idle and borrowed
     */
    public int getTotalConnections() {
        return poolSize + activeConnections;
    }

    /**
     * @return borrowed connections as a percentage of the maximum size
     */
    public double getUtilization() {
        return totalCapacity > 0 ? activeConnections * 100.0 / totalCapacity : 0.0;
    }

    /**
     * Lifetime counters of a pool. They only ever grow.
     */
    @Value
    public static class Counters {

        /**
         * Connections opened through the factory and taken into the pool.
         */
        long created;

        /**
         * Acquisitions served from the idle queue.
         */
        long reused;
        long closed;

        /**
         * Factory failures.
         */
        long errors;
        long staleCleaned;

        /**
         * Health probes run on idle connections before handing them out.
         */
        long healthChecks;
    }
}
