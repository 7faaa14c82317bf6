package com.ombudsman.connpool;

/**
 * The javax.management MBean for a connection pool instance.
 */
public interface ConnectionPoolMXBean {

    /**
     * Get the number of currently idle connections in the pool.
     * <p>
     * The return value is extremely transient and is a point-in-time measurement. Therefore, the return
     * value should not be used for decisions about whether a connection can be acquired.
     *
     * @return the current number of idle connections in the pool
     */
    int getIdleConnections();

    /**
     * Get the number of currently borrowed connections.
     *
     * @return the current number of borrowed connections
     */
    int getActiveConnections();

    /**
     * Get the total number of connections currently in the pool, idle and borrowed.
     *
     * @return the total number of connections in the pool
     */
    int getTotalConnections();

    /**
     * Get the number of threads awaiting connections from the pool.
     *
     * @return the number of threads awaiting a connection from the pool
     */
    int getThreadsAwaitingConnection();

    /**
     * Evict currently idle connections from the pool, and mark borrowed connections for eviction
     * when they are returned to the pool.
     */
    void softEvictConnections();
}
