/*
 * Copyright (C) 2013, 2014 Brett Wooldridge
 *
 * Modifications made by Foulest (https://github.com/Foulest)
 * for the HikariCP fork (https://github.com/Foulest/HikariCP).
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.ombudsman.connpool.pool;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.health.HealthCheckRegistry;
import com.ombudsman.connpool.*;
import com.ombudsman.connpool.metrics.MetricsTrackerFactory;
import com.ombudsman.connpool.metrics.PoolGauges;
import com.ombudsman.connpool.metrics.dropwizard.CodahaleHealthChecker;
import com.ombudsman.connpool.metrics.dropwizard.CodahaleMetricsTrackerFactory;
import com.ombudsman.connpool.metrics.micrometer.MicrometerMetricsTrackerFactory;
import com.ombudsman.connpool.util.ClockSource;
import com.ombudsman.connpool.util.UtilityElf;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.*;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A bounded pool of raw connections of one kind.
 * <p>
 * Idle connections wait in a FIFO queue, borrowed ones are tracked by the identity of their raw
 * handle. All pool state is guarded by a single lock; waiting callers park on its condition and
 * are woken whenever a connection is returned or capacity is freed. Factory calls, health probes
 * and {@code close()} calls on raw handles never run with the lock held.
 * <p>
 * A background housekeeper closes stale idle connections and tops the pool up to its minimum size
 * every {@code healthCheckInterval} milliseconds.
 *
 * @param <C> the raw connection type
 */
@Slf4j
@SuppressWarnings({"unused", "WeakerAccess"})
public final class ConnectionPool<C extends RawConnection> extends PoolBase<C>
        implements ConnectionPoolMXBean, AutoCloseable {

    public static final int POOL_NORMAL = 0;
    public static final int POOL_SHUTDOWN = 1;

    @Getter
    private volatile int poolState;

    private static final String STALE_CONNECTION_MESSAGE = "(connection has passed maxAge)";
    private static final String DEAD_CONNECTION_MESSAGE = "(connection is dead)";
    private static final String EVICTED_CONNECTION_MESSAGE = "(connection was evicted)";
    private static final String SHUTDOWN_MESSAGE = "(pool is shutting down)";

    private static final long HOUSEKEEPER_TERMINATION_SECONDS = 5L;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition connectionAvailable = lock.newCondition();
    private final Deque<PooledConnection<C>> idleConnections = new ArrayDeque<>();
    private final Map<C, PooledConnection<C>> activeConnections = new IdentityHashMap<>();

    // guarded by lock
    private int pendingCreations;
    private int waitingThreads;
    private long createdCount;
    private long reusedCount;
    private long closedCount;
    private long errorCount;
    private long staleCleanedCount;
    private long healthCheckCount;

    private final ScheduledExecutorService houseKeepingExecutorService;
    private final ScheduledFuture<?> houseKeeperTask;

    /**
     * Construct a pool with the specified configuration. The configuration is validated and sealed,
     * {@code minSize} connections are opened before the constructor returns, and the housekeeper is
     * scheduled. Failures to open the initial connections are logged and counted, never thrown.
     *
     * @param config            the pool configuration
     * @param connectionFactory the factory that opens raw connections
     */
    public ConnectionPool(@NotNull PoolConfig config, @NotNull ConnectionFactory<C> connectionFactory) {
        super(prepare(config), connectionFactory);
        houseKeepingExecutorService = initializeHouseKeepingExecutorService();

        if (config.getMetricsTrackerFactory() != null) {
            setMetricsTrackerFactory(config.getMetricsTrackerFactory());
        } else {
            setMetricRegistry(config.getMetricRegistry());
        }

        setHealthCheckRegistry(config.getHealthCheckRegistry());
        handleMBeans(this, true);

        fillPool();

        long interval = config.getHealthCheckInterval();
        houseKeeperTask = houseKeepingExecutorService.scheduleWithFixedDelay(new HouseKeeper(),
                interval, interval, TimeUnit.MILLISECONDS);

        log.info("{} - Started (min={}, max={}, maxAge={}ms, healthCheckInterval={}ms).", poolName,
                config.getMinSize(), config.getMaxSize(), config.getMaxAge(), interval);
    }

    private static PoolConfig prepare(@NotNull PoolConfig config) {
        config.validate();
        config.seal();
        return config;
    }

    /**
     * Borrow a connection, waiting at most {@code acquireTimeout} milliseconds.
     *
     * @return a raw connection owned by the caller until it is released
     * @throws PoolException if no connection could be obtained
     */
    public C acquire() throws PoolException {
        return acquire(config.getAcquireTimeout());
    }

    /**
     * Borrow a connection, waiting at most {@code timeoutMs} milliseconds.
     * <p>
     * An idle connection is preferred and probed before it is handed out; one that fails its probe is
     * closed and the next one is tried. When nothing is idle and the pool is below its maximum size,
     * a new connection is opened. Otherwise the caller waits until one is returned.
     *
     * @param timeoutMs the maximum time to wait, zero to fail at once
     * @return a raw connection owned by the caller until it is released
     * @throws PoolClosedException        if the pool is shut down
     * @throws PoolTimeoutException       if no connection became available in time
     * @throws ResourceCreationException  if the factory failed to open a new connection
     * @throws PoolException              if the thread was interrupted while waiting
     */
    public C acquire(long timeoutMs) throws PoolException {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs cannot be negative");
        }

        long startTime = ClockSource.currentTime();
        long deadline = ClockSource.plusMillis(startTime, timeoutMs);
        boolean retrying = false;

        while (true) {
            PooledConnection<C> candidate = null;
            List<PooledConnection<C>> staleEntries = new ArrayList<>();

            lock.lock();
            try {
                while (true) {
                    checkOpen();

                    if (retrying && ClockSource.elapsedNanos(deadline) >= 0) {
                        throw createTimeoutException(startTime);
                    }

                    candidate = pollIdle(staleEntries);

                    if (candidate != null) {
                        candidate.state = PooledConnection.State.BORROWED;
                        activeConnections.put(candidate.getConnection(), candidate);
                        break;
                    }

                    if (hasCapacity()) {
                        pendingCreations++;
                        break;
                    }

                    long remainingNanos = -ClockSource.elapsedNanos(deadline);

                    if (remainingNanos <= 0) {
                        throw createTimeoutException(startTime);
                    }

                    awaitConnection(remainingNanos);
                }
            } finally {
                lock.unlock();
                staleEntries.forEach(entry -> metricsTracker.recordConnectionEvicted());
                closeEntries(staleEntries, STALE_CONNECTION_MESSAGE);
            }

            if (candidate == null) {
                return acquireNew(startTime);
            }

            boolean handedOut = false;

            try {
                ProbeResult probe = probeConnection(candidate);

                if (admitProbed(candidate, probe)) {
                    metricsTracker.recordBorrowStats(startTime);
                    handedOut = true;
                    return candidate.getConnection();
                }

                log.debug("{} - Discarding connection {}: {}", poolName, candidate.getConnection(), probe.describe());
                metricsTracker.recordConnectionEvicted();
                quietlyCloseConnection(candidate.getConnection(), DEAD_CONNECTION_MESSAGE);
                retrying = true;
            } finally {
                if (!handedOut) {
                    reclaimCandidate(candidate);
                }
            }
        }
    }

    /**
     * Borrow a connection for use in a try-with-resources block.
     *
     * @return a lease that returns the connection to the pool when closed
     * @throws PoolException if no connection could be obtained
     */
    @Contract(" -> new")
    public @NotNull ConnectionLease<C> lease() throws PoolException {
        return new ConnectionLease<>(this, acquire());
    }

    @Contract("_ -> new")
    public @NotNull ConnectionLease<C> lease(long timeoutMs) throws PoolException {
        return new ConnectionLease<>(this, acquire(timeoutMs));
    }

    /**
     * Return a borrowed connection. Healthy, fresh connections go back to the idle queue, anything
     * else is closed. Releasing a connection this pool does not know, or releasing it twice, is
     * logged and ignored. Never throws.
     *
     * @param connection the raw connection obtained from {@link #acquire()}
     */
    public void release(C connection) {
        if (connection == null) {
            return;
        }

        try {
            PooledConnection<C> entry;
            String closureReason = null;

            lock.lock();
            try {
                entry = activeConnections.remove(connection);

                if (entry == null) {
                    log.debug("{} - Ignoring release of connection {} not borrowed from this pool",
                            poolName, connection);
                    return;
                }

                if (poolState != POOL_NORMAL) {
                    closureReason = SHUTDOWN_MESSAGE;
                } else if (entry.markedEvicted) {
                    closureReason = EVICTED_CONNECTION_MESSAGE;
                } else if (entry.isStale(config.getMaxAge())) {
                    closureReason = STALE_CONNECTION_MESSAGE;
                    staleCleanedCount++;
                }

                if (closureReason == null) {
                    entry.state = PooledConnection.State.IDLE;
                    idleConnections.addLast(entry);
                } else {
                    entry.state = PooledConnection.State.CLOSED;
                    closedCount++;
                }
                connectionAvailable.signal();
            } finally {
                lock.unlock();
            }

            metricsTracker.recordConnectionUsage(entry);

            if (closureReason != null) {
                metricsTracker.recordConnectionEvicted();
                quietlyCloseConnection(connection, closureReason);
            }
        } catch (RuntimeException ex) {
            log.warn("{} - Unexpected failure releasing connection {}", poolName, connection, ex);
        }
    }

    /**
     * Mark a borrowed connection so that it is closed instead of reused when it is released.
     *
     * @param connection a connection currently borrowed from this pool
     * @return false if the connection is not currently borrowed from this pool
     */
    public boolean evictConnection(C connection) {
        lock.lock();
        try {
            PooledConnection<C> entry = activeConnections.get(connection);

            if (entry == null) {
                return false;
            }

            entry.markedEvicted = true;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Shut the pool down: stop the housekeeper, close every idle and borrowed connection and wake
     * every waiting caller. Later calls to {@link #acquire()} fail with {@link PoolClosedException}.
     * Calling this more than once has no further effect.
     */
    public void closeAll() {
        List<PooledConnection<C>> entries;

        lock.lock();
        try {
            if (poolState == POOL_SHUTDOWN) {
                return;
            }

            poolState = POOL_SHUTDOWN;
            logPoolState("Before shutdown ");

            entries = new ArrayList<>(idleConnections);
            entries.addAll(activeConnections.values());
            idleConnections.clear();
            activeConnections.clear();

            for (PooledConnection<C> entry : entries) {
                entry.state = PooledConnection.State.CLOSED;
            }

            closedCount += entries.size();
            connectionAvailable.signalAll();
        } finally {
            lock.unlock();
        }

        try {
            houseKeeperTask.cancel(false);
            destroyHouseKeepingExecutorService();
            closeEntries(entries, SHUTDOWN_MESSAGE);
        } finally {
            logPoolState("After shutdown ");
            handleMBeans(this, false);
            unregisterHealthChecks();
            metricsTracker.close();
            log.info("{} - Shutdown completed.", poolName);
        }
    }

    @Override
    public void close() {
        closeAll();
    }

    /**
     * @return true once {@link #closeAll()} has been called
     */
    public boolean isClosed() {
        return poolState == POOL_SHUTDOWN;
    }

    /**
     * Take a consistent snapshot of the pool's sizes and counters.
     *
     * @return the current statistics
     */
    public @NotNull PoolStats getStats() {
        lock.lock();
        try {
            return new PoolStats(poolName, idleConnections.size(), activeConnections.size(),
                    config.getMaxSize(), config.getMinSize(),
                    new PoolStats.Counters(createdCount, reusedCount, closedCount,
                            errorCount, staleCleanedCount, healthCheckCount));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Set a metrics registry to be used when registering metrics collectors.
     *
     * @param metricRegistry the metrics registry instance to use
     */
    public void setMetricRegistry(Object metricRegistry) {
        if (metricRegistry != null
                && UtilityElf.safeIsAssignableFrom(metricRegistry, "com.codahale.metrics.MetricRegistry")) {
            setMetricsTrackerFactory(new CodahaleMetricsTrackerFactory((MetricRegistry) metricRegistry));

        } else if (metricRegistry != null
                && UtilityElf.safeIsAssignableFrom(metricRegistry, "io.micrometer.core.instrument.MeterRegistry")) {
            setMetricsTrackerFactory(new MicrometerMetricsTrackerFactory((MeterRegistry) metricRegistry));

        } else {
            setMetricsTrackerFactory(null);
        }
    }

    /**
     * Set the MetricsTrackerFactory to be used to create the IMetricsTracker instance used by the pool.
     *
     * @param metricsTrackerFactory an instance of a class that subclasses MetricsTrackerFactory
     */
    public void setMetricsTrackerFactory(MetricsTrackerFactory metricsTrackerFactory) {
        metricsTracker.close();

        if (metricsTrackerFactory != null) {
            metricsTracker = new MetricsTrackerDelegate(metricsTrackerFactory.create(poolName, getPoolGauges()));
        } else {
            metricsTracker = new NopMetricsTrackerDelegate();
        }
    }

    /**
     * Set the health check registry to be used when registering health checks. Currently only Codahale health
     * checks are supported.
     *
     * @param healthCheckRegistry the health check registry instance to use
     */
    public void setHealthCheckRegistry(Object healthCheckRegistry) {
        if (healthCheckRegistry != null) {
            CodahaleHealthChecker.registerHealthChecks(poolName, this::getStats,
                    (HealthCheckRegistry) healthCheckRegistry);
        }
    }

    // ***********************************************************************
    //                        ConnectionPoolMXBean methods
    // ***********************************************************************

    @Override
    public int getActiveConnections() {
        lock.lock();
        try {
            return activeConnections.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getIdleConnections() {
        lock.lock();
        try {
            return idleConnections.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getTotalConnections() {
        lock.lock();
        try {
            return idleConnections.size() + activeConnections.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getThreadsAwaitingConnection() {
        lock.lock();
        try {
            return waitingThreads;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void softEvictConnections() {
        List<PooledConnection<C>> evicted;

        lock.lock();
        try {
            evicted = new ArrayList<>(idleConnections);
            idleConnections.clear();

            for (PooledConnection<C> entry : evicted) {
                entry.state = PooledConnection.State.CLOSED;
            }

            closedCount += evicted.size();
            activeConnections.values().forEach(entry -> entry.markedEvicted = true);
            connectionAvailable.signalAll();
        } finally {
            lock.unlock();
        }

        evicted.forEach(entry -> metricsTracker.recordConnectionEvicted());
        closeEntries(evicted, EVICTED_CONNECTION_MESSAGE);
    }

    /**
     * Log the current pool state at debug level.
     *
     * @param prefix an optional prefix to prepend the log message
     */
    void logPoolState(String... prefix) {
        if (log.isDebugEnabled()) {
            PoolStats stats = getStats();
            log.debug("{} - {}stats (total={}, active={}, idle={}, waiting={})",
                    poolName, (prefix.length > 0 ? prefix[0] : ""), stats.getTotalConnections(),
                    stats.getActiveConnections(), stats.getPoolSize(), getThreadsAwaitingConnection());
        }
    }

    // ***********************************************************************
    //                           Private methods
    // ***********************************************************************

    private void checkOpen() throws PoolClosedException {
        if (poolState != POOL_NORMAL) {
            throw new PoolClosedException(poolName + " - Pool is closed");
        }
    }

    /**
     * Pop the oldest usable idle entry, moving stale ones into {@code staleEntries}. Lock must be held.
     */
    private PooledConnection<C> pollIdle(List<PooledConnection<C>> staleEntries) {
        PooledConnection<C> entry;

        while ((entry = idleConnections.pollFirst()) != null) {
            if (!entry.isStale(config.getMaxAge())) {
                return entry;
            }

            entry.state = PooledConnection.State.CLOSED;
            closedCount++;
            staleCleanedCount++;
            staleEntries.add(entry);
        }
        return null;
    }

    /**
     * Lock must be held.
     */
    private boolean hasCapacity() {
        return idleConnections.size() + activeConnections.size() + pendingCreations < config.getMaxSize();
    }

    /**
     * Park on the condition for at most {@code remainingNanos}. Lock must be held.
     */
    private void awaitConnection(long remainingNanos) throws PoolException {
        waitingThreads++;

        try {
            connectionAvailable.awaitNanos(remainingNanos);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            waitingThreads--;
            passSignalOn();
            throw new PoolException(poolName + " - Interrupted while waiting for a connection", ex);
        }

        waitingThreads--;
    }

    /**
     * A waiter leaving without taking what it was woken for hands the wake-up to another waiter.
     * Lock must be held.
     */
    private void passSignalOn() {
        if (waitingThreads > 0 && (!idleConnections.isEmpty() || hasCapacity())) {
            connectionAvailable.signal();
        }
    }

    /**
     * Open a connection on a slot reserved by the caller and hand it out.
     */
    private C acquireNew(long startTime) throws PoolException {
        PooledConnection<C> entry = newEntryOnReservedSlot();
        boolean admitted;

        lock.lock();
        try {
            pendingCreations--;
            admitted = poolState == POOL_NORMAL;

            if (admitted) {
                entry.markUsed();
                entry.state = PooledConnection.State.BORROWED;
                activeConnections.put(entry.getConnection(), entry);
                createdCount++;
            } else {
                entry.state = PooledConnection.State.CLOSED;
            }
        } finally {
            lock.unlock();
        }

        if (!admitted) {
            quietlyCloseConnection(entry.getConnection(), SHUTDOWN_MESSAGE);
            throw new PoolClosedException(poolName + " - Pool was closed while opening a connection");
        }

        metricsTracker.recordBorrowStats(startTime);
        log.debug("{} - Opened connection {}", poolName, entry.getConnection());
        return entry.getConnection();
    }

    /**
     * Call the factory on a slot reserved by the caller. On failure the reservation is given back,
     * the failure is counted and one waiter is woken.
     */
    private PooledConnection<C> newEntryOnReservedSlot() throws ResourceCreationException {
        PooledConnection<C> entry = null;

        try {
            entry = newPooledConnection();
            return entry;
        } finally {
            if (entry == null) {
                lock.lock();
                try {
                    pendingCreations--;
                    errorCount++;
                    connectionAvailable.signal();
                } finally {
                    lock.unlock();
                }
            }
        }
    }

    /**
     * Finish handing out a probed idle entry.
     *
     * @return true if the entry now belongs to the caller, false if it must be closed
     */
    private boolean admitProbed(PooledConnection<C> candidate, ProbeResult probe) throws PoolClosedException {
        lock.lock();
        try {
            healthCheckCount++;

            if (activeConnections.get(candidate.getConnection()) != candidate) {
                // drained by closeAll() while the probe ran, and closed there
                throw new PoolClosedException(poolName + " - Pool was closed while validating a connection");
            }

            if (probe.isHealthy() && !candidate.markedEvicted) {
                candidate.markUsed();
                reusedCount++;
                return true;
            }

            candidate.state = PooledConnection.State.CLOSED;
            activeConnections.remove(candidate.getConnection());
            closedCount++;
            connectionAvailable.signal();
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take back a candidate that could not be handed out, for instance because its probe threw an
     * {@link Error}. Does nothing if the candidate already left the active map.
     */
    private void reclaimCandidate(PooledConnection<C> candidate) {
        boolean owned;

        lock.lock();
        try {
            owned = activeConnections.get(candidate.getConnection()) == candidate;

            if (owned) {
                activeConnections.remove(candidate.getConnection());
                candidate.state = PooledConnection.State.CLOSED;
                closedCount++;
                connectionAvailable.signal();
            }
        } finally {
            lock.unlock();
        }

        if (owned) {
            quietlyCloseConnection(candidate.getConnection(), DEAD_CONNECTION_MESSAGE);
        }
    }

    private void closeEntries(@NotNull List<PooledConnection<C>> entries, String closureReason) {
        for (PooledConnection<C> entry : entries) {
            quietlyCloseConnection(entry.getConnection(), closureReason);
        }
    }

    /**
     * Open connections until idle + active reaches {@code minSize}, one at a time. Stops at the first
     * factory failure, which is logged and counted.
     */
    private void fillPool() {
        while (true) {
            lock.lock();
            try {
                if (poolState != POOL_NORMAL
                        || idleConnections.size() + activeConnections.size() + pendingCreations >= config.getMinSize()) {
                    return;
                }
                pendingCreations++;
            } finally {
                lock.unlock();
            }

            PooledConnection<C> entry;

            try {
                entry = newEntryOnReservedSlot();
            } catch (ResourceCreationException ex) {
                log.warn("{} - Failed to open connection while filling pool: {}", poolName, ex.getMessage());
                return;
            }

            boolean added;

            lock.lock();
            try {
                pendingCreations--;
                added = poolState == POOL_NORMAL;

                if (added) {
                    idleConnections.addLast(entry);
                    createdCount++;
                    connectionAvailable.signal();
                } else {
                    entry.state = PooledConnection.State.CLOSED;
                }
            } finally {
                lock.unlock();
            }

            if (!added) {
                quietlyCloseConnection(entry.getConnection(), SHUTDOWN_MESSAGE);
                return;
            }

            log.debug("{} - Added connection {}", poolName, entry.getConnection());
        }
    }

    private void evictStaleConnections() {
        List<PooledConnection<C>> staleEntries = new ArrayList<>();

        lock.lock();
        try {
            Iterator<PooledConnection<C>> iterator = idleConnections.iterator();

            while (iterator.hasNext()) {
                PooledConnection<C> entry = iterator.next();

                if (entry.isStale(config.getMaxAge())) {
                    iterator.remove();
                    entry.state = PooledConnection.State.CLOSED;
                    staleEntries.add(entry);
                }
            }

            closedCount += staleEntries.size();
            staleCleanedCount += staleEntries.size();
        } finally {
            lock.unlock();
        }

        if (!staleEntries.isEmpty()) {
            staleEntries.forEach(entry -> metricsTracker.recordConnectionEvicted());
            closeEntries(staleEntries, STALE_CONNECTION_MESSAGE);
            log.info("{} - Cleaned up {} stale connections", poolName, staleEntries.size());
        }
    }

    /**
     * Create/initialize the Housekeeping service {@link ScheduledExecutorService}. If the user specified an
     * Executor to be used in the {@link PoolConfig}, then we use that. If no Executor was specified (typical),
     * then create an Executor and configure it.
     *
     * @return either the user specified {@link ScheduledExecutorService}, or the one we created
     */
    private ScheduledExecutorService initializeHouseKeepingExecutorService() {
        if (config.getScheduledExecutor() == null) {
            return UtilityElf.createHousekeepingExecutor(poolName + ":housekeeper", config.getThreadFactory());
        }
        return config.getScheduledExecutor();
    }

    /**
     * Shut down the housekeeping executor and wait for a running task to finish, if it was the one
     * that we created.
     */
    private void destroyHouseKeepingExecutorService() {
        if (config.getScheduledExecutor() != null) {
            return;
        }

        houseKeepingExecutorService.shutdownNow();

        try {
            if (!houseKeepingExecutorService.awaitTermination(HOUSEKEEPER_TERMINATION_SECONDS, TimeUnit.SECONDS)) {
                log.warn("{} - Housekeeper did not terminate within {}s", poolName, HOUSEKEEPER_TERMINATION_SECONDS);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("{} - Interrupted while waiting for the housekeeper to terminate", poolName);
        }
    }

    private void unregisterHealthChecks() {
        Object registry = config.getHealthCheckRegistry();

        if (registry != null) {
            CodahaleHealthChecker.unregisterHealthChecks(poolName, (HealthCheckRegistry) registry);
        }
    }

    /**
     * Create a PoolGauges instance that will be used by metrics tracking, with a pollable resolution of 1 second.
     *
     * @return a PoolGauges instance
     */
    @Contract(" -> new")
    private @NotNull PoolGauges getPoolGauges() {
        return new PoolGauges(TimeUnit.SECONDS.toMillis(1)) {
            @Override
            protected void update() {
                PoolStats stats = getStats();
                pendingThreads = getThreadsAwaitingConnection();
                idleConnections = stats.getPoolSize();
                activeConnections = stats.getActiveConnections();
                totalConnections = stats.getTotalConnections();
                maxConnections = stats.getTotalCapacity();
                minConnections = stats.getMinSize();
            }
        };
    }

    /**
     * Create the exception thrown when no connection became available before the deadline. The last
     * factory failure, if any, becomes its cause. Lock must be held.
     *
     * @param startTime the start time (timestamp) of the acquisition attempt
     * @return the exception to throw
     */
    private @NotNull PoolTimeoutException createTimeoutException(long startTime) {
        passSignalOn();
        metricsTracker.recordBorrowTimeoutStats(startTime);
        metricsTracker.recordConnectionTimeout();

        PoolTimeoutException ex = new PoolTimeoutException(poolName
                + " - Connection is not available, request timed out after " + ClockSource.elapsedMillis(startTime) + "ms"
                + " (total=" + (idleConnections.size() + activeConnections.size())
                + ", active=" + activeConnections.size()
                + ", idle=" + idleConnections.size()
                + ", waiting=" + waitingThreads + ")",
                lastConnectionFailure.get());

        log.debug("{}", ex.getMessage());
        return ex;
    }

    // ***********************************************************************
    //                      Non-anonymous Inner-classes
    // ***********************************************************************

    /**
     * The house keeping task to retire stale idle connections and keep the minimum number of
     * connections open.
     */
    private final class HouseKeeper implements Runnable {

        @Override
        public void run() {
            try {
                logPoolState("Before cleanup ");
                evictStaleConnections();
                fillPool();
                logPoolState("After cleanup  ");
            } catch (RuntimeException ex) {
                log.error("{} - Unexpected exception in housekeeping task", poolName, ex);
            }
        }
    }
}
