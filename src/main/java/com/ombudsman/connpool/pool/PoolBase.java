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

import com.ombudsman.connpool.ConnectionFactory;
import com.ombudsman.connpool.PoolConfig;
import com.ombudsman.connpool.RawConnection;
import com.ombudsman.connpool.ResourceCreationException;
import com.ombudsman.connpool.metrics.IMetricsTracker;
import com.ombudsman.connpool.util.ClockSource;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import javax.management.*;
import java.lang.management.ManagementFactory;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The resource-facing half of a pool: opening connections through the factory, probing and
 * closing them, JMX registration and metrics delegation. Nothing here touches pool state.
 *
 * @param <C> the raw connection type
 */
@Slf4j
@Getter
@ToString(onlyExplicitlyIncluded = true)
abstract class PoolBase<C extends RawConnection> {

    final PoolConfig config;
    final ConnectionFactory<C> connectionFactory;
    final AtomicReference<Exception> lastConnectionFailure;
    IMetricsTrackerDelegate metricsTracker;

    @ToString.Include
    protected final String poolName;

    PoolBase(@NotNull PoolConfig config, @NotNull ConnectionFactory<C> connectionFactory) {
        this.config = config;
        this.connectionFactory = connectionFactory;
        poolName = config.getPoolName();
        lastConnectionFailure = new AtomicReference<>();
        metricsTracker = new NopMetricsTrackerDelegate();
    }

    /**
     * Open a new connection through the factory. Never called with the pool lock held.
     *
     * @return a new entry in state IDLE
     * @throws ResourceCreationException if the factory failed or returned null
     */
    PooledConnection<C> newPooledConnection() throws ResourceCreationException {
        long start = ClockSource.currentTime();
        C connection;

        try {
            connection = connectionFactory.create();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            lastConnectionFailure.set(ex);
            throw new ResourceCreationException(poolName + " - Interrupted while opening a connection", ex);
        } catch (Exception ex) {
            lastConnectionFailure.set(ex);
            log.debug("{} - Cannot acquire connection from factory", poolName, ex);
            throw new ResourceCreationException(poolName + " - Failed to open a connection: " + ex.getMessage(), ex);
        }

        if (connection == null) {
            ResourceCreationException ex = new ResourceCreationException(poolName + " - Connection factory returned null");
            lastConnectionFailure.set(ex);
            throw ex;
        }

        metricsTracker.recordConnectionCreated(ClockSource.elapsedMillis(start));
        return new PooledConnection<>(connection, poolName);
    }

    /**
     * Run the connection's health probe. Never called with the pool lock held.
     */
    ProbeResult probeConnection(@NotNull PooledConnection<C> entry) {
        try {
            return entry.getConnection().healthProbe() ? ProbeResult.healthy() : ProbeResult.unhealthy();
        } catch (Exception ex) {
            if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return ProbeResult.failed(ex);
        }
    }

    void quietlyCloseConnection(C connection, String closureReason) {
        if (connection == null) {
            return;
        }

        log.debug("{} - Closing connection {}: {}", poolName, connection, closureReason);

        try {
            connection.close();
        } catch (RuntimeException ex) {
            log.debug("{} - Closing connection {} failed", poolName, connection, ex);
        }
    }

    /**
     * Register or unregister the MBean of a pool.
     *
     * @param pool a ConnectionPool instance
     */
    void handleMBeans(ConnectionPool<C> pool, boolean register) {
        if (!config.isRegisterMbeans()) {
            return;
        }

        try {
            MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
            ObjectName beanPoolName = new ObjectName("com.ombudsman.connpool:type=Pool (" + poolName + ")");

            if (register) {
                if (mBeanServer.isRegistered(beanPoolName)) {
                    log.error("{} - JMX name ({}) is already registered.", poolName, poolName);
                } else {
                    mBeanServer.registerMBean(pool, beanPoolName);
                }
            } else if (mBeanServer.isRegistered(beanPoolName)) {
                mBeanServer.unregisterMBean(beanPoolName);
            }
        } catch (InstanceAlreadyExistsException | InstanceNotFoundException | MBeanRegistrationException
                 | MalformedObjectNameException | NotCompliantMBeanException ex) {
            log.warn("{} - Failed to {} management beans.", poolName, (register ? "register" : "unregister"), ex);
        }
    }

    interface IMetricsTrackerDelegate extends AutoCloseable {

        default void recordConnectionUsage(PooledConnection<?> entry) {
        }

        default void recordConnectionCreated(long connectionCreatedMillis) {
        }

        default void recordBorrowTimeoutStats(long startTime) {
        }

        default void recordBorrowStats(long startTime) {
        }

        default void recordConnectionTimeout() {
        }

        default void recordConnectionEvicted() {
        }

        @Override
        default void close() {
        }
    }

    /**
     * A class that delegates to a MetricsTracker implementation. The use of a delegate
     * allows us to use the NopMetricsTrackerDelegate when metrics are disabled.
     */
    @AllArgsConstructor
    static class MetricsTrackerDelegate implements IMetricsTrackerDelegate {

        final IMetricsTracker tracker;

        @Override
        public void recordConnectionUsage(@NotNull PooledConnection<?> entry) {
            tracker.recordConnectionUsageMillis(entry.getMillisSinceBorrowed());
        }

        @Override
        public void recordConnectionCreated(long connectionCreatedMillis) {
            tracker.recordConnectionCreatedMillis(connectionCreatedMillis);
        }

        @Override
        public void recordBorrowTimeoutStats(long startTime) {
            tracker.recordConnectionAcquiredNanos(ClockSource.elapsedNanos(startTime));
        }

        @Override
        public void recordBorrowStats(long startTime) {
            tracker.recordConnectionAcquiredNanos(ClockSource.elapsedNanos(startTime));
        }

        @Override
        public void recordConnectionTimeout() {
            tracker.recordConnectionTimeout();
        }

        @Override
        public void recordConnectionEvicted() {
            tracker.recordConnectionEvicted();
        }

        @Override
        public void close() {
            tracker.close();
        }
    }

    /**
     * A no-op implementation of the IMetricsTrackerDelegate that is used when metrics capture is
     * disabled.
     */
    @NoArgsConstructor
    static final class NopMetricsTrackerDelegate implements IMetricsTrackerDelegate {

    }
}
