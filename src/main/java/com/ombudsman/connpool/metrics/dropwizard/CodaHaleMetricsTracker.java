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
package com.ombudsman.connpool.metrics.dropwizard;

import com.codahale.metrics.*;
import com.ombudsman.connpool.metrics.IMetricsTracker;
import com.ombudsman.connpool.metrics.PoolGauges;
import lombok.Getter;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.TimeUnit;

@Getter
public final class CodaHaleMetricsTracker implements IMetricsTracker {

    private static final String METRIC_CATEGORY = "pool";
    private static final String METRIC_NAME_WAIT = "Wait";
    private static final String METRIC_NAME_USAGE = "Usage";
    private static final String METRIC_NAME_CONNECT = "ConnectionCreation";
    private static final String METRIC_NAME_TIMEOUT_RATE = "ConnectionTimeoutRate";
    private static final String METRIC_NAME_EVICTION_RATE = "ConnectionEvictionRate";
    private static final String METRIC_NAME_TOTAL_CONNECTIONS = "TotalConnections";
    private static final String METRIC_NAME_IDLE_CONNECTIONS = "IdleConnections";
    private static final String METRIC_NAME_ACTIVE_CONNECTIONS = "ActiveConnections";
    private static final String METRIC_NAME_PENDING_CONNECTIONS = "PendingConnections";
    private static final String METRIC_NAME_MAX_CONNECTIONS = "MaxConnections";
    private static final String METRIC_NAME_MIN_CONNECTIONS = "MinConnections";

    private static final String[] ALL_METRIC_NAMES = {METRIC_NAME_WAIT, METRIC_NAME_USAGE, METRIC_NAME_CONNECT,
            METRIC_NAME_TIMEOUT_RATE, METRIC_NAME_EVICTION_RATE, METRIC_NAME_TOTAL_CONNECTIONS,
            METRIC_NAME_IDLE_CONNECTIONS, METRIC_NAME_ACTIVE_CONNECTIONS, METRIC_NAME_PENDING_CONNECTIONS,
            METRIC_NAME_MAX_CONNECTIONS, METRIC_NAME_MIN_CONNECTIONS};

    private final String poolName;
    private final Timer connectionAcquisitionTimer;
    private final Histogram connectionDurationHistogram;
    private final Histogram connectionCreationHistogram;
    private final Meter connectionTimeoutMeter;
    private final Meter connectionEvictionMeter;
    private final MetricRegistry registry;

    CodaHaleMetricsTracker(String poolName,
                           @NotNull PoolGauges poolGauges,
                           @NotNull MetricRegistry registry) {
        this.poolName = poolName;
        this.registry = registry;

        connectionAcquisitionTimer = registry.timer(metricName(METRIC_NAME_WAIT));
        connectionDurationHistogram = registry.histogram(metricName(METRIC_NAME_USAGE));
        connectionCreationHistogram = registry.histogram(metricName(METRIC_NAME_CONNECT));
        connectionTimeoutMeter = registry.meter(metricName(METRIC_NAME_TIMEOUT_RATE));
        connectionEvictionMeter = registry.meter(metricName(METRIC_NAME_EVICTION_RATE));

        registry.register(metricName(METRIC_NAME_TOTAL_CONNECTIONS),
                (Gauge<Integer>) poolGauges::getTotalConnections);

        registry.register(metricName(METRIC_NAME_IDLE_CONNECTIONS),
                (Gauge<Integer>) poolGauges::getIdleConnections);

        registry.register(metricName(METRIC_NAME_ACTIVE_CONNECTIONS),
                (Gauge<Integer>) poolGauges::getActiveConnections);

        registry.register(metricName(METRIC_NAME_PENDING_CONNECTIONS),
                (Gauge<Integer>) poolGauges::getPendingThreads);

        registry.register(metricName(METRIC_NAME_MAX_CONNECTIONS),
                (Gauge<Integer>) poolGauges::getMaxConnections);

        registry.register(metricName(METRIC_NAME_MIN_CONNECTIONS),
                (Gauge<Integer>) poolGauges::getMinConnections);
    }

    @Override
    public void close() {
        for (String name : ALL_METRIC_NAMES) {
            registry.remove(metricName(name));
        }
    }

    @Override
    public void recordConnectionAcquiredNanos(long elapsedAcquiredNanos) {
        connectionAcquisitionTimer.update(elapsedAcquiredNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void recordConnectionUsageMillis(long elapsedBorrowedMillis) {
        connectionDurationHistogram.update(elapsedBorrowedMillis);
    }

    @Override
    public void recordConnectionTimeout() {
        connectionTimeoutMeter.mark();
    }

    @Override
    public void recordConnectionEvicted() {
        connectionEvictionMeter.mark();
    }

    @Override
    public void recordConnectionCreatedMillis(long connectionCreatedMillis) {
        connectionCreationHistogram.update(connectionCreatedMillis);
    }

    private String metricName(String name) {
        return MetricRegistry.name(poolName, METRIC_CATEGORY, name);
    }
}
