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
package com.ombudsman.connpool.metrics.prometheus;

import com.ombudsman.connpool.metrics.IMetricsTracker;
import com.ombudsman.connpool.metrics.MetricsTrackerFactory;
import com.ombudsman.connpool.metrics.PoolGauges;
import io.prometheus.client.Collector;
import io.prometheus.client.CollectorRegistry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * <pre>{@code
 * PoolConfig config = new PoolConfig();
 * config.setMetricsTrackerFactory(new PrometheusMetricsTrackerFactory());
 * }</pre>
 * or
 * <pre>{@code
 * config.setMetricsTrackerFactory(new PrometheusMetricsTrackerFactory(new CollectorRegistry()));
 * }</pre>
 */
@SuppressWarnings("unused")
public class PrometheusMetricsTrackerFactory implements MetricsTrackerFactory {

    private static final Map<CollectorRegistry, RegistrationStatus> registrationStatuses = new ConcurrentHashMap<>();

    private static final PoolGaugesCollector COLLECTOR = new PoolGaugesCollector();

    private final CollectorRegistry collectorRegistry;

    enum RegistrationStatus {
        REGISTERED
    }

    /**
     * Default Constructor. The pool metrics are registered to the default
     * collector registry ({@code CollectorRegistry.defaultRegistry}).
     */
    public PrometheusMetricsTrackerFactory() {
        this(CollectorRegistry.defaultRegistry);
    }

    /**
     * Constructor that allows to pass in a {@link CollectorRegistry} to which the
     * pool metrics are registered.
     */
    public PrometheusMetricsTrackerFactory(CollectorRegistry collectorRegistry) {
        this.collectorRegistry = collectorRegistry;
    }

    @Override
    public IMetricsTracker create(String poolName, PoolGauges poolGauges) {
        registerCollector(COLLECTOR, collectorRegistry);
        COLLECTOR.add(poolName, poolGauges);
        return new PrometheusMetricsTracker(poolName, collectorRegistry, COLLECTOR);
    }

    private static void registerCollector(Collector collector, CollectorRegistry collectorRegistry) {
        if (registrationStatuses.putIfAbsent(collectorRegistry, RegistrationStatus.REGISTERED) == null) {
            collector.register(collectorRegistry);
        }
    }
}
