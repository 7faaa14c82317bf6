package com.ombudsman.connpool.metrics.micrometer;

import com.ombudsman.connpool.metrics.IMetricsTracker;
import com.ombudsman.connpool.metrics.PoolGauges;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.ToDoubleFunction;

/**
 * {@link IMetricsTracker Metrics tracker} for Micrometer. Every meter is named under
 * {@link #METRIC_NAME_PREFIX} and tagged with the pool name, so a
 * {@link io.micrometer.core.instrument.config.MeterFilter MeterFilter} on that prefix configures all of them.
 */
@Getter
public class MicrometerMetricsTracker implements IMetricsTracker {

    public static final String METRIC_NAME_PREFIX = "ombudsman.pool";

    private static final String METRIC_CATEGORY = "pool";
    private static final String METRIC_NAME_WAIT = METRIC_NAME_PREFIX + ".connections.acquire";
    private static final String METRIC_NAME_USAGE = METRIC_NAME_PREFIX + ".connections.usage";
    private static final String METRIC_NAME_CONNECT = METRIC_NAME_PREFIX + ".connections.creation";
    private static final String METRIC_NAME_TIMEOUT_RATE = METRIC_NAME_PREFIX + ".connections.timeout";
    private static final String METRIC_NAME_EVICTED = METRIC_NAME_PREFIX + ".connections.evicted";

    private final Timer connectionObtainTimer;
    private final Counter connectionTimeoutCounter;
    private final Counter connectionEvictedCounter;
    private final Timer connectionUsage;
    private final Timer connectionCreation;
    private final List<Gauge> gauges;
    private final MeterRegistry meterRegistry;

    // gauges only hold a weak reference to their source
    private final PoolGauges poolGauges;

    MicrometerMetricsTracker(String poolName, PoolGauges poolGauges, MeterRegistry meterRegistry) {
        this.poolGauges = poolGauges;
        this.meterRegistry = meterRegistry;

        connectionObtainTimer = Timer.builder(METRIC_NAME_WAIT)
                .description("Connection acquire time")
                .tags(METRIC_CATEGORY, poolName)
                .register(meterRegistry);

        connectionCreation = Timer.builder(METRIC_NAME_CONNECT)
                .description("Connection creation time")
                .tags(METRIC_CATEGORY, poolName)
                .register(meterRegistry);

        connectionUsage = Timer.builder(METRIC_NAME_USAGE)
                .description("Connection usage time")
                .tags(METRIC_CATEGORY, poolName)
                .register(meterRegistry);

        connectionTimeoutCounter = Counter.builder(METRIC_NAME_TIMEOUT_RATE)
                .description("Connection timeout total count")
                .tags(METRIC_CATEGORY, poolName)
                .register(meterRegistry);

        connectionEvictedCounter = Counter.builder(METRIC_NAME_EVICTED)
                .description("Connections closed as stale, unhealthy or evicted")
                .tags(METRIC_CATEGORY, poolName)
                .register(meterRegistry);

        gauges = Arrays.asList(
                gauge(poolName, "", "Total connections", PoolGauges::getTotalConnections),
                gauge(poolName, ".idle", "Idle connections", PoolGauges::getIdleConnections),
                gauge(poolName, ".active", "Active connections", PoolGauges::getActiveConnections),
                gauge(poolName, ".pending", "Pending threads", PoolGauges::getPendingThreads),
                gauge(poolName, ".max", "Max connections", PoolGauges::getMaxConnections),
                gauge(poolName, ".min", "Min connections", PoolGauges::getMinConnections));
    }

    private Gauge gauge(String poolName, String suffix, String description, ToDoubleFunction<PoolGauges> value) {
        return Gauge.builder(METRIC_NAME_PREFIX + ".connections" + suffix, poolGauges, value)
                .description(description)
                .tags(METRIC_CATEGORY, poolName)
                .register(meterRegistry);
    }

    @Override
    public void recordConnectionAcquiredNanos(long elapsedAcquiredNanos) {
        connectionObtainTimer.record(elapsedAcquiredNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void recordConnectionUsageMillis(long elapsedBorrowedMillis) {
        connectionUsage.record(elapsedBorrowedMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordConnectionTimeout() {
        connectionTimeoutCounter.increment();
    }

    @Override
    public void recordConnectionEvicted() {
        connectionEvictedCounter.increment();
    }

    @Override
    public void recordConnectionCreatedMillis(long connectionCreatedMillis) {
        connectionCreation.record(connectionCreatedMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        for (Meter meter : Arrays.<Meter>asList(connectionObtainTimer, connectionTimeoutCounter,
                connectionEvictedCounter, connectionUsage, connectionCreation)) {
            meterRegistry.remove(meter);
        }
        gauges.forEach(meterRegistry::remove);
    }
}
