package com.ombudsman.connpool.metrics.prometheus;

import com.ombudsman.connpool.metrics.IMetricsTracker;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Summary;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records pool events into Prometheus counters and summaries labelled with the pool name.
 * The collectors are shared by every pool and registered once per {@link CollectorRegistry}.
 */
class PrometheusMetricsTracker implements IMetricsTracker {

    private static final Counter CONNECTION_TIMEOUT_COUNTER = Counter.build()
            .name("ombudsman_pool_connection_timeout_total")
            .labelNames("pool")
            .help("Connection timeout total count")
            .create();

    private static final Counter CONNECTION_EVICTED_COUNTER = Counter.build()
            .name("ombudsman_pool_connection_evicted_total")
            .labelNames("pool")
            .help("Connections closed as stale, unhealthy or evicted")
            .create();

    private static final Summary ELAPSED_ACQUIRED_SUMMARY = createSummary(
            "ombudsman_pool_connection_acquired_nanos", "Connection acquired time (ns)");

    private static final Summary ELAPSED_USAGE_SUMMARY = createSummary(
            "ombudsman_pool_connection_usage_millis", "Connection usage (ms)");

    private static final Summary ELAPSED_CREATION_SUMMARY = createSummary(
            "ombudsman_pool_connection_creation_millis", "Connection creation (ms)");

    private static final Map<CollectorRegistry, Boolean> registered = new ConcurrentHashMap<>();

    private final String poolName;
    private final PoolGaugesCollector collector;

    private final Counter.Child connectionTimeoutCounterChild;
    private final Counter.Child connectionEvictedCounterChild;
    private final Summary.Child elapsedAcquiredSummaryChild;
    private final Summary.Child elapsedUsageSummaryChild;
    private final Summary.Child elapsedCreationSummaryChild;

    PrometheusMetricsTracker(String poolName, CollectorRegistry collectorRegistry, PoolGaugesCollector collector) {
        registerMetrics(collectorRegistry);
        this.poolName = poolName;
        this.collector = collector;

        connectionTimeoutCounterChild = CONNECTION_TIMEOUT_COUNTER.labels(poolName);
        connectionEvictedCounterChild = CONNECTION_EVICTED_COUNTER.labels(poolName);
        elapsedAcquiredSummaryChild = ELAPSED_ACQUIRED_SUMMARY.labels(poolName);
        elapsedUsageSummaryChild = ELAPSED_USAGE_SUMMARY.labels(poolName);
        elapsedCreationSummaryChild = ELAPSED_CREATION_SUMMARY.labels(poolName);
    }

    private static Summary createSummary(String name, String help) {
        return Summary.build()
                .name(name)
                .labelNames("pool")
                .help(help)
                .quantile(0.5, 0.05)
                .quantile(0.95, 0.01)
                .quantile(0.99, 0.001)
                .maxAgeSeconds(300)
                .ageBuckets(5)
                .create();
    }

    private static void registerMetrics(CollectorRegistry registry) {
        if (registered.putIfAbsent(registry, Boolean.TRUE) == null) {
            CONNECTION_TIMEOUT_COUNTER.register(registry);
            CONNECTION_EVICTED_COUNTER.register(registry);
            ELAPSED_ACQUIRED_SUMMARY.register(registry);
            ELAPSED_USAGE_SUMMARY.register(registry);
            ELAPSED_CREATION_SUMMARY.register(registry);
        }
    }

    @Override
    public void recordConnectionAcquiredNanos(long elapsedAcquiredNanos) {
        elapsedAcquiredSummaryChild.observe(elapsedAcquiredNanos);
    }

    @Override
    public void recordConnectionUsageMillis(long elapsedBorrowedMillis) {
        elapsedUsageSummaryChild.observe(elapsedBorrowedMillis);
    }

    @Override
    public void recordConnectionCreatedMillis(long connectionCreatedMillis) {
        elapsedCreationSummaryChild.observe(connectionCreatedMillis);
    }

    @Override
    public void recordConnectionTimeout() {
        connectionTimeoutCounterChild.inc();
    }

    @Override
    public void recordConnectionEvicted() {
        connectionEvictedCounterChild.inc();
    }

    @Override
    public void close() {
        collector.remove(poolName);
        CONNECTION_TIMEOUT_COUNTER.remove(poolName);
        CONNECTION_EVICTED_COUNTER.remove(poolName);
        ELAPSED_ACQUIRED_SUMMARY.remove(poolName);
        ELAPSED_USAGE_SUMMARY.remove(poolName);
        ELAPSED_CREATION_SUMMARY.remove(poolName);
    }
}
