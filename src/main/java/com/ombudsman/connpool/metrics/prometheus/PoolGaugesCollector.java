package com.ombudsman.connpool.metrics.prometheus;

import com.ombudsman.connpool.metrics.PoolGauges;
import io.prometheus.client.Collector;
import io.prometheus.client.GaugeMetricFamily;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.ToIntFunction;

class PoolGaugesCollector extends Collector {

    private static final List<String> LABEL_NAMES = Collections.singletonList("pool");

    private final Map<String, PoolGauges> poolGaugesMap = new ConcurrentHashMap<>();

    @Override
    public List<MetricFamilySamples> collect() {
        return Arrays.asList(
                createGauge("ombudsman_pool_active_connections", "Active connections", PoolGauges::getActiveConnections),
                createGauge("ombudsman_pool_idle_connections", "Idle connections", PoolGauges::getIdleConnections),
                createGauge("ombudsman_pool_pending_threads", "Pending threads", PoolGauges::getPendingThreads),
                createGauge("ombudsman_pool_connections", "The number of current connections", PoolGauges::getTotalConnections),
                createGauge("ombudsman_pool_max_connections", "Max connections", PoolGauges::getMaxConnections),
                createGauge("ombudsman_pool_min_connections", "Min connections", PoolGauges::getMinConnections)
        );
    }

    void add(String name, PoolGauges poolGauges) {
        poolGaugesMap.put(name, poolGauges);
    }

    void remove(String name) {
        poolGaugesMap.remove(name);
    }

    private @NotNull GaugeMetricFamily createGauge(String metric, String help,
                                                   ToIntFunction<PoolGauges> metricValueFunction) {
        GaugeMetricFamily metricFamily = new GaugeMetricFamily(metric, help, LABEL_NAMES);

        poolGaugesMap.forEach((name, gauges) -> metricFamily.addMetric(
                Collections.singletonList(name),
                metricValueFunction.applyAsInt(gauges)
        ));
        return metricFamily;
    }
}
