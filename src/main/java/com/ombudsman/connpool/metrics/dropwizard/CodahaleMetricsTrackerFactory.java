package com.ombudsman.connpool.metrics.dropwizard;

import com.codahale.metrics.MetricRegistry;
import com.ombudsman.connpool.metrics.IMetricsTracker;
import com.ombudsman.connpool.metrics.MetricsTrackerFactory;
import com.ombudsman.connpool.metrics.PoolGauges;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

@Getter
@AllArgsConstructor
public final class CodahaleMetricsTrackerFactory implements MetricsTrackerFactory {

    private final MetricRegistry registry;

    @Override
    @Contract("_, _ -> new")
    public @NotNull IMetricsTracker create(String poolName, PoolGauges poolGauges) {
        return new CodaHaleMetricsTracker(poolName, poolGauges, registry);
    }
}
