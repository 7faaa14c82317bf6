package com.ombudsman.connpool.metrics.micrometer;

import com.ombudsman.connpool.metrics.IMetricsTracker;
import com.ombudsman.connpool.metrics.MetricsTrackerFactory;
import com.ombudsman.connpool.metrics.PoolGauges;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class MicrometerMetricsTrackerFactory implements MetricsTrackerFactory {

    private final MeterRegistry registry;

    @Override
    public IMetricsTracker create(String poolName, PoolGauges poolGauges) {
        return new MicrometerMetricsTracker(poolName, poolGauges, registry);
    }
}
