package com.ombudsman.connpool;

import lombok.Value;
import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * Health summary over every pool of a {@link ConnectionPoolManager}.
 */
@Value
public class PoolHealthReport {

    PoolHealthStatus overallStatus;
    Map<String, PoolHealthStatus> pools;
    List<String> warnings;

    public static @NotNull PoolHealthReport from(@NotNull Map<String, PoolStats> allStats) {
        Map<String, PoolHealthStatus> statuses = new TreeMap<>();
        List<String> warnings = new ArrayList<>();
        int healthy = 0;

        for (Map.Entry<String, PoolStats> entry : allStats.entrySet()) {
            String name = entry.getKey();
            PoolStats stats = entry.getValue();
            PoolHealthStatus status = PoolHealthStatus.of(stats);
            statuses.put(name, status);

            if (status == PoolHealthStatus.HEALTHY) {
                healthy++;
            } else {
                warnings.add(String.format("Pool %s is %s (utilization %.1f%%, %d errors)",
                        name, status, stats.getUtilization(), stats.getCounters().getErrors()));
            }

            if (stats.getPoolSize() < stats.getMinSize()) {
                warnings.add(String.format("Pool %s has %d idle connections, below its minimum of %d",
                        name, stats.getPoolSize(), stats.getMinSize()));
            }
        }

        PoolHealthStatus overall;
        if (healthy == statuses.size()) {
            overall = PoolHealthStatus.HEALTHY;
        } else if (healthy > 0) {
            overall = PoolHealthStatus.DEGRADED;
        } else {
            overall = PoolHealthStatus.UNHEALTHY;
        }

        return new PoolHealthReport(overall, Collections.unmodifiableMap(statuses),
                Collections.unmodifiableList(warnings));
    }
}
