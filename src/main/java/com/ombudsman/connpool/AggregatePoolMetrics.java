package com.ombudsman.connpool;

import lombok.Value;
import org.jetbrains.annotations.NotNull;

import java.util.Map;

/**
 * Totals across every pool of a {@link ConnectionPoolManager}.
 */
@Value
public class AggregatePoolMetrics {

    int poolCount;
    int totalConnections;
    int activeConnections;
    int idleConnections;
    int totalCapacity;
    double averageUtilization;
    long totalCreated;
    long totalReused;
    long totalClosed;
    long totalErrors;

    /**
     * @return reused acquisitions per created connection, as a percentage; 0 when nothing was created
     */
    public double getReuseRatio() {
        return totalCreated > 0 ? totalReused * 100.0 / totalCreated : 0.0;
    }

    public static @NotNull AggregatePoolMetrics from(@NotNull Map<String, PoolStats> allStats) {
        int active = 0;
        int idle = 0;
        int capacity = 0;
        double utilization = 0.0;
        long created = 0;
        long reused = 0;
        long closed = 0;
        long errors = 0;

        for (PoolStats stats : allStats.values()) {
            active += stats.getActiveConnections();
            idle += stats.getPoolSize();
            capacity += stats.getTotalCapacity();
            utilization += stats.getUtilization();
            created += stats.getCounters().getCreated();
            reused += stats.getCounters().getReused();
            closed += stats.getCounters().getClosed();
            errors += stats.getCounters().getErrors();
        }

        int count = allStats.size();
        return new AggregatePoolMetrics(count, active + idle, active, idle, capacity,
                count > 0 ? utilization / count : 0.0, created, reused, closed, errors);
    }
}
