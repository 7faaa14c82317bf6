package com.ombudsman.connpool;

import org.jetbrains.annotations.NotNull;

public enum PoolHealthStatus {

    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    static final double DEGRADED_UTILIZATION = 80.0;
    static final double UNHEALTHY_UTILIZATION = 95.0;
    static final long UNHEALTHY_ERRORS = 10;

    /**
     * Classify one pool from its statistics. Above 95% utilization or more than 10 factory errors
     * is unhealthy, above 80% or any error at all is degraded.
     *
     * @param stats the pool snapshot
     * @return the status of the pool
     */
    public static @NotNull PoolHealthStatus of(@NotNull PoolStats stats) {
        double utilization = stats.getUtilization();
        long errors = stats.getCounters().getErrors();

        if (utilization > UNHEALTHY_UTILIZATION || errors > UNHEALTHY_ERRORS) {
            return UNHEALTHY;
        } else if (utilization > DEGRADED_UTILIZATION || errors > 0) {
            return DEGRADED;
        }
        return HEALTHY;
    }
}
