package com.ombudsman.connpool.metrics.dropwizard;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.health.HealthCheck;
import com.codahale.metrics.health.HealthCheckRegistry;
import com.ombudsman.connpool.PoolHealthStatus;
import com.ombudsman.connpool.PoolStats;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.jetbrains.annotations.NotNull;

import java.util.function.Supplier;

/**
 * Registers one Dropwizard health check per pool, reporting the pool's {@link PoolHealthStatus}.
 * A degraded pool is reported healthy with a {@code status} detail of {@code DEGRADED}.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CodahaleHealthChecker {

    private static final String CHECK_NAME = "ConnectivityCheck";

    public static void registerHealthChecks(String poolName, Supplier<PoolStats> stats,
                                            @NotNull HealthCheckRegistry registry) {
        registry.register(checkName(poolName), new ConnectivityHealthCheck(stats));
    }

    public static void unregisterHealthChecks(String poolName, @NotNull HealthCheckRegistry registry) {
        registry.unregister(checkName(poolName));
    }

    static String checkName(String poolName) {
        return MetricRegistry.name(poolName, "pool", CHECK_NAME);
    }

    static final class ConnectivityHealthCheck extends HealthCheck {

        private final Supplier<PoolStats> stats;

        ConnectivityHealthCheck(Supplier<PoolStats> stats) {
            this.stats = stats;
        }

        @Override
        protected Result check() {
            PoolStats snapshot = stats.get();
            PoolHealthStatus status = PoolHealthStatus.of(snapshot);
            String message = String.format("utilization %.1f%%, %d errors",
                    snapshot.getUtilization(), snapshot.getCounters().getErrors());

            ResultBuilder builder = Result.builder()
                    .withMessage(message)
                    .withDetail("status", status.name())
                    .withDetail("idle", snapshot.getPoolSize())
                    .withDetail("active", snapshot.getActiveConnections());

            return status == PoolHealthStatus.UNHEALTHY ? builder.unhealthy().build() : builder.healthy().build();
        }
    }
}
