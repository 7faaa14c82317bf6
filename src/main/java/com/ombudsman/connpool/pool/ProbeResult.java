package com.ombudsman.connpool.pool;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Outcome of a health probe. A probe never throws to the pool; anything other than
 * {@link Outcome#HEALTHY} leads to the connection being closed.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
class ProbeResult {

    enum Outcome {
        HEALTHY,
        UNHEALTHY,
        FAILED
    }

    private static final ProbeResult HEALTHY_RESULT = new ProbeResult(Outcome.HEALTHY, null);
    private static final ProbeResult UNHEALTHY_RESULT = new ProbeResult(Outcome.UNHEALTHY, null);

    Outcome outcome;
    @Nullable Throwable cause;

    static ProbeResult healthy() {
        return HEALTHY_RESULT;
    }

    static ProbeResult unhealthy() {
        return UNHEALTHY_RESULT;
    }

    @Contract("_ -> new")
    static @NotNull ProbeResult failed(Throwable cause) {
        return new ProbeResult(Outcome.FAILED, cause);
    }

    boolean isHealthy() {
        return outcome == Outcome.HEALTHY;
    }

    String describe() {
        switch (outcome) {
            case HEALTHY:
                return "healthy";
            case UNHEALTHY:
                return "probe reported the connection as dead";
            default:
                return "probe failed: " + cause;
        }
    }
}
