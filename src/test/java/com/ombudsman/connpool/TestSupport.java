package com.ombudsman.connpool;

import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

public final class TestSupport {

    private TestSupport() {
    }

    /**
     * A configuration whose housekeeper stays out of the way of the test.
     */
    public static PoolConfig config(int minSize, int maxSize) {
        PoolConfig config = new PoolConfig();
        config.setMinSize(minSize);
        config.setMaxSize(maxSize);
        config.setAcquireTimeout(1000);
        config.setHealthCheckInterval(60_000);
        return config;
    }

    public static void awaitCondition(String description, BooleanSupplier condition, long timeoutMs)
            throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;

        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out waiting for " + description);
            }
            Thread.sleep(10);
        }
    }
}
