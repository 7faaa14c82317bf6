package com.ombudsman.connpool.metrics.micrometer;

import com.ombudsman.connpool.FakeConnection;
import com.ombudsman.connpool.FakeConnectionFactory;
import com.ombudsman.connpool.PoolConfig;
import com.ombudsman.connpool.PoolTimeoutException;
import com.ombudsman.connpool.TestSupport;
import com.ombudsman.connpool.pool.ConnectionPool;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsTrackerTest {

    private SimpleMeterRegistry registry;
    private ConnectionPool<FakeConnection> pool;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        PoolConfig config = TestSupport.config(1, 2);
        config.setPoolName("micrometer");
        config.setMetricRegistry(registry);
        pool = new ConnectionPool<>(config, new FakeConnectionFactory());
    }

    @AfterEach
    void tearDown() {
        pool.closeAll();
    }

    @Test
    @DisplayName("Should time acquisitions and connection creation")
    void testTimers() throws Exception {
        pool.acquire();
        pool.acquire();

        Timer acquire = registry.get("ombudsman.pool.connections.acquire").tag("pool", "micrometer").timer();
        Timer creation = registry.get("ombudsman.pool.connections.creation").tag("pool", "micrometer").timer();

        assertEquals(2, acquire.count());
        assertEquals(2, creation.count(), "initial fill and one on demand");
    }

    @Test
    @DisplayName("Should count timeouts")
    void testTimeoutCounter() throws Exception {
        pool.acquire();
        pool.acquire();

        assertThrows(PoolTimeoutException.class, () -> pool.acquire(0));

        assertEquals(1.0, registry.get("ombudsman.pool.connections.timeout")
                .tag("pool", "micrometer").counter().count());
    }

    @Test
    @DisplayName("Should expose connection gauges")
    void testGauges() throws Exception {
        pool.acquire();

        Gauge active = registry.get("ombudsman.pool.connections.active").tag("pool", "micrometer").gauge();
        Gauge max = registry.get("ombudsman.pool.connections.max").tag("pool", "micrometer").gauge();

        assertEquals(1.0, active.value());
        assertEquals(2.0, max.value());
    }

    @Test
    @DisplayName("Should count stale connections closed during acquire as evictions")
    void testStaleEvictionCounted() throws Exception {
        PoolConfig config = TestSupport.config(1, 2);
        config.setPoolName("micrometer-stale");
        config.setMaxAge(50);
        config.setMetricRegistry(registry);
        ConnectionPool<FakeConnection> stalePool = new ConnectionPool<>(config, new FakeConnectionFactory());

        try {
            Thread.sleep(100);
            stalePool.acquire();

            assertEquals(1.0, registry.get("ombudsman.pool.connections.evicted")
                    .tag("pool", "micrometer-stale").counter().count());
        } finally {
            stalePool.closeAll();
        }
    }

    @Test
    @DisplayName("Should remove its meters when the pool closes")
    void testRemovedOnClose() {
        pool.closeAll();

        assertNull(registry.find("ombudsman.pool.connections.acquire").timer());
        assertNull(registry.find("ombudsman.pool.connections.active").gauge());
        assertTrue(registry.getMeters().isEmpty());
    }
}
