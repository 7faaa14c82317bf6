package com.ombudsman.connpool;

import com.ombudsman.connpool.pool.ConnectionPool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionPoolManagerTest {

    private final ConnectionPoolManager manager = new ConnectionPoolManager(TestSupport.config(1, 3));

    @AfterEach
    void tearDown() {
        manager.close();
    }

    @Nested
    @DisplayName("Registry")
    class Registry {

        @Test
        @DisplayName("Should create a pool once and return it afterwards")
        void testGetOrCreate() {
            FakeConnectionFactory factory = new FakeConnectionFactory();

            ConnectionPool<FakeConnection> first = manager.getOrCreatePool("orders", factory);
            ConnectionPool<FakeConnection> second = manager.getOrCreatePool("orders", new FakeConnectionFactory());

            assertSame(first, second);
            assertEquals("orders", first.getPoolName());
            assertEquals(1, factory.getCalls());
        }

        @Test
        @DisplayName("Should create exactly one pool under concurrent first use")
        void testConcurrentCreation() throws Exception {
            FakeConnectionFactory factory = new FakeConnectionFactory();
            int threads = 16;
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(threads);

            try {
                List<Future<ConnectionPool<FakeConnection>>> futures = new ArrayList<>();

                for (int i = 0; i < threads; i++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        return manager.getOrCreatePool("shared", factory);
                    }));
                }
                start.countDown();

                ConnectionPool<FakeConnection> expected = futures.get(0).get(5, TimeUnit.SECONDS);
                for (Future<ConnectionPool<FakeConnection>> future : futures) {
                    assertSame(expected, future.get(5, TimeUnit.SECONDS));
                }
            } finally {
                executor.shutdownNow();
            }

            assertEquals(1, factory.getCalls(), "only the one pool fills itself");
            assertEquals(1, manager.getPoolNames().size());
        }

        @Test
        @DisplayName("Should reject an empty pool name")
        void testEmptyName() {
            assertThrows(IllegalArgumentException.class,
                    () -> manager.getOrCreatePool("  ", new FakeConnectionFactory()));
        }

        @Test
        @DisplayName("Should return empty for an unknown pool")
        void testGetPoolMissing() {
            assertFalse(manager.getPool("missing").isPresent());

            manager.getOrCreatePool("present", new FakeConnectionFactory());
            assertTrue(manager.getPool("present").isPresent());
        }

        @Test
        @DisplayName("Should leave the caller's configuration untouched")
        void testConfigCopied() {
            PoolConfig config = TestSupport.config(0, 5);
            config.setPoolName("ignored");

            ConnectionPool<FakeConnection> pool = manager.getOrCreatePool("analytics", new FakeConnectionFactory(), config);

            assertEquals("analytics", pool.getPoolName());
            assertEquals(5, pool.getStats().getTotalCapacity());
            assertFalse(config.isSealed());
            assertEquals("ignored", config.getPoolName());
        }

        @Test
        @DisplayName("Should recreate a pool after it was closed by name")
        void testClosePool() {
            ConnectionPool<FakeConnection> pool = manager.getOrCreatePool("reports", new FakeConnectionFactory());

            assertTrue(manager.closePool("reports"));
            assertFalse(manager.closePool("reports"));
            assertTrue(pool.isClosed());

            ConnectionPool<FakeConnection> recreated = manager.getOrCreatePool("reports", new FakeConnectionFactory());
            assertNotSame(pool, recreated);
            assertFalse(recreated.isClosed());
        }

        @Test
        @DisplayName("Should close every pool and forget it")
        void testCloseAllPools() {
            FakeConnectionFactory factory = new FakeConnectionFactory();
            ConnectionPool<FakeConnection> a = manager.getOrCreatePool("a", factory);
            ConnectionPool<FakeConnection> b = manager.getOrCreatePool("b", factory);

            manager.closeAllPools();

            assertTrue(a.isClosed());
            assertTrue(b.isClosed());
            assertTrue(manager.getPoolNames().isEmpty());
            assertTrue(manager.getAllStats().isEmpty());
            factory.getCreated().forEach(connection -> assertEquals(1, connection.getCloseCount()));
        }
    }

    @Nested
    @DisplayName("Statistics")
    class Statistics {

        @Test
        @DisplayName("Should report stats ordered by pool name")
        void testAllStats() throws Exception {
            manager.getOrCreatePool("zeta", new FakeConnectionFactory());
            ConnectionPool<FakeConnection> alpha = manager.getOrCreatePool("alpha", new FakeConnectionFactory());
            alpha.acquire();

            Map<String, PoolStats> stats = manager.getAllStats();

            assertEquals(List.of("alpha", "zeta"), new ArrayList<>(stats.keySet()));
            assertEquals(1, stats.get("alpha").getActiveConnections());
            assertEquals(0, stats.get("alpha").getPoolSize());
            assertEquals(1, stats.get("zeta").getPoolSize());
        }

        @Test
        @DisplayName("Should report a healthy empty manager")
        void testEmptyHealth() {
            PoolHealthReport report = manager.getHealth();

            assertEquals(PoolHealthStatus.HEALTHY, report.getOverallStatus());
            assertTrue(report.getPools().isEmpty());
            assertTrue(report.getWarnings().isEmpty());
        }

        @Test
        @DisplayName("Should degrade overall health when one pool is exhausted")
        void testMixedHealth() throws Exception {
            ConnectionPool<FakeConnection> busy =
                    manager.getOrCreatePool("busy", new FakeConnectionFactory(), TestSupport.config(0, 2));
            manager.getOrCreatePool("quiet", new FakeConnectionFactory(), TestSupport.config(0, 2));
            busy.acquire();
            busy.acquire();

            PoolHealthReport report = manager.getHealth();

            assertEquals(PoolHealthStatus.DEGRADED, report.getOverallStatus());
            assertEquals(PoolHealthStatus.UNHEALTHY, report.getPools().get("busy"));
            assertEquals(PoolHealthStatus.HEALTHY, report.getPools().get("quiet"));
            assertEquals(1, report.getWarnings().size());
            assertTrue(report.getWarnings().get(0).startsWith("Pool busy is UNHEALTHY"));
        }

        @Test
        @DisplayName("Should aggregate totals across pools")
        void testAggregateMetrics() throws Exception {
            ConnectionPool<FakeConnection> first = manager.getOrCreatePool("first", new FakeConnectionFactory());
            manager.getOrCreatePool("second", new FakeConnectionFactory());

            FakeConnection connection = first.acquire();
            first.release(connection);
            first.release(first.acquire());

            AggregatePoolMetrics metrics = manager.getAggregateMetrics();

            assertEquals(2, metrics.getPoolCount());
            assertEquals(2, metrics.getTotalConnections());
            assertEquals(0, metrics.getActiveConnections());
            assertEquals(6, metrics.getTotalCapacity());
            assertEquals(2, metrics.getTotalCreated());
            assertEquals(2, metrics.getTotalReused());
            assertEquals(100.0, metrics.getReuseRatio(), 0.001);
            assertEquals(0.0, metrics.getAverageUtilization(), 0.001);
        }
    }
}
