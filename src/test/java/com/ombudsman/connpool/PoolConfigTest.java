package com.ombudsman.connpool;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.health.HealthCheckRegistry;
import com.ombudsman.connpool.metrics.prometheus.PrometheusMetricsTrackerFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class PoolConfigTest {

    @Test
    @DisplayName("Should create config with defaults")
    void testDefaults() {
        PoolConfig config = new PoolConfig();

        assertEquals(2, config.getMinSize());
        assertEquals(10, config.getMaxSize());
        assertEquals(3_600_000, config.getMaxAge());
        assertEquals(300_000, config.getHealthCheckInterval());
        assertEquals(30_000, config.getAcquireTimeout());
        assertNull(config.getPoolName());
        assertFalse(config.isRegisterMbeans());
        assertFalse(config.isSealed());
    }

    @Nested
    @DisplayName("Setters")
    class Setters {

        private final PoolConfig config = new PoolConfig();

        @Test
        @DisplayName("Should reject out-of-range values")
        void testRejects() {
            assertThrows(IllegalArgumentException.class, () -> config.setMaxSize(0));
            assertThrows(IllegalArgumentException.class, () -> config.setMinSize(-1));
            assertThrows(IllegalArgumentException.class, () -> config.setMaxAge(-1));
            assertThrows(IllegalArgumentException.class, () -> config.setHealthCheckInterval(0));
            assertThrows(IllegalArgumentException.class, () -> config.setAcquireTimeout(-5));
        }

        @Test
        @DisplayName("Should accept zero maxAge and zero acquireTimeout")
        void testZeroes() {
            config.setMaxAge(0);
            config.setAcquireTimeout(0);
            config.setMinSize(0);

            assertEquals(0, config.getMaxAge());
            assertEquals(0, config.getAcquireTimeout());
            assertEquals(0, config.getMinSize());
        }

        @Test
        @DisplayName("Should refuse changes once sealed")
        void testSealed() {
            config.seal();

            assertThrows(IllegalStateException.class, () -> config.setPoolName("late"));
            assertThrows(IllegalStateException.class, () -> config.setMinSize(1));
            assertThrows(IllegalStateException.class, () -> config.setRegisterMbeans(true));
        }

        @Test
        @DisplayName("Should accept only known registries")
        void testRegistries() {
            config.setMetricRegistry(new MetricRegistry());
            config.setMetricRegistry(new SimpleMeterRegistry());
            config.setHealthCheckRegistry(new HealthCheckRegistry());

            assertThrows(IllegalArgumentException.class, () -> config.setMetricRegistry("registry"));
            assertThrows(IllegalArgumentException.class, () -> config.setHealthCheckRegistry(new Object()));
            assertThrows(IllegalStateException.class,
                    () -> config.setMetricsTrackerFactory(new PrometheusMetricsTrackerFactory(new CollectorRegistry())));
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Should generate a pool name")
        void testGeneratedName() {
            PoolConfig config = new PoolConfig();
            config.validate();

            assertTrue(config.getPoolName().startsWith("ConnectionPool-"));
        }

        @Test
        @DisplayName("Should clamp minSize to maxSize")
        void testClamp() {
            PoolConfig config = new PoolConfig();
            config.setMaxSize(3);
            config.setMinSize(8);
            config.validate();

            assertEquals(3, config.getMinSize());
        }

        @Test
        @DisplayName("Should reject a JMX-unsafe pool name")
        void testJmxName() {
            PoolConfig config = new PoolConfig();
            config.setPoolName("db:primary");
            config.setRegisterMbeans(true);

            assertThrows(IllegalArgumentException.class, config::validate);
        }
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("Should load settings from properties")
        void testProperties() {
            Properties props = new Properties();
            props.setProperty("poolName", "snowflake");
            props.setProperty("maxSize", "6");
            props.setProperty("acquireTimeout", " 1500 ");
            props.setProperty("registerMbeans", "true");

            PoolConfig config = new PoolConfig(props);

            assertEquals("snowflake", config.getPoolName());
            assertEquals(6, config.getMaxSize());
            assertEquals(1500, config.getAcquireTimeout());
            assertTrue(config.isRegisterMbeans());
        }

        @Test
        @DisplayName("Should reject unknown properties and invalid values")
        void testBadProperties() {
            Properties unknown = new Properties();
            unknown.setProperty("maximumPoolSize", "6");
            assertThrows(IllegalArgumentException.class, () -> new PoolConfig(unknown));

            Properties invalid = new Properties();
            invalid.setProperty("maxSize", "0");
            assertThrows(IllegalArgumentException.class, () -> new PoolConfig(invalid));
        }

        @Test
        @DisplayName("Should load settings from a property file on the classpath")
        void testPropertyFile() {
            PoolConfig config = new PoolConfig("/pool-test.properties");

            assertEquals("reporting", config.getPoolName());
            assertEquals(1, config.getMinSize());
            assertEquals(4, config.getMaxSize());
            assertEquals(120_000, config.getMaxAge());
            assertEquals(15_000, config.getHealthCheckInterval());
            assertEquals(2_500, config.getAcquireTimeout());
        }

        @Test
        @DisplayName("Should fail on a missing property file")
        void testMissingFile() {
            assertThrows(IllegalArgumentException.class, () -> new PoolConfig("/no-such-file.properties"));
        }
    }

    @Test
    @DisplayName("Should copy every setting into an unsealed copy")
    void testCopyStateTo() {
        PoolConfig source = new PoolConfig();
        source.setPoolName("source");
        source.setMinSize(4);
        source.setMaxAge(1234);
        source.seal();

        PoolConfig copy = new PoolConfig();
        source.copyStateTo(copy);

        assertEquals("source", copy.getPoolName());
        assertEquals(4, copy.getMinSize());
        assertEquals(1234, copy.getMaxAge());
        assertFalse(copy.isSealed());
        copy.setPoolName("copy");
        assertEquals("source", source.getPoolName());
    }
}
