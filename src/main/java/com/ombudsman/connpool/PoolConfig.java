package com.ombudsman.connpool;

import com.ombudsman.connpool.metrics.MetricsTrackerFactory;
import com.ombudsman.connpool.util.PropertyElf;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import static com.ombudsman.connpool.util.UtilityElf.getNullIfEmpty;
import static com.ombudsman.connpool.util.UtilityElf.safeIsAssignableFrom;
import static java.util.concurrent.TimeUnit.HOURS;
import static java.util.concurrent.TimeUnit.MINUTES;
import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * Construction-time configuration of a {@link com.ombudsman.connpool.pool.ConnectionPool}.
 * <p>
 * All durations are in milliseconds. The configuration is sealed once a pool has been started with
 * it, after which every setter throws {@link IllegalStateException}.
 */
@Slf4j
@Getter
@Setter
@SuppressWarnings("unused")
public class PoolConfig {

    private static final int DEFAULT_MIN_SIZE = 2;
    private static final int DEFAULT_MAX_SIZE = 10;
    private static final long MAX_AGE = HOURS.toMillis(1);
    private static final long HEALTH_CHECK_INTERVAL = MINUTES.toMillis(5);
    private static final long ACQUIRE_TIMEOUT = SECONDS.toMillis(30);
    private static final String POOL_NAME_PREFIX = "ConnectionPool-";
    private static final AtomicInteger POOL_NUMBER = new AtomicInteger(0);

    private String poolName;
    private int minSize;
    private int maxSize;
    private long maxAge;
    private long healthCheckInterval;
    private long acquireTimeout;
    private boolean registerMbeans;
    private ThreadFactory threadFactory;
    private ScheduledExecutorService scheduledExecutor;
    private MetricsTrackerFactory metricsTrackerFactory;
    private Object metricRegistry;
    private Object healthCheckRegistry;

    @Setter(AccessLevel.NONE)
    private volatile boolean sealed;

    /**
     * Default constructor
     */
    public PoolConfig() {
        minSize = DEFAULT_MIN_SIZE;
        maxSize = DEFAULT_MAX_SIZE;
        maxAge = MAX_AGE;
        healthCheckInterval = HEALTH_CHECK_INTERVAL;
        acquireTimeout = ACQUIRE_TIMEOUT;
    }

    /**
     * Construct a PoolConfig from the specified properties object.
     *
     * @param properties bean-style property names mapped to their values
     */
    public PoolConfig(Properties properties) {
        this();
        PropertyElf.setTargetFromProperties(this, properties);
    }

    /**
     * Construct a PoolConfig from the specified property file name. <code>propertyFileName</code>
     * will first be treated as a path in the file-system, and if that fails the
     * Class.getResourceAsStream(propertyFileName) will be tried.
     *
     * @param propertyFileName the name of the property file
     */
    public PoolConfig(String propertyFileName) {
        this();
        loadProperties(propertyFileName);
    }

    public void setPoolName(String poolName) {
        checkIfSealed();
        this.poolName = poolName;
    }

    public void setMinSize(int minSize) {
        checkIfSealed();

        if (minSize < 0) {
            throw new IllegalArgumentException("minSize cannot be negative");
        }
        this.minSize = minSize;
    }

    public void setMaxSize(int maxSize) {
        checkIfSealed();

        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize cannot be less than 1");
        }
        this.maxSize = maxSize;
    }

    /**
     * Set the time a connection may sit unused before it is considered stale. Zero makes every
     * connection stale as soon as it has aged at all.
     *
     * @param maxAgeMs the maximum age since last use in milliseconds
     */
    public void setMaxAge(long maxAgeMs) {
        checkIfSealed();

        if (maxAgeMs < 0) {
            throw new IllegalArgumentException("maxAge cannot be negative");
        }
        maxAge = maxAgeMs;
    }

    public void setHealthCheckInterval(long healthCheckIntervalMs) {
        checkIfSealed();

        if (healthCheckIntervalMs <= 0) {
            throw new IllegalArgumentException("healthCheckInterval must be positive");
        }
        healthCheckInterval = healthCheckIntervalMs;
    }

    /**
     * Set the default time {@code acquire()} waits for a connection. Zero means fail at once when
     * nothing is available.
     *
     * @param acquireTimeoutMs the acquire timeout in milliseconds
     */
    public void setAcquireTimeout(long acquireTimeoutMs) {
        checkIfSealed();

        if (acquireTimeoutMs < 0) {
            throw new IllegalArgumentException("acquireTimeout cannot be negative");
        }
        acquireTimeout = acquireTimeoutMs;
    }

    public void setRegisterMbeans(boolean register) {
        checkIfSealed();
        registerMbeans = register;
    }

    public void setThreadFactory(ThreadFactory threadFactory) {
        checkIfSealed();
        this.threadFactory = threadFactory;
    }

    /**
     * Run housekeeping on an externally owned scheduler. The pool cancels its task on shutdown but
     * never shuts this executor down.
     *
     * @param executor the scheduler to use
     */
    public void setScheduledExecutor(ScheduledExecutorService executor) {
        checkIfSealed();
        scheduledExecutor = executor;
    }

    public void setMetricsTrackerFactory(MetricsTrackerFactory metricsTrackerFactory) {
        checkIfSealed();

        if (metricRegistry != null) {
            throw new IllegalStateException("cannot use setMetricsTrackerFactory() and setMetricRegistry() together");
        }
        this.metricsTrackerFactory = metricsTrackerFactory;
    }

    public void setMetricRegistry(Object metricRegistry) {
        checkIfSealed();

        if (metricsTrackerFactory != null) {
            throw new IllegalStateException("cannot use setMetricRegistry() and setMetricsTrackerFactory() together");
        }

        if (metricRegistry != null
                && !safeIsAssignableFrom(metricRegistry, "com.codahale.metrics.MetricRegistry")
                && !safeIsAssignableFrom(metricRegistry, "io.micrometer.core.instrument.MeterRegistry")) {
            throw new IllegalArgumentException("Class must be instance of com.codahale.metrics.MetricRegistry"
                    + " or io.micrometer.core.instrument.MeterRegistry");
        }
        this.metricRegistry = metricRegistry;
    }

    public void setHealthCheckRegistry(Object healthCheckRegistry) {
        checkIfSealed();

        if (healthCheckRegistry != null
                && !safeIsAssignableFrom(healthCheckRegistry, "com.codahale.metrics.health.HealthCheckRegistry")) {
            throw new IllegalArgumentException("Class must be an instance of"
                    + " com.codahale.metrics.health.HealthCheckRegistry");
        }
        this.healthCheckRegistry = healthCheckRegistry;
    }

    /**
     * Prevent further changes. Called by a pool when it starts.
     */
    public void seal() {
        sealed = true;
    }

    /**
     * Copy every setting of this configuration to another one. The copy is left unsealed.
     *
     * @param other the configuration to overwrite
     */
    public void copyStateTo(PoolConfig other) {
        for (Field field : PoolConfig.class.getDeclaredFields()) {
            if (!Modifier.isFinal(field.getModifiers()) && !Modifier.isStatic(field.getModifiers())) {
                field.setAccessible(true);

                try {
                    field.set(other, field.get(this));
                } catch (IllegalAccessException ex) {
                    throw new IllegalStateException("Failed to copy PoolConfig state: " + ex.getMessage(), ex);
                }
            }
        }

        other.sealed = false;
    }

    /**
     * Fill in defaults and repair inconsistent settings, logging a warning for every adjustment.
     */
    public void validate() {
        poolName = getNullIfEmpty(poolName);

        if (poolName == null) {
            poolName = generatePoolName();
        } else if (registerMbeans && poolName.contains(":")) {
            throw new IllegalArgumentException("poolName cannot contain ':' when used with JMX");
        }

        if (minSize > maxSize) {
            log.warn("{} - minSize {} is greater than maxSize {}, setting it to {}.",
                    poolName, minSize, maxSize, maxSize);
            minSize = maxSize;
        }

        if (maxAge == 0) {
            log.warn("{} - maxAge is 0, every connection is closed when it is returned.", poolName);
        }

        if (log.isDebugEnabled()) {
            logConfiguration();
        }
    }

    private void checkIfSealed() {
        if (sealed) {
            throw new IllegalStateException("The configuration of the pool is sealed once started.");
        }
    }

    private void logConfiguration() {
        log.debug("{} - configuration:", poolName);
        Set<String> propertyNames = new TreeSet<>(PropertyElf.getPropertyNames(PoolConfig.class));

        for (String prop : propertyNames) {
            Object value = PropertyElf.getProperty(prop, this);

            switch (prop) {
                case "scheduledExecutor":
                case "threadFactory":
                    value = value == null ? "internal" : value;
                    break;

                default:
                    if (value instanceof String) {
                        value = "\"" + value + "\"";
                    } else if (value == null) {
                        value = "none";
                    }
                    break;
            }
            log.debug("{}{}", String.format("%-32s", prop), value);
        }
    }

    private void loadProperties(String propertyFileName) {
        Properties props = new Properties();
        Path propFilePath = Paths.get(propertyFileName);

        try (InputStream is = Files.exists(propFilePath)
                ? Files.newInputStream(propFilePath)
                : getClass().getResourceAsStream(propertyFileName)) {
            if (is == null) {
                throw new IllegalArgumentException("Cannot find property file: " + propertyFileName);
            }

            props.load(is);
            PropertyElf.setTargetFromProperties(this, props);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read property file: " + propertyFileName, ex);
        }
    }

    private static @NotNull String generatePoolName() {
        return POOL_NAME_PREFIX + POOL_NUMBER.incrementAndGet();
    }
}
