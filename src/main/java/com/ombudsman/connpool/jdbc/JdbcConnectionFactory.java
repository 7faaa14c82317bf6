/*
 * Copyright (C) 2013, 2014 Brett Wooldridge
 *
 * Modifications made by Foulest (https://github.com/Foulest)
 * for the HikariCP fork (https://github.com/Foulest/HikariCP).
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.ombudsman.connpool.jdbc;

import com.ombudsman.connpool.ConnectionFactory;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import javax.sql.DataSource;
import java.lang.reflect.InvocationTargetException;
import java.sql.Connection;
import java.sql.Driver;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Enumeration;
import java.util.Map;
import java.util.Properties;

import static com.ombudsman.connpool.util.UtilityElf.getNullIfEmpty;

/**
 * Opens {@link JdbcConnection}s, either from a {@link DataSource} or from a JDBC URL through a
 * {@link Driver} resolved by class name or by {@link DriverManager}.
 */
@Slf4j
public final class JdbcConnectionFactory implements ConnectionFactory<JdbcConnection> {

    private static final String PASSWORD = "password";
    private static final String USER = "user";
    private static final int DEFAULT_VALIDATION_TIMEOUT_SECONDS = 5;

    private final ConnectionSource source;
    private final String testQuery;
    private final int validationTimeoutSeconds;

    @FunctionalInterface
    private interface ConnectionSource {
        Connection open() throws SQLException;
    }

    private JdbcConnectionFactory(ConnectionSource source, @Nullable String testQuery, int validationTimeoutSeconds) {
        if (validationTimeoutSeconds < 0) {
            throw new IllegalArgumentException("validationTimeoutSeconds cannot be negative");
        }

        this.source = source;
        this.testQuery = getNullIfEmpty(testQuery);
        this.validationTimeoutSeconds = validationTimeoutSeconds;
    }

    @Contract("_ -> new")
    public static @NotNull JdbcConnectionFactory forDataSource(@NotNull DataSource dataSource) {
        return forDataSource(dataSource, null, DEFAULT_VALIDATION_TIMEOUT_SECONDS);
    }

    @Contract("_, _, _ -> new")
    public static @NotNull JdbcConnectionFactory forDataSource(@NotNull DataSource dataSource,
                                                               @Nullable String testQuery,
                                                               int validationTimeoutSeconds) {
        return new JdbcConnectionFactory(dataSource::getConnection, testQuery, validationTimeoutSeconds);
    }

    /**
     * Build a factory that connects to {@code jdbcUrl} through a JDBC driver.
     *
     * @param jdbcUrl          the JDBC URL
     * @param driverClassName  the driver class, or null to let {@link DriverManager} pick one for the URL
     * @param properties       extra driver properties, may be null
     * @param username         the user name, may be null
     * @param password         the password, may be null
     * @param testQuery        a query used as health probe, or null to use {@link Connection#isValid(int)}
     * @param validationTimeoutSeconds timeout of the health probe
     * @return a new factory
     */
    public static @NotNull JdbcConnectionFactory forDriver(@NotNull String jdbcUrl,
                                                           @Nullable String driverClassName,
                                                           @Nullable Properties properties,
                                                           @Nullable String username,
                                                           @Nullable String password,
                                                           @Nullable String testQuery,
                                                           int validationTimeoutSeconds) {
        Properties driverProperties = new Properties();

        if (properties != null) {
            for (Map.Entry<Object, Object> entry : properties.entrySet()) {
                driverProperties.setProperty(entry.getKey().toString(), entry.getValue().toString());
            }
        }

        if (username != null) {
            driverProperties.put(USER, driverProperties.getProperty(USER, username));
        }

        if (password != null) {
            driverProperties.put(PASSWORD, driverProperties.getProperty(PASSWORD, password));
        }

        Driver driver = resolveDriver(jdbcUrl, getNullIfEmpty(driverClassName));
        return new JdbcConnectionFactory(() -> driver.connect(jdbcUrl, driverProperties),
                testQuery, validationTimeoutSeconds);
    }

    @Override
    public @NotNull JdbcConnection create() throws SQLException {
        Connection connection = source.open();

        if (connection == null) {
            throw new SQLException("JDBC driver returned no connection");
        }
        return new JdbcConnection(connection, testQuery, validationTimeoutSeconds);
    }

    private static @NotNull Driver resolveDriver(String jdbcUrl, @Nullable String driverClassName) {
        String sanitizedUrl = jdbcUrl.replaceAll("([?&;]password=)[^&#;]*(.*)", "$1<masked>$2");
        Driver driver = null;

        if (driverClassName != null) {
            Enumeration<Driver> drivers = DriverManager.getDrivers();

            while (drivers.hasMoreElements()) {
                Driver registered = drivers.nextElement();

                if (registered.getClass().getName().equals(driverClassName)) {
                    driver = registered;
                    break;
                }
            }

            if (driver == null) {
                log.warn("Registered driver with driverClassName={} was not found,"
                        + " trying direct instantiation.", driverClassName);
                driver = loadDriver(driverClassName);
            }
        }

        try {
            if (driver == null) {
                driver = DriverManager.getDriver(jdbcUrl);
                log.debug("Loaded driver with class name {} for jdbcUrl={}",
                        driver.getClass().getName(), sanitizedUrl);
            } else if (!driver.acceptsURL(jdbcUrl)) {
                throw new IllegalArgumentException("Driver " + driverClassName
                        + " claims to not accept jdbcUrl, " + sanitizedUrl);
            }
        } catch (SQLException ex) {
            throw new IllegalArgumentException("Failed to get driver instance for jdbcUrl=" + sanitizedUrl, ex);
        }
        return driver;
    }

    private static @Nullable Driver loadDriver(String driverClassName) {
        Class<?> driverClass = loadDriverClass(driverClassName);

        if (driverClass != null) {
            try {
                return (Driver) driverClass.getDeclaredConstructor().newInstance();
            } catch (IllegalAccessException | InvocationTargetException | SecurityException | ClassCastException
                     | NoSuchMethodException | InstantiationException | IllegalArgumentException ex) {
                log.warn("Failed to create instance of driver class {},"
                        + " trying jdbcUrl resolution", driverClassName, ex);
            }
        }
        return null;
    }

    private static @Nullable Class<?> loadDriverClass(String driverClassName) {
        ClassLoader threadContextClassLoader = Thread.currentThread().getContextClassLoader();

        if (threadContextClassLoader != null) {
            try {
                Class<?> driverClass = threadContextClassLoader.loadClass(driverClassName);
                log.debug("Driver class {} found in Thread context class loader {}",
                        driverClassName, threadContextClassLoader);
                return driverClass;
            } catch (ClassNotFoundException ex) {
                log.debug("Driver class {} not found in Thread context class loader {}, trying classloader {}",
                        driverClassName, threadContextClassLoader, JdbcConnectionFactory.class.getClassLoader());
            }
        }

        try {
            return JdbcConnectionFactory.class.getClassLoader().loadClass(driverClassName);
        } catch (ClassNotFoundException ex) {
            log.debug("Failed to load driver class {} from classloader {}",
                    driverClassName, JdbcConnectionFactory.class.getClassLoader());
            return null;
        }
    }
}
