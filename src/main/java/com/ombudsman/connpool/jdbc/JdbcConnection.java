package com.ombudsman.connpool.jdbc;

import com.ombudsman.connpool.RawConnection;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * A {@link RawConnection} over a JDBC {@link Connection}.
 * <p>
 * The health probe uses {@link Connection#isValid(int)}, or executes the configured test query on a
 * fresh {@link Statement} when there is one.
 */
@Slf4j
public final class JdbcConnection implements RawConnection {

    private final Connection connection;

    @Getter
    private final @Nullable String testQuery;

    @Getter
    private final int validationTimeoutSeconds;

    public JdbcConnection(@NotNull Connection connection, @Nullable String testQuery, int validationTimeoutSeconds) {
        this.connection = connection;
        this.testQuery = testQuery;
        this.validationTimeoutSeconds = validationTimeoutSeconds;
    }

    /**
     * @return the underlying JDBC connection
     */
    public Connection unwrap() {
        return connection;
    }

    @Override
    public boolean healthProbe() throws SQLException {
        if (connection.isClosed()) {
            return false;
        }

        if (testQuery == null) {
            return connection.isValid(validationTimeoutSeconds);
        }

        try (Statement statement = connection.createStatement()) {
            statement.setQueryTimeout(validationTimeoutSeconds);
            statement.execute(testQuery);
        }
        return true;
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException ex) {
            log.debug("Closing JDBC connection {} failed", connection, ex);
        }
    }

    @Override
    public String toString() {
        return connection.toString();
    }
}
