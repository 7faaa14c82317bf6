package com.ombudsman.connpool.jdbc;

import com.ombudsman.connpool.PoolConfig;
import com.ombudsman.connpool.ResourceCreationException;
import com.ombudsman.connpool.TestSupport;
import com.ombudsman.connpool.pool.ConnectionPool;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JdbcConnectionFactoryTest {

    @Mock
    private DataSource dataSource;

    @Mock
    private Connection connection;

    @Test
    @DisplayName("Should open connections from a DataSource")
    void testDataSource() throws SQLException {
        when(dataSource.getConnection()).thenReturn(connection);

        JdbcConnection jdbc = JdbcConnectionFactory.forDataSource(dataSource, "SELECT 1", 7).create();

        assertSame(connection, jdbc.unwrap());
        assertEquals("SELECT 1", jdbc.getTestQuery());
        assertEquals(7, jdbc.getValidationTimeoutSeconds());
    }

    @Test
    @DisplayName("Should propagate DataSource failures")
    void testDataSourceFailure() throws SQLException {
        when(dataSource.getConnection()).thenThrow(new SQLException("connection refused"));

        JdbcConnectionFactory factory = JdbcConnectionFactory.forDataSource(dataSource);

        SQLException ex = assertThrows(SQLException.class, factory::create);
        assertEquals("connection refused", ex.getMessage());
    }

    @Test
    @DisplayName("Should fail when the DataSource returns no connection")
    void testNullConnection() throws SQLException {
        when(dataSource.getConnection()).thenReturn(null);

        assertThrows(SQLException.class, JdbcConnectionFactory.forDataSource(dataSource)::create);
    }

    @Test
    @DisplayName("Should reject a negative validation timeout")
    void testNegativeTimeout() {
        assertThrows(IllegalArgumentException.class,
                () -> JdbcConnectionFactory.forDataSource(dataSource, null, -1));
    }

    @Test
    @DisplayName("Should reject a URL no driver accepts and mask its password")
    void testUnknownDriver() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> JdbcConnectionFactory.forDriver("jdbc:nosuchdb://localhost/app?user=app&password=secret",
                        null, null, null, null, null, 5));

        assertTrue(ex.getMessage().contains("password=<masked>"));
        assertFalse(ex.getMessage().contains("secret"));
    }

    @Test
    @DisplayName("Should pool JDBC connections and close them on shutdown")
    void testPooled() throws Exception {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.isValid(5)).thenReturn(true);

        PoolConfig config = TestSupport.config(1, 2);
        config.setPoolName("jdbc");
        ConnectionPool<JdbcConnection> pool = new ConnectionPool<>(config, JdbcConnectionFactory.forDataSource(dataSource));

        JdbcConnection borrowed = pool.acquire();
        assertSame(connection, borrowed.unwrap());
        pool.release(borrowed);
        pool.closeAll();

        verify(dataSource, times(1)).getConnection();
        verify(connection).close();
    }

    @Test
    @DisplayName("Should count a failing DataSource as a creation error")
    void testPooledFailure() throws Exception {
        when(dataSource.getConnection()).thenThrow(new SQLException("database is down"));

        ConnectionPool<JdbcConnection> pool =
                new ConnectionPool<>(TestSupport.config(0, 1), JdbcConnectionFactory.forDataSource(dataSource));

        try {
            ResourceCreationException ex = assertThrows(ResourceCreationException.class, pool::acquire);
            assertInstanceOf(SQLException.class, ex.getCause());
            assertEquals(1, pool.getStats().getCounters().getErrors());
        } finally {
            pool.closeAll();
        }
    }
}
