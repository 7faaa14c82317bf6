package com.ombudsman.connpool.jdbc;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JdbcConnectionTest {

    @Mock
    private Connection connection;

    @Mock
    private Statement statement;

    @Test
    @DisplayName("Should probe with isValid when no test query is set")
    void testIsValidProbe() throws SQLException {
        when(connection.isValid(3)).thenReturn(true);

        JdbcConnection jdbc = new JdbcConnection(connection, null, 3);

        assertTrue(jdbc.healthProbe());
        verify(connection, never()).createStatement();
    }

    @Test
    @DisplayName("Should probe with the test query when one is set")
    void testQueryProbe() throws SQLException {
        when(connection.createStatement()).thenReturn(statement);

        JdbcConnection jdbc = new JdbcConnection(connection, "SELECT 1", 2);

        assertTrue(jdbc.healthProbe());
        verify(statement).setQueryTimeout(2);
        verify(statement).execute("SELECT 1");
        verify(statement).close();
    }

    @Test
    @DisplayName("Should propagate a failing test query")
    void testQueryProbeFailure() throws SQLException {
        when(connection.createStatement()).thenReturn(statement);
        when(statement.execute("SELECT 1")).thenThrow(new SQLException("broken pipe"));

        JdbcConnection jdbc = new JdbcConnection(connection, "SELECT 1", 2);

        SQLException ex = assertThrows(SQLException.class, jdbc::healthProbe);
        assertEquals("broken pipe", ex.getMessage());
    }

    @Test
    @DisplayName("Should report a closed connection as unhealthy")
    void testClosedProbe() throws SQLException {
        when(connection.isClosed()).thenReturn(true);

        assertFalse(new JdbcConnection(connection, null, 1).healthProbe());
        verify(connection, never()).isValid(anyInt());
    }

    @Test
    @DisplayName("Should not throw when closing fails")
    void testCloseFailure() throws SQLException {
        doThrow(new SQLException("already gone")).when(connection).close();

        JdbcConnection jdbc = new JdbcConnection(connection, null, 1);

        assertDoesNotThrow(jdbc::close);
        assertSame(connection, jdbc.unwrap());
    }
}
