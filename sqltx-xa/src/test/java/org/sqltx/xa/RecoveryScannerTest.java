package org.sqltx.xa;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.sqltx.commons.exception.TransactionConnectionException;
import org.sqltx.datasource.ConnectionPool;
import org.sqltx.xa.dialect.PostgresXaDialect;

import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RecoveryScannerTest {

    @Test
    @DisplayName("rows of the recovery query become TransactionInfo entries")
    void testScan() throws SQLException {
        ConnectionPool pool = mock(ConnectionPool.class);
        Connection connection = mock(Connection.class);
        Statement statement = mock(Statement.class);
        ResultSet rs = mock(ResultSet.class);
        when(pool.acquire()).thenReturn(connection);
        when(connection.createStatement()).thenReturn(statement);
        when(statement.executeQuery(new PostgresXaDialect().recoveryQuery())).thenReturn(rs);

        byte[] first = "batch-1".getBytes(StandardCharsets.UTF_8);
        byte[] second = "batch-2".getBytes(StandardCharsets.UTF_8);
        when(rs.next()).thenReturn(true, true, false);
        when(rs.getInt("formatID")).thenReturn(1, 1);
        when(rs.getInt("gtrid_length")).thenReturn(first.length, second.length);
        when(rs.getInt("bqual_length")).thenReturn(0, 0);
        when(rs.getBytes("data")).thenReturn(first, second);

        List<TransactionInfo> prepared = new RecoveryScanner(new PostgresXaDialect(), pool).scan();

        assertEquals(2, prepared.size());
        assertEquals("batch-1", prepared.get(0).getXid());
        assertEquals("batch-2", prepared.get(1).getXid());
        verify(pool).release(connection);
        verify(rs).close();
        verify(statement).close();
    }

    @Test
    @DisplayName("connection failure during recovery invalidates the connection")
    void testScanConnectionFailure() throws SQLException {
        ConnectionPool pool = mock(ConnectionPool.class);
        Connection connection = mock(Connection.class);
        when(pool.getName()).thenReturn("pg");
        when(pool.acquire()).thenReturn(connection);
        when(connection.createStatement()).thenThrow(new SQLException("This connection has been closed.", "08003"));

        assertThrows(TransactionConnectionException.class,
                () -> new RecoveryScanner(new PostgresXaDialect(), pool).scan());

        verify(pool).invalidate(connection);
        verify(pool, never()).release(connection);
    }
}
