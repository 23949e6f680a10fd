package org.sqltx.xa;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.sqltx.commons.exception.TransactionConnectionException;
import org.sqltx.datasource.ConnectionPool;
import org.sqltx.xa.dialect.PostgresXaDialect;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * PostgreSQL branches run as ordinary transactions that become prepared transactions.
 */
class PostgresTwoPhaseParticipantTest {

    private ConnectionPool pool;
    private Connection connection;
    private Statement statement;
    private JdbcTwoPhaseParticipant participant;

    @BeforeEach
    void setUp() throws SQLException {
        pool = mock(ConnectionPool.class);
        connection = mock(Connection.class);
        statement = mock(Statement.class);
        when(pool.getName()).thenReturn("pg");
        when(pool.acquire()).thenReturn(connection);
        when(connection.createStatement()).thenReturn(statement);
        participant = new JdbcTwoPhaseParticipant(new PostgresXaDialect(), pool);
    }

    @Test
    @DisplayName("two-phase commit issues BEGIN, PREPARE TRANSACTION and COMMIT PREPARED")
    void testTwoPhaseCommit() throws SQLException {
        XaSession session = participant.begin("pg-tx");
        participant.end(session);
        participant.prepare(session);
        participant.commit(session);

        InOrder order = inOrder(connection, statement, pool);
        order.verify(connection).setAutoCommit(true);
        order.verify(statement).execute("BEGIN");
        order.verify(statement).execute("PREPARE TRANSACTION 'pg-tx'");
        order.verify(statement).execute("COMMIT PREPARED 'pg-tx'");
        order.verify(pool).release(connection);
        verify(statement, times(3)).execute(anyString());
        assertEquals(XaState.COMMITTED, session.getState());
        assertTrue(session.isConsumed());
    }

    @Test
    @DisplayName("end is a local state change only")
    void testEndIssuesNothing() throws SQLException {
        XaSession session = participant.begin("pg-end");
        clearInvocations(statement);

        participant.end(session);

        verifyNoInteractions(statement);
        assertEquals(XaState.ENDED, session.getState());
    }

    @Test
    @DisplayName("one-phase commit is a plain COMMIT")
    void testOnePhase() throws SQLException {
        XaSession session = participant.begin("pg-1pc");
        participant.end(session);
        participant.commitOnePhase(session);

        verify(statement).execute("COMMIT");
        verify(pool).release(connection);
    }

    @Test
    @DisplayName("rollback before prepare is a plain ROLLBACK")
    void testRollbackActive() throws SQLException {
        XaSession session = participant.begin("pg-rb");
        participant.rollback(session);

        verify(statement).execute("ROLLBACK");
        verify(statement, never()).execute("ROLLBACK PREPARED 'pg-rb'");
        assertEquals(XaState.ROLLED_BACK, session.getState());
    }

    @Test
    @DisplayName("rollback after prepare uses ROLLBACK PREPARED")
    void testRollbackPrepared() throws SQLException {
        XaSession session = participant.begin("pg-rbp");
        participant.end(session);
        participant.prepare(session);
        participant.rollback(session);

        verify(statement).execute("ROLLBACK PREPARED 'pg-rbp'");
    }

    @Test
    @DisplayName("commit of an unknown prepared transaction maps 42704 to not found")
    void testCommitByXidUnknown() throws SQLException {
        when(statement.execute("COMMIT PREPARED 'nope'"))
                .thenThrow(new SQLException("prepared transaction with identifier \"nope\" does not exist", "42704"));

        NoSuchTransactionException e = assertThrows(NoSuchTransactionException.class, () -> participant.commitByXid("nope"));

        assertEquals("nope", e.getXid());
        verify(pool).release(connection);
        verify(pool, never()).invalidate(connection);
    }

    @Test
    @DisplayName("a lost connection during COMMIT PREPARED discards the connection")
    void testCommitByXidConnectionLost() throws SQLException {
        when(statement.execute("COMMIT PREPARED 'lost'"))
                .thenThrow(new SQLException("An I/O error occurred while sending to the backend", "08006"));

        assertThrows(TransactionConnectionException.class, () -> participant.commitByXid("lost"));

        verify(pool).invalidate(connection);
        verify(pool, never()).release(connection);
    }

    @Test
    @DisplayName("prepare refused by the server keeps the session usable")
    void testPrepareDisabled() throws SQLException {
        when(statement.execute("PREPARE TRANSACTION 'pg-off'"))
                .thenThrow(new SQLException("prepared transactions are disabled", "55000"));
        XaSession session = participant.begin("pg-off");
        participant.end(session);

        XaProtocolException e = assertThrows(XaProtocolException.class, () -> participant.prepare(session));

        assertEquals("55000", e.getSQLState());
        assertEquals(XaState.ENDED, session.getState());
        assertFalse(session.isConsumed());
        participant.rollback(session);
        verify(statement).execute("ROLLBACK");
    }
}
