package org.sqltx.xa;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.sqltx.commons.exception.TransactionConnectionException;
import org.sqltx.xa.dialect.MySqlXaDialect;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Branch lifecycle of {@link JdbcTwoPhaseParticipant} against an in-memory MySQL XA backend.
 */
class JdbcTwoPhaseParticipantTest {

    private FakeMySqlXaBackend backend;
    private JdbcTwoPhaseParticipant participant;

    @BeforeEach
    void setUp() {
        backend = new FakeMySqlXaBackend();
        participant = new JdbcTwoPhaseParticipant(new MySqlXaDialect(), backend);
    }

    @Test
    @DisplayName("commit straight after begin is rejected before reaching the backend")
    void testCommitWithoutPrepareIsInvalidState() throws SQLException {
        XaSession session = participant.begin("tx-1");

        InvalidXaStateException e = assertThrows(InvalidXaStateException.class, () -> participant.commit(session));

        assertEquals(XaState.STARTED, e.getState());
        assertEquals("XAE09", e.getSQLState());
        assertEquals(XaState.STARTED, session.getState());
        assertFalse(session.isConsumed());
        assertEquals(List.of("XA START 'tx-1'"), backend.executed);
        assertEquals(1, backend.outstanding());
    }

    @Test
    @DisplayName("begin, end, prepare, commit succeeds and a second commit by xid finds nothing")
    void testFullTwoPhaseCommit() throws SQLException {
        XaSession session = participant.begin("tx-2");
        participant.end(session);
        assertEquals(XaState.ENDED, session.getState());
        participant.prepare(session);
        assertEquals(XaState.PREPARED, session.getState());
        participant.commit(session);

        assertEquals(XaState.COMMITTED, session.getState());
        assertTrue(session.isConsumed());
        assertThrows(IllegalStateException.class, session::getConnection);
        assertEquals(List.of("tx-2"), backend.committed);
        assertEquals(0, backend.outstanding());
        assertEquals(1, backend.released);

        NoSuchTransactionException e = assertThrows(NoSuchTransactionException.class, () -> participant.commitByXid("tx-2"));
        assertEquals("tx-2", e.getXid());
        assertEquals(0, backend.outstanding());
    }

    @Test
    @DisplayName("one-phase commit works from ENDED without a prepare")
    void testCommitOnePhase() throws SQLException {
        XaSession session = participant.begin("solo");
        participant.end(session);
        participant.commitOnePhase(session);

        assertEquals(XaState.COMMITTED, session.getState());
        assertEquals(List.of("XA START 'solo'", "XA END 'solo'", "XA COMMIT 'solo' ONE PHASE"), backend.executed);
        assertEquals(List.of("solo"), backend.committed);
    }

    @Test
    @DisplayName("one-phase commit from PREPARED is an invalid state")
    void testCommitOnePhaseAfterPrepare() throws SQLException {
        XaSession session = participant.begin("prepared-solo");
        participant.end(session);
        participant.prepare(session);

        assertThrows(InvalidXaStateException.class, () -> participant.commitOnePhase(session));
        assertEquals(XaState.PREPARED, session.getState());
    }

    @Test
    @DisplayName("prepare is only accepted from ENDED")
    void testPrepareRequiresEnded() throws SQLException {
        XaSession session = participant.begin("early");

        assertThrows(InvalidXaStateException.class, () -> participant.prepare(session));
        assertEquals(1, backend.executed.size());
    }

    @Test
    @DisplayName("Xids with quotes, backslashes and NUL reach the backend unchanged")
    void testEscapingRoundTrip() throws SQLException {
        String xid = "it's a \\path\\ with '' and \0 end";
        XaSession session = participant.begin(xid);
        participant.end(session);
        participant.prepare(session);

        Optional<TransactionInfo> found = participant.findPreparedTransaction(xid);
        assertTrue(found.isPresent());
        assertEquals(xid, found.get().getXid());

        participant.commitByXid(xid);
        assertEquals(List.of(xid), backend.committed);
    }

    @Test
    @DisplayName("rollback from STARTED ends the branch first")
    void testRollbackFromStarted() throws SQLException {
        XaSession session = participant.begin("abort-early");
        participant.rollback(session);

        assertEquals(XaState.ROLLED_BACK, session.getState());
        assertEquals(List.of("XA START 'abort-early'", "XA END 'abort-early'", "XA ROLLBACK 'abort-early'"), backend.executed);
        assertEquals(List.of("abort-early"), backend.rolledBack);
        assertEquals(1, backend.released);
    }

    @Test
    @DisplayName("rollback of a prepared branch")
    void testRollbackPrepared() throws SQLException {
        XaSession session = participant.begin("abort-late");
        participant.end(session);
        participant.prepare(session);
        participant.rollback(session);

        assertEquals(List.of("abort-late"), backend.rolledBack);
        assertTrue(backend.branches.isEmpty());
    }

    @Test
    @DisplayName("every operation on a consumed session is an invalid state")
    void testConsumedSession() throws SQLException {
        XaSession session = participant.begin("done");
        participant.end(session);
        participant.commitOnePhase(session);

        assertThrows(InvalidXaStateException.class, () -> participant.rollback(session));
        assertThrows(InvalidXaStateException.class, () -> participant.commit(session));
        assertThrows(InvalidXaStateException.class, () -> participant.end(session));
        assertEquals(1, backend.released);
    }

    @Test
    @DisplayName("duplicate Xid is a protocol error and the new connection is discarded")
    void testDuplicateXid() throws SQLException {
        participant.begin("dup");

        XaProtocolException e = assertThrows(XaProtocolException.class, () -> participant.begin("dup"));

        assertEquals("XAE08", e.getSQLState());
        assertEquals(1440, e.getErrorCode());
        assertEquals(1, backend.invalidated);
        assertEquals(1, backend.outstanding());
    }

    @Test
    @DisplayName("failed prepare leaves the session in ENDED so it can be rolled back")
    void testPrepareFailureKeepsSession() throws SQLException {
        XaSession session = participant.begin("vote-no");
        participant.end(session);
        backend.failOn("PREPARE", "vote-no", new SQLException("XA_RBROLLBACK: Transaction branch was rolled back", "XA100", 1402));

        assertThrows(XaProtocolException.class, () -> participant.prepare(session));

        assertEquals(XaState.ENDED, session.getState());
        assertFalse(session.isConsumed());
        participant.rollback(session);
        assertEquals(List.of("vote-no"), backend.rolledBack);
    }

    @Test
    @DisplayName("failed commit consumes the session and invalidates its connection")
    void testCommitConnectionFailure() throws SQLException {
        XaSession session = participant.begin("lost");
        participant.end(session);
        participant.prepare(session);
        backend.failOn("COMMIT", "lost", new SQLException("Communications link failure", "08S01"));

        TransactionConnectionException e = assertThrows(TransactionConnectionException.class, () -> participant.commit(session));

        assertEquals("08S01", e.getSQLState());
        assertTrue(session.isConsumed());
        assertEquals(XaState.PREPARED, session.getState());
        assertEquals(1, backend.invalidated);
        assertEquals(0, backend.outstanding());
        // The branch is still prepared on the backend and can be finished by Xid
        participant.commitByXid("lost");
        assertEquals(List.of("lost"), backend.committed);
    }

    @Test
    @DisplayName("unrecognised backend errors propagate unchanged")
    void testFatalErrorUnchanged() throws SQLException {
        XaSession session = participant.begin("odd");
        SQLException disk = new SQLException("Disk full", "HY000", 1021);
        backend.failOn("END", "odd", disk);

        SQLException e = assertThrows(SQLException.class, () -> participant.end(session));

        assertSame(disk, e);
        assertEquals(XaState.STARTED, session.getState());
    }

    @Test
    @DisplayName("pool failure surfaces as a connection error")
    void testAcquireFailure() {
        backend.acquireFailure = new SQLTransientConnectionException("Connection is not available, request timed out after 30000ms.");

        TransactionConnectionException e = assertThrows(TransactionConnectionException.class, () -> participant.begin("nope"));

        assertEquals("08001", e.getSQLState());
        assertTrue(e.getMessage().contains("fake-mysql"));
    }

    @Test
    @DisplayName("Xid longer than the backend allows is rejected without borrowing a connection")
    void testXidTooLong() {
        String xid = "x".repeat(65);

        XaProtocolException e = assertThrows(XaProtocolException.class, () -> participant.begin(xid));

        assertEquals("XAE00", e.getSQLState());
        assertEquals(0, backend.acquired);
    }

    @Test
    @DisplayName("empty Xid is rejected")
    void testEmptyXid() {
        assertThrows(IllegalArgumentException.class, () -> participant.begin(""));
        assertThrows(IllegalArgumentException.class, () -> participant.commitByXid(null));
    }

    @Test
    @DisplayName("rollback by xid of an unknown branch is not found")
    void testRollbackByXidUnknown() {
        assertThrows(NoSuchTransactionException.class, () -> participant.rollbackByXid("ghost"));
        assertEquals(0, backend.outstanding());
    }

    @Test
    @DisplayName("recovery lists only prepared branches")
    void testListPreparedTransactions() throws SQLException {
        backend.seedPrepared("a", "b");
        participant.begin("still-active");

        List<TransactionInfo> prepared = participant.listPreparedTransactions();

        assertEquals(2, prepared.size());
        assertEquals("a", prepared.get(0).getXid());
        assertEquals(1, prepared.get(0).getFormatId());
        assertEquals(1, prepared.get(0).getGtridLength());
        assertEquals(0, prepared.get(0).getBqualLength());
        assertEquals(Optional.empty(), participant.findPreparedTransaction("still-active"));
    }

    @Test
    @DisplayName("cleanup rolls back exactly the prefixed branches")
    void testCleanupStaleTransactions() throws SQLException {
        backend.seedPrepared("job_1", "job_2", "other");

        int cleaned = participant.cleanupStaleTransactions("job_");

        assertEquals(2, cleaned);
        assertEquals(List.of("job_1", "job_2"), backend.rolledBack);
        assertEquals(List.of("other"), List.copyOf(backend.branches.keySet()));
        assertEquals(0, backend.outstanding());
    }

    @Test
    @DisplayName("cleanup swallows individual failures and counts only successful rollbacks")
    void testCleanupSwallowsFailures() throws SQLException {
        backend.seedPrepared("job_1", "job_2", "other");
        backend.failOn("ROLLBACK", "job_1", new SQLException("Lock wait timeout exceeded", "HY000", 1205));

        int cleaned = participant.cleanupStaleTransactions("job_");

        assertEquals(1, cleaned);
        assertEquals(List.of("job_2"), backend.rolledBack);
        assertTrue(backend.branches.containsKey("job_1"));
    }

    @Test
    @DisplayName("cleanup accepts a custom staleness rule")
    void testCleanupWithPredicate() throws SQLException {
        backend.seedPrepared("job_1", "job_22", "other");

        int cleaned = participant.cleanupStaleTransactions(info -> info.getGtridLength() > 5);

        assertEquals(1, cleaned);
        assertEquals(List.of("job_22"), backend.rolledBack);
    }

    @Test
    @DisplayName("backslashes survive recovery and cleanup on a NO_BACKSLASH_ESCAPES server")
    void testNoBackslashEscapesRoundTrip() throws SQLException {
        FakeMySqlXaBackend literalServer = new FakeMySqlXaBackend(false);
        JdbcTwoPhaseParticipant literal = new JdbcTwoPhaseParticipant(new MySqlXaDialect(false), literalServer);
        String xid = "c:\\batch\\job_1\\";

        XaSession session = literal.begin(xid);
        literal.end(session);
        literal.prepare(session);

        assertEquals(List.of("XA START 'c:\\batch\\job_1\\'", "XA END 'c:\\batch\\job_1\\'",
                "XA PREPARE 'c:\\batch\\job_1\\'"), literalServer.executed);
        assertEquals(xid, literal.findPreparedTransaction(xid).orElseThrow().getXid());
        assertEquals(1, literal.cleanupStaleTransactions("c:\\batch\\"));
        assertEquals(List.of(xid), literalServer.rolledBack);
    }

    @Test
    @DisplayName("escaping backslashes for a NO_BACKSLASH_ESCAPES server stores a different Xid")
    void testBackslashEscapesMismatch() throws SQLException {
        FakeMySqlXaBackend literalServer = new FakeMySqlXaBackend(false);
        JdbcTwoPhaseParticipant escaping = new JdbcTwoPhaseParticipant(new MySqlXaDialect(), literalServer);
        String xid = "c:\\batch";

        XaSession session = escaping.begin(xid);
        escaping.end(session);
        escaping.prepare(session);

        assertTrue(escaping.findPreparedTransaction(xid).isEmpty());
        assertTrue(literalServer.branches.containsKey("c:\\\\batch"));
    }
}
