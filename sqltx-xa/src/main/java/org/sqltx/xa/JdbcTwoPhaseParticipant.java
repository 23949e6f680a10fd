package org.sqltx.xa;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqltx.commons.SqlStates;
import org.sqltx.commons.exception.TransactionConnectionException;
import org.sqltx.datasource.ConnectionPool;
import org.sqltx.datasource.ConnectionPoolProviderRegistry;
import org.sqltx.datasource.PoolConfig;
import org.sqltx.xa.dialect.XaDialect;
import org.sqltx.xa.dialect.XaDialects;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * {@link TwoPhaseParticipant} issuing a {@link XaDialect}'s statements over pooled JDBC
 * connections.
 *
 * <h3>Connection handling</h3>
 * <ul>
 *   <li>{@code begin} borrows a connection and keeps it in the session until a terminal
 *       operation; auto-commit is switched on because the XA statements delimit the branch.</li>
 *   <li>After a successful terminal statement the connection goes back to the pool. If the
 *       terminal statement fails the session is consumed all the same and the connection is
 *       invalidated, since the backend state of its branch is unknown.</li>
 *   <li>Xid-keyed operations and recovery borrow a connection per call.</li>
 * </ul>
 *
 * <p>Thread-safe for distinct Xids.</p>
 */
public class JdbcTwoPhaseParticipant implements TwoPhaseParticipant {

    private static final Logger log = LoggerFactory.getLogger(JdbcTwoPhaseParticipant.class);

    private final XaDialect dialect;
    private final ConnectionPool pool;
    private final RecoveryScanner recoveryScanner;

    public JdbcTwoPhaseParticipant(XaDialect dialect, ConnectionPool pool) {
        if (dialect == null) {
            throw new IllegalArgumentException("dialect cannot be null");
        }
        if (pool == null) {
            throw new IllegalArgumentException("pool cannot be null");
        }
        this.dialect = dialect;
        this.pool = pool;
        this.recoveryScanner = new RecoveryScanner(dialect, pool);
    }

    /**
     * Creates a participant for the backend named by the config's JDBC url, with a pool from
     * the configured (or default) {@link org.sqltx.datasource.ConnectionPoolProvider}.
     *
     * @throws SQLException if no dialect is registered for the url or the pool cannot be created
     */
    public static JdbcTwoPhaseParticipant create(PoolConfig config) throws SQLException {
        XaDialect dialect = XaDialects.forJdbcUrl(config.getUrl())
                .orElseThrow(() -> new SQLException("No XA dialect available for url " + config.getUrl()));
        return new JdbcTwoPhaseParticipant(dialect, ConnectionPoolProviderRegistry.createPool(config));
    }

    public XaDialect getDialect() {
        return dialect;
    }

    public ConnectionPool getPool() {
        return pool;
    }

    @Override
    public XaSession begin(String xid) throws SQLException {
        log.debug("begin: xid={}", xid);
        // Rejects Xids the backend cannot represent before a connection is borrowed
        List<String> statements = dialect.startStatements(requireXid(xid));

        Connection connection = acquire(pool, "begin", xid);
        try {
            connection.setAutoCommit(true);
            execute(connection, statements);
        } catch (SQLException e) {
            log.error("Failed to start XA branch: xid={}", xid, e);
            pool.invalidate(connection);
            throw dialect.translate(e, xid, "begin");
        }
        log.info("XA branch started: xid={}", xid);
        return new XaSession(xid, connection, XaState.STARTED);
    }

    @Override
    public void end(XaSession session) throws SQLException {
        requireState(session, "end", XaState.STARTED);
        runOnSession(session, "end", dialect.endStatements(session.getXid()));
        session.advance(XaState.ENDED);
        log.debug("XA branch ended: xid={}", session.getXid());
    }

    @Override
    public void prepare(XaSession session) throws SQLException {
        requireState(session, "prepare", XaState.ENDED);
        runOnSession(session, "prepare", dialect.prepareStatements(session.getXid()));
        session.advance(XaState.PREPARED);
        log.info("XA branch prepared: xid={}", session.getXid());
    }

    @Override
    public void commit(XaSession session) throws SQLException {
        requireState(session, "commit", XaState.PREPARED);
        complete(session, "commit", dialect.commitStatements(session.getXid()), XaState.COMMITTED);
    }

    @Override
    public void commitOnePhase(XaSession session) throws SQLException {
        requireState(session, "commit one phase", XaState.ENDED);
        complete(session, "commit one phase", dialect.commitOnePhaseStatements(session.getXid()), XaState.COMMITTED);
    }

    @Override
    public void rollback(XaSession session) throws SQLException {
        requireNotConsumed(session, "rollback");
        XaState state = session.getState();
        if (!dialect.rollbackStates().contains(state)) {
            throw new InvalidXaStateException("rollback", session.getXid(), state, false);
        }
        complete(session, "rollback", dialect.rollbackStatements(session.getXid(), state), XaState.ROLLED_BACK);
    }

    @Override
    public void commitByXid(String xid) throws SQLException {
        runOnFreshConnection(xid, "commit", dialect.commitStatements(requireXid(xid)));
        log.info("XA branch committed by xid: xid={}", xid);
    }

    @Override
    public void rollbackByXid(String xid) throws SQLException {
        runOnFreshConnection(xid, "rollback", dialect.rollbackStatements(requireXid(xid), XaState.PREPARED));
        log.info("XA branch rolled back by xid: xid={}", xid);
    }

    @Override
    public List<TransactionInfo> listPreparedTransactions() throws SQLException {
        return recoveryScanner.scan();
    }

    @Override
    public Optional<TransactionInfo> findPreparedTransaction(String xid) throws SQLException {
        requireXid(xid);
        return listPreparedTransactions().stream()
                .filter(info -> xid.equals(info.getXid()))
                .findFirst();
    }

    @Override
    public int cleanupStaleTransactions(String prefix) throws SQLException {
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }
        return cleanupStaleTransactions(info -> info.getXid().startsWith(prefix));
    }

    @Override
    public int cleanupStaleTransactions(Predicate<TransactionInfo> stale) throws SQLException {
        int rolledBack = 0;
        for (TransactionInfo info : listPreparedTransactions()) {
            if (!stale.test(info)) {
                continue;
            }
            try {
                rollbackByXid(info.getXid());
                rolledBack++;
            } catch (SQLException e) {
                log.warn("Could not roll back stale XA transaction {}: {}", info.getXid(), e.getMessage());
            }
        }
        if (rolledBack > 0) {
            log.info("Rolled back {} stale XA transaction(s) on pool '{}'", rolledBack, pool.getName());
        }
        return rolledBack;
    }

    /**
     * Runs a non-terminal step on the session connection. On failure the session keeps its
     * state and connection so the caller can still roll it back.
     */
    private void runOnSession(XaSession session, String operation, List<String> statements) throws SQLException {
        try {
            execute(session.getConnection(), statements);
        } catch (SQLException e) {
            log.error("XA {} failed: xid={}", operation, session.getXid(), e);
            throw dialect.translate(e, session.getXid(), operation);
        }
    }

    private void complete(XaSession session, String operation, List<String> statements, XaState outcome) throws SQLException {
        Connection connection = session.getConnection();
        try {
            execute(connection, statements);
        } catch (SQLException e) {
            log.error("XA {} failed, discarding connection: xid={}", operation, session.getXid(), e);
            session.consume(null);
            pool.invalidate(connection);
            throw dialect.translate(e, session.getXid(), operation);
        }
        session.consume(outcome);
        pool.release(connection);
        log.info("XA branch {}: xid={}", outcome == XaState.COMMITTED ? "committed" : "rolled back", session.getXid());
    }

    private void runOnFreshConnection(String xid, String operation, List<String> statements) throws SQLException {
        Connection connection = acquire(pool, operation, xid);
        boolean healthy = true;
        try {
            connection.setAutoCommit(true);
            execute(connection, statements);
        } catch (SQLException e) {
            healthy = !SqlStates.isConnectionFailure(e);
            throw dialect.translate(e, xid, operation);
        } finally {
            if (healthy) {
                pool.release(connection);
            } else {
                pool.invalidate(connection);
            }
        }
    }

    static Connection acquire(ConnectionPool pool, String operation, String xid) throws TransactionConnectionException {
        try {
            return pool.acquire();
        } catch (SQLException e) {
            throw new TransactionConnectionException("Unable to obtain a connection from pool '" + pool.getName()
                    + "' for " + operation + (xid != null ? " of xid '" + xid + "'" : "") + ": " + e.getMessage(), e);
        }
    }

    private static void execute(Connection connection, List<String> statements) throws SQLException {
        if (statements.isEmpty()) {
            return;
        }
        try (Statement statement = connection.createStatement()) {
            for (String sql : statements) {
                log.debug("Executing: {}", sql);
                statement.execute(sql);
            }
        }
    }

    private static String requireXid(String xid) {
        if (xid == null || xid.isEmpty()) {
            throw new IllegalArgumentException("xid cannot be null or empty");
        }
        return xid;
    }

    private static void requireNotConsumed(XaSession session, String operation) throws InvalidXaStateException {
        if (session == null) {
            throw new IllegalArgumentException("session cannot be null");
        }
        if (session.isConsumed()) {
            throw new InvalidXaStateException(operation, session.getXid(), session.getState(), true);
        }
    }

    private static void requireState(XaSession session, String operation, XaState expected) throws InvalidXaStateException {
        requireNotConsumed(session, operation);
        if (session.getState() != expected) {
            throw new InvalidXaStateException(operation, session.getXid(), session.getState(), false);
        }
    }
}
