package org.sqltx.retry;

import lombok.extern.slf4j.Slf4j;
import org.sqltx.commons.SqlStates;
import org.sqltx.commons.exception.TransactionConnectionException;
import org.sqltx.commons.exception.TransactionException;
import org.sqltx.datasource.ConnectionPool;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs units of work in serializable transactions and retries them when the backend reports
 * a serialization conflict, the way CockroachDB expects clients to.
 *
 * <p>Each attempt borrows a connection, switches auto-commit off, runs the work and commits.
 * A conflict raised by the work or by the commit rolls the attempt back and, after an
 * exponential backoff, runs the whole work again. Any other error is rethrown unchanged
 * after the rollback. Conflicts are recognised by SQLSTATE anywhere in the exception's cause
 * chain.</p>
 *
 * <p>Thread-safe; every call uses its own connection.</p>
 */
@Slf4j
public class RetryingTransactionManager {

    static final String VERSION_QUERY = "SELECT version()";
    static final String SHOW_REGIONS = "SHOW REGIONS";

    /** Operation canceled. */
    static final String INTERRUPTED_SQL_STATE = "HY008";

    private final ConnectionPool pool;
    private final RetryConfig config;

    public RetryingTransactionManager(ConnectionPool pool) {
        this(pool, RetryConfig.defaults());
    }

    public RetryingTransactionManager(ConnectionPool pool, RetryConfig config) {
        if (pool == null) {
            throw new IllegalArgumentException("pool cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.pool = pool;
        this.config = config;
    }

    public ConnectionPool getPool() {
        return pool;
    }

    public RetryConfig getConfig() {
        return config;
    }

    /**
     * Runs {@code work} in a transaction, retrying it on serialization conflicts.
     *
     * @return the result of the attempt that committed
     * @throws RetryExhaustedException if {@code maxRetries + 1} attempts all conflicted
     * @throws SQLException            the first non-retryable error, unchanged
     */
    public <T> T executeWithRetry(TransactionWork<T> work) throws SQLException {
        return execute(null, work);
    }

    /**
     * Same as {@link #executeWithRetry(TransactionWork)} with the transaction priority set at
     * the start of every attempt.
     */
    public <T> T executeWithPriority(TransactionPriority priority, TransactionWork<T> work) throws SQLException {
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        return execute(priority, work);
    }

    /**
     * Reads the server version and, where supported, the database regions.
     */
    public ClusterInfo getClusterInfo() throws SQLException {
        Connection connection = acquire();
        boolean healthy = true;
        try (Statement statement = connection.createStatement()) {
            String fullVersion;
            try (ResultSet rs = statement.executeQuery(VERSION_QUERY)) {
                if (!rs.next()) {
                    throw new SQLException("version() returned no row");
                }
                fullVersion = rs.getString(1);
            }
            List<String> regions = new ArrayList<>();
            try (ResultSet rs = statement.executeQuery(SHOW_REGIONS)) {
                while (rs.next()) {
                    regions.add(rs.getString(1));
                }
            } catch (SQLException e) {
                if (SqlStates.isConnectionFailure(e)) {
                    throw e;
                }
                log.debug("Regions not available on pool '{}': {}", pool.getName(), e.getMessage());
                regions.clear();
            }
            ClusterInfo info = new ClusterInfo(ClusterInfo.parseVersion(fullVersion), fullVersion, regions);
            log.debug("Cluster info for pool '{}': {}", pool.getName(), info);
            return info;
        } catch (SQLException e) {
            healthy = !SqlStates.isConnectionFailure(e);
            throw e;
        } finally {
            handBack(connection, healthy);
        }
    }

    /**
     * @see AsOfSystemTime#apply(String, String)
     */
    public String asOfSystemTimeSql(String query, String interval) {
        return AsOfSystemTime.apply(query, interval);
    }

    private <T> T execute(TransactionPriority priority, TransactionWork<T> work) throws SQLException {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        int maxAttempts = config.getMaxRetries() + 1;
        SQLException lastConflict = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                backoff(attempt - 1);
            }
            try {
                T result = runAttempt(priority, work);
                if (attempt > 1) {
                    log.info("Transaction committed on attempt {}", attempt);
                }
                return result;
            } catch (SQLException e) {
                if (!isRetryable(e)) {
                    throw e;
                }
                lastConflict = e;
                log.debug("Serialization conflict on attempt {}/{}: {}", attempt, maxAttempts, e.getMessage());
            }
        }
        log.warn("Giving up after {} attempts, last conflict: {}", maxAttempts, lastConflict.getMessage());
        throw new RetryExhaustedException(maxAttempts, lastConflict);
    }

    private <T> T runAttempt(TransactionPriority priority, TransactionWork<T> work) throws SQLException {
        Connection connection = acquire();
        boolean healthy = true;
        try {
            connection.setAutoCommit(false);
            try {
                if (priority != null) {
                    try (Statement statement = connection.createStatement()) {
                        statement.execute(priority.toSql());
                    }
                }
                T result = work.execute(connection);
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                healthy = rollback(connection, e);
                throw e;
            }
        } catch (SQLException e) {
            healthy = healthy && !SqlStates.isConnectionFailure(e);
            throw e;
        } finally {
            healthy = healthy && restoreAutoCommit(connection);
            handBack(connection, healthy);
        }
    }

    /**
     * @return false if the connection cannot be trusted afterwards
     */
    private boolean rollback(Connection connection, Exception cause) {
        try {
            connection.rollback();
            return true;
        } catch (SQLException e) {
            log.warn("Rollback failed: {}", e.getMessage());
            cause.addSuppressed(e);
            return false;
        }
    }

    private boolean restoreAutoCommit(Connection connection) {
        try {
            connection.setAutoCommit(true);
            return true;
        } catch (SQLException e) {
            log.debug("Could not restore auto-commit, discarding connection: {}", e.getMessage());
            return false;
        }
    }

    private boolean isRetryable(SQLException e) {
        return SqlStates.hasSqlState(e, config.getRetryableSqlStates());
    }

    private void backoff(int retry) throws TransactionException {
        long delay = config.backoffMillis(retry);
        try {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException();
            }
            if (delay > 0) {
                log.debug("Backing off {} ms before retry {}", delay, retry);
                Thread.sleep(delay);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransactionException("Interrupted while waiting to retry the transaction", INTERRUPTED_SQL_STATE, e);
        }
    }

    private Connection acquire() throws TransactionConnectionException {
        try {
            return pool.acquire();
        } catch (SQLException e) {
            throw new TransactionConnectionException("Unable to obtain a connection from pool '" + pool.getName()
                    + "': " + e.getMessage(), e);
        }
    }

    private void handBack(Connection connection, boolean healthy) {
        if (healthy) {
            pool.release(connection);
        } else {
            pool.invalidate(connection);
        }
    }
}
