package org.sqltx.datasource;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;

/**
 * Source of exclusive connections to one backend.
 *
 * <p>A connection obtained from {@link #acquire()} belongs to the caller until it is
 * handed back through exactly one of {@link #release(Connection)} or
 * {@link #invalidate(Connection)}. Callers use {@code invalidate} when the backend
 * side of the connection is in an unknown state (for example after a failed
 * {@code XA COMMIT}) so the pool never hands it out again.</p>
 */
public interface ConnectionPool extends AutoCloseable {

    /**
     * @return the pool name used in logs
     */
    String getName();

    /**
     * Borrows a connection, waiting at most the configured connection timeout.
     *
     * @return an exclusive connection
     * @throws SQLException if no connection can be obtained
     */
    Connection acquire() throws SQLException;

    /**
     * Returns a healthy connection to the pool.
     */
    void release(Connection connection);

    /**
     * Removes a connection from the pool and closes it.
     */
    void invalidate(Connection connection);

    /**
     * Runtime statistics. Keys are provider specific; {@code activeConnections} and
     * {@code idleConnections} are reported by all shipped providers.
     */
    Map<String, Object> getStatistics();

    /**
     * Closes the pool and all idle connections.
     */
    @Override
    void close();
}
