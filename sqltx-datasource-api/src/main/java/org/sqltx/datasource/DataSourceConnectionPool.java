package org.sqltx.datasource;

import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Adapts a plain {@link DataSource} to {@link ConnectionPool}.
 *
 * <p>Release closes the connection, which returns it to the underlying pool if the
 * data source pools. Invalidation aborts the physical connection first so a pooling
 * data source will discard it rather than reuse it.</p>
 */
@Slf4j
public class DataSourceConnectionPool implements ConnectionPool {

    private final String name;
    private final DataSource dataSource;
    private final AtomicInteger active = new AtomicInteger();

    public DataSourceConnectionPool(String name, DataSource dataSource) {
        if (dataSource == null) {
            throw new IllegalArgumentException("DataSource cannot be null");
        }
        this.name = name;
        this.dataSource = dataSource;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Connection acquire() throws SQLException {
        Connection connection = dataSource.getConnection();
        active.incrementAndGet();
        return connection;
    }

    @Override
    public void release(Connection connection) {
        if (connection == null) {
            return;
        }
        active.decrementAndGet();
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Error closing connection of pool '{}': {}", name, e.getMessage());
        }
    }

    @Override
    public void invalidate(Connection connection) {
        if (connection == null) {
            return;
        }
        active.decrementAndGet();
        try {
            connection.abort(Runnable::run);
        } catch (SQLException | RuntimeException e) {
            log.debug("Abort not supported for connection of pool '{}': {}", name, e.getMessage());
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Error closing invalidated connection of pool '{}': {}", name, e.getMessage());
        }
    }

    @Override
    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("poolName", name);
        stats.put("activeConnections", active.get());
        stats.put("idleConnections", 0);
        return stats;
    }

    @Override
    public void close() {
        if (dataSource instanceof AutoCloseable) {
            try {
                ((AutoCloseable) dataSource).close();
            } catch (Exception e) {
                log.warn("Error closing data source of pool '{}': {}", name, e.getMessage());
            }
        }
    }
}
