package org.sqltx.datasource.dbcp;

import org.apache.commons.dbcp2.BasicDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqltx.datasource.ConnectionPool;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;

/**
 * {@link ConnectionPool} backed by a DBCP2 {@link BasicDataSource}.
 */
public class DbcpConnectionPool implements ConnectionPool {

    private static final Logger log = LoggerFactory.getLogger(DbcpConnectionPool.class);

    private final String name;
    private final BasicDataSource dataSource;

    DbcpConnectionPool(String name, BasicDataSource dataSource) {
        this.name = name;
        this.dataSource = dataSource;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Connection acquire() throws SQLException {
        return dataSource.getConnection();
    }

    @Override
    public void release(Connection connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Error returning connection to pool '{}': {}", name, e.getMessage());
        }
    }

    @Override
    public void invalidate(Connection connection) {
        if (connection == null) {
            return;
        }
        try {
            dataSource.invalidateConnection(connection);
            log.debug("Invalidated connection of pool '{}'", name);
        } catch (IllegalStateException e) {
            log.warn("Could not invalidate connection of pool '{}', closing it instead: {}", name, e.getMessage());
            release(connection);
        }
    }

    @Override
    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("poolName", name);
        stats.put("activeConnections", dataSource.getNumActive());
        stats.put("idleConnections", dataSource.getNumIdle());
        stats.put("totalConnections", dataSource.getNumActive() + dataSource.getNumIdle());
        stats.put("maxPoolSize", dataSource.getMaxTotal());
        stats.put("minIdle", dataSource.getMinIdle());
        stats.put("maxWaitMs", dataSource.getMaxWaitDuration().toMillis());
        stats.put("isClosed", dataSource.isClosed());
        return stats;
    }

    public BasicDataSource getDataSource() {
        return dataSource;
    }

    @Override
    public void close() {
        try {
            log.info("Closing DBCP pool '{}': active={}, idle={}", name, dataSource.getNumActive(), dataSource.getNumIdle());
            dataSource.close();
        } catch (SQLException e) {
            log.warn("Error closing DBCP pool '{}': {}", name, e.getMessage());
        }
    }
}
