package org.sqltx.datasource.hikari;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqltx.datasource.ConnectionPool;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;

/**
 * {@link ConnectionPool} backed by a {@link HikariDataSource}. Invalidated connections are
 * evicted with {@link HikariDataSource#evictConnection(Connection)}.
 */
public class HikariConnectionPool implements ConnectionPool {

    private static final Logger log = LoggerFactory.getLogger(HikariConnectionPool.class);

    private final HikariDataSource dataSource;

    HikariConnectionPool(HikariDataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public String getName() {
        return dataSource.getPoolName();
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
            log.warn("Error returning connection to pool '{}': {}", getName(), e.getMessage());
        }
    }

    @Override
    public void invalidate(Connection connection) {
        if (connection == null) {
            return;
        }
        log.debug("Evicting connection from pool '{}'", getName());
        dataSource.evictConnection(connection);
    }

    @Override
    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("poolName", dataSource.getPoolName());
        stats.put("maxPoolSize", dataSource.getMaximumPoolSize());
        stats.put("minIdle", dataSource.getMinimumIdle());
        stats.put("isClosed", dataSource.isClosed());
        HikariPoolMXBean mxBean = dataSource.getHikariPoolMXBean();
        if (mxBean != null) {
            stats.put("activeConnections", mxBean.getActiveConnections());
            stats.put("idleConnections", mxBean.getIdleConnections());
            stats.put("totalConnections", mxBean.getTotalConnections());
            stats.put("threadsAwaitingConnection", mxBean.getThreadsAwaitingConnection());
        }
        return stats;
    }

    /**
     * @return the underlying data source
     */
    public HikariDataSource getDataSource() {
        return dataSource;
    }

    @Override
    public void close() {
        if (dataSource.isClosed()) {
            return;
        }
        log.info("Closing HikariCP pool '{}'", getName());
        dataSource.close();
    }
}
