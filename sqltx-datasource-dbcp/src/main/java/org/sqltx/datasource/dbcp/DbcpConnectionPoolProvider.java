package org.sqltx.datasource.dbcp;

import org.apache.commons.dbcp2.BasicDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqltx.datasource.ConnectionPool;
import org.sqltx.datasource.ConnectionPoolProvider;
import org.sqltx.datasource.PoolConfig;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Map;

/**
 * Apache Commons DBCP2 implementation of {@link ConnectionPoolProvider}, id {@code "dbcp"}.
 *
 * <h2>Configuration Mapping</h2>
 * <ul>
 *   <li>{@code maxPoolSize} → {@code maxTotal} and {@code maxIdle}</li>
 *   <li>{@code minIdle} → {@code minIdle}</li>
 *   <li>{@code connectionTimeoutMs} → {@code maxWait}</li>
 *   <li>{@code idleTimeoutMs} → {@code minEvictableIdle}</li>
 *   <li>{@code maxLifetimeMs} → {@code maxConn}</li>
 *   <li>{@code validationQuery} → {@code validationQuery}, with test on borrow</li>
 * </ul>
 */
public class DbcpConnectionPoolProvider implements ConnectionPoolProvider {

    private static final Logger log = LoggerFactory.getLogger(DbcpConnectionPoolProvider.class);

    public static final String PROVIDER_ID = "dbcp";
    private static final int PRIORITY = 10;

    @Override
    public String id() {
        return PROVIDER_ID;
    }

    @Override
    public ConnectionPool createPool(PoolConfig config) throws SQLException {
        if (config == null) {
            throw new IllegalArgumentException("PoolConfig cannot be null");
        }

        BasicDataSource dataSource = new BasicDataSource();
        dataSource.setUrl(config.getUrl());
        if (config.getUsername() != null) {
            dataSource.setUsername(config.getUsername());
        }
        String password = config.getPasswordAsString();
        if (password != null) {
            dataSource.setPassword(password);
        }
        if (config.getDriverClassName() != null) {
            dataSource.setDriverClassName(config.getDriverClassName());
        }

        dataSource.setMaxTotal(config.getMaxPoolSize());
        dataSource.setMaxIdle(config.getMaxPoolSize());
        dataSource.setMinIdle(config.getMinIdle());

        dataSource.setMaxWait(Duration.ofMillis(config.getConnectionTimeoutMs()));
        dataSource.setMinEvictableIdle(Duration.ofMillis(config.getIdleTimeoutMs()));
        dataSource.setMaxConn(Duration.ofMillis(config.getMaxLifetimeMs()));
        dataSource.setDurationBetweenEvictionRuns(Duration.ofSeconds(30));
        dataSource.setNumTestsPerEvictionRun(3);

        if (config.getValidationQuery() != null && !config.getValidationQuery().isEmpty()) {
            dataSource.setValidationQuery(config.getValidationQuery());
            dataSource.setTestOnBorrow(true);
            dataSource.setTestWhileIdle(true);
        }

        // Coordinators toggle auto-commit per use; DBCP restores it on return
        dataSource.setDefaultAutoCommit(true);
        dataSource.setAutoCommitOnReturn(true);
        dataSource.setRollbackOnReturn(true);

        if (config.getDefaultTransactionIsolation() != null) {
            dataSource.setDefaultTransactionIsolation(config.getDefaultTransactionIsolation());
        }

        for (Map.Entry<String, String> entry : config.getProperties().entrySet()) {
            dataSource.addConnectionProperty(entry.getKey(), entry.getValue());
        }

        log.info("Created DBCP pool '{}': url={}, maxTotal={}, minIdle={}, maxWait={}ms",
                config.getPoolName(), config.getUrl(), dataSource.getMaxTotal(),
                dataSource.getMinIdle(), config.getConnectionTimeoutMs());

        return new DbcpConnectionPool(config.getPoolName(), dataSource);
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        try {
            Class.forName("org.apache.commons.dbcp2.BasicDataSource");
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }
}
