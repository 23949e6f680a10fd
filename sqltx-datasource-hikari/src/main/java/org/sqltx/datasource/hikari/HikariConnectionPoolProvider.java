package org.sqltx.datasource.hikari;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqltx.datasource.ConnectionPool;
import org.sqltx.datasource.ConnectionPoolProvider;
import org.sqltx.datasource.PoolConfig;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;

/**
 * HikariCP implementation of {@link ConnectionPoolProvider}, the default provider.
 *
 * <h2>Configuration Mapping</h2>
 * <ul>
 *   <li>{@code url} → {@code jdbcUrl}</li>
 *   <li>{@code poolName} → {@code poolName}</li>
 *   <li>{@code maxPoolSize} → {@code maximumPoolSize}</li>
 *   <li>{@code minIdle} → {@code minimumIdle}</li>
 *   <li>{@code connectionTimeoutMs} → {@code connectionTimeout}</li>
 *   <li>{@code idleTimeoutMs} → {@code idleTimeout}</li>
 *   <li>{@code maxLifetimeMs} → {@code maxLifetime}</li>
 *   <li>{@code validationQuery} → {@code connectionTestQuery}</li>
 *   <li>{@code defaultTransactionIsolation} → {@code transactionIsolation}</li>
 * </ul>
 *
 * <p>Connections are handed out with auto-commit enabled; the transaction coordinators
 * switch it per use and the pool restores it on return.</p>
 */
public class HikariConnectionPoolProvider implements ConnectionPoolProvider {

    private static final Logger log = LoggerFactory.getLogger(HikariConnectionPoolProvider.class);

    public static final String PROVIDER_ID = "hikari";
    private static final int PRIORITY = 100;

    @Override
    public String id() {
        return PROVIDER_ID;
    }

    @Override
    public ConnectionPool createPool(PoolConfig config) throws SQLException {
        if (config == null) {
            throw new IllegalArgumentException("PoolConfig cannot be null");
        }

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setPoolName(config.getPoolName());
        hikariConfig.setJdbcUrl(config.getUrl());
        if (config.getUsername() != null) {
            hikariConfig.setUsername(config.getUsername());
        }
        String password = config.getPasswordAsString();
        if (password != null) {
            hikariConfig.setPassword(password);
        }
        if (config.getDriverClassName() != null) {
            hikariConfig.setDriverClassName(config.getDriverClassName());
        }

        hikariConfig.setMaximumPoolSize(config.getMaxPoolSize());
        hikariConfig.setMinimumIdle(config.getMinIdle());
        hikariConfig.setConnectionTimeout(config.getConnectionTimeoutMs());
        hikariConfig.setIdleTimeout(config.getIdleTimeoutMs());
        hikariConfig.setMaxLifetime(config.getMaxLifetimeMs());
        if (config.getValidationQuery() != null && !config.getValidationQuery().isEmpty()) {
            hikariConfig.setConnectionTestQuery(config.getValidationQuery());
        }
        hikariConfig.setAutoCommit(true);

        if (config.getDefaultTransactionIsolation() != null) {
            hikariConfig.setTransactionIsolation(isolationName(config.getDefaultTransactionIsolation()));
        }

        // Prepared branches may legitimately hold a connection for a long time; only warn after 5 minutes
        hikariConfig.setLeakDetectionThreshold(300000);
        hikariConfig.setValidationTimeout(5000);

        for (Map.Entry<String, String> entry : config.getProperties().entrySet()) {
            hikariConfig.addDataSourceProperty(entry.getKey(), entry.getValue());
        }

        log.info("Creating HikariCP pool '{}': url={}, maxPoolSize={}, minIdle={}, connectionTimeout={}ms",
                config.getPoolName(), config.getUrl(), hikariConfig.getMaximumPoolSize(),
                hikariConfig.getMinimumIdle(), hikariConfig.getConnectionTimeout());

        try {
            return new HikariConnectionPool(new HikariDataSource(hikariConfig));
        } catch (RuntimeException e) {
            log.error("Failed to create HikariCP pool '{}': {}", config.getPoolName(), e.getMessage(), e);
            throw new SQLException("Failed to create HikariCP pool '" + config.getPoolName() + "': " + e.getMessage(), e);
        }
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        try {
            Class.forName("com.zaxxer.hikari.HikariDataSource");
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    static String isolationName(int isolationLevel) {
        switch (isolationLevel) {
            case Connection.TRANSACTION_NONE:
                return "TRANSACTION_NONE";
            case Connection.TRANSACTION_READ_UNCOMMITTED:
                return "TRANSACTION_READ_UNCOMMITTED";
            case Connection.TRANSACTION_READ_COMMITTED:
                return "TRANSACTION_READ_COMMITTED";
            case Connection.TRANSACTION_REPEATABLE_READ:
                return "TRANSACTION_REPEATABLE_READ";
            case Connection.TRANSACTION_SERIALIZABLE:
                return "TRANSACTION_SERIALIZABLE";
            default:
                throw new IllegalArgumentException("Unknown transaction isolation level: " + isolationLevel);
        }
    }
}
