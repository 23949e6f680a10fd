package org.sqltx.datasource;

import java.sql.SQLException;

/**
 * Service provider interface for connection pool implementations.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader}; register them
 * in {@code META-INF/services/org.sqltx.datasource.ConnectionPoolProvider}.</p>
 */
public interface ConnectionPoolProvider {

    /**
     * Unique id of the provider, used as {@link PoolConfig#getProviderId()}.
     */
    String id();

    /**
     * Creates and starts a pool.
     *
     * @param config the pool settings
     * @return the new pool
     * @throws SQLException if the pool cannot be created
     * @throws IllegalArgumentException if config is null
     */
    ConnectionPool createPool(PoolConfig config) throws SQLException;

    /**
     * Providers with a higher priority win when no provider is requested by id.
     */
    default int getPriority() {
        return 0;
    }

    /**
     * Whether the pool library is present on the classpath.
     */
    default boolean isAvailable() {
        return true;
    }
}
