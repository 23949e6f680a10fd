package org.sqltx.commons.constants;

/**
 * Configuration keys and defaults shared across sqltx modules.
 */
public class CommonConstants {

    public static final String PROPERTIES_FILE = "sqltx.properties";
    public static final String DEFAULT_DATASOURCE_NAME = "default";

    // Connection pool property suffixes, read as [<datasource>.]sqltx.pool.<suffix>
    public static final String POOL_PREFIX = "sqltx.pool.";
    public static final String POOL_PROVIDER_PROPERTY = "sqltx.pool.provider";
    public static final String POOL_URL_PROPERTY = "sqltx.pool.url";
    public static final String POOL_USERNAME_PROPERTY = "sqltx.pool.username";
    public static final String POOL_PASSWORD_PROPERTY = "sqltx.pool.password";
    public static final String POOL_DRIVER_CLASS_PROPERTY = "sqltx.pool.driverClassName";
    public static final String POOL_MAX_SIZE_PROPERTY = "sqltx.pool.maxPoolSize";
    public static final String POOL_MIN_IDLE_PROPERTY = "sqltx.pool.minIdle";
    public static final String POOL_CONNECTION_TIMEOUT_PROPERTY = "sqltx.pool.connectionTimeoutMs";
    public static final String POOL_IDLE_TIMEOUT_PROPERTY = "sqltx.pool.idleTimeoutMs";
    public static final String POOL_MAX_LIFETIME_PROPERTY = "sqltx.pool.maxLifetimeMs";
    public static final String POOL_VALIDATION_QUERY_PROPERTY = "sqltx.pool.validationQuery";

    // Retrying transaction manager
    public static final String RETRY_MAX_RETRIES_PROPERTY = "sqltx.retry.maxRetries";
    public static final String RETRY_BASE_BACKOFF_MS_PROPERTY = "sqltx.retry.baseBackoffMs";
    public static final String RETRY_MAX_BACKOFF_MS_PROPERTY = "sqltx.retry.maxBackoffMs";
    public static final String RETRY_SQL_STATES_PROPERTY = "sqltx.retry.sqlStates";

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_BASE_BACKOFF_MS = 100L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 5000L;
}
