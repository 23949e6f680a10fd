package org.sqltx.datasource;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Provider-neutral settings for one backend connection pool.
 *
 * <p>Instances are immutable and built once, before the pool is created:</p>
 * <pre>{@code
 * PoolConfig config = PoolConfig.builder()
 *     .poolName("orders-mysql")
 *     .url("jdbc:mysql://db1:3306/orders")
 *     .username("app")
 *     .password("secret".toCharArray())
 *     .maxPoolSize(20)
 *     .build();
 * }</pre>
 *
 * <p>The password is held as a {@code char[]} (or obtained from a supplier on every
 * read, for secret managers) and never appears in {@link #toString()}.</p>
 */
public final class PoolConfig {

    public static final int DEFAULT_MAX_POOL_SIZE = 10;
    public static final int DEFAULT_MIN_IDLE = 2;
    public static final long DEFAULT_CONNECTION_TIMEOUT_MS = 30000L;
    public static final long DEFAULT_IDLE_TIMEOUT_MS = 600000L;
    public static final long DEFAULT_MAX_LIFETIME_MS = 1800000L;

    private final String poolName;
    private final String providerId;
    private final String url;
    private final String username;
    private final char[] password;
    private final Supplier<char[]> passwordSupplier;
    private final String driverClassName;
    private final int maxPoolSize;
    private final int minIdle;
    private final long connectionTimeoutMs;
    private final long idleTimeoutMs;
    private final long maxLifetimeMs;
    private final String validationQuery;
    private final Integer defaultTransactionIsolation;
    private final Map<String, String> properties;

    private PoolConfig(Builder builder) {
        this.poolName = builder.poolName;
        this.providerId = builder.providerId;
        this.url = builder.url;
        this.username = builder.username;
        this.password = builder.password != null ? builder.password.clone() : null;
        this.passwordSupplier = builder.passwordSupplier;
        this.driverClassName = builder.driverClassName;
        this.maxPoolSize = builder.maxPoolSize;
        this.minIdle = builder.minIdle;
        this.connectionTimeoutMs = builder.connectionTimeoutMs;
        this.idleTimeoutMs = builder.idleTimeoutMs;
        this.maxLifetimeMs = builder.maxLifetimeMs;
        this.validationQuery = builder.validationQuery;
        this.defaultTransactionIsolation = builder.defaultTransactionIsolation;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Name used for the pool in logs and statistics; never null.
     */
    public String getPoolName() {
        return poolName;
    }

    /**
     * Id of the {@link ConnectionPoolProvider} that should build the pool, or null for
     * the highest priority available provider.
     */
    public String getProviderId() {
        return providerId;
    }

    public String getUrl() {
        return url;
    }

    public String getUsername() {
        return username;
    }

    /**
     * Returns a copy of the password, asking the supplier again if one was configured.
     *
     * @return the password, or null if none is configured
     */
    public char[] getPassword() {
        char[] source = passwordSupplier != null ? passwordSupplier.get() : password;
        return source != null ? source.clone() : null;
    }

    public String getPasswordAsString() {
        char[] pwd = getPassword();
        return pwd != null ? new String(pwd) : null;
    }

    public String getDriverClassName() {
        return driverClassName;
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    public int getMinIdle() {
        return minIdle;
    }

    /**
     * Maximum time {@link ConnectionPool#acquire()} waits for a free connection.
     */
    public long getConnectionTimeoutMs() {
        return connectionTimeoutMs;
    }

    public long getIdleTimeoutMs() {
        return idleTimeoutMs;
    }

    public long getMaxLifetimeMs() {
        return maxLifetimeMs;
    }

    public String getValidationQuery() {
        return validationQuery;
    }

    /**
     * Isolation level restored on every connection returned to the pool, or null to keep
     * the driver default.
     */
    public Integer getDefaultTransactionIsolation() {
        return defaultTransactionIsolation;
    }

    /**
     * Driver specific connection properties, passed through untouched.
     */
    public Map<String, String> getProperties() {
        return properties;
    }

    /**
     * Overwrites the stored password. Has no effect on a password supplier.
     */
    public void clearPassword() {
        if (password != null) {
            Arrays.fill(password, '\0');
        }
    }

    @Override
    public String toString() {
        return "PoolConfig{" +
                "poolName='" + poolName + '\'' +
                ", providerId='" + providerId + '\'' +
                ", url='" + url + '\'' +
                ", username='" + username + '\'' +
                ", password='****'" +
                ", maxPoolSize=" + maxPoolSize +
                ", minIdle=" + minIdle +
                ", connectionTimeoutMs=" + connectionTimeoutMs +
                ", idleTimeoutMs=" + idleTimeoutMs +
                ", maxLifetimeMs=" + maxLifetimeMs +
                ", defaultTransactionIsolation=" + defaultTransactionIsolation +
                ", properties=" + properties.keySet() +
                '}';
    }

    public static final class Builder {
        private String poolName;
        private String providerId;
        private String url;
        private String username;
        private char[] password;
        private Supplier<char[]> passwordSupplier;
        private String driverClassName;
        private int maxPoolSize = DEFAULT_MAX_POOL_SIZE;
        private int minIdle = DEFAULT_MIN_IDLE;
        private long connectionTimeoutMs = DEFAULT_CONNECTION_TIMEOUT_MS;
        private long idleTimeoutMs = DEFAULT_IDLE_TIMEOUT_MS;
        private long maxLifetimeMs = DEFAULT_MAX_LIFETIME_MS;
        private String validationQuery;
        private Integer defaultTransactionIsolation;
        private final Map<String, String> properties = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder poolName(String poolName) {
            this.poolName = poolName;
            return this;
        }

        public Builder providerId(String providerId) {
            this.providerId = providerId;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(char[] password) {
            this.password = password != null ? password.clone() : null;
            this.passwordSupplier = null;
            return this;
        }

        public Builder password(String password) {
            return password(password != null ? password.toCharArray() : null);
        }

        /**
         * Resolves the password lazily, on every connection the provider opens.
         */
        public Builder passwordSupplier(Supplier<char[]> passwordSupplier) {
            this.passwordSupplier = passwordSupplier;
            this.password = null;
            return this;
        }

        public Builder driverClassName(String driverClassName) {
            this.driverClassName = driverClassName;
            return this;
        }

        public Builder maxPoolSize(int maxPoolSize) {
            if (maxPoolSize < 1) {
                throw new IllegalArgumentException("maxPoolSize must be at least 1");
            }
            this.maxPoolSize = maxPoolSize;
            return this;
        }

        public Builder minIdle(int minIdle) {
            if (minIdle < 0) {
                throw new IllegalArgumentException("minIdle cannot be negative");
            }
            this.minIdle = minIdle;
            return this;
        }

        public Builder connectionTimeoutMs(long connectionTimeoutMs) {
            this.connectionTimeoutMs = requireNonNegative("connectionTimeoutMs", connectionTimeoutMs);
            return this;
        }

        public Builder idleTimeoutMs(long idleTimeoutMs) {
            this.idleTimeoutMs = requireNonNegative("idleTimeoutMs", idleTimeoutMs);
            return this;
        }

        public Builder maxLifetimeMs(long maxLifetimeMs) {
            this.maxLifetimeMs = requireNonNegative("maxLifetimeMs", maxLifetimeMs);
            return this;
        }

        public Builder validationQuery(String validationQuery) {
            this.validationQuery = validationQuery;
            return this;
        }

        public Builder defaultTransactionIsolation(Integer defaultTransactionIsolation) {
            this.defaultTransactionIsolation = defaultTransactionIsolation;
            return this;
        }

        public Builder property(String key, String value) {
            this.properties.put(key, value);
            return this;
        }

        public Builder properties(Map<String, String> properties) {
            if (properties != null) {
                this.properties.putAll(properties);
            }
            return this;
        }

        /**
         * @throws IllegalArgumentException if no JDBC url is set
         * @throws IllegalStateException if minIdle exceeds maxPoolSize
         */
        public PoolConfig build() {
            if (url == null || url.isBlank()) {
                throw new IllegalArgumentException("url is required");
            }
            if (minIdle > maxPoolSize) {
                throw new IllegalStateException("minIdle (" + minIdle + ") cannot exceed maxPoolSize (" + maxPoolSize + ")");
            }
            if (poolName == null || poolName.isBlank()) {
                poolName = "sqltx-" + Integer.toHexString(url.hashCode());
            }
            return new PoolConfig(this);
        }

        private static long requireNonNegative(String name, long value) {
            if (value < 0) {
                throw new IllegalArgumentException(name + " cannot be negative");
            }
            return value;
        }
    }
}
