package org.sqltx.datasource;

import lombok.extern.slf4j.Slf4j;
import org.sqltx.commons.config.PropertyResolver;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import static org.sqltx.commons.constants.CommonConstants.DEFAULT_DATASOURCE_NAME;
import static org.sqltx.commons.constants.CommonConstants.POOL_CONNECTION_TIMEOUT_PROPERTY;
import static org.sqltx.commons.constants.CommonConstants.POOL_DRIVER_CLASS_PROPERTY;
import static org.sqltx.commons.constants.CommonConstants.POOL_IDLE_TIMEOUT_PROPERTY;
import static org.sqltx.commons.constants.CommonConstants.POOL_MAX_LIFETIME_PROPERTY;
import static org.sqltx.commons.constants.CommonConstants.POOL_MAX_SIZE_PROPERTY;
import static org.sqltx.commons.constants.CommonConstants.POOL_MIN_IDLE_PROPERTY;
import static org.sqltx.commons.constants.CommonConstants.POOL_PASSWORD_PROPERTY;
import static org.sqltx.commons.constants.CommonConstants.POOL_PREFIX;
import static org.sqltx.commons.constants.CommonConstants.POOL_PROVIDER_PROPERTY;
import static org.sqltx.commons.constants.CommonConstants.POOL_URL_PROPERTY;
import static org.sqltx.commons.constants.CommonConstants.POOL_USERNAME_PROPERTY;
import static org.sqltx.commons.constants.CommonConstants.POOL_VALIDATION_QUERY_PROPERTY;
import static org.sqltx.commons.constants.CommonConstants.PROPERTIES_FILE;

/**
 * Builds {@link PoolConfig}s from {@code sqltx.properties} on the classpath.
 *
 * <p>Settings for a named data source use the {@code <name>.sqltx.pool.*} keys, for example
 * {@code orders.sqltx.pool.url}. The {@code default} data source also accepts the
 * unprefixed {@code sqltx.pool.*} keys. Every value can be overridden by a JVM property or
 * environment variable with the same (unprefixed) key.</p>
 */
@Slf4j
public class PoolConfigLoader {

    private PoolConfigLoader() {
    }

    /**
     * Loads the pool settings of {@code dataSourceName}.
     *
     * @param dataSourceName the data source name
     * @return the pool configuration
     * @throws IllegalArgumentException if no url is configured for the data source
     */
    public static PoolConfig load(String dataSourceName) {
        return fromProperties(dataSourceName, loadPropertiesFile());
    }

    /**
     * Builds a pool configuration from already loaded properties.
     */
    public static PoolConfig fromProperties(String dataSourceName, Properties allProperties) {
        Properties scoped = scope(dataSourceName, allProperties);
        PropertyResolver resolver = new PropertyResolver(scoped);

        PoolConfig.Builder builder = PoolConfig.builder()
                .poolName(dataSourceName)
                .providerId(resolver.getString(POOL_PROVIDER_PROPERTY, null))
                .url(resolver.getString(POOL_URL_PROPERTY, null))
                .username(resolver.getString(POOL_USERNAME_PROPERTY, null))
                .password(resolver.getString(POOL_PASSWORD_PROPERTY, null))
                .driverClassName(resolver.getString(POOL_DRIVER_CLASS_PROPERTY, null))
                .maxPoolSize(resolver.getInt(POOL_MAX_SIZE_PROPERTY, PoolConfig.DEFAULT_MAX_POOL_SIZE))
                .minIdle(resolver.getInt(POOL_MIN_IDLE_PROPERTY, PoolConfig.DEFAULT_MIN_IDLE))
                .connectionTimeoutMs(resolver.getLong(POOL_CONNECTION_TIMEOUT_PROPERTY, PoolConfig.DEFAULT_CONNECTION_TIMEOUT_MS))
                .idleTimeoutMs(resolver.getLong(POOL_IDLE_TIMEOUT_PROPERTY, PoolConfig.DEFAULT_IDLE_TIMEOUT_MS))
                .maxLifetimeMs(resolver.getLong(POOL_MAX_LIFETIME_PROPERTY, PoolConfig.DEFAULT_MAX_LIFETIME_MS))
                .validationQuery(resolver.getString(POOL_VALIDATION_QUERY_PROPERTY, null));

        // Anything under sqltx.pool.property.* is handed to the driver
        String driverPropertyPrefix = POOL_PREFIX + "property.";
        for (String key : scoped.stringPropertyNames()) {
            if (key.startsWith(driverPropertyPrefix)) {
                builder.property(key.substring(driverPropertyPrefix.length()), scoped.getProperty(key));
            }
        }

        PoolConfig config = builder.build();
        log.debug("Loaded pool configuration for dataSource '{}': {}", dataSourceName, config);
        return config;
    }

    /**
     * Reads the raw {@code sqltx.properties} file from the classpath.
     *
     * @return the file contents, empty if the file is absent or unreadable
     */
    public static Properties loadPropertiesFile() {
        Properties properties = new Properties();
        try (InputStream is = PoolConfigLoader.class.getClassLoader().getResourceAsStream(PROPERTIES_FILE)) {
            if (is != null) {
                properties.load(is);
                log.debug("Loaded {} from classpath", PROPERTIES_FILE);
            } else {
                log.debug("No {} found on classpath", PROPERTIES_FILE);
            }
        } catch (IOException e) {
            log.warn("Could not read {}: {}", PROPERTIES_FILE, e.getMessage());
        }
        return properties;
    }

    private static Properties scope(String dataSourceName, Properties allProperties) {
        Properties scoped = new Properties();
        String prefix = dataSourceName + "." + POOL_PREFIX;
        for (String key : allProperties.stringPropertyNames()) {
            if (key.startsWith(prefix)) {
                scoped.setProperty(key.substring(dataSourceName.length() + 1), allProperties.getProperty(key));
            }
        }
        if (scoped.isEmpty() && DEFAULT_DATASOURCE_NAME.equals(dataSourceName)) {
            for (String key : allProperties.stringPropertyNames()) {
                if (key.startsWith(POOL_PREFIX)) {
                    scoped.setProperty(key, allProperties.getProperty(key));
                }
            }
        }
        return scoped;
    }
}
