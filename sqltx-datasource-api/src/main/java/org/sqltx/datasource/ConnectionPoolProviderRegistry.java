package org.sqltx.datasource;

import lombok.extern.slf4j.Slf4j;

import java.sql.SQLException;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Registry of the {@link ConnectionPoolProvider}s found on the classpath.
 *
 * <p>Providers are loaded lazily on first use. Tests may {@link #register} additional
 * providers and {@link #clear()} the registry between runs.</p>
 */
@Slf4j
public final class ConnectionPoolProviderRegistry {

    private static final Map<String, ConnectionPoolProvider> PROVIDERS = new LinkedHashMap<>();
    private static boolean loaded;

    private ConnectionPoolProviderRegistry() {
    }

    public static synchronized Optional<ConnectionPoolProvider> getProvider(String id) {
        ensureLoaded();
        return Optional.ofNullable(PROVIDERS.get(id));
    }

    /**
     * @return the available provider with the highest priority
     */
    public static synchronized Optional<ConnectionPoolProvider> getDefaultProvider() {
        ensureLoaded();
        return PROVIDERS.values().stream()
                .filter(ConnectionPoolProvider::isAvailable)
                .max(Comparator.comparingInt(ConnectionPoolProvider::getPriority));
    }

    public static synchronized Map<String, ConnectionPoolProvider> getProviders() {
        ensureLoaded();
        return Collections.unmodifiableMap(new LinkedHashMap<>(PROVIDERS));
    }

    /**
     * Creates a pool with the provider named in the config, or the default provider when
     * the config names none.
     *
     * @throws SQLException if the requested provider is missing or unavailable, or pool creation fails
     */
    public static ConnectionPool createPool(PoolConfig config) throws SQLException {
        if (config == null) {
            throw new IllegalArgumentException("PoolConfig cannot be null");
        }
        Optional<ConnectionPoolProvider> provider = config.getProviderId() != null
                ? getProvider(config.getProviderId()).filter(ConnectionPoolProvider::isAvailable)
                : getDefaultProvider();
        if (provider.isEmpty()) {
            throw new SQLException("No connection pool provider available for pool '" + config.getPoolName()
                    + "' (requested: " + config.getProviderId() + ", registered: " + getProviders().keySet() + ")");
        }
        log.debug("Creating pool '{}' with provider '{}'", config.getPoolName(), provider.get().id());
        return provider.get().createPool(config);
    }

    public static synchronized void register(ConnectionPoolProvider provider) {
        ensureLoaded();
        ConnectionPoolProvider previous = PROVIDERS.put(provider.id(), provider);
        if (previous != null && previous != provider) {
            log.warn("Connection pool provider '{}' replaced: {} -> {}", provider.id(),
                    previous.getClass().getName(), provider.getClass().getName());
        }
    }

    /**
     * Discards all registered providers and loads them again from the classpath.
     */
    public static synchronized void reload() {
        PROVIDERS.clear();
        loaded = false;
        ensureLoaded();
    }

    /**
     * Discards all registered providers. The next lookup loads them again.
     */
    public static synchronized void clear() {
        PROVIDERS.clear();
        loaded = false;
    }

    private static void ensureLoaded() {
        if (loaded) {
            return;
        }
        loaded = true;
        try {
            for (ConnectionPoolProvider provider : ServiceLoader.load(ConnectionPoolProvider.class)) {
                PROVIDERS.putIfAbsent(provider.id(), provider);
                log.debug("Discovered connection pool provider '{}' (priority {})", provider.id(), provider.getPriority());
            }
        } catch (ServiceConfigurationError e) {
            log.error("Failed to load connection pool providers: {}", e.getMessage(), e);
        }
    }
}
