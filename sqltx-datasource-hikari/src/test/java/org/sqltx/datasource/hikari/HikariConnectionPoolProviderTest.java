package org.sqltx.datasource.hikari;

import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.sqltx.datasource.ConnectionPool;
import org.sqltx.datasource.ConnectionPoolProvider;
import org.sqltx.datasource.ConnectionPoolProviderRegistry;
import org.sqltx.datasource.PoolConfig;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HikariConnectionPoolProvider.
 */
class HikariConnectionPoolProviderTest {

    private HikariConnectionPoolProvider provider;
    private ConnectionPool pool;

    @BeforeEach
    void setUp() {
        provider = new HikariConnectionPoolProvider();
        ConnectionPoolProviderRegistry.clear();
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.close();
            pool = null;
        }
    }

    private static PoolConfig.Builder h2(String name) {
        return PoolConfig.builder()
                .poolName(name)
                .url("jdbc:h2:mem:" + name + ";DB_CLOSE_DELAY=-1")
                .username("sa")
                .password("");
    }

    @Test
    @DisplayName("Provider should have id 'hikari' and the highest priority")
    void testIdentity() {
        assertEquals("hikari", provider.id());
        assertEquals(100, provider.getPriority());
        assertTrue(provider.isAvailable());
    }

    @Test
    @DisplayName("createPool should create a working H2 pool")
    void testCreatePoolH2() throws SQLException {
        pool = provider.createPool(h2("hikariworking").validationQuery("SELECT 1").build());

        assertEquals("hikariworking", pool.getName());
        Connection conn = pool.acquire();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT 1")) {
            assertTrue(rs.next());
            assertEquals(1, rs.getInt(1));
        } finally {
            pool.release(conn);
        }
    }

    @Test
    @DisplayName("createPool should map sizing, timeouts and isolation")
    void testConfigurationMapping() throws SQLException {
        pool = provider.createPool(h2("hikarimapping")
                .maxPoolSize(7)
                .minIdle(1)
                .connectionTimeoutMs(4000)
                .idleTimeoutMs(300000)
                .maxLifetimeMs(600000)
                .defaultTransactionIsolation(Connection.TRANSACTION_READ_COMMITTED)
                .build());
        HikariDataSource ds = ((HikariConnectionPool) pool).getDataSource();

        assertEquals(7, ds.getMaximumPoolSize());
        assertEquals(1, ds.getMinimumIdle());
        assertEquals(4000, ds.getConnectionTimeout());
        assertEquals(300000, ds.getIdleTimeout());
        assertEquals(600000, ds.getMaxLifetime());
        assertEquals("TRANSACTION_READ_COMMITTED", ds.getTransactionIsolation());
        assertTrue(ds.isAutoCommit());
    }

    @Test
    @DisplayName("Released connections come back with auto-commit restored")
    void testAutoCommitRestoredOnRelease() throws SQLException {
        pool = provider.createPool(h2("hikariautocommit").maxPoolSize(1).minIdle(0).build());

        Connection first = pool.acquire();
        first.setAutoCommit(false);
        pool.release(first);

        Connection second = pool.acquire();
        assertTrue(second.getAutoCommit());
        pool.release(second);
    }

    @Test
    @DisplayName("Invalidated connections are evicted and replaced")
    void testInvalidate() throws SQLException {
        pool = provider.createPool(h2("hikarievict").maxPoolSize(1).minIdle(0).connectionTimeoutMs(5000).build());

        Connection first = pool.acquire();
        Object physicalFirst = first.unwrap(org.h2.jdbc.JdbcConnection.class);
        pool.invalidate(first);

        Connection second = pool.acquire();
        Object physicalSecond = second.unwrap(org.h2.jdbc.JdbcConnection.class);
        assertNotSame(physicalFirst, physicalSecond);
        pool.release(second);
    }

    @Test
    @DisplayName("getStatistics should report active connections")
    void testGetStatistics() throws SQLException {
        pool = provider.createPool(h2("hikaristats").maxPoolSize(10).minIdle(2).build());

        Connection conn1 = pool.acquire();
        Connection conn2 = pool.acquire();

        Map<String, Object> stats = pool.getStatistics();
        assertEquals(2, stats.get("activeConnections"));
        assertEquals(10, stats.get("maxPoolSize"));
        assertFalse((Boolean) stats.get("isClosed"));

        pool.release(conn1);
        pool.release(conn2);
    }

    @Test
    @DisplayName("close should close the underlying data source and be repeatable")
    void testClose() throws SQLException {
        ConnectionPool closing = provider.createPool(h2("hikariclose").build());
        closing.release(closing.acquire());

        closing.close();
        closing.close();

        assertTrue(((HikariConnectionPool) closing).getDataSource().isClosed());
    }

    @Test
    @DisplayName("createPool should throw for null config")
    void testNullConfig() {
        assertThrows(IllegalArgumentException.class, () -> provider.createPool(null));
    }

    @Test
    @DisplayName("Provider should be discoverable via ServiceLoader and be the default")
    void testServiceLoaderDiscovery() {
        ConnectionPoolProviderRegistry.reload();

        Optional<ConnectionPoolProvider> found = ConnectionPoolProviderRegistry.getProvider("hikari");
        assertTrue(found.isPresent());
        assertInstanceOf(HikariConnectionPoolProvider.class, found.get());
        assertEquals("hikari", ConnectionPoolProviderRegistry.getDefaultProvider().orElseThrow().id());
    }

    @Test
    @DisplayName("All JDBC isolation levels map to HikariCP names")
    void testIsolationNames() {
        assertEquals("TRANSACTION_SERIALIZABLE", HikariConnectionPoolProvider.isolationName(Connection.TRANSACTION_SERIALIZABLE));
        assertEquals("TRANSACTION_REPEATABLE_READ", HikariConnectionPoolProvider.isolationName(Connection.TRANSACTION_REPEATABLE_READ));
        assertEquals("TRANSACTION_READ_UNCOMMITTED", HikariConnectionPoolProvider.isolationName(Connection.TRANSACTION_READ_UNCOMMITTED));
        assertThrows(IllegalArgumentException.class, () -> HikariConnectionPoolProvider.isolationName(42));
    }
}
