package org.sqltx.xa.dialect;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Lookup of the {@link XaDialect}s registered in
 * {@code META-INF/services/org.sqltx.xa.dialect.XaDialect}. A backend whose dialect is not on
 * the classpath is simply not available.
 */
@Slf4j
public final class XaDialects {

    private static volatile List<XaDialect> dialects;

    private XaDialects() {
    }

    public static List<XaDialect> all() {
        List<XaDialect> loaded = dialects;
        if (loaded == null) {
            synchronized (XaDialects.class) {
                loaded = dialects;
                if (loaded == null) {
                    loaded = load();
                    dialects = loaded;
                }
            }
        }
        return loaded;
    }

    public static Optional<XaDialect> forName(String name) {
        return all().stream().filter(d -> d.name().equalsIgnoreCase(name)).findFirst();
    }

    /**
     * Selects the dialect by JDBC url prefix, e.g. {@code jdbc:mysql:} or {@code jdbc:postgresql:}.
     */
    public static Optional<XaDialect> forJdbcUrl(String jdbcUrl) {
        Optional<XaDialect> dialect = all().stream().filter(d -> d.supportsJdbcUrl(jdbcUrl)).findFirst();
        if (dialect.isEmpty()) {
            log.debug("No XA dialect registered for url {}", jdbcUrl);
        }
        return dialect;
    }

    private static List<XaDialect> load() {
        List<XaDialect> found = new ArrayList<>();
        try {
            for (XaDialect dialect : ServiceLoader.load(XaDialect.class)) {
                found.add(dialect);
                log.debug("Registered XA dialect '{}'", dialect.name());
            }
        } catch (ServiceConfigurationError e) {
            log.error("Failed to load XA dialects: {}", e.getMessage(), e);
        }
        return Collections.unmodifiableList(found);
    }
}
