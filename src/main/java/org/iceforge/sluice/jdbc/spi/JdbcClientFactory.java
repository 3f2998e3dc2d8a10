package org.iceforge.sluice.jdbc.spi;

import org.iceforge.sluice.jdbc.DatabaseNotFoundException;
import org.iceforge.sluice.jdbc.DatabaseProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Opens engine connections for declared databases.
 * <p>
 * Providers can be supplied as Spring beans or discovered via {@link ServiceLoader};
 * Spring wins if provider IDs collide.
 */
public final class JdbcClientFactory {
    private static final Logger log = LoggerFactory.getLogger(JdbcClientFactory.class);

    private final DatabaseProperties databases;
    private final List<JdbcConnectionProvider> providers;

    public JdbcClientFactory(DatabaseProperties databases, Collection<JdbcConnectionProvider> springProviders) {
        this.databases = Objects.requireNonNull(databases, "databases");

        List<JdbcConnectionProvider> fromSpring = springProviders == null ? List.of() : List.copyOf(springProviders);
        List<JdbcConnectionProvider> fromServiceLoader = ServiceLoader.load(JdbcConnectionProvider.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        Map<String, JdbcConnectionProvider> merged = new LinkedHashMap<>();
        for (JdbcConnectionProvider p : fromServiceLoader) merged.put(p.id(), p);
        for (JdbcConnectionProvider p : fromSpring) merged.put(p.id(), p);

        this.providers = List.copyOf(merged.values());

        log.info("Discovered JdbcConnectionProviders: {}", this.providers.stream()
                .map(JdbcConnectionProvider::id).collect(Collectors.toList()));
    }

    /**
     * Open a new connection to {@code database} with per-connection engine settings applied.
     *
     * @param cacheSizeKb engine cache size for this connection; 0 keeps the engine default
     */
    public Connection openConnection(String database, int cacheSizeKb) throws Exception {
        DatabaseProperties.DatabaseConfig cfg = databases.get(database);
        if (cfg == null) {
            throw new DatabaseNotFoundException(database);
        }

        JdbcClientContext ctx = new JdbcClientContext(
                database,
                JdbcClientContext.engineOf(cfg.getJdbcUrl()),
                cfg.isImmutable(),
                cfg.getProperties() == null ? Map.of() : Map.copyOf(cfg.getProperties())
        );
        JdbcConnectionProvider provider = resolveProvider(cfg.getProvider(), ctx);
        log.debug("Using JDBC provider id='{}' for database='{}'", provider.id(), database);

        Connection conn = provider.openConnection(ctx, cfg);
        try {
            applyEngineSettings(conn, cfg, cacheSizeKb);
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    /**
     * Auto-commit is turned off so the governor can roll back whatever a statement changed.
     * Immutable databases are also flagged read-only for drivers that honor the hint.
     */
    static void applyEngineSettings(Connection conn, DatabaseProperties.DatabaseConfig cfg, int cacheSizeKb)
            throws SQLException {
        conn.setAutoCommit(false);
        if (cfg.isImmutable()) {
            conn.setReadOnly(true);
        }
        if (cacheSizeKb > 0 && "h2".equals(JdbcClientContext.engineOf(cfg.getJdbcUrl()))) {
            try (Statement st = conn.createStatement()) {
                st.execute("SET CACHE_SIZE " + cacheSizeKb);
            }
        }
    }

    private JdbcConnectionProvider resolveProvider(String forcedProviderId, JdbcClientContext ctx) {
        if (forcedProviderId != null && !forcedProviderId.isBlank()) {
            return providers.stream()
                    .filter(p -> forcedProviderId.equals(p.id()))
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException(
                            "Forced JDBC provider '" + forcedProviderId + "' not found. Available: " + ids()));
        }

        // Deterministic tie-break: lexicographically by id.
        return providers.stream()
                .filter(p -> p.supports(ctx))
                .min(Comparator.comparing(JdbcConnectionProvider::id))
                .orElseThrow(() -> new IllegalStateException(
                        "No JdbcConnectionProvider supports database=" + ctx.database() + " providers=" + ids()));
    }

    private List<String> ids() {
        return providers.stream().map(JdbcConnectionProvider::id).sorted().toList();
    }
}
