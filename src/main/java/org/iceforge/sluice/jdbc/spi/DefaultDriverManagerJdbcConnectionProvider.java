package org.iceforge.sluice.jdbc.spi;

import org.iceforge.sluice.jdbc.DatabaseProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Opens declared databases through {@link DriverManager}; the fallback for every engine.
 * <p>
 * Immutable H2 databases that live in files get {@code ACCESS_MODE_DATA=r}, so H2 opens them
 * read-only. In-memory H2 databases belong to whoever created them and keep their URL.
 */
public class DefaultDriverManagerJdbcConnectionProvider implements JdbcConnectionProvider {
    private static final Logger log = LoggerFactory.getLogger(DefaultDriverManagerJdbcConnectionProvider.class);

    static final String H2_READ_ONLY = "ACCESS_MODE_DATA=r";

    @Override
    public String id() {
        return "default";
    }

    @Override
    public boolean supports(JdbcClientContext context) {
        return true;
    }

    @Override
    public Connection openConnection(JdbcClientContext context, DatabaseProperties.DatabaseConfig cfg) throws Exception {
        String url = connectionUrl(context, cfg.getJdbcUrl());
        if (!url.equals(cfg.getJdbcUrl())) {
            log.debug("Opening immutable database={} read-only", context.database());
        }
        return DriverManager.getConnection(url, driverProperties(cfg));
    }

    static String connectionUrl(JdbcClientContext context, String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("jdbc-url is required for database=" + context.database());
        }
        if (!context.immutable() || !context.isH2() || jdbcUrl.startsWith("jdbc:h2:mem:")) {
            return jdbcUrl;
        }
        if (jdbcUrl.toUpperCase(Locale.ROOT).contains("ACCESS_MODE_DATA=")) {
            return jdbcUrl;
        }
        return jdbcUrl + ";" + H2_READ_ONLY;
    }

    /** Declared driver properties plus credentials; credentials win over same-named properties. */
    static Properties driverProperties(DatabaseProperties.DatabaseConfig cfg) {
        Properties props = new Properties();
        Map<String, String> declared = cfg.getProperties();
        if (declared != null) {
            declared.forEach((k, v) -> {
                if (k != null && v != null) props.put(k, v);
            });
        }
        if (cfg.getUsername() != null && !cfg.getUsername().isBlank()) {
            props.put("user", cfg.getUsername());
            if (cfg.getPassword() != null) {
                props.put("password", cfg.getPassword());
            }
        }
        return props;
    }
}
