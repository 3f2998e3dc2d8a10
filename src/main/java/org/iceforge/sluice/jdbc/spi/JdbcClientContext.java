package org.iceforge.sluice.jdbc.spi;

import java.util.Locale;
import java.util.Map;

/**
 * What a provider gets to know about the database it is asked to open.
 * <p>
 * Keep this free of credentials so it is safe to log.
 *
 * @param database   declared database name
 * @param engine     engine id from the JDBC URL ({@code h2}, {@code postgresql}, ...), or
 *                   {@code unknown}
 * @param immutable  the database file never changes while Sluice serves it
 * @param properties extra driver properties from the declaration
 */
public record JdbcClientContext(
        String database,
        String engine,
        boolean immutable,
        Map<String, String> properties
) {

    /** The subprotocol of {@code jdbc:<engine>:...}. */
    public static String engineOf(String jdbcUrl) {
        if (jdbcUrl == null || !jdbcUrl.startsWith("jdbc:")) {
            return "unknown";
        }
        int end = jdbcUrl.indexOf(':', 5);
        return end < 0 ? "unknown" : jdbcUrl.substring(5, end).toLowerCase(Locale.ROOT);
    }

    public boolean isH2() {
        return "h2".equals(engine);
    }
}
