package org.iceforge.sluice.jdbc.spi;

import org.iceforge.sluice.jdbc.DatabaseProperties;

import java.sql.Connection;

/**
 * Opens the long-lived connection a worker slot keeps for one declared database.
 * <p>
 * A provider opens immutable databases so the engine refuses writes wherever the engine
 * supports it. {@link JdbcClientFactory} applies the per-connection settings afterwards.
 */
public interface JdbcConnectionProvider {

    /** Stable id, matched against a database's {@code provider} setting. */
    String id();

    /** Whether this provider can open the database described by {@code context}. */
    boolean supports(JdbcClientContext context);

    Connection openConnection(JdbcClientContext context, DatabaseProperties.DatabaseConfig cfg) throws Exception;
}
