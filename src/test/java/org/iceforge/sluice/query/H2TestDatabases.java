package org.iceforge.sluice.query;

import org.iceforge.sluice.jdbc.DatabaseProperties;
import org.iceforge.sluice.jdbc.spi.DefaultDriverManagerJdbcConnectionProvider;
import org.iceforge.sluice.jdbc.spi.JdbcClientFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.UUID;

/**
 * In-memory H2 databases for tests, plus a {@code SLOW(ms, value)} function that sleeps
 * once per call so a query can be made to run as long as needed.
 */
public final class H2TestDatabases {
    private H2TestDatabases() {}

    /** Declare in-memory databases with unique URLs so test classes never share state. */
    public static DatabaseProperties declare(String... names) {
        DatabaseProperties props = new DatabaseProperties();
        for (String name : names) {
            DatabaseProperties.DatabaseConfig cfg = new DatabaseProperties.DatabaseConfig();
            cfg.setJdbcUrl("jdbc:h2:mem:" + name + "-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
            props.getDatabases().put(name, cfg);
        }
        return props;
    }

    public static void exec(DatabaseProperties props, String database, String... statements) throws SQLException {
        try (Connection conn = DriverManager.getConnection(props.get(database).getJdbcUrl());
             Statement st = conn.createStatement()) {
            for (String sql : statements) {
                st.execute(sql);
            }
        }
    }

    /** Registers {@code SLOW} on the database. */
    public static void installSlowFunction(DatabaseProperties props, String database) throws SQLException {
        exec(props, database,
                "CREATE ALIAS IF NOT EXISTS SLOW FOR '" + H2TestDatabases.class.getName() + ".slow'");
    }

    /** A pool over the declared databases through the regular connection factory. */
    public static WorkerPool pool(DatabaseProperties props, int size) {
        JdbcClientFactory factory = new JdbcClientFactory(props, List.of(new DefaultDriverManagerJdbcConnectionProvider()));
        return new WorkerPool(size, db -> factory.openConnection(db, 0));
    }

    public static int slow(int millis, int value) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return value;
    }
}
