package org.iceforge.sluice.query;

import org.iceforge.sluice.governance.GovernanceConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Table lookups and the SQL used to browse a table.
 * <p>
 * Lookups are ordinary system queries, so they share the worker pool and deadlines with
 * everything else.
 */
public class TableCatalog {

    private static final String TABLES_SQL =
            "SELECT TABLE_NAME FROM INFORMATION_SCHEMA.TABLES "
                    + "WHERE TABLE_SCHEMA <> 'INFORMATION_SCHEMA' ORDER BY TABLE_NAME";

    private static final String TABLE_EXISTS_SQL =
            "SELECT COUNT(*) AS MATCHES FROM INFORMATION_SCHEMA.TABLES "
                    + "WHERE TABLE_SCHEMA <> 'INFORMATION_SCHEMA' AND TABLE_NAME = :table";

    private final QueryGovernor governor;

    public TableCatalog(QueryGovernor governor) {
        this.governor = Objects.requireNonNull(governor, "governor");
    }

    /**
     * User tables and views, in name order.
     *
     * @param names     at most {@code max_returned_rows} names
     * @param truncated the database has more tables than were listed
     */
    public record Listing(List<String> names, boolean truncated) {
        public Listing {
            names = List.copyOf(names);
        }
    }

    public Listing tables(String database, GovernanceConfig config) {
        QuerySpec spec = QuerySpec.system(database, TABLES_SQL, Map.of())
                .withRowLimit(config.maxReturnedRows());
        QueryResult result = governor.execute(spec, config);
        List<String> names = new ArrayList<>(result.rowCount());
        for (Map<String, Object> row : result.rows()) {
            names.add(String.valueOf(row.get("TABLE_NAME")));
        }
        return new Listing(names, result.truncated());
    }

    /** Looks the table up by name, so it works however many tables the database has. */
    public boolean exists(String database, String table, GovernanceConfig config) {
        QueryResult result = governor.execute(
                QuerySpec.system(database, TABLE_EXISTS_SQL, Map.of("table", table)), config);
        Object matches = result.rows().get(0).get("MATCHES");
        return matches instanceof Number n && n.longValue() > 0;
    }

    /** {@code SELECT * FROM "table"}; callers check {@link #exists} first. */
    public static String browseSql(String table) {
        return "SELECT * FROM " + SqlStatements.quoteIdentifier(table);
    }
}
