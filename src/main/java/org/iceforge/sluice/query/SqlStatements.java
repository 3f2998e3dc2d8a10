package org.iceforge.sluice.query;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Small helpers for SQL text Sluice builds or accepts.
 */
public final class SqlStatements {
    private SqlStatements() {}

    private static final Pattern READ_ONLY =
            Pattern.compile("^\\s*(select|with|explain|values|table)\\b.*", Pattern.DOTALL);

    /** A statement separator with more code after it. */
    private static final Pattern TRAILING_STATEMENT = Pattern.compile(";[\\s;]*[^\\s;]");

    /** H2 delta tables, e.g. {@code SELECT * FROM OLD TABLE (DELETE FROM t)}. */
    private static final Pattern DATA_CHANGE_TABLE =
            Pattern.compile("\\b(old|new|final)\\s+table\\s*\\(");

    /** Engine functions that touch the file system or other databases. */
    private static final Pattern ADMIN_FUNCTION =
            Pattern.compile("\\b(file_write|file_read|csvwrite|csvread|link_schema)\\s*\\(");

    /** Quote an identifier for use in generated SQL. */
    public static String quoteIdentifier(String name) {
        return '"' + name.replace("\"", "\"\"") + '"';
    }

    /**
     * Reject anything that is not a single read-only statement. Client SQL only; generated SQL
     * is trusted. Connections also discard any change a statement makes, see
     * {@link QueryGovernor}.
     */
    public static void validateReadOnly(String database, String sql) {
        if (sql == null || sql.isBlank()) {
            throw new InvalidSqlException(database, "SQL is empty");
        }
        String code = NamedParameters.codeOnly(sql).toLowerCase(Locale.ROOT);
        if (!READ_ONLY.matcher(code).matches()) {
            throw new InvalidSqlException(database, "Statement must be a SELECT");
        }
        if (TRAILING_STATEMENT.matcher(code).find()) {
            throw new InvalidSqlException(database, "Only a single statement is allowed");
        }
        if (DATA_CHANGE_TABLE.matcher(code).find()) {
            throw new InvalidSqlException(database, "Data change tables are not allowed");
        }
        Matcher admin = ADMIN_FUNCTION.matcher(code);
        if (admin.find()) {
            throw new InvalidSqlException(database,
                    "Function " + admin.group(1).toUpperCase(Locale.ROOT) + " is not allowed");
        }
    }
}
