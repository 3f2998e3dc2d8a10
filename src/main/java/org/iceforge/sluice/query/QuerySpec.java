package org.iceforge.sluice.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One statement to run under governance. Immutable once built.
 *
 * @param database         declared database name
 * @param sql              statement text; may use {@code :name} parameters
 * @param params           values for {@code :name} parameters
 * @param rowLimitOverride requested page size; null or non-positive means the configured default
 * @param timeLimitMs      requested deadline; can only tighten the configured limit
 * @param origin           who wrote the SQL
 */
public record QuerySpec(
        String database,
        String sql,
        Map<String, Object> params,
        Integer rowLimitOverride,
        Long timeLimitMs,
        Origin origin
) {

    public enum Origin {
        /** Free-form SQL from a client; subject to {@code allow_sql}. */
        USER_SQL,
        /** SQL built by Sluice itself (table browsing, facets). */
        SYSTEM
    }

    public QuerySpec {
        Objects.requireNonNull(database, "database");
        Objects.requireNonNull(sql, "sql");
        Objects.requireNonNull(origin, "origin");
        params = params == null || params.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static QuerySpec userSql(String database, String sql, Map<String, Object> params) {
        return new QuerySpec(database, sql, params, null, null, Origin.USER_SQL);
    }

    public static QuerySpec system(String database, String sql, Map<String, Object> params) {
        return new QuerySpec(database, sql, params, null, null, Origin.SYSTEM);
    }

    public QuerySpec withRowLimit(Integer rows) {
        return new QuerySpec(database, sql, params, rows, timeLimitMs, origin);
    }

    public QuerySpec withTimeLimit(Long ms) {
        return new QuerySpec(database, sql, params, rowLimitOverride, ms, origin);
    }
}
