package org.iceforge.sluice.query;

import org.iceforge.sluice.governance.GovernanceConfig;
import org.iceforge.sluice.governance.RequestOverrides;
import org.iceforge.sluice.governance.SqlDisabledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Blob;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs statements under a deadline and a row cap, one worker slot at a time.
 * <p>
 * Truncation is detected by fetching one row past the limit, so no separate COUNT(*) is
 * needed. Expiry cancels the in-flight statement through JDBC rather than marking it failed
 * after the fact.
 * <p>
 * Slot connections run with auto-commit off and every statement is rolled back afterwards,
 * so nothing a statement changes is ever committed.
 */
public class QueryGovernor {
    private static final Logger log = LoggerFactory.getLogger(QueryGovernor.class);

    private final WorkerPool pool;
    private final DeadlineClock clock;

    public QueryGovernor(WorkerPool pool, DeadlineClock clock) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Execute and wait.
     *
     * @throws SqlDisabledException       client SQL while {@code allow_sql} is off
     * @throws TimeLimitExceededException the deadline expired while queued or running
     * @throws QueryExecutionException    the engine rejected or failed the statement
     */
    public QueryResult execute(QuerySpec spec, GovernanceConfig config) {
        return start(spec, config).await();
    }

    /**
     * Admit and submit without waiting. The deadline starts now.
     */
    public GovernedExecution start(QuerySpec spec, GovernanceConfig config) {
        Objects.requireNonNull(spec, "spec");
        Objects.requireNonNull(config, "config");

        if (spec.origin() == QuerySpec.Origin.USER_SQL) {
            if (!config.allowSql()) {
                throw new SqlDisabledException(spec.database());
            }
            SqlStatements.validateReadOnly(spec.database(), spec.sql());
        }

        int rowLimit = effectiveRowLimit(spec.rowLimitOverride(), config);
        long timeLimitMs = effectiveTimeLimitMs(spec.timeLimitMs(), config.sqlTimeLimitMs());

        Deadline deadline = clock.start(timeLimitMs);
        GovernedExecution.ActiveStatement active = new GovernedExecution.ActiveStatement();
        GovernedExecution execution = new GovernedExecution(spec, deadline, clock, pool, active);
        execution.bind(pool.submit(spec.database(), conn -> run(conn, spec, rowLimit, deadline, active)));
        return execution;
    }

    /**
     * {@code min(override or default_page_size, max_returned_rows)}; a non-positive override
     * means "use the default", an oversized one is clamped.
     */
    public static int effectiveRowLimit(Integer override, GovernanceConfig config) {
        int requested = override == null || override <= 0 ? config.defaultPageSize() : override;
        return Math.min(requested, config.maxReturnedRows());
    }

    /**
     * An override can only tighten the configured limit, never relax it. A configured limit of
     * 0 means unlimited, in which case the override alone applies.
     */
    public static long effectiveTimeLimitMs(Long override, long configuredMs) {
        if (override == null) return configuredMs;
        long o = Math.max(RequestOverrides.MIN_TIME_LIMIT_MS, override);
        return configuredMs == 0 ? o : Math.min(o, configuredMs);
    }

    private QueryResult run(Connection conn, QuerySpec spec, int rowLimit, Deadline deadline,
                            GovernedExecution.ActiveStatement active) throws SQLException {
        active.markStarted();
        if (clock.expired(deadline)) {
            throw new TimeLimitExceededException(spec.database(), deadline.budgetMs(), true);
        }

        long t0 = clock.nanos();
        NamedParameters.Rewritten rewritten = NamedParameters.rewrite(spec.sql(), spec.params());

        try (PreparedStatement ps = conn.prepareStatement(rewritten.sql())) {
            active.attach(ps);
            try {
                List<Object> values = rewritten.values();
                for (int i = 0; i < values.size(); i++) {
                    ps.setObject(i + 1, values.get(i));
                }
                ps.setMaxRows(rowLimit + 1);
                // Engine-side backstop in case cancel() is not honored promptly. Some drivers
                // keep the timeout on the connection, so an unbounded query resets it.
                if (deadline.unbounded()) {
                    ps.setQueryTimeout(0);
                } else {
                    long seconds = (clock.remaining(deadline) + 999L) / 1000L;
                    ps.setQueryTimeout((int) Math.max(1L, Math.min(Integer.MAX_VALUE, seconds)));
                }

                List<String> columns = new ArrayList<>();
                List<Map<String, Object>> rows = new ArrayList<>();
                int fetched = 0;
                boolean truncated = false;

                try (ResultSet rs = ps.executeQuery()) {
                    ResultSetMetaData md = rs.getMetaData();
                    int cols = md.getColumnCount();
                    for (int c = 1; c <= cols; c++) {
                        columns.add(uniqueLabel(md.getColumnLabel(c), columns));
                    }
                    while (rs.next()) {
                        fetched++;
                        if (rows.size() == rowLimit) {
                            truncated = true;
                            break;
                        }
                        Map<String, Object> row = new LinkedHashMap<>(cols * 2);
                        for (int c = 1; c <= cols; c++) {
                            row.put(columns.get(c - 1), readValue(rs, c));
                        }
                        rows.add(Collections.unmodifiableMap(row));
                    }
                }

                Duration elapsed = Duration.ofNanos(clock.nanos() - t0);
                log.debug("Query on database={} returned {} row(s) truncated={} in {}ms",
                        spec.database(), rows.size(), truncated, elapsed.toMillis());
                return new QueryResult(columns, rows, truncated, rowLimit, fetched, elapsed);
            } finally {
                active.detach();
                discardChanges(conn);
            }
        }
    }

    private static void discardChanges(Connection conn) throws SQLException {
        if (!conn.getAutoCommit()) {
            conn.rollback();
        }
    }

    /** Repeated labels get a {@code _2}, {@code _3}, ... suffix so row keys stay distinct. */
    static String uniqueLabel(String label, List<String> taken) {
        if (!taken.contains(label)) {
            return label;
        }
        for (int n = 2; ; n++) {
            String candidate = label + "_" + n;
            if (!taken.contains(candidate)) {
                return candidate;
            }
        }
    }

    private static Object readValue(ResultSet rs, int column) throws SQLException {
        Object v = rs.getObject(column);
        if (v instanceof Clob clob) {
            return clob.getSubString(1, (int) Math.min(Integer.MAX_VALUE, clob.length()));
        }
        if (v instanceof Blob blob) {
            return blob.getBytes(1, (int) Math.min(Integer.MAX_VALUE, blob.length()));
        }
        return v;
    }
}
