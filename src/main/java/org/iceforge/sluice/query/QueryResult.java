package org.iceforge.sluice.query;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Rows from one governed execution.
 *
 * @param columns     result column labels, in engine order
 * @param rows        returned rows, each an unmodifiable column -> value map
 * @param truncated   true iff the engine had at least one more row than {@code rowLimit}
 * @param rowLimit    the effective row limit the query ran with
 * @param rowsFetched rows read from the engine, including the probe row past the limit
 * @param elapsed     time spent executing on a worker slot
 */
public record QueryResult(
        List<String> columns,
        List<Map<String, Object>> rows,
        boolean truncated,
        int rowLimit,
        int rowsFetched,
        Duration elapsed
) {

    public QueryResult {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public int rowCount() {
        return rows.size();
    }
}
