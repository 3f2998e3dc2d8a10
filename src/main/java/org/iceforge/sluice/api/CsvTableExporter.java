package org.iceforge.sluice.api;

import org.iceforge.sluice.governance.ExportGuard;
import org.iceforge.sluice.governance.GovernanceConfig;
import org.iceforge.sluice.governance.SizeLimitedOutputStream;
import org.iceforge.sluice.query.QueryGovernor;
import org.iceforge.sluice.query.QueryResult;
import org.iceforge.sluice.query.QuerySpec;
import org.iceforge.sluice.query.TableCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Streams a whole table as CSV, one governed page of {@code max_returned_rows} at a time.
 * Each page gets its own deadline; the output is capped at {@code max_csv_mb}.
 */
@Component
public class CsvTableExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvTableExporter.class);

    private final QueryGovernor governor;

    public CsvTableExporter(QueryGovernor governor) {
        this.governor = Objects.requireNonNull(governor, "governor");
    }

    /**
     * @return number of data rows written
     * @throws org.iceforge.sluice.governance.ExportLimitExceededException the size cap was hit mid-stream
     */
    public long export(String database, String table, GovernanceConfig config, OutputStream out) throws IOException {
        ExportGuard.checkCsvStream(config);

        String pageSql = TableCatalog.browseSql(table) + " LIMIT :limit OFFSET :offset";
        int pageSize = config.maxReturnedRows();
        long offset = 0;
        boolean header = false;

        SizeLimitedOutputStream limited = ExportGuard.limit(config, out);
        Writer w = new BufferedWriter(new OutputStreamWriter(limited, StandardCharsets.UTF_8));
        while (true) {
            QuerySpec spec = QuerySpec.system(database, pageSql, Map.of("limit", pageSize, "offset", offset))
                    .withRowLimit(pageSize);
            QueryResult page = governor.execute(spec, config);
            if (!header) {
                writeRow(w, page.columns());
                header = true;
            }
            for (Map<String, Object> row : page.rows()) {
                writeRow(w, page.columns().stream().map(row::get).toList());
            }
            offset += page.rowCount();
            if (page.rowCount() < pageSize) break;
        }
        w.flush();
        log.debug("Exported {} row(s) of {}/{} as CSV ({} bytes)", offset, database, table, limited.written());
        return offset;
    }

    private static void writeRow(Writer w, List<?> cells) throws IOException {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) w.write(',');
            w.write(escape(cells.get(i)));
        }
        w.write("\r\n");
    }

    static String escape(Object cell) {
        if (cell == null) return "";
        String s = cell instanceof byte[] bytes ? "<Binary: " + bytes.length + " bytes>" : String.valueOf(cell);
        if (s.indexOf(',') >= 0 || s.indexOf('"') >= 0 || s.indexOf('\n') >= 0 || s.indexOf('\r') >= 0) {
            return '"' + s.replace("\"", "\"\"") + '"';
        }
        return s;
    }
}
