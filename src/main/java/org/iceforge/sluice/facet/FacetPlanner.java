package org.iceforge.sluice.facet;

import org.iceforge.sluice.governance.FacetDisabledException;
import org.iceforge.sluice.governance.GovernanceConfig;
import org.iceforge.sluice.governance.GovernanceException;
import org.iceforge.sluice.query.GovernedExecution;
import org.iceforge.sluice.query.QueryGovernor;
import org.iceforge.sluice.query.QueryResult;
import org.iceforge.sluice.query.QuerySpec;
import org.iceforge.sluice.query.SqlStatements;
import org.iceforge.sluice.query.TimeLimitExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Computes facets for a table view, one governed query per column.
 * <p>
 * All column queries are submitted before any is awaited, so they share the worker pool
 * and the page waits roughly as long as its slowest column. A column that times out or
 * fails is reported as skipped; it never fails the page.
 */
@Service
public class FacetPlanner {
    private static final Logger log = LoggerFactory.getLogger(FacetPlanner.class);

    private final QueryGovernor governor;

    public FacetPlanner(QueryGovernor governor) {
        this.governor = Objects.requireNonNull(governor, "governor");
    }

    /**
     * @return one result per requested facet, in request order
     * @throws FacetDisabledException ad hoc facets were requested while {@code allow_facet} is off
     */
    public List<FacetResult> plan(FacetPlanRequest request, GovernanceConfig config) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(config, "config");

        checkAllowed(request.facets(), config);

        Set<String> columns = new HashSet<>(request.columns());
        Set<String> requested = new HashSet<>();
        for (FacetRequest f : request.facets()) {
            if (f.mode() == FacetMode.REQUESTED) requested.add(f.column());
        }

        int n = request.facets().size();
        FacetResult[] results = new FacetResult[n];
        GovernedExecution[] running = new GovernedExecution[n];

        for (int i = 0; i < n; i++) {
            FacetRequest f = request.facets().get(i);
            if (f.mode() == FacetMode.SUGGESTED) {
                if (!config.suggestFacets()) {
                    results[i] = FacetResult.skipped(f.column(), f.mode(), FacetResult.SkipReason.DISABLED);
                    continue;
                }
                if (requested.contains(f.column())) {
                    results[i] = FacetResult.skipped(f.column(), f.mode(), FacetResult.SkipReason.NOT_ELIGIBLE);
                    continue;
                }
            }
            if (!columns.contains(f.column())) {
                results[i] = FacetResult.skipped(f.column(), f.mode(), FacetResult.SkipReason.NOT_ELIGIBLE);
                continue;
            }
            try {
                running[i] = governor.start(facetSpec(request, f, config), config);
            } catch (GovernanceException e) {
                log.warn("Facet {} on {}/{} could not start: {}", f.column(), request.database(), request.table(), e.getMessage());
                results[i] = FacetResult.skipped(f.column(), f.mode(), FacetResult.SkipReason.QUERY_FAILED);
            }
        }

        for (int i = 0; i < n; i++) {
            if (running[i] == null) continue;
            FacetRequest f = request.facets().get(i);
            results[i] = collect(request, f, running[i]);
        }

        return List.of(results);
    }

    /** Suggestions for every column, in column order. */
    public static List<FacetRequest> suggestionsFor(List<String> columns) {
        List<FacetRequest> out = new ArrayList<>(columns.size());
        for (String c : columns) out.add(FacetRequest.suggested(c));
        return out;
    }

    /**
     * The per-column breakdown query. Selects one row more than {@code facetSize} so
     * truncation shows up without counting distinct values separately.
     */
    static String facetSql(String baseSql, String column, int facetSize) {
        String col = SqlStatements.quoteIdentifier(column);
        return "SELECT " + col + " AS \"value\", COUNT(*) AS \"count\""
                + " FROM (" + baseSql + ") AS facet_base"
                + " WHERE " + col + " IS NOT NULL"
                + " GROUP BY " + col
                + " ORDER BY 2 DESC, 1"
                + " LIMIT " + (facetSize + 1);
    }

    private static void checkAllowed(List<FacetRequest> facets, GovernanceConfig config) {
        if (config.allowFacet()) return;
        List<String> adHoc = new ArrayList<>();
        for (FacetRequest f : facets) {
            if (f.mode() == FacetMode.REQUESTED && f.source() == FacetRequest.Source.AD_HOC) {
                adHoc.add(f.column());
            }
        }
        if (!adHoc.isEmpty()) {
            throw new FacetDisabledException(adHoc);
        }
    }

    private static QuerySpec facetSpec(FacetPlanRequest request, FacetRequest f, GovernanceConfig config) {
        long limit = f.mode() == FacetMode.REQUESTED ? config.facetTimeLimitMs() : config.facetSuggestTimeLimitMs();
        return QuerySpec.system(request.database(), facetSql(request.baseSql(), f.column(), request.facetSize()), request.params())
                .withRowLimit(request.facetSize())
                .withTimeLimit(limit > 0 ? limit : null);
    }

    private FacetResult collect(FacetPlanRequest request, FacetRequest f, GovernedExecution execution) {
        QueryResult result;
        try {
            result = execution.await();
        } catch (TimeLimitExceededException e) {
            log.debug("Facet {} on {}/{} hit its {}ms limit", f.column(), request.database(), request.table(), e.timeLimitMs());
            return FacetResult.skipped(f.column(), f.mode(), FacetResult.SkipReason.TIME_LIMIT_EXCEEDED);
        } catch (GovernanceException e) {
            log.warn("Facet {} on {}/{} failed: {}", f.column(), request.database(), request.table(), e.getMessage());
            return FacetResult.skipped(f.column(), f.mode(), FacetResult.SkipReason.QUERY_FAILED);
        }

        List<FacetValue> values = new ArrayList<>(result.rowCount());
        for (Map<String, Object> row : result.rows()) {
            Object count = row.get("count");
            values.add(new FacetValue(row.get("value"), count instanceof Number num ? num.longValue() : 0L));
        }

        if (f.mode() == FacetMode.SUGGESTED && !worthSuggesting(values, result.truncated())) {
            return FacetResult.skipped(f.column(), f.mode(), FacetResult.SkipReason.NOT_ELIGIBLE);
        }
        return FacetResult.of(f.column(), f.mode(), values, result.truncated());
    }

    /**
     * A suggestion is useful when it fits on the page, actually splits the rows, and groups
     * at least some of them together.
     */
    static boolean worthSuggesting(List<FacetValue> values, boolean truncated) {
        if (truncated || values.size() < 2) return false;
        for (FacetValue v : values) {
            if (v.count() > 1) return true;
        }
        return false;
    }
}
