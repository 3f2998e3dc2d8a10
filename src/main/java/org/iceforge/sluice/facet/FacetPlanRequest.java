package org.iceforge.sluice.facet;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything the planner needs about one table view.
 *
 * @param database  declared database name
 * @param table     table being browsed; used for logging only
 * @param baseSql   the view's query; facets are computed over its rows
 * @param params    parameters of {@code baseSql}
 * @param columns   columns of the view, the only columns that may be faceted
 * @param facets    facets to compute, in the order results are wanted
 * @param facetSize entries per facet, already clamped by the caller
 */
public record FacetPlanRequest(
        String database,
        String table,
        String baseSql,
        Map<String, Object> params,
        List<String> columns,
        List<FacetRequest> facets,
        int facetSize
) {
    public FacetPlanRequest {
        Objects.requireNonNull(database, "database");
        Objects.requireNonNull(baseSql, "baseSql");
        params = params == null ? Map.of() : params;
        columns = List.copyOf(columns);
        facets = List.copyOf(facets);
        if (facetSize <= 0) throw new IllegalArgumentException("facetSize must be > 0: " + facetSize);
    }
}
