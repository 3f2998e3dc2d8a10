package org.iceforge.sluice.api;

import org.iceforge.sluice.facet.FacetResult;
import org.iceforge.sluice.facet.FacetValue;

import java.util.List;
import java.util.Map;

/**
 * JSON shapes returned by the HTTP surface.
 */
public final class ApiModels {
    private ApiModels() {}

    public record DatabaseResponse(
            String database,
            String path,
            String hash,
            List<String> tables,
            boolean truncated
    ) {}

    public record QueryResponse(
            String database,
            List<String> columns,
            List<Map<String, Object>> rows,
            boolean truncated,
            double queryMs,
            Query query
    ) {
        public record Query(String sql, Map<String, Object> params) {}
    }

    public record TableResponse(
            String database,
            String table,
            List<String> columns,
            List<Map<String, Object>> rows,
            boolean truncated,
            double queryMs,
            List<Facet> facetResults,
            List<SuggestedFacet> suggestedFacets
    ) {}

    public record Facet(
            String column,
            List<FacetValue> results,
            boolean truncated,
            boolean skipped,
            String reason
    ) {
        static Facet from(FacetResult r) {
            return new Facet(r.column(), r.values(), r.truncated(), r.skipped(), r.reason());
        }
    }

    public record SuggestedFacet(String name, String toggleUrl) {}

    public record ErrorResponse(
            String code,
            String title,
            String message,
            int status
    ) {}
}
