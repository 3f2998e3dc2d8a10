package org.iceforge.sluice.facet;

import java.util.List;

/**
 * Outcome for one column. Skipped results carry no values and a reason; a skip is a normal
 * outcome, not an error.
 */
public record FacetResult(
        String column,
        FacetMode mode,
        List<FacetValue> values,
        boolean truncated,
        boolean skipped,
        SkipReason skipReason
) {

    public enum SkipReason {
        TIME_LIMIT_EXCEEDED("time limit exceeded"),
        NOT_ELIGIBLE("not eligible"),
        QUERY_FAILED("query failed"),
        DISABLED("disabled");

        private final String text;

        SkipReason(String text) {
            this.text = text;
        }

        public String text() {
            return text;
        }
    }

    public FacetResult {
        values = values == null ? List.of() : List.copyOf(values);
    }

    public static FacetResult of(String column, FacetMode mode, List<FacetValue> values, boolean truncated) {
        return new FacetResult(column, mode, values, truncated, false, null);
    }

    public static FacetResult skipped(String column, FacetMode mode, SkipReason reason) {
        return new FacetResult(column, mode, List.of(), false, true, reason);
    }

    /** Reason as shown to clients, or null when not skipped. */
    public String reason() {
        return skipReason == null ? null : skipReason.text();
    }
}
