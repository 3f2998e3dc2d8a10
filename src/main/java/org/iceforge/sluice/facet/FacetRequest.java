package org.iceforge.sluice.facet;

import java.util.Objects;

/**
 * @param column column to break down
 * @param mode   requested or suggested
 * @param source where a requested facet came from; suggestions are always {@link Source#AD_HOC}
 */
public record FacetRequest(String column, FacetMode mode, Source source) {

    public enum Source {
        /** A {@code _facet=} request parameter. */
        AD_HOC,
        /** Declared in table metadata; honored even when ad hoc facets are disabled. */
        METADATA
    }

    public FacetRequest {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(source, "source");
    }

    public static FacetRequest requested(String column) {
        return new FacetRequest(column, FacetMode.REQUESTED, Source.AD_HOC);
    }

    public static FacetRequest declared(String column) {
        return new FacetRequest(column, FacetMode.REQUESTED, Source.METADATA);
    }

    public static FacetRequest suggested(String column) {
        return new FacetRequest(column, FacetMode.SUGGESTED, Source.AD_HOC);
    }
}
