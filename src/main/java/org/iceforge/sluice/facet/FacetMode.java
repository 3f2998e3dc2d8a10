package org.iceforge.sluice.facet;

public enum FacetMode {
    /** Asked for explicitly, via {@code _facet=} or table metadata. */
    REQUESTED,
    /** Computed speculatively to suggest useful filters. */
    SUGGESTED
}
