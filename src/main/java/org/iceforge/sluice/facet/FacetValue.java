package org.iceforge.sluice.facet;

public record FacetValue(Object value, long count) {
}
