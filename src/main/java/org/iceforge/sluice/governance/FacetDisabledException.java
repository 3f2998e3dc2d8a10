package org.iceforge.sluice.governance;

import java.util.List;

public class FacetDisabledException extends GovernanceException {
    private final List<String> columns;

    public FacetDisabledException(List<String> columns) {
        super("_facet= is not allowed: " + columns);
        this.columns = List.copyOf(columns);
    }

    public List<String> columns() { return columns; }
}
