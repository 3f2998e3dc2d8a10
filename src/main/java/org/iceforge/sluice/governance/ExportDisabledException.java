package org.iceforge.sluice.governance;

public class ExportDisabledException extends GovernanceException {
    public ExportDisabledException(String message) {
        super(message);
    }
}
