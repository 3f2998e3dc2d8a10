package org.iceforge.sluice.governance;

public class ExportLimitExceededException extends GovernanceException {
    private final long limitBytes;

    public ExportLimitExceededException(long limitBytes) {
        super("Export exceeded the " + (limitBytes / (1024 * 1024)) + "MB limit");
        this.limitBytes = limitBytes;
    }

    public long limitBytes() { return limitBytes; }
}
