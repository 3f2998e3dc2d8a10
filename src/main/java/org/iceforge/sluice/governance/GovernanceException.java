package org.iceforge.sluice.governance;

/**
 * Base type for every error raised by query governance.
 */
public class GovernanceException extends RuntimeException {
    public GovernanceException(String message) {
        super(message);
    }

    public GovernanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
