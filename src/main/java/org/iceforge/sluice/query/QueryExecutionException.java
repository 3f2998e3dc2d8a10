package org.iceforge.sluice.query;

import org.iceforge.sluice.governance.GovernanceException;

/**
 * The engine rejected or failed the statement. The message is the engine's own.
 */
public class QueryExecutionException extends GovernanceException {
    private final String database;

    public QueryExecutionException(String database, String message, Throwable cause) {
        super(message, cause);
        this.database = database;
    }

    public String database() { return database; }
}
