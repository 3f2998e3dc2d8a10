package org.iceforge.sluice.query;

public class InvalidSqlException extends QueryExecutionException {
    public InvalidSqlException(String database, String message) {
        super(database, message, null);
    }
}
