package org.iceforge.sluice.query;

public class TableNotFoundException extends RuntimeException {
    public TableNotFoundException(String database, String table) {
        super("Table not found: " + database + "/" + table);
    }
}
