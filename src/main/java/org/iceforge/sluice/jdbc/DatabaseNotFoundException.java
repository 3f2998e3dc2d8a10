package org.iceforge.sluice.jdbc;

public class DatabaseNotFoundException extends RuntimeException {
    private final String database;

    public DatabaseNotFoundException(String database) {
        super("Database not found: " + database);
        this.database = database;
    }

    public String database() { return database; }
}
