package org.iceforge.sluice.governance;

public class SqlDisabledException extends GovernanceException {
    public SqlDisabledException(String database) {
        super("Arbitrary SQL queries are disabled for database " + database);
    }
}
