package org.iceforge.sluice.query;

import org.iceforge.sluice.governance.GovernanceException;

/**
 * The deadline expired while the query was queued or running.
 */
public class TimeLimitExceededException extends GovernanceException {
    private final String database;
    private final long timeLimitMs;
    private final boolean expiredInQueue;

    public TimeLimitExceededException(String database, long timeLimitMs, boolean expiredInQueue) {
        super("SQL query took too long: time limit of " + timeLimitMs + "ms exceeded"
                + (expiredInQueue ? " while waiting for a worker" : ""));
        this.database = database;
        this.timeLimitMs = timeLimitMs;
        this.expiredInQueue = expiredInQueue;
    }

    public String database() { return database; }
    public long timeLimitMs() { return timeLimitMs; }
    public boolean expiredInQueue() { return expiredInQueue; }
}
