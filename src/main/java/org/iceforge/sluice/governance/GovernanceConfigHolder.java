package org.iceforge.sluice.governance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link GovernanceConfig} snapshot.
 * <p>
 * Callers take one snapshot per request and pass it down; a reload never changes a
 * snapshot that is already in flight.
 */
public class GovernanceConfigHolder {
    private static final Logger log = LoggerFactory.getLogger(GovernanceConfigHolder.class);

    private final AtomicReference<GovernanceConfig> current;

    public GovernanceConfigHolder(GovernanceConfig initial) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
    }

    public GovernanceConfig current() {
        return current.get();
    }

    /** Atomically replace the snapshot, returning the previous one. */
    public GovernanceConfig replace(GovernanceConfig next) {
        Objects.requireNonNull(next, "next");
        GovernanceConfig previous = current.getAndSet(next);
        if (previous.numSqlThreads() != next.numSqlThreads()) {
            log.info("num_sql_threads changed {} -> {}; the worker pool keeps its size until restart",
                    previous.numSqlThreads(), next.numSqlThreads());
        }
        log.info("Governance configuration reloaded");
        return previous;
    }
}
