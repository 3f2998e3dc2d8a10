package org.iceforge.sluice.query;

import org.iceforge.sluice.governance.GovernanceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handle on a query submitted through {@link QueryGovernor#start}. The deadline was
 * fixed at submission, so time spent queued counts against it.
 */
public final class GovernedExecution {
    private static final Logger log = LoggerFactory.getLogger(GovernedExecution.class);

    private final QuerySpec spec;
    private final Deadline deadline;
    private final DeadlineClock clock;
    private final WorkerPool pool;
    private final ActiveStatement active;
    private volatile Future<QueryResult> future;

    GovernedExecution(QuerySpec spec, Deadline deadline, DeadlineClock clock, WorkerPool pool, ActiveStatement active) {
        this.spec = spec;
        this.deadline = deadline;
        this.clock = clock;
        this.pool = pool;
        this.active = active;
    }

    void bind(Future<QueryResult> future) {
        this.future = future;
    }

    public QuerySpec spec() {
        return spec;
    }

    public Deadline deadline() {
        return deadline;
    }

    /**
     * Wait for the result, no longer than the remaining budget. On expiry the statement is
     * cancelled and control returns immediately, without waiting for the engine.
     */
    public QueryResult await() {
        try {
            if (deadline.unbounded()) {
                return future.get();
            }
            return future.get(clock.remainingNanos(deadline), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            cancel();
            log.info("Time limit of {}ms exceeded on database={}", deadline.budgetMs(), spec.database());
            throw new TimeLimitExceededException(spec.database(), deadline.budgetMs(), !active.started());
        } catch (CancellationException e) {
            throw new TimeLimitExceededException(spec.database(), deadline.budgetMs(), !active.started());
        } catch (InterruptedException e) {
            cancel();
            Thread.currentThread().interrupt();
            throw new GovernanceException("Interrupted while waiting for query", e);
        } catch (ExecutionException e) {
            throw translate(e.getCause());
        }
    }

    /** Cancel the in-flight statement, or withdraw the task if it has not started. */
    public void cancel() {
        active.cancel();
        Future<QueryResult> f = future;
        if (f != null) {
            pool.withdraw(f);
        }
    }

    private RuntimeException translate(Throwable cause) {
        if (cause instanceof TimeLimitExceededException tle) {
            log.info("Time limit of {}ms exceeded on database={} (in queue={})",
                    deadline.budgetMs(), spec.database(), tle.expiredInQueue());
            return tle;
        }
        if (cause instanceof SQLException sql) {
            if (active.cancelled() || clock.expired(deadline)) {
                return new TimeLimitExceededException(spec.database(), deadline.budgetMs(), false);
            }
            return new QueryExecutionException(spec.database(), sql.getMessage(), sql);
        }
        if (cause instanceof RuntimeException re) {
            return re;
        }
        return new QueryExecutionException(spec.database(), String.valueOf(cause.getMessage()), cause);
    }

    /**
     * The statement currently running for one execution. Cancellation may arrive before the
     * statement exists, while it runs, or after it finished.
     */
    static final class ActiveStatement {
        private Statement statement;
        private boolean cancelled;
        private boolean started;

        synchronized void attach(Statement st) throws SQLException {
            started = true;
            if (cancelled) {
                throw new SQLException("Statement was cancelled before it started");
            }
            statement = st;
        }

        synchronized void detach() {
            statement = null;
        }

        synchronized void markStarted() {
            started = true;
        }

        synchronized boolean started() {
            return started;
        }

        synchronized boolean cancelled() {
            return cancelled;
        }

        synchronized void cancel() {
            cancelled = true;
            if (statement != null) {
                try {
                    statement.cancel();
                } catch (SQLException e) {
                    log.warn("Statement cancel failed: {}", e.toString());
                }
            }
        }
    }
}
