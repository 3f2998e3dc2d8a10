package org.iceforge.sluice.query;

/**
 * An absolute expiry instant on the monotonic clock of the {@link DeadlineClock} that created it.
 *
 * @param expiresAtNanos monotonic expiry instant; meaningless when {@link #unbounded()}
 * @param budgetMs       the budget the deadline was started with; 0 means no limit
 */
public record Deadline(long expiresAtNanos, long budgetMs) {

    public boolean unbounded() {
        return budgetMs == 0;
    }
}
