package org.iceforge.sluice.query;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Deadline arithmetic over a monotonic nanosecond source. Never uses wall-clock time, so
 * system clock adjustments cannot stretch or shrink a budget.
 */
public final class DeadlineClock {
    private static final DeadlineClock SYSTEM = new DeadlineClock(System::nanoTime);

    private final LongSupplier nanoTime;

    public DeadlineClock(LongSupplier nanoTime) {
        this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime");
    }

    public static DeadlineClock system() {
        return SYSTEM;
    }

    /**
     * @param budgetMs milliseconds from now; 0 produces a deadline that never expires
     */
    public Deadline start(long budgetMs) {
        if (budgetMs < 0) {
            throw new IllegalArgumentException("budgetMs must be >= 0: " + budgetMs);
        }
        return new Deadline(nanoTime.getAsLong() + TimeUnit.MILLISECONDS.toNanos(budgetMs), budgetMs);
    }

    /** Remaining budget in milliseconds, rounded up; 0 once expired. */
    public long remaining(Deadline deadline) {
        if (deadline.unbounded()) return Long.MAX_VALUE;
        long nanos = remainingNanos(deadline);
        return nanos <= 0 ? 0 : (nanos + 999_999L) / 1_000_000L;
    }

    public long remainingNanos(Deadline deadline) {
        if (deadline.unbounded()) return Long.MAX_VALUE;
        // Subtract rather than compare: nanoTime values may wrap.
        return Math.max(0L, deadline.expiresAtNanos() - nanoTime.getAsLong());
    }

    public boolean expired(Deadline deadline) {
        return !deadline.unbounded() && deadline.expiresAtNanos() - nanoTime.getAsLong() <= 0;
    }

    long nanos() {
        return nanoTime.getAsLong();
    }
}
