package org.evgrid.core;

import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Per-query wall-clock bound for remotely exposed queries.
 *
 * <p>In-process callers normally use {@link #none()}. Long-running loops call
 * {@link #check(String)} and fail fast with {@code TIMEOUT} once the deadline
 * has passed.</p>
 */
public final class QueryDeadline {
    private static final QueryDeadline NONE = new QueryDeadline(Long.MAX_VALUE, System::nanoTime, false);

    private final long deadlineNanos;
    private final LongSupplier nanoClock;
    private final boolean bounded;

    private QueryDeadline(long deadlineNanos, LongSupplier nanoClock, boolean bounded) {
        this.deadlineNanos = deadlineNanos;
        this.nanoClock = nanoClock;
        this.bounded = bounded;
    }

    /**
     * Unbounded deadline; {@link #check(String)} never fails.
     */
    public static QueryDeadline none() {
        return NONE;
    }

    /**
     * Deadline {@code budget} from now on the system monotonic clock.
     */
    public static QueryDeadline after(Duration budget) {
        return after(budget, System::nanoTime);
    }

    /**
     * Deadline {@code budget} from now on a caller-supplied nanosecond clock.
     */
    public static QueryDeadline after(Duration budget, LongSupplier nanoClock) {
        Objects.requireNonNull(budget, "budget");
        Objects.requireNonNull(nanoClock, "nanoClock");
        if (budget.isNegative()) {
            throw new IllegalArgumentException("budget must be >= 0, got " + budget);
        }
        long now = nanoClock.getAsLong();
        long budgetNanos = budget.toNanos();
        long deadline = now + budgetNanos < now ? Long.MAX_VALUE : now + budgetNanos;
        return new QueryDeadline(deadline, nanoClock, true);
    }

    public boolean isBounded() {
        return bounded;
    }

    public boolean expired() {
        return bounded && nanoClock.getAsLong() - deadlineNanos >= 0;
    }

    /**
     * Fails with {@code TIMEOUT} when the deadline has passed.
     *
     * @param operation name of the running query, used in the error message.
     */
    public void check(String operation) {
        if (expired()) {
            throw new StationCoreException(
                    StationCoreException.REASON_TIMEOUT,
                    operation + " exceeded its deadline"
            );
        }
    }
}
