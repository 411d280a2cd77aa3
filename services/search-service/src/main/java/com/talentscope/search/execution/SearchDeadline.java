package com.talentscope.search.execution;

import java.util.function.LongSupplier;

/**
 * Wall-clock budget for a single search request.
 */
public final class SearchDeadline {
    private final long deadlineMs;
    private final LongSupplier clock;

    private SearchDeadline(long deadlineMs, LongSupplier clock) {
        this.deadlineMs = deadlineMs;
        this.clock = clock;
    }

    public static SearchDeadline after(long budgetMs) {
        return after(budgetMs, System::currentTimeMillis);
    }

    public static SearchDeadline after(long budgetMs, LongSupplier clock) {
        return new SearchDeadline(clock.getAsLong() + Math.max(0L, budgetMs), clock);
    }

    public long remainingMs() {
        return Math.max(0L, deadlineMs - clock.getAsLong());
    }

    public boolean isExpired() {
        return remainingMs() == 0L;
    }

    /**
     * Deadline with at least {@code floorMs} left, used so a degraded path still gets a fair
     * attempt after the primary path used up the budget.
     */
    public SearchDeadline withFloor(long floorMs) {
        long now = clock.getAsLong();
        return new SearchDeadline(Math.max(deadlineMs, now + floorMs), clock);
    }

    public void ensureRemaining(String stage) {
        if (isExpired()) {
            throw new SearchTimeoutException(stage);
        }
    }
}
