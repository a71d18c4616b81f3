package org.javai.resilience.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Context provided to retry policies for making decisions.
 *
 * @param attemptIndex The attempt that just completed (0 for the first attempt)
 * @param startedNanos When the first attempt began, on the executor's nano clock
 * @param elapsed Time elapsed since the first attempt
 * @param budget Optional total time budget (null if no budget)
 */
public record RetryContext(
        int attemptIndex,
        long startedNanos,
        Duration elapsed,
        Duration budget
) {
    public RetryContext {
        if (attemptIndex < 0) {
            throw new IllegalArgumentException("attemptIndex must be >= 0");
        }
        Objects.requireNonNull(elapsed, "elapsed must not be null");
    }

    public static RetryContext first(long nowNanos) {
        return new RetryContext(0, nowNanos, Duration.ZERO, null);
    }

    public static RetryContext first(long nowNanos, Duration budget) {
        return new RetryContext(0, nowNanos, Duration.ZERO, budget);
    }

    /**
     * Refreshes the elapsed time without moving to the next attempt.
     */
    public RetryContext at(long nowNanos) {
        return new RetryContext(attemptIndex, startedNanos, Duration.ofNanos(nowNanos - startedNanos), budget);
    }

    public RetryContext next(long nowNanos) {
        return new RetryContext(attemptIndex + 1, startedNanos, Duration.ofNanos(nowNanos - startedNanos), budget);
    }

    public boolean hasBudgetRemaining() {
        return budget == null || budget.compareTo(elapsed) > 0;
    }

    public Duration remainingBudget() {
        if (budget == null) {
            return null;
        }
        Duration remaining = budget.minus(elapsed);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
