package org.javai.resilience.ops;

import org.javai.resilience.ApiError;

import java.time.Duration;

/**
 * Observes request execution for logging, metrics, and operator notification.
 * Implementations must be thread-safe; they are called from whichever thread completes
 * the attempt.
 */
public interface OpReporter {

    /**
     * Reports the end of one attempt. Called for every attempt, successful or not.
     */
    void reportAttempt(AttemptEvent event);

    /**
     * Reports that a failed attempt will be retried.
     *
     * @param event The failed attempt
     * @param delay How long the executor waits before the next attempt
     */
    default void reportRetryScheduled(AttemptEvent event, Duration delay) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that a call gave up after more than one attempt.
     *
     * @param event The final attempt
     * @param exhausted The error returned to the caller
     */
    default void reportRetryExhausted(AttemptEvent event, ApiError.RetryExhausted exhausted) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static OpReporter noOp() {
        return event -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static OpReporter composite(OpReporter... reporters) {
        return CompositeOpReporter.of(reporters);
    }
}
