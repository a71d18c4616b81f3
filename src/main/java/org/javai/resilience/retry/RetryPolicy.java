package org.javai.resilience.retry;

import org.javai.resilience.ApiError;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Decides whether and when to resubmit a failed request.
 *
 * <p>The delay before the retry that follows attempt {@code n} is {@code initialDelay} for
 * {@code n == 0} and {@code min(initialDelay * multiplier^n, maxDelay)} afterwards. With
 * jitter enabled the capped delay is scaled by a fresh random factor in {@code [0.5, 1.5)}.
 *
 * <pre>{@code
 * RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0, false);
 * policy.delayForAttempt(0); // 1s
 * policy.delayForAttempt(1); // 2s
 * policy.delayForAttempt(2); // 4s
 * }</pre>
 *
 * @param maxAttempts number of retries after the first attempt
 * @param initialDelay delay after the first attempt
 * @param maxDelay upper bound of the pre-jitter delay
 * @param multiplier exponential growth factor, greater than 1.0
 * @param jitter whether delays are randomized
 */
public record RetryPolicy(
        int maxAttempts,
        Duration initialDelay,
        Duration maxDelay,
        double multiplier,
        boolean jitter
) {

    public RetryPolicy {
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0");
        }
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (!(multiplier > 1.0) || Double.isInfinite(multiplier)) {
            throw new IllegalArgumentException("multiplier must be > 1.0, was: " + multiplier);
        }
    }

    /**
     * Three retries starting at one second, doubling up to a minute, with jitter.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0, true);
    }

    /**
     * A policy that never retries.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 2.0, false);
    }

    public RetryPolicy withoutJitter() {
        return new RetryPolicy(maxAttempts, initialDelay, maxDelay, multiplier, false);
    }

    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, initialDelay, maxDelay, multiplier, jitter);
    }

    /**
     * The capped delay before jitter is applied.
     */
    public Duration baseDelay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        if (attempt == 0) {
            return initialDelay;
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attempt);
        if (Double.isNaN(millis) || millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    /**
     * The delay to wait after attempt {@code attempt} failed.
     */
    public Duration delayForAttempt(int attempt) {
        return delayForAttempt(attempt, ThreadLocalRandom.current().nextDouble());
    }

    /**
     * The delay to wait after attempt {@code attempt} failed, using {@code sample}
     * (in {@code [0, 1)}) as the jitter source.
     */
    Duration delayForAttempt(int attempt, double sample) {
        Duration base = baseDelay(attempt);
        if (!jitter) {
            return base;
        }
        double factor = 0.5 + sample;
        return Duration.ofMillis((long) (base.toMillis() * factor));
    }

    /**
     * Whether another attempt is allowed after attempt {@code attempt}.
     */
    public boolean shouldRetry(int attempt) {
        return attempt < maxAttempts;
    }

    /**
     * Evaluates a failed attempt.
     *
     * <p>The returned delay is never shorter than the error's own {@link ApiError#retryAfter()}.
     *
     * @param context The current retry context
     * @param error The classified failure of the attempt
     * @return Retry with a delay, or GiveUp
     */
    public RetryDecision decide(RetryContext context, ApiError error) {
        if (!error.isRetryable()) {
            return RetryDecision.GiveUp.because("failure is not retryable");
        }
        if (!shouldRetry(context.attemptIndex())) {
            return RetryDecision.GiveUp.because("max attempts reached");
        }
        if (!context.hasBudgetRemaining()) {
            return RetryDecision.GiveUp.because("budget exhausted");
        }

        Duration delay = delayForAttempt(context.attemptIndex());

        // Respect the server's Retry-After hint
        Duration hint = error.retryAfter().orElse(Duration.ZERO);
        if (hint.compareTo(delay) > 0) {
            delay = hint;
        }
        return RetryDecision.Retry.after(delay);
    }
}
