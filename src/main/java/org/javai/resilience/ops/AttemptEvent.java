package org.javai.resilience.ops;

import org.javai.resilience.ApiError;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * What happened to one attempt of a call.
 *
 * @param operation The logical operation (e.g., "GET /api/v1/orders")
 * @param attemptIndex The attempt number, 0 for the first attempt
 * @param elapsed Time since the first attempt of the call started
 * @param outcome How the attempt ended
 * @param error The classified error (null on success)
 * @param correlationId The call's request ID (may be null)
 * @param occurredAt When the attempt ended
 */
public record AttemptEvent(
        String operation,
        int attemptIndex,
        Duration elapsed,
        Result outcome,
        ApiError error,
        String correlationId,
        Instant occurredAt
) {

    public AttemptEvent {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(elapsed, "elapsed must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        if (outcome != Result.SUCCESS && outcome != Result.CANCELLED) {
            Objects.requireNonNull(error, "error must not be null for outcome " + outcome);
        }
    }

    /**
     * How an attempt ended.
     */
    public enum Result {
        /** The server answered with a success status and the body decoded. */
        SUCCESS,
        /** The attempt reached the transport and failed. */
        FAILURE,
        /** The open circuit breaker rejected the attempt locally. */
        REJECTED_BY_BREAKER,
        /** The client-side rate limiter rejected the attempt locally. */
        REJECTED_BY_LIMITER,
        /** The caller cancelled the call while the attempt was in flight. */
        CANCELLED
    }

    public boolean isSuccess() {
        return outcome == Result.SUCCESS;
    }

    /**
     * Stable name of the error variant, or "none".
     */
    public String errorKind() {
        return error == null ? "none" : error.getClass().getSimpleName();
    }
}
