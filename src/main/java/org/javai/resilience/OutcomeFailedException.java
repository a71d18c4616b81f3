package org.javai.resilience;

/**
 * Thrown when {@link Outcome#getOrThrow()} is called on a failed outcome.
 * Callers are expected to check {@link Outcome#isFail()} first or inspect the error.
 */
public class OutcomeFailedException extends RuntimeException {

    private final ApiError error;

    public OutcomeFailedException(ApiError error) {
        super("API call failed: " + error.message());
        this.error = error;
    }

    public ApiError error() {
        return error;
    }
}
