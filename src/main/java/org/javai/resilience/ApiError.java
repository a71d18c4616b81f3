package org.javai.resilience;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A classified failure of a remote API call.
 * Exactly one variant describes each failure; the retry engine decides what to do
 * purely from {@link #isRetryable()}, {@link #statusCode()} and {@link #retryAfter()}.
 *
 * <p>An open circuit breaker is reported as {@link ServiceUnavailable}, so callers cannot
 * tell it apart from a genuine 503. A rejected local rate limit check is reported as
 * {@link RateLimit}.</p>
 */
public sealed interface ApiError permits
        ApiError.NotFound,
        ApiError.Authentication,
        ApiError.Authorization,
        ApiError.RateLimit,
        ApiError.Api,
        ApiError.Validation,
        ApiError.Network,
        ApiError.Timeout,
        ApiError.Conflict,
        ApiError.ServiceUnavailable,
        ApiError.RetryExhausted,
        ApiError.InvalidRequest,
        ApiError.QuotaExceeded,
        ApiError.Other {

    /**
     * Delay suggested after a network error, so that a failing socket does not turn
     * into a hot retry loop.
     */
    Duration NETWORK_RETRY_AFTER = Duration.ofSeconds(1);

    /**
     * Human-readable description of the failure.
     */
    String message();

    /**
     * Whether resubmitting the same request might succeed.
     */
    default boolean isRetryable() {
        if (this instanceof RateLimit
                || this instanceof Conflict
                || this instanceof ServiceUnavailable
                || this instanceof Timeout) {
            return true;
        }
        if (this instanceof Network network) {
            return network.canRetry();
        }
        if (this instanceof Api api) {
            return api.code() >= 500 && api.code() <= 599;
        }
        return false;
    }

    /**
     * The HTTP status this failure corresponds to, if any.
     */
    default OptionalInt statusCode() {
        if (this instanceof NotFound) {
            return OptionalInt.of(404);
        }
        if (this instanceof Authentication) {
            return OptionalInt.of(401);
        }
        if (this instanceof Authorization) {
            return OptionalInt.of(403);
        }
        if (this instanceof RateLimit || this instanceof QuotaExceeded) {
            return OptionalInt.of(429);
        }
        if (this instanceof Api api) {
            return OptionalInt.of(api.code());
        }
        if (this instanceof Validation) {
            return OptionalInt.of(422);
        }
        if (this instanceof Timeout) {
            return OptionalInt.of(408);
        }
        if (this instanceof Conflict) {
            return OptionalInt.of(409);
        }
        if (this instanceof ServiceUnavailable) {
            return OptionalInt.of(503);
        }
        if (this instanceof InvalidRequest) {
            return OptionalInt.of(400);
        }
        if (this instanceof RetryExhausted exhausted) {
            return exhausted.lastError().statusCode();
        }
        return OptionalInt.empty();
    }

    /**
     * The minimum wait before this request should be resubmitted, if the failure
     * carries one.
     */
    default Optional<Duration> retryAfter() {
        if (this instanceof RateLimit rateLimit) {
            return Optional.ofNullable(rateLimit.delay());
        }
        if (this instanceof Conflict conflict) {
            return Optional.ofNullable(conflict.delay());
        }
        if (this instanceof ServiceUnavailable unavailable) {
            return Optional.ofNullable(unavailable.delay());
        }
        if (this instanceof Network) {
            return Optional.of(NETWORK_RETRY_AFTER);
        }
        return Optional.empty();
    }

    // === Variants ===

    record NotFound() implements ApiError {
        @Override
        public String message() {
            return "Resource not found";
        }
    }

    record Authentication(String detail) implements ApiError {
        public Authentication {
            Objects.requireNonNull(detail, "detail must not be null");
        }

        @Override
        public String message() {
            return "Authentication failed: " + detail;
        }
    }

    record Authorization(String detail) implements ApiError {
        public Authorization {
            Objects.requireNonNull(detail, "detail must not be null");
        }

        @Override
        public String message() {
            return "Authorization failed: " + detail;
        }
    }

    /**
     * @param delay parsed {@code Retry-After}, or null when the server sent none
     */
    record RateLimit(Duration delay) implements ApiError {
        @Override
        public String message() {
            return delay == null
                    ? "Rate limit exceeded"
                    : "Rate limit exceeded. Retry after " + delay.toSeconds() + "s";
        }
    }

    /**
     * @param code HTTP status code
     * @param detail message from the error envelope, or the raw body
     * @param details the parsed JSON error body (may be null)
     * @param requestId the server's {@code X-Request-ID} (may be null)
     */
    record Api(int code, String detail, JsonNode details, String requestId) implements ApiError {
        public Api {
            Objects.requireNonNull(detail, "detail must not be null");
        }

        public Api(int code, String detail) {
            this(code, detail, null, null);
        }

        @Override
        public String message() {
            return "API error " + code + ": " + detail;
        }
    }

    /**
     * @param detail validation message
     * @param field offending field (may be null)
     * @param code machine-readable validation code (may be null)
     */
    record Validation(String detail, String field, String code) implements ApiError {
        public Validation {
            Objects.requireNonNull(detail, "detail must not be null");
        }

        public Validation(String detail) {
            this(detail, null, null);
        }

        @Override
        public String message() {
            return field == null
                    ? "Validation error: " + detail
                    : "Validation error on '" + field + "': " + detail;
        }
    }

    /**
     * @param detail what went wrong on the wire
     * @param timeout whether the failure was a timeout at the socket level
     * @param canRetry whether resubmitting might succeed
     */
    record Network(String detail, boolean timeout, boolean canRetry) implements ApiError {
        public Network {
            Objects.requireNonNull(detail, "detail must not be null");
        }

        public static Network retryable(String detail) {
            return new Network(detail, false, true);
        }

        public static Network permanent(String detail) {
            return new Network(detail, false, false);
        }

        @Override
        public String message() {
            return "Network error: " + detail;
        }
    }

    record Timeout(Duration duration, String operation) implements ApiError {
        public Timeout {
            Objects.requireNonNull(duration, "duration must not be null");
            Objects.requireNonNull(operation, "operation must not be null");
        }

        @Override
        public String message() {
            return "Operation '" + operation + "' timed out after " + duration.toMillis() + "ms";
        }
    }

    record Conflict(Duration delay) implements ApiError {
        @Override
        public String message() {
            return "Resource conflict";
        }
    }

    record ServiceUnavailable(Duration delay) implements ApiError {
        @Override
        public String message() {
            return "Service temporarily unavailable";
        }
    }

    /**
     * Terminal failure after more than one attempt.
     *
     * @param attempts number of attempts made
     * @param operation the operation that was retried
     * @param lastError the failure of the final attempt
     */
    record RetryExhausted(int attempts, String operation, ApiError lastError) implements ApiError {
        public RetryExhausted {
            Objects.requireNonNull(operation, "operation must not be null");
            Objects.requireNonNull(lastError, "lastError must not be null");
            if (attempts < 1) {
                throw new IllegalArgumentException("attempts must be >= 1");
            }
        }

        @Override
        public String message() {
            return "Operation '" + operation + "' failed after " + attempts + " attempts: " + lastError.message();
        }
    }

    record InvalidRequest(String detail) implements ApiError {
        public InvalidRequest {
            Objects.requireNonNull(detail, "detail must not be null");
        }

        @Override
        public String message() {
            return "Invalid request: " + detail;
        }
    }

    /**
     * @param resetTime when the quota resets (may be null)
     */
    record QuotaExceeded(Instant resetTime) implements ApiError {
        @Override
        public String message() {
            return resetTime == null ? "Quota exceeded" : "Quota exceeded until " + resetTime;
        }
    }

    record Other(String detail) implements ApiError {
        public Other {
            Objects.requireNonNull(detail, "detail must not be null");
        }

        @Override
        public String message() {
            return detail;
        }
    }
}
