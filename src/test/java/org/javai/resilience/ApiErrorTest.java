package org.javai.resilience;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ApiErrorTest {

    @Test
    void isRetryable_transientVariants_areRetryable() {
        List<ApiError> retryable = List.of(
                new ApiError.RateLimit(null),
                new ApiError.Conflict(null),
                new ApiError.ServiceUnavailable(Duration.ofSeconds(3)),
                new ApiError.Timeout(Duration.ofSeconds(30), "GET /x"),
                ApiError.Network.retryable("reset"),
                new ApiError.Api(500, "oops"),
                new ApiError.Api(599, "edge"));

        assertThat(retryable).allMatch(ApiError::isRetryable);
    }

    @Test
    void isRetryable_permanentVariants_areNotRetryable() {
        List<ApiError> permanent = List.of(
                new ApiError.NotFound(),
                new ApiError.Authentication("bad token"),
                new ApiError.Authorization("no"),
                new ApiError.Validation("bad"),
                ApiError.Network.permanent("unknown host"),
                new ApiError.Api(400, "bad request"),
                new ApiError.Api(600, "nonsense"),
                new ApiError.InvalidRequest("missing id"),
                new ApiError.QuotaExceeded(null),
                new ApiError.Other("?"),
                new ApiError.RetryExhausted(4, "op", new ApiError.ServiceUnavailable(null)));

        assertThat(permanent).noneMatch(ApiError::isRetryable);
    }

    @Test
    void statusCode_mapsVariantsToHttpStatus() {
        assertThat(new ApiError.NotFound().statusCode()).hasValue(404);
        assertThat(new ApiError.Authentication("x").statusCode()).hasValue(401);
        assertThat(new ApiError.Authorization("x").statusCode()).hasValue(403);
        assertThat(new ApiError.RateLimit(null).statusCode()).hasValue(429);
        assertThat(new ApiError.QuotaExceeded(Instant.EPOCH).statusCode()).hasValue(429);
        assertThat(new ApiError.Api(418, "teapot").statusCode()).hasValue(418);
        assertThat(new ApiError.Validation("x").statusCode()).hasValue(422);
        assertThat(new ApiError.Timeout(Duration.ofSeconds(1), "op").statusCode()).hasValue(408);
        assertThat(new ApiError.Conflict(null).statusCode()).hasValue(409);
        assertThat(new ApiError.ServiceUnavailable(null).statusCode()).hasValue(503);
        assertThat(new ApiError.InvalidRequest("x").statusCode()).hasValue(400);
        assertThat(ApiError.Network.retryable("x").statusCode()).isEmpty();
        assertThat(new ApiError.Other("x").statusCode()).isEmpty();
    }

    @Test
    void statusCode_retryExhausted_reportsLastError() {
        ApiError error = new ApiError.RetryExhausted(3, "op", new ApiError.Api(502, "bad gateway"));

        assertThat(error.statusCode()).hasValue(502);
    }

    @Test
    void retryAfter_networkError_isOneSecond() {
        assertThat(ApiError.Network.retryable("x").retryAfter()).contains(Duration.ofSeconds(1));
        assertThat(ApiError.Network.permanent("x").retryAfter()).contains(Duration.ofSeconds(1));
    }

    @Test
    void retryAfter_serverHint_isPassedThrough() {
        assertThat(new ApiError.RateLimit(Duration.ofSeconds(9)).retryAfter()).contains(Duration.ofSeconds(9));
        assertThat(new ApiError.Conflict(Duration.ofSeconds(2)).retryAfter()).contains(Duration.ofSeconds(2));
        assertThat(new ApiError.ServiceUnavailable(null).retryAfter()).isEmpty();
        assertThat(new ApiError.Api(500, "x").retryAfter()).isEmpty();
    }

    @Test
    void message_describesVariant() {
        assertThat(new ApiError.RateLimit(Duration.ofSeconds(5)).message()).isEqualTo("Rate limit exceeded. Retry after 5s");
        assertThat(new ApiError.Validation("is required", "name", null).message())
                .isEqualTo("Validation error on 'name': is required");
        assertThat(new ApiError.RetryExhausted(3, "GET /x", new ApiError.NotFound()).message())
                .isEqualTo("Operation 'GET /x' failed after 3 attempts: Resource not found");
    }

    @Test
    void retryExhausted_zeroAttempts_throws() {
        assertThatThrownBy(() -> new ApiError.RetryExhausted(0, "op", new ApiError.NotFound()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
