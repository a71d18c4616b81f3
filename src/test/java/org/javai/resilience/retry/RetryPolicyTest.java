package org.javai.resilience.retry;

import org.javai.resilience.ApiError;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0, false);

    @Test
    void delayForAttempt_withoutJitter_doublesFromInitialDelay() {
        assertThat(policy.delayForAttempt(0)).isEqualTo(Duration.ofMillis(1000));
        assertThat(policy.delayForAttempt(1)).isEqualTo(Duration.ofMillis(2000));
        assertThat(policy.delayForAttempt(2)).isEqualTo(Duration.ofMillis(4000));
    }

    @Test
    void delayForAttempt_largeAttempt_isCappedAtMaxDelay() {
        RetryPolicy capped = new RetryPolicy(10, Duration.ofSeconds(1), Duration.ofSeconds(5), 2.0, false);

        assertThat(capped.delayForAttempt(3)).isEqualTo(Duration.ofSeconds(5));
        assertThat(capped.delayForAttempt(500)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void baseDelay_isNonDecreasing() {
        RetryPolicy growing = new RetryPolicy(50, Duration.ofMillis(10), Duration.ofSeconds(30), 1.5, true);
        Duration previous = Duration.ZERO;
        for (int attempt = 0; attempt < 50; attempt++) {
            Duration current = growing.baseDelay(attempt);
            assertThat(current).isGreaterThanOrEqualTo(previous).isLessThanOrEqualTo(Duration.ofSeconds(30));
            previous = current;
        }
    }

    @Test
    void delayForAttempt_withJitter_staysWithinHalfToOneAndAHalf() {
        RetryPolicy jittered = RetryPolicy.defaults();

        assertThat(jittered.delayForAttempt(1, 0.0)).isEqualTo(Duration.ofMillis(1000));
        assertThat(jittered.delayForAttempt(1, 0.5)).isEqualTo(Duration.ofMillis(2000));
        for (int i = 0; i < 200; i++) {
            assertThat(jittered.delayForAttempt(1))
                    .isGreaterThanOrEqualTo(Duration.ofMillis(1000))
                    .isLessThanOrEqualTo(Duration.ofMillis(3000));
        }
    }

    @Test
    void shouldRetry_trueOnlyBelowMaxAttempts() {
        assertThat(policy.shouldRetry(0)).isTrue();
        assertThat(policy.shouldRetry(2)).isTrue();
        assertThat(policy.shouldRetry(3)).isFalse();
        assertThat(RetryPolicy.noRetry().shouldRetry(0)).isFalse();
    }

    @Test
    void decide_nonRetryableError_givesUp() {
        RetryDecision decision = policy.decide(RetryContext.first(0), new ApiError.NotFound());

        assertThat(decision).isEqualTo(RetryDecision.GiveUp.because("failure is not retryable"));
    }

    @Test
    void decide_lastAttempt_givesUp() {
        RetryContext context = new RetryContext(3, 0, Duration.ZERO, null);

        RetryDecision decision = policy.decide(context, new ApiError.ServiceUnavailable(null));

        assertThat(decision).isEqualTo(RetryDecision.GiveUp.because("max attempts reached"));
    }

    @Test
    void decide_budgetSpent_givesUp() {
        RetryContext context = new RetryContext(0, 0, Duration.ofSeconds(5), Duration.ofSeconds(5));

        assertThat(policy.decide(context, new ApiError.ServiceUnavailable(null)))
                .isInstanceOf(RetryDecision.GiveUp.class);
    }

    @Test
    void decide_retryAfterLongerThanBackoff_usesRetryAfter() {
        RetryDecision decision = policy.decide(RetryContext.first(0), new ApiError.RateLimit(Duration.ofSeconds(30)));

        assertThat(decision).isEqualTo(RetryDecision.Retry.after(Duration.ofSeconds(30)));
    }

    @Test
    void decide_retryAfterShorterThanBackoff_usesBackoff() {
        RetryContext second = RetryContext.first(0).next(0).next(0);

        RetryDecision decision = policy.decide(second, new ApiError.Conflict(Duration.ofSeconds(1)));

        assertThat(decision).isEqualTo(RetryDecision.Retry.after(Duration.ofSeconds(4)));
    }

    @Test
    void constructor_invalidArguments_throw() {
        assertThatThrownBy(() -> new RetryPolicy(-1, Duration.ZERO, Duration.ZERO, 2.0, false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(3, Duration.ofSeconds(2), Duration.ofSeconds(1), 2.0, false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(2), 1.0, false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withers_changeOnlyTheirComponent() {
        RetryPolicy changed = RetryPolicy.defaults().withoutJitter().withMaxAttempts(7);

        assertThat(changed).isEqualTo(new RetryPolicy(7, Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0, false));
    }
}
