package org.javai.resilience.ops;

import org.javai.resilience.ApiError;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CompositeOpReporterTest {

	private static final AttemptEvent FAILED = new AttemptEvent("GET /orders", 0, Duration.ofMillis(5),
			AttemptEvent.Result.FAILURE, ApiError.Network.retryable("reset"), null, Instant.now());

	@Test
	void reportAttempt_fansOutToAll() {
		RecordingOpReporter first = new RecordingOpReporter();
		RecordingOpReporter second = new RecordingOpReporter();

		CompositeOpReporter.of(first, second).reportAttempt(FAILED);

		assertThat(first.attempts()).containsExactly(FAILED);
		assertThat(second.attempts()).containsExactly(FAILED);
	}

	@Test
	void reportAttempt_throwingReporter_othersStillCalled() {
		OpReporter throwing = event -> {
			throw new IllegalStateException("boom");
		};
		RecordingOpReporter recording = new RecordingOpReporter();

		CompositeOpReporter composite = CompositeOpReporter.of(throwing, recording);

		assertThatCode(() -> composite.reportAttempt(FAILED)).doesNotThrowAnyException();
		assertThat(recording.attempts()).hasSize(1);
	}

	@Test
	void retryCallbacks_areForwarded() {
		RecordingOpReporter recording = new RecordingOpReporter();
		CompositeOpReporter composite = CompositeOpReporter.of(List.of(recording));

		composite.reportRetryScheduled(FAILED, Duration.ofSeconds(1));
		composite.reportRetryExhausted(FAILED, new ApiError.RetryExhausted(2, "GET /orders", FAILED.error()));

		assertThat(recording.retries()).extracting(RecordingOpReporter.Scheduled::delay).containsExactly(Duration.ofSeconds(1));
		assertThat(recording.exhausted()).extracting(ApiError.RetryExhausted::attempts).containsExactly(2);
	}

	@Test
	void builder_skipsNullAndDisabled() {
		CompositeOpReporter composite = CompositeOpReporter.builder()
				.add(new RecordingOpReporter())
				.add(null)
				.addIf(false, new RecordingOpReporter())
				.addAll(List.of(new RecordingOpReporter()))
				.build();

		assertThat(composite.size()).isEqualTo(2);
	}

	@Test
	void noOp_acceptsEverything() {
		assertThatCode(() -> OpReporter.noOp().reportAttempt(FAILED)).doesNotThrowAnyException();
	}
}
