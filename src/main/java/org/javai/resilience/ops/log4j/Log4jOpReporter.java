package org.javai.resilience.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.resilience.ApiError;
import org.javai.resilience.ops.AttemptEvent;
import org.javai.resilience.ops.OpReporter;
import org.javai.resilience.ops.OpReporterUtils;

import java.time.Duration;

/**
 * Reports request attempts using Log4j2 with markers.
 *
 * <p>Attempt levels:
 * <ul>
 *   <li>success, cancellation → DEBUG</li>
 *   <li>retryable failure, local rejection → INFO</li>
 *   <li>non-retryable failure → WARN</li>
 * </ul>
 * Retries are logged at INFO under {@code RETRY}; exhaustion at WARN under
 * {@code RETRY_EXHAUSTED}.
 */
public class Log4jOpReporter implements OpReporter {

	static final Marker ATTEMPT_MARKER = MarkerManager.getMarker("ATTEMPT");
	static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE").addParents(ATTEMPT_MARKER);
	static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");

	private final Logger logger;

	public Log4jOpReporter() {
		this(LogManager.getLogger("org.javai.resilience.OpReporter"));
	}

	public Log4jOpReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void reportAttempt(AttemptEvent event) {
		Level level = levelFor(event);
		if (event.error() == null) {
			logger.atLevel(level)
				.withMarker(ATTEMPT_MARKER)
				.log("Attempt {} of [{}] {} in {}ms, correlationId={}",
					event.attemptIndex(),
					event.operation(),
					event.outcome(),
					event.elapsed().toMillis(),
					OpReporterUtils.formatCorrelationId(event));
			return;
		}
		logger.atLevel(level)
			.withMarker(FAILURE_MARKER)
			.log("Attempt {} of [{}] {}: {} | kind={}, retryable={}, elapsed={}ms, correlationId={}",
				event.attemptIndex(),
				event.operation(),
				event.outcome(),
				event.error().message(),
				event.errorKind(),
				event.error().isRetryable(),
				event.elapsed().toMillis(),
				OpReporterUtils.formatCorrelationId(event));
	}

	@Override
	public void reportRetryScheduled(AttemptEvent event, Duration delay) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Retrying [{}] after attempt {} in {}ms. Kind: {}, Message: {}",
				event.operation(),
				event.attemptIndex(),
				delay.toMillis(),
				event.errorKind(),
				event.error() != null ? event.error().message() : "");
	}

	@Override
	public void reportRetryExhausted(AttemptEvent event, ApiError.RetryExhausted exhausted) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.log("Retry exhausted for [{}] after {} attempts. Last error: {}, correlationId={}",
				exhausted.operation(),
				exhausted.attempts(),
				exhausted.lastError().message(),
				OpReporterUtils.formatCorrelationId(event));
	}

	static Level levelFor(AttemptEvent event) {
		return switch (event.outcome()) {
			case SUCCESS, CANCELLED -> Level.DEBUG;
			case REJECTED_BY_BREAKER, REJECTED_BY_LIMITER -> Level.INFO;
			case FAILURE -> event.error().isRetryable() ? Level.INFO : Level.WARN;
		};
	}
}
