package org.javai.resilience.ops.metrics;

import org.javai.resilience.ApiError;
import org.javai.resilience.ops.AttemptEvent;
import org.javai.resilience.ops.OpReporter;
import org.javai.resilience.ops.OpReporterUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.function.Supplier;

/**
 * Reports request attempts as JSON-lines metrics via SLF4J.
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"orders.GET /orders","attempt":"0","outcome":"FAILURE","errorKind":"Timeout",...}
 * }</pre>
 */
public class MetricsOpReporter implements OpReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.resilience.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;
	private static final Logger internal = LoggerFactory.getLogger(MetricsOpReporter.class);

	private final String namespace;
	private final Logger logger;

	public MetricsOpReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsOpReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	public MetricsOpReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName));
	}

	// Package-private for testing.
	MetricsOpReporter(String namespace, Logger logger) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
	}

	@Override
	public void reportAttempt(AttemptEvent event) {
		emit("attempt", () -> buildAttemptJson(event));
	}

	@Override
	public void reportRetryScheduled(AttemptEvent event, Duration delay) {
		emit("retry_scheduled", () -> buildRetryJson(event, delay));
	}

	@Override
	public void reportRetryExhausted(AttemptEvent event, ApiError.RetryExhausted exhausted) {
		emit("retry_exhausted", () -> buildExhaustedJson(event, exhausted));
	}

	private void emit(String eventType, Supplier<String> json) {
		try {
			logger.info(json.get());
		} catch (RuntimeException e) {
			internal.debug("Dropped {} metric: {}", eventType, e.getMessage());
		}
	}

	String buildAttemptJson(AttemptEvent event) {
		StringBuilder sb = new StringBuilder();
		sb.append("{");
		appendField(sb, "eventType", "attempt", true);
		appendCommon(sb, event);
		appendField(sb, "outcome", event.outcome().name(), false);
		appendField(sb, "elapsedMs", String.valueOf(event.elapsed().toMillis()), false);
		if (event.error() != null) {
			appendField(sb, "errorKind", event.errorKind(), false);
			appendField(sb, "retryable", String.valueOf(event.error().isRetryable()), false);
			event.error().statusCode().ifPresent(code -> appendField(sb, "status", String.valueOf(code), false));
		}
		sb.append("}");
		return sb.toString();
	}

	private String buildRetryJson(AttemptEvent event, Duration delay) {
		StringBuilder sb = new StringBuilder();
		sb.append("{");
		appendField(sb, "eventType", "retry_scheduled", true);
		appendCommon(sb, event);
		appendField(sb, "delayMs", String.valueOf(delay.toMillis()), false);
		appendField(sb, "errorKind", event.errorKind(), false);
		sb.append("}");
		return sb.toString();
	}

	private String buildExhaustedJson(AttemptEvent event, ApiError.RetryExhausted exhausted) {
		StringBuilder sb = new StringBuilder();
		sb.append("{");
		appendField(sb, "eventType", "retry_exhausted", true);
		appendCommon(sb, event);
		appendField(sb, "totalAttempts", String.valueOf(exhausted.attempts()), false);
		appendField(sb, "errorKind", exhausted.lastError().getClass().getSimpleName(), false);
		sb.append("}");
		return sb.toString();
	}

	private void appendCommon(StringBuilder sb, AttemptEvent event) {
		appendField(sb, "timestamp", ISO_FORMATTER.format(event.occurredAt()), false);
		appendField(sb, "trackingKey", buildTrackingKey(event), false);
		appendField(sb, "attempt", String.valueOf(event.attemptIndex()), false);
		if (event.correlationId() != null) {
			appendField(sb, "correlationId", event.correlationId(), false);
		}
	}

	String buildTrackingKey(AttemptEvent event) {
		if (namespace == null) {
			return event.operation();
		}
		return namespace + "." + event.operation();
	}

	private static void appendField(StringBuilder sb, String key, String value, boolean first) {
		if (!first) {
			sb.append(",");
		}
		sb.append("\"").append(key).append("\":\"").append(OpReporterUtils.escapeJson(value)).append("\"");
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
