package org.javai.resilience.ops;

import java.util.Optional;

/**
 * Shared utilities for OpReporter implementations and environment-driven configuration.
 */
public final class OpReporterUtils {

	private OpReporterUtils() {
		// Utility class
	}

	/**
	 * Resolves configuration from system property or environment variable.
	 *
	 * @param sysProp the system property name
	 * @param envVar the environment variable name
	 * @return the resolved value
	 * @throws IllegalStateException if neither is set
	 */
	public static String resolveConfig(String sysProp, String envVar) {
		return resolveOptional(sysProp, envVar).orElseThrow(() -> new IllegalStateException(
				"Missing required configuration: set system property '" + sysProp +
				"' or environment variable '" + envVar + "'"));
	}

	/**
	 * Like {@link #resolveConfig} but empty when neither source is set.
	 */
	public static Optional<String> resolveOptional(String sysProp, String envVar) {
		String value = System.getProperty(sysProp);
		if (value == null || value.isBlank()) {
			value = System.getenv(envVar);
		}
		if (value == null || value.isBlank()) {
			return Optional.empty();
		}
		return Optional.of(value.trim());
	}

	/**
	 * Validates that a value is not null or blank.
	 *
	 * @throws IllegalArgumentException if value is null or blank
	 */
	public static String requireNonEmpty(String value, String name) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException(name + " must not be null or empty");
		}
		return value;
	}

	/**
	 * Escapes special characters for JSON string values.
	 */
	public static String escapeJson(String s) {
		if (s == null) return "";
		return s.replace("\\", "\\\\")
				.replace("\"", "\\\"")
				.replace("\n", "\\n")
				.replace("\r", "\\r")
				.replace("\t", "\\t");
	}

	/**
	 * The correlation ID of an event, or "none".
	 */
	public static String formatCorrelationId(AttemptEvent event) {
		return event.correlationId() != null ? event.correlationId() : "none";
	}
}
