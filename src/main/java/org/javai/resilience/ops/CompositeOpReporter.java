package org.javai.resilience.ops;

import org.javai.resilience.ApiError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * An {@link OpReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. A reporter that throws is logged and
 * skipped; the remaining reporters still run and the request is unaffected.
 *
 * <pre>{@code
 * OpReporter reporter = CompositeOpReporter.builder()
 *     .add(new Log4jOpReporter())
 *     .addIf(metricsEnabled, new MetricsOpReporter("orders"))
 *     .build();
 * }</pre>
 */
public final class CompositeOpReporter implements OpReporter {

	private static final Logger log = LoggerFactory.getLogger(CompositeOpReporter.class);

	private final List<OpReporter> reporters;

	private CompositeOpReporter(List<OpReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	public static CompositeOpReporter of(OpReporter... reporters) {
		return new CompositeOpReporter(Arrays.asList(reporters));
	}

	public static CompositeOpReporter of(Collection<? extends OpReporter> reporters) {
		return new CompositeOpReporter(new ArrayList<>(reporters));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void reportAttempt(AttemptEvent event) {
		fanOut("reportAttempt", r -> r.reportAttempt(event));
	}

	@Override
	public void reportRetryScheduled(AttemptEvent event, Duration delay) {
		fanOut("reportRetryScheduled", r -> r.reportRetryScheduled(event, delay));
	}

	@Override
	public void reportRetryExhausted(AttemptEvent event, ApiError.RetryExhausted exhausted) {
		fanOut("reportRetryExhausted", r -> r.reportRetryExhausted(event, exhausted));
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private void fanOut(String method, Consumer<OpReporter> call) {
		for (OpReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (RuntimeException e) {
				log.warn("OpReporter.{} failed for {}: {}", method, reporter.getClass().getName(), e.getMessage(), e);
			}
		}
	}

	/**
	 * Builder for creating a {@link CompositeOpReporter}.
	 */
	public static final class Builder {
		private final List<OpReporter> reporters = new ArrayList<>();

		private Builder() {}

		/**
		 * Adds a reporter; {@code null} is ignored.
		 */
		public Builder add(OpReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		public Builder addAll(Collection<? extends OpReporter> reporters) {
			for (OpReporter reporter : reporters) {
				add(reporter);
			}
			return this;
		}

		public Builder addIf(boolean condition, OpReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeOpReporter build() {
			return new CompositeOpReporter(reporters);
		}
	}
}
