package org.javai.resilience.retry;

import org.javai.resilience.ApiError;
import org.javai.resilience.Outcome;
import org.javai.resilience.boundary.ErrorClassifier;
import org.javai.resilience.boundary.HttpErrorClassifier;
import org.javai.resilience.boundary.ResponseDecoder;
import org.javai.resilience.boundary.Transport;
import org.javai.resilience.boundary.TransportRequest;
import org.javai.resilience.boundary.TransportResponse;
import org.javai.resilience.guard.CircuitBreaker;
import org.javai.resilience.guard.RateLimiter;
import org.javai.resilience.ops.AttemptEvent;
import org.javai.resilience.ops.OpReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.LongSupplier;

/**
 * Runs one logical call as a sequence of attempts against a {@link Transport}.
 * Operates entirely over Outcome values: operational failures never escape as exceptions.
 *
 * <p>Each attempt passes the circuit breaker, then the rate limiter, then goes to the
 * transport. A failed attempt is classified and offered to the {@link RetryPolicy}; the
 * wait before the next attempt never blocks a thread. A call that stops on its first
 * attempt returns the classified error itself; a call that made several attempts returns
 * {@link ApiError.RetryExhausted} boxing the last one.</p>
 *
 * <pre>{@code
 * RequestExecutor executor = RequestExecutor.builder()
 *     .transport(JdkHttpTransport.create(...))
 *     .policy(RetryPolicy.defaults())
 *     .classifier(new HttpErrorClassifier(Duration.ofSeconds(30)))
 *     .circuitBreaker(new CircuitBreaker("orders", 5, Duration.ofSeconds(30)))
 *     .build();
 *
 * CompletableFuture<Outcome<Order>> order = executor.executeAsync("GET /orders/42", request, decoder);
 * }</pre>
 *
 * <p>Cancelling the returned future cancels the in-flight exchange or backoff. A cancelled
 * attempt gives back its breaker trial and its limiter token and is counted neither as a
 * success nor as a failure.</p>
 */
public final class RequestExecutor {

    private static final Logger log = LoggerFactory.getLogger(RequestExecutor.class);

    private final Transport transport;
    private final RetryPolicy policy;
    private final ErrorClassifier classifier;
    private final OpReporter reporter;
    private final CircuitBreaker circuitBreaker;
    private final RateLimiter rateLimiter;
    private final Sleeper sleeper;
    private final Duration budget;
    private final LongSupplier nanoTimeSource;
    private final Clock clock;

    private RequestExecutor(Builder builder) {
        this.transport = builder.transport;
        this.policy = builder.policy;
        this.classifier = builder.classifier;
        this.reporter = builder.reporter;
        this.circuitBreaker = builder.circuitBreaker;
        this.rateLimiter = builder.rateLimiter;
        this.sleeper = builder.sleeper;
        this.budget = builder.budget;  // null means unlimited
        this.nanoTimeSource = builder.nanoTimeSource;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for configuring a RequestExecutor.
     */
    public static final class Builder {
        private Transport transport;
        private RetryPolicy policy = RetryPolicy.defaults();
        private ErrorClassifier classifier;
        private OpReporter reporter = OpReporter.noOp();
        private CircuitBreaker circuitBreaker;
        private RateLimiter rateLimiter;
        private Sleeper sleeper = Sleeper.nonBlocking();
        private Duration budget;
        private LongSupplier nanoTimeSource = System::nanoTime;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        /**
         * Sets the transport (required).
         */
        public Builder transport(Transport transport) {
            this.transport = Objects.requireNonNull(transport, "transport must not be null");
            return this;
        }

        /**
         * Sets the retry policy (optional, defaults to {@link RetryPolicy#defaults()}).
         */
        public Builder policy(RetryPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        /**
         * Sets the error classifier (optional, defaults to {@link HttpErrorClassifier} with a 30s timeout).
         */
        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets a circuit breaker shared by every call of this executor (optional).
         */
        public Builder circuitBreaker(CircuitBreaker circuitBreaker) {
            this.circuitBreaker = circuitBreaker;
            return this;
        }

        /**
         * Sets a rate limiter shared by every call of this executor (optional).
         */
        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        /**
         * Sets a time budget after which no further retry is scheduled (optional, defaults to unlimited).
         */
        public Builder budget(Duration budget) {
            this.budget = Objects.requireNonNull(budget, "budget must not be null");
            return this;
        }

        public Builder nanoTimeSource(LongSupplier nanoTimeSource) {
            this.nanoTimeSource = Objects.requireNonNull(nanoTimeSource, "nanoTimeSource must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * @throws NullPointerException if no transport has been set
         */
        public RequestExecutor build() {
            Objects.requireNonNull(transport, "transport must be set");
            if (classifier == null) {
                classifier = new HttpErrorClassifier(Duration.ofSeconds(30));
            }
            return new RequestExecutor(this);
        }
    }

    /**
     * Starts a call and returns a handle exposing its state and result.
     *
     * @param operation name used in reports and in {@link ApiError.Timeout} / {@link ApiError.RetryExhausted}
     * @param request the request to send on every attempt
     * @param decoder turns a 2xx response into the value
     */
    public <T> Execution<T> start(String operation, TransportRequest request, ResponseDecoder<T> decoder) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(decoder, "decoder must not be null");

        Execution<T> execution = new Execution<>(operation, request, decoder);
        if (!request.replayable() && policy.maxAttempts() > 0) {
            execution.finish(Outcome.fail(ApiError.Network.permanent(
                    "Request body is a one-shot stream and cannot be retried; buffer it or disable retries")),
                    ExecutionState.FAILED);
            return execution;
        }
        execution.attempt();
        return execution;
    }

    public <T> CompletableFuture<Outcome<T>> executeAsync(String operation, TransportRequest request, ResponseDecoder<T> decoder) {
        return start(operation, request, decoder).future();
    }

    public <T> CompletableFuture<Outcome<T>> executeAsync(TransportRequest request, ResponseDecoder<T> decoder) {
        return executeAsync(request.toString(), request, decoder);
    }

    /**
     * Blocking convenience over {@link #executeAsync(String, TransportRequest, ResponseDecoder)}.
     */
    public <T> Outcome<T> execute(String operation, TransportRequest request, ResponseDecoder<T> decoder) {
        return executeAsync(operation, request, decoder).join();
    }

    public <T> Outcome<T> execute(TransportRequest request, ResponseDecoder<T> decoder) {
        return execute(request.toString(), request, decoder);
    }

    public RetryPolicy policy() {
        return policy;
    }

    public CircuitBreaker circuitBreaker() {
        return circuitBreaker;
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    /**
     * Whether an error counts against the circuit breaker: transport failures and server
     * errors do, any other answer proves the server reachable.
     */
    static boolean isBreakerFailure(ApiError error) {
        if (error instanceof ApiError.Network || error instanceof ApiError.Timeout) {
            return true;
        }
        return error.statusCode().orElse(0) >= 500;
    }

    /**
     * Guards held by one attempt.
     */
    private final class Permit {
        private final long breakerPermission;
        private final boolean tokenHeld;
        private final long tokenWindow;

        private Permit(long breakerPermission, boolean tokenHeld, long tokenWindow) {
            this.breakerPermission = breakerPermission;
            this.tokenHeld = tokenHeld;
            this.tokenWindow = tokenWindow;
        }

        private boolean breakerHeld() {
            return circuitBreaker != null && breakerPermission != CircuitBreaker.REJECTED;
        }

        void release() {
            if (breakerHeld()) {
                circuitBreaker.releasePermission(breakerPermission);
            }
            if (tokenHeld) {
                rateLimiter.refund(tokenWindow);
            }
        }

        void record(ApiError error) {
            if (!breakerHeld()) {
                return;
            }
            if (error != null && isBreakerFailure(error)) {
                circuitBreaker.recordFailure(breakerPermission);
            } else {
                circuitBreaker.recordSuccess(breakerPermission);
            }
        }
    }

    /**
     * One logical call in progress.
     *
     * @param <T> the decoded type
     */
    public final class Execution<T> {

        private final String operation;
        private final TransportRequest request;
        private final ResponseDecoder<T> decoder;
        private final String correlationId;
        private final CompletableFuture<Outcome<T>> result = new CompletableFuture<>();

        private volatile ExecutionState state = ExecutionState.IDLE;
        private volatile CompletableFuture<?> pending;
        private RetryContext context;

        private Execution(String operation, TransportRequest request, ResponseDecoder<T> decoder) {
            this.operation = operation;
            this.request = request;
            this.decoder = decoder;
            this.correlationId = request.headers().get(HttpErrorClassifier.REQUEST_ID);
            long now = nanoTimeSource.getAsLong();
            this.context = budget == null ? RetryContext.first(now) : RetryContext.first(now, budget);
            result.whenComplete((outcome, failure) -> {
                if (result.isCancelled()) {
                    CompletableFuture<?> inFlight = pending;
                    if (inFlight != null) {
                        inFlight.cancel(true);
                    }
                }
            });
        }

        public ExecutionState state() {
            return state;
        }

        public CompletableFuture<Outcome<T>> future() {
            return result;
        }

        /**
         * Index of the current (or last) attempt.
         */
        public int attemptIndex() {
            return context.attemptIndex();
        }

        private void attempt() {
            if (result.isDone()) {
                return;
            }
            state = ExecutionState.ATTEMPTING;
            int attemptIndex = context.attemptIndex();

            long breakerPermission = CircuitBreaker.REJECTED;
            if (circuitBreaker != null) {
                breakerPermission = circuitBreaker.tryAcquirePermission();
                if (breakerPermission == CircuitBreaker.REJECTED) {
                    Duration wait = circuitBreaker.remainingOpenTime();
                    if (wait.isZero()) {
                        wait = circuitBreaker.recoveryTimeout();
                    }
                    log.debug("[{}] attempt {} rejected: circuit breaker [{}] is {}",
                            operation, attemptIndex, circuitBreaker.name(), circuitBreaker.state());
                    onFailure(new ApiError.ServiceUnavailable(wait), AttemptEvent.Result.REJECTED_BY_BREAKER);
                    return;
                }
            }

            boolean tokenHeld = false;
            long tokenWindow = 0L;
            if (rateLimiter != null) {
                if (!rateLimiter.tryAcquire()) {
                    if (breakerPermission != CircuitBreaker.REJECTED) {
                        circuitBreaker.releasePermission(breakerPermission);
                    }
                    log.debug("[{}] attempt {} rejected: client rate limit reached", operation, attemptIndex);
                    onFailure(new ApiError.RateLimit(rateLimiter.timeUntilRefill()), AttemptEvent.Result.REJECTED_BY_LIMITER);
                    return;
                }
                tokenHeld = true;
                tokenWindow = rateLimiter.windowStartNanos();
            }

            Permit permit = new Permit(breakerPermission, tokenHeld, tokenWindow);
            log.debug("[{}] attempt {} sending {}", operation, attemptIndex, request);

            CompletableFuture<TransportResponse> exchange;
            try {
                exchange = transport.send(request);
            } catch (RuntimeException e) {
                exchange = CompletableFuture.failedFuture(e);
            }
            pending = exchange;
            if (result.isCancelled()) {
                exchange.cancel(true);
            }
            exchange.whenComplete((response, failure) -> {
                try {
                    onExchangeComplete(permit, response, failure);
                } catch (Throwable t) {
                    result.completeExceptionally(t);
                }
            });
        }

        private void onExchangeComplete(Permit permit, TransportResponse response, Throwable failure) {
            if (result.isDone()) {
                permit.release();
                report(event(AttemptEvent.Result.CANCELLED, null));
                log.debug("[{}] attempt {} cancelled", operation, context.attemptIndex());
                return;
            }

            if (failure != null) {
                ApiError error = classifier.classify(operation, unwrap(failure));
                permit.record(error);
                onFailure(error, AttemptEvent.Result.FAILURE);
                return;
            }

            if (!response.isSuccess()) {
                ApiError error = classifier.classify(response);
                permit.record(error);
                onFailure(error, AttemptEvent.Result.FAILURE);
                return;
            }

            permit.record(null);
            T value;
            try {
                value = decoder.decode(response);
            } catch (IOException | IllegalArgumentException e) {
                onFailure(classifier.decodeFailure(e.getMessage()), AttemptEvent.Result.FAILURE);
                return;
            }

            report(event(AttemptEvent.Result.SUCCESS, null));
            log.debug("[{}] attempt {} succeeded with status {}", operation, context.attemptIndex(), response.statusCode());
            finish(Outcome.ok(value), ExecutionState.SUCCEEDED);
        }

        private void onFailure(ApiError error, AttemptEvent.Result kind) {
            context = context.at(nanoTimeSource.getAsLong());
            AttemptEvent event = event(kind, error);
            report(event);

            RetryDecision decision = policy.decide(context, error);
            if (decision instanceof RetryDecision.Retry) {
                Duration delay = ((RetryDecision.Retry) decision).delay();
                log.debug("[{}] attempt {} failed ({}), retrying in {}ms",
                        operation, context.attemptIndex(), error.message(), delay.toMillis());
                safely(() -> reporter.reportRetryScheduled(event, delay));
                backoff(delay);
                return;
            }

            String reason = ((RetryDecision.GiveUp) decision).reason();
            int attemptIndex = context.attemptIndex();
            if (attemptIndex == 0) {
                log.debug("[{}] failed without retry ({}): {}", operation, reason, error.message());
                finish(Outcome.fail(error), ExecutionState.FAILED);
                return;
            }
            ApiError.RetryExhausted exhausted = new ApiError.RetryExhausted(attemptIndex + 1, operation, error);
            log.debug("[{}] giving up after {} attempts ({}): {}", operation, attemptIndex + 1, reason, error.message());
            safely(() -> reporter.reportRetryExhausted(event, exhausted));
            finish(Outcome.fail(exhausted), ExecutionState.FAILED);
        }

        private void backoff(Duration delay) {
            state = ExecutionState.BACKOFF;
            CompletableFuture<Void> pause = sleeper.sleep(delay);
            pending = pause;
            if (result.isCancelled()) {
                pause.cancel(true);
            }
            pause.whenComplete((ignored, failure) -> {
                if (result.isDone()) {
                    return;
                }
                if (failure != null) {
                    result.completeExceptionally(failure);
                    return;
                }
                context = context.next(nanoTimeSource.getAsLong());
                try {
                    attempt();
                } catch (Throwable t) {
                    result.completeExceptionally(t);
                }
            });
        }

        private void finish(Outcome<T> outcome, ExecutionState terminal) {
            state = terminal;
            result.complete(correlationId == null ? outcome : outcome.correlationId(correlationId));
        }

        private AttemptEvent event(AttemptEvent.Result kind, ApiError error) {
            Duration elapsed = Duration.ofNanos(nanoTimeSource.getAsLong() - context.startedNanos());
            return new AttemptEvent(operation, context.attemptIndex(), elapsed, kind, error, correlationId, clock.instant());
        }

        private void report(AttemptEvent event) {
            safely(() -> reporter.reportAttempt(event));
        }
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static void safely(Runnable report) {
        try {
            report.run();
        } catch (RuntimeException e) {
            log.warn("OpReporter failed: {}", e.getMessage(), e);
        }
    }
}
