package org.javai.resilience.guard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Consecutive-failure circuit breaker shared by every call of a client.
 *
 * <p>The breaker gates each individual attempt, before and independently of the retry
 * policy. While it is {@link CircuitState#OPEN} the executor reports attempts as
 * {@link org.javai.resilience.ApiError.ServiceUnavailable} without contacting the server,
 * which callers cannot distinguish from a genuine 503.</p>
 *
 * <p>Counters are atomics so they can be read without locking. Compound
 * check-then-transition steps, including every failure count, run under one private lock;
 * nothing else is held while it is.
 * Time comes from a monotonic nano clock, injectable for tests.</p>
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    /** Returned by {@link #tryAcquirePermission()} when the attempt is not admitted. */
    public static final long REJECTED = -1L;

    private final String name;
    private final int failureThreshold;
    private final long recoveryNanos;
    private final Duration recoveryTimeout;
    private final LongSupplier nanoTimeSource;

    private final Object lock = new Object();
    private final AtomicInteger failureCount = new AtomicInteger();
    private final AtomicLong lastFailureNanos = new AtomicLong();
    private volatile CircuitState state = CircuitState.CLOSED;
    private volatile long generation;
    private boolean trialInFlight;

    /**
     * Creates a breaker.
     *
     * @param name name used in log lines
     * @param failureThreshold consecutive failures that open the circuit (must be {@code > 0})
     * @param recoveryTimeout how long the circuit stays open before a trial is allowed
     */
    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout) {
        this(name, failureThreshold, recoveryTimeout, System::nanoTime);
    }

    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout, LongSupplier nanoTimeSource) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.recoveryTimeout = Objects.requireNonNull(recoveryTimeout, "recoveryTimeout must not be null");
        this.nanoTimeSource = Objects.requireNonNull(nanoTimeSource, "nanoTimeSource must not be null");
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, was: " + failureThreshold);
        }
        if (recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("recoveryTimeout must not be negative");
        }
        this.failureThreshold = failureThreshold;
        this.recoveryNanos = recoveryTimeout.toNanos();
    }

    /**
     * Asks for permission to send one attempt.
     *
     * <p>When the circuit is open and the recovery timeout has elapsed since the last
     * failure, the breaker moves to {@link CircuitState#HALF_OPEN} and grants the single
     * trial permission. A caller that was granted a permission must later pass it to
     * exactly one of {@link #recordSuccess(long)}, {@link #recordFailure(long)} or
     * {@link #releasePermission(long)}.</p>
     *
     * <p>A permission is stamped with the breaker's generation, which advances on every
     * state transition. Reports carrying an older generation are ignored, so an attempt
     * admitted before the circuit opened cannot close or reopen it later.</p>
     *
     * @return the permission, or {@link #REJECTED} if the attempt must not be sent
     */
    public long tryAcquirePermission() {
        if (state == CircuitState.CLOSED) {
            long current = generation;
            if (state == CircuitState.CLOSED) {
                return current;
            }
        }
        synchronized (lock) {
            switch (state) {
                case CLOSED:
                    return generation;
                case OPEN:
                    if (nanoTimeSource.getAsLong() - lastFailureNanos.get() < recoveryNanos) {
                        return REJECTED;
                    }
                    transition(CircuitState.HALF_OPEN);
                    trialInFlight = true;
                    return generation;
                case HALF_OPEN:
                default:
                    if (trialInFlight) {
                        return REJECTED;
                    }
                    trialInFlight = true;
                    return generation;
            }
        }
    }

    /**
     * Records a successful attempt made under {@code permission}.
     */
    public void recordSuccess(long permission) {
        if (permission != generation) {
            return;
        }
        if (state == CircuitState.CLOSED) {
            failureCount.set(0);
            return;
        }
        synchronized (lock) {
            if (permission == generation && state == CircuitState.HALF_OPEN) {
                failureCount.set(0);
                trialInFlight = false;
                transition(CircuitState.CLOSED);
            }
        }
    }

    /**
     * Records a failed attempt made under {@code permission}.
     */
    public void recordFailure(long permission) {
        if (permission != generation) {
            return;
        }
        long now = nanoTimeSource.getAsLong();
        synchronized (lock) {
            if (permission != generation) {
                return;
            }
            switch (state) {
                case CLOSED:
                    if (failureCount.incrementAndGet() >= failureThreshold) {
                        lastFailureNanos.set(now);
                        transition(CircuitState.OPEN);
                    }
                    break;
                case HALF_OPEN:
                    failureCount.incrementAndGet();
                    lastFailureNanos.set(now);
                    trialInFlight = false;
                    transition(CircuitState.OPEN);
                    break;
                case OPEN:
                default:
                    break;
            }
        }
    }

    /**
     * Gives back a permission whose attempt was cancelled, without counting it as a
     * success or a failure.
     */
    public void releasePermission(long permission) {
        if (state != CircuitState.HALF_OPEN || permission != generation) {
            return;
        }
        synchronized (lock) {
            if (state == CircuitState.HALF_OPEN && permission == generation) {
                trialInFlight = false;
            }
        }
    }

    /**
     * Current generation; advances on every state transition.
     */
    public long generation() {
        return generation;
    }

    public CircuitState state() {
        return state;
    }

    public int failureCount() {
        return failureCount.get();
    }

    public int failureThreshold() {
        return failureThreshold;
    }

    public Duration recoveryTimeout() {
        return recoveryTimeout;
    }

    public String name() {
        return name;
    }

    /**
     * Time left before an open circuit admits a trial request; zero unless open.
     */
    public Duration remainingOpenTime() {
        if (state != CircuitState.OPEN) {
            return Duration.ZERO;
        }
        long remaining = recoveryNanos - (nanoTimeSource.getAsLong() - lastFailureNanos.get());
        return remaining <= 0 ? Duration.ZERO : Duration.ofNanos(remaining);
    }

    // Caller holds the lock.
    private void transition(CircuitState next) {
        CircuitState previous = state;
        generation++;
        state = next;
        if (next == CircuitState.OPEN) {
            log.warn("Circuit breaker [{}] {} -> OPEN after {} failure(s); rejecting requests for {}ms",
                    name, previous, failureCount.get(), recoveryTimeout.toMillis());
        } else {
            log.info("Circuit breaker [{}] {} -> {}", name, previous, next);
        }
    }

    @Override
    public String toString() {
        return "CircuitBreaker[" + name + ", state=" + state + ", failures=" + failureCount.get() + "]";
    }
}
