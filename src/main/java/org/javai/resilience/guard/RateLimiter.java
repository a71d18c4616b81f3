package org.javai.resilience.guard;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Fixed-window request counter for client-side self-throttling.
 *
 * <p>Each check first refills the window if at least one full window has elapsed since it
 * started, then takes a token if one is left. Refill happens only when a check observes the
 * elapsed window, never in the background.</p>
 *
 * <p>Because the window is fixed rather than sliding, up to {@code 2 × capacity} requests
 * can pass around a window boundary. That is acceptable for being a polite client; it is
 * not an authoritative limit.</p>
 */
public final class RateLimiter {

    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

    private final int capacity;
    private final long windowNanos;
    private final LongSupplier nanoTimeSource;

    private final AtomicInteger tokens;
    private final AtomicLong windowStart;

    /**
     * Creates a limiter allowing {@code requestsPerMinute} checks per 60-second window.
     */
    public RateLimiter(int requestsPerMinute) {
        this(requestsPerMinute, DEFAULT_WINDOW, System::nanoTime);
    }

    public RateLimiter(int capacity, Duration window) {
        this(capacity, window, System::nanoTime);
    }

    public RateLimiter(int capacity, Duration window, LongSupplier nanoTimeSource) {
        Objects.requireNonNull(window, "window must not be null");
        this.nanoTimeSource = Objects.requireNonNull(nanoTimeSource, "nanoTimeSource must not be null");
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, was: " + capacity);
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.capacity = capacity;
        this.windowNanos = window.toNanos();
        this.tokens = new AtomicInteger(capacity);
        this.windowStart = new AtomicLong(nanoTimeSource.getAsLong());
    }

    /**
     * Attempts to take one token.
     *
     * @return {@code true} if the request may be issued
     */
    public boolean tryAcquire() {
        refillIfElapsed(nanoTimeSource.getAsLong());
        return tokens.getAndUpdate(t -> t > 0 ? t - 1 : t) > 0;
    }

    /**
     * Returns a token taken by an attempt that was cancelled before it was sent.
     * Has no effect once the window the token came from has been refilled.
     *
     * @param acquiredInWindow the {@link #windowStartNanos()} observed when the token was taken
     */
    public void refund(long acquiredInWindow) {
        if (windowStart.get() != acquiredInWindow) {
            return;
        }
        tokens.getAndUpdate(t -> t < capacity ? t + 1 : t);
    }

    public int remaining() {
        return tokens.get();
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Start of the current window on the limiter's nano clock.
     */
    public long windowStartNanos() {
        return windowStart.get();
    }

    /**
     * Time until the current window ends and capacity is restored.
     */
    public Duration timeUntilRefill() {
        long remaining = windowNanos - (nanoTimeSource.getAsLong() - windowStart.get());
        return remaining <= 0 ? Duration.ZERO : Duration.ofNanos(remaining);
    }

    private void refillIfElapsed(long now) {
        long start = windowStart.get();
        if (now - start < windowNanos) {
            return;
        }
        synchronized (this) {
            if (now - windowStart.get() >= windowNanos) {
                tokens.set(capacity);
                windowStart.set(now);
            }
        }
    }
}
