package org.javai.resilience.retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Waits out a backoff delay without occupying a thread.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Returns a future that completes once {@code delay} has passed.
     */
    CompletableFuture<Void> sleep(Duration delay);

    /**
     * Schedules the wake-up on {@link CompletableFuture#delayedExecutor}.
     */
    static Sleeper nonBlocking() {
        return delay -> {
            if (delay.isZero() || delay.isNegative()) {
                return CompletableFuture.completedFuture(null);
            }
            return CompletableFuture.runAsync(() -> { },
                    CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS));
        };
    }
}
