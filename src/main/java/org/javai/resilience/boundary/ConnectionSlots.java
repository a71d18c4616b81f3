package org.javai.resilience.boundary;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounds the number of in-flight exchanges per host and in total.
 *
 * <p>{@link #acquire(String)} never blocks: when the limits are reached the returned future
 * stays pending until another exchange releases its slot. Waiters are served in arrival
 * order, skipping waiters whose host is still saturated; a host with free capacity is never
 * held up by waiters for other hosts. A waiter that is cancelled before
 * it is granted never holds a slot.</p>
 */
public final class ConnectionSlots {

    private final int maxPerHost;
    private final int maxTotal;

    private final Object lock = new Object();
    private final Map<String, Integer> inUseByHost = new HashMap<>();
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private int inUseTotal;

    public ConnectionSlots(int maxPerHost, int maxTotal) {
        if (maxPerHost < 1) {
            throw new IllegalArgumentException("maxPerHost must be >= 1");
        }
        if (maxTotal < 1) {
            throw new IllegalArgumentException("maxTotal must be >= 1");
        }
        this.maxPerHost = maxPerHost;
        this.maxTotal = maxTotal;
    }

    /**
     * Requests a slot for an exchange with {@code host}.
     *
     * @param host the target host
     * @return a future that completes with the granted slot
     */
    public CompletableFuture<Slot> acquire(String host) {
        synchronized (lock) {
            if (hasCapacity(host) && !hasWaiter(host)) {
                return CompletableFuture.completedFuture(grant(host));
            }
            Waiter waiter = new Waiter(host, new CompletableFuture<>());
            waiters.addLast(waiter);
            waiter.future.whenComplete((slot, failure) -> {
                if (waiter.future.isCancelled()) {
                    withdraw(waiter);
                }
            });
            return waiter.future;
        }
    }

    public int inUse() {
        synchronized (lock) {
            return inUseTotal;
        }
    }

    public int inUse(String host) {
        synchronized (lock) {
            return inUseByHost.getOrDefault(host, 0);
        }
    }

    public int waiting() {
        synchronized (lock) {
            return waiters.size();
        }
    }

    private void release(String host) {
        List<Waiter> granted = new ArrayList<>();
        synchronized (lock) {
            inUseTotal--;
            int remaining = inUseByHost.getOrDefault(host, 1) - 1;
            if (remaining <= 0) {
                inUseByHost.remove(host);
            } else {
                inUseByHost.put(host, remaining);
            }

            Iterator<Waiter> it = waiters.iterator();
            while (it.hasNext() && inUseTotal < maxTotal) {
                Waiter waiter = it.next();
                if (waiter.future.isDone()) {
                    it.remove();
                    continue;
                }
                if (hasCapacity(waiter.host)) {
                    it.remove();
                    waiter.slot = grant(waiter.host);
                    granted.add(waiter);
                }
            }
        }
        // Complete outside the lock; dependent stages may run inline.
        for (Waiter waiter : granted) {
            if (!waiter.future.complete(waiter.slot)) {
                waiter.slot.close();
            }
        }
    }

    private void withdraw(Waiter waiter) {
        synchronized (lock) {
            waiters.remove(waiter);
        }
    }

    private boolean hasWaiter(String host) {
        for (Waiter waiter : waiters) {
            if (waiter.host.equals(host) && !waiter.future.isDone()) {
                return true;
            }
        }
        return false;
    }

    private boolean hasCapacity(String host) {
        return inUseTotal < maxTotal && inUseByHost.getOrDefault(host, 0) < maxPerHost;
    }

    private Slot grant(String host) {
        inUseTotal++;
        inUseByHost.merge(host, 1, Integer::sum);
        return new Slot(host);
    }

    private static final class Waiter {
        private final String host;
        private final CompletableFuture<Slot> future;
        private Slot slot;

        private Waiter(String host, CompletableFuture<Slot> future) {
            this.host = host;
            this.future = future;
        }
    }

    /**
     * A granted slot. Closing it more than once has no further effect.
     */
    public final class Slot implements AutoCloseable {
        private final String host;
        private final AtomicBoolean released = new AtomicBoolean();

        private Slot(String host) {
            this.host = host;
        }

        public String host() {
            return host;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                release(host);
            }
        }
    }
}
