package org.javai.resilience.guard;

/**
 * The three states of a {@link CircuitBreaker}.
 *
 * <p>State transitions:
 * <ul>
 *   <li>CLOSED → OPEN: consecutive failures reach the threshold</li>
 *   <li>OPEN → HALF_OPEN: an attempt arrives after the recovery timeout</li>
 *   <li>HALF_OPEN → CLOSED: the trial request succeeds</li>
 *   <li>HALF_OPEN → OPEN: the trial request fails</li>
 * </ul>
 */
public enum CircuitState {
    /**
     * Normal operation. Requests pass and failures are counted.
     */
    CLOSED,

    /**
     * Requests are rejected without contacting the server until the recovery
     * timeout has elapsed.
     */
    OPEN,

    /**
     * One trial request is allowed through to probe whether the server recovered.
     */
    HALF_OPEN
}
