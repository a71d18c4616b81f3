package org.javai.resilience.retry;

/**
 * Lifecycle of one logical call inside the {@link RequestExecutor}.
 */
public enum ExecutionState {
    /** Created, no attempt made yet. */
    IDLE,
    /** An attempt is passing the guards or waiting for the transport. */
    ATTEMPTING,
    /** Waiting before the next attempt. */
    BACKOFF,
    SUCCEEDED,
    FAILED
}
