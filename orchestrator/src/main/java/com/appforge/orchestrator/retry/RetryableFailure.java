package com.appforge.orchestrator.retry;

import java.time.Duration;

/**
 * Implemented by step exceptions so the {@link Retrier} can tell whether
 * another attempt makes sense and how long to wait before it.
 */
public interface RetryableFailure {

    /** False when repeating the same call cannot succeed. */
    boolean retryable();

    /** True when the upstream asked us to slow down. */
    default boolean rateLimited() {
        return false;
    }

    /** Server-suggested delay, or null. */
    default Duration retryAfter() {
        return null;
    }
}
