package com.appforge.orchestrator.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Runs one pipeline step under a {@link RetryPolicy}.
 *
 * The step is attempted at most policy.maxAttempts() times. Only exceptions
 * of the given failure type are retried, and only while they report
 * themselves retryable; anything else propagates at once. When the budget
 * is exhausted the last failure is rethrown.
 */
public class Retrier {

    private static final Logger log = LoggerFactory.getLogger(Retrier.class);

    /** One attempt of a step. The argument is the 1-based attempt number. */
    @FunctionalInterface
    public interface Attempt<T> {
        T run(int attempt);
    }

    /** Called after each failed attempt, before any wait. */
    @FunctionalInterface
    public interface FailureListener<E> {
        void onFailure(int attempt, E failure);
    }

    private final Sleeper sleeper;

    public Retrier(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    public <T, E extends RuntimeException & RetryableFailure> T execute(
            String stepName,
            RetryPolicy policy,
            Class<E> failureType,
            Attempt<T> attempt) {
        return execute(stepName, policy, failureType, attempt, (n, e) -> { });
    }

    public <T, E extends RuntimeException & RetryableFailure> T execute(
            String stepName,
            RetryPolicy policy,
            Class<E> failureType,
            Attempt<T> attempt,
            FailureListener<E> listener) {

        for (int n = 1; ; n++) {
            try {
                return attempt.run(n);
            } catch (RuntimeException e) {
                if (!failureType.isInstance(e)) {
                    throw e;
                }
                E failure = failureType.cast(e);
                listener.onFailure(n, failure);

                if (!failure.retryable()) {
                    log.warn("{} failed with a non-retryable error on attempt {}: {}",
                            stepName, n, failure.getMessage());
                    throw failure;
                }
                if (n >= policy.maxAttempts()) {
                    log.warn("{} failed on attempt {}/{}, retry budget exhausted: {}",
                            stepName, n, policy.maxAttempts(), failure.getMessage());
                    throw failure;
                }

                Duration delay = policy.delayAfter(n, failure.rateLimited(), failure.retryAfter());
                log.warn("{} failed on attempt {}/{}, retrying in {} ms: {}",
                        stepName, n, policy.maxAttempts(), delay.toMillis(), failure.getMessage());
                pause(delay, failure);
            }
        }
    }

    private void pause(Duration delay, RuntimeException failure) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            failure.addSuppressed(ie);
            throw failure;
        }
    }
}
