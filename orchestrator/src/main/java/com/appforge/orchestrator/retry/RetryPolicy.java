package com.appforge.orchestrator.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded exponential backoff.
 *
 * The delay before attempt n+1 is baseDelay * 2^(n-1), capped at maxDelay,
 * with up to {@code jitter} (a fraction, 0..1) added at random. Failures
 * flagged as rate limited wait rateLimitMultiplier times longer, or the
 * server-suggested delay when that is longer still.
 *
 * @param maxAttempts         total attempts including the first one (>= 1)
 * @param baseDelay           delay after the first failure
 * @param maxDelay            upper bound for a single computed delay
 * @param jitter              random extra fraction of the delay, 0 disables it
 * @param rateLimitMultiplier factor applied when the upstream signals a rate limit
 */
public record RetryPolicy(
        int      maxAttempts,
        Duration baseDelay,
        Duration maxDelay,
        double   jitter,
        double   rateLimitMultiplier) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        baseDelay = baseDelay == null ? Duration.ofSeconds(1) : baseDelay;
        maxDelay  = maxDelay  == null ? Duration.ofMinutes(1) : maxDelay;
        if (jitter < 0 || jitter > 1) {
            throw new IllegalArgumentException("jitter must be within [0, 1], got " + jitter);
        }
        rateLimitMultiplier = rateLimitMultiplier < 1 ? 1 : rateLimitMultiplier;
    }

    /** Same attempt budget, no waiting. Used by tests. */
    public static RetryPolicy immediate(int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ZERO, Duration.ZERO, 0, 1);
    }

    public static RetryPolicy exponential(int maxAttempts, Duration baseDelay) {
        return new RetryPolicy(maxAttempts, baseDelay, Duration.ofMinutes(1), 0.2, 4);
    }

    /**
     * Delay to wait after the given failed attempt (1-based).
     *
     * @param retryAfter server-suggested delay, or null when none was given
     */
    public Duration delayAfter(int failedAttempt, boolean rateLimited, Duration retryAfter) {
        long base = baseDelay.toMillis();
        int shift = Math.min(Math.max(failedAttempt - 1, 0), 30);
        long millis = Math.min(saturatedShift(base, shift), maxDelay.toMillis());
        if (rateLimited) {
            millis = (long) (millis * rateLimitMultiplier);
        }
        if (jitter > 0 && millis > 0) {
            millis += (long) (millis * jitter * ThreadLocalRandom.current().nextDouble());
        }
        if (retryAfter != null && retryAfter.toMillis() > millis) {
            millis = retryAfter.toMillis();
        }
        return Duration.ofMillis(millis);
    }

    private static long saturatedShift(long value, int shift) {
        if (value == 0) return 0;
        return value > (Long.MAX_VALUE >> shift) ? Long.MAX_VALUE : value << shift;
    }
}
