package com.appforge.orchestrator.retry;

import java.time.Duration;

/**
 * Pause between retry attempts. Tests substitute {@link #NONE}.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper NONE = d -> {};

    Sleeper THREAD = d -> {
        if (!d.isZero() && !d.isNegative()) {
            Thread.sleep(d.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
