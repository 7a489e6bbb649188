package com.appforge.orchestrator.notify;

import com.appforge.orchestrator.retry.RetryableFailure;

/**
 * One failed delivery attempt. Never leaves the {@link Notifier}.
 */
class NotifyException extends RuntimeException implements RetryableFailure {

    enum Kind { UPSTREAM_TIMEOUT, UPSTREAM_ERROR }

    NotifyException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
    }

    @Override public boolean retryable() { return true; }
}
