package com.appforge.orchestrator.generator;

import com.appforge.orchestrator.retry.RetryableFailure;

/**
 * Thrown when the generator cannot turn a task into a usable file set.
 *
 * Every kind is worth another attempt: timeouts and upstream errors are
 * transient, and a malformed response is retried with the parse failure fed
 * back into the prompt.
 */
public class GenerationException extends RuntimeException implements RetryableFailure {

    public enum Kind { UPSTREAM_TIMEOUT, UPSTREAM_ERROR, MALFORMED_RESPONSE }

    private final Kind    kind;
    private final boolean rateLimited;

    public GenerationException(Kind kind, String message) {
        this(kind, message, null, false);
    }

    public GenerationException(Kind kind, String message, Throwable underlying, boolean rateLimited) {
        super("[" + kind + "] " + message, underlying);
        this.kind        = kind;
        this.rateLimited = rateLimited;
    }

    public Kind getKind() { return kind; }

    @Override public boolean retryable()   { return true; }
    @Override public boolean rateLimited() { return rateLimited; }
}
