package com.appforge.orchestrator.publisher;

import com.appforge.orchestrator.github.GitHubApiException;
import com.appforge.orchestrator.retry.RetryableFailure;

import java.time.Duration;

/**
 * Thrown when a generated file set cannot be published.
 *
 * NAMING_CONFLICT is final: the repository name belongs to another task and
 * asking again gives the same answer. Every other kind is retried.
 */
public class PublishException extends RuntimeException implements RetryableFailure {

    public enum Kind { NAMING_CONFLICT, RATE_LIMITED, UPSTREAM_ERROR, PARTIAL_COMMIT }

    private final Kind     kind;
    private final Duration retryAfter;

    public PublishException(Kind kind, String message) {
        this(kind, message, null, null);
    }

    public PublishException(Kind kind, String message, Throwable cause, Duration retryAfter) {
        super("[" + kind + "] " + message, cause);
        this.kind       = kind;
        this.retryAfter = retryAfter;
    }

    /** Classify a REST failure: rate limits keep their suggested delay, the rest are upstream errors. */
    public static PublishException from(GitHubApiException e) {
        if (e.rateLimited()) {
            return new PublishException(Kind.RATE_LIMITED, e.getMessage(), e, e.retryAfter());
        }
        return new PublishException(Kind.UPSTREAM_ERROR, e.getMessage(), e, null);
    }

    public Kind getKind() { return kind; }

    @Override public boolean  retryable()   { return kind != Kind.NAMING_CONFLICT; }
    @Override public boolean  rateLimited() { return kind == Kind.RATE_LIMITED; }
    @Override public Duration retryAfter()  { return retryAfter; }
}
