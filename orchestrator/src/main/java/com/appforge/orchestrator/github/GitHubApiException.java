package com.appforge.orchestrator.github;

import java.time.Duration;

/**
 * Thrown when the GitHub REST API answers with an unexpected status or is
 * unreachable.
 */
public class GitHubApiException extends RuntimeException {

    private final int      statusCode;
    private final String   body;
    private final boolean  rateLimited;
    private final Duration retryAfter;

    public GitHubApiException(String operation, int statusCode, String body,
                              boolean rateLimited, Duration retryAfter) {
        super(operation + " failed: HTTP " + statusCode + ": " + body);
        this.statusCode  = statusCode;
        this.body        = body;
        this.rateLimited = rateLimited;
        this.retryAfter  = retryAfter;
    }

    public GitHubApiException(String operation, Throwable cause) {
        super(operation + " failed: " + cause.getMessage(), cause);
        this.statusCode  = -1;
        this.body        = null;
        this.rateLimited = false;
        this.retryAfter  = null;
    }

    /** HTTP status, or -1 when no response arrived. */
    public int      statusCode()  { return statusCode; }
    public String   body()        { return body; }
    public boolean  rateLimited() { return rateLimited; }
    public Duration retryAfter()  { return retryAfter; }

    /** GitHub's 422 for a repository name that is already taken. */
    public boolean isNameAlreadyExists() {
        return statusCode == 422 && body != null && body.contains("name already exists");
    }
}
