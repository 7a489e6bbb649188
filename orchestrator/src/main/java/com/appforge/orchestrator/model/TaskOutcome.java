package com.appforge.orchestrator.model;

import java.util.Objects;

/**
 * Terminal record for a task.
 *
 * deployment is present iff status == SUCCEEDED; errorKind and errorDetail
 * are present iff status == FAILED. After creation only the notified flag
 * ever changes, via {@link #markNotified()}.
 */
public record TaskOutcome(
        OutcomeStatus status,
        Deployment    deployment,
        ErrorKind     errorKind,
        String        errorDetail,
        boolean       notified
) {

    public TaskOutcome {
        Objects.requireNonNull(status, "status");
        if (status == OutcomeStatus.SUCCEEDED && (deployment == null || errorKind != null)) {
            throw new IllegalArgumentException("A succeeded outcome needs a deployment and no error");
        }
        if (status == OutcomeStatus.FAILED && (deployment != null || errorKind == null)) {
            throw new IllegalArgumentException("A failed outcome needs an error kind and no deployment");
        }
    }

    public static TaskOutcome succeeded(Deployment deployment) {
        return new TaskOutcome(OutcomeStatus.SUCCEEDED, deployment, null, null, false);
    }

    public static TaskOutcome failed(ErrorKind kind, String detail) {
        return new TaskOutcome(OutcomeStatus.FAILED, null, kind, detail, false);
    }

    public TaskOutcome markNotified() {
        return new TaskOutcome(status, deployment, errorKind, errorDetail, true);
    }

    public boolean succeeded() {
        return status == OutcomeStatus.SUCCEEDED;
    }
}
