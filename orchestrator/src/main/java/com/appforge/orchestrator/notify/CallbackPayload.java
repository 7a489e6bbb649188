package com.appforge.orchestrator.notify;

import com.appforge.orchestrator.model.Deployment;
import com.appforge.orchestrator.model.Task;
import com.appforge.orchestrator.model.TaskOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body POSTed to the evaluation URL. Field names follow the callback
 * contract the evaluators expect (snake_case).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CallbackPayload(
        String email,
        String task,
        int    round,
        String nonce,
        String status,
        String repo_url,
        String commit_sha,
        String pages_url,
        String pages_status,
        String error_kind,
        String error_detail
) {
    public static CallbackPayload of(Task task, TaskOutcome outcome) {
        Deployment d = outcome.deployment();
        return new CallbackPayload(
                task.email(),
                task.task(),
                task.round(),
                task.nonce(),
                outcome.status().name().toLowerCase(),
                d == null ? null : d.repositoryUrl(),
                d == null ? null : d.commitSha(),
                d == null ? null : d.pagesUrl(),
                d == null ? null : d.pagesStatus().name().toLowerCase(),
                outcome.errorKind() == null ? null : outcome.errorKind().name().toLowerCase().replace('_', '-'),
                outcome.errorDetail()
        );
    }
}
