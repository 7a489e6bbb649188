package com.appforge.orchestrator.api.dto;

import com.appforge.orchestrator.model.TaskRecord;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for GET /tasks/{id}. Outcome fields stay null until the
 * pipeline reaches a terminal result.
 */
public record TaskResponse(
        UUID    id,
        String  taskKey,
        String  task,
        int     round,
        String  state,
        String  status,
        String  errorKind,
        String  errorDetail,
        String  repositoryName,
        String  repositoryUrl,
        String  pagesUrl,
        String  pagesStatus,
        String  commitSha,
        boolean notified,
        int     generationAttempts,
        int     publishAttempts,
        int     notifyAttempts,
        Instant createdAt,
        Instant updatedAt
) {
    public static TaskResponse from(TaskRecord r) {
        return new TaskResponse(
                r.getId(),
                r.getTaskKey(),
                r.getTaskName(),
                r.getRound(),
                r.getState().name(),
                r.getOutcomeStatus() == null ? null : r.getOutcomeStatus().name(),
                r.getErrorKind()     == null ? null : r.getErrorKind().name(),
                r.getErrorDetail(),
                r.getRepositoryName(),
                r.getRepositoryUrl(),
                r.getPagesUrl(),
                r.getPagesStatus()   == null ? null : r.getPagesStatus().name(),
                r.getCommitSha(),
                r.isNotified(),
                r.getGenerationAttempts(),
                r.getPublishAttempts(),
                r.getNotifyAttempts(),
                r.getCreatedAt(),
                r.getUpdatedAt()
        );
    }
}
