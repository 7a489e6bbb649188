package com.appforge.orchestrator.api.dto;

import com.appforge.orchestrator.model.TaskRecord;

import java.util.UUID;

/**
 * Response body for POST /tasks: enough to poll GET /tasks/{id} and to
 * know which repository the task will publish to.
 */
public record SubmitTaskResponse(
        UUID   id,
        String taskKey,
        String state,
        String repositoryName
) {
    public static SubmitTaskResponse from(TaskRecord record) {
        return new SubmitTaskResponse(
                record.getId(),
                record.getTaskKey(),
                record.getState().name(),
                record.getRepositoryName()
        );
    }
}
