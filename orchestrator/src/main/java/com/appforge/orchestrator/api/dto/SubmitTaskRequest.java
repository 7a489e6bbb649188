package com.appforge.orchestrator.api.dto;

import com.appforge.orchestrator.model.Attachment;
import com.appforge.orchestrator.model.Task;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Request body for POST /tasks.
 *
 * Required: email, secret, task, round, nonce.
 * Optional: brief, checks, evaluation_url, attachments.
 */
public record SubmitTaskRequest(
        @NotBlank @Email String email,
        @NotBlank String  secret,
        @NotBlank String  task,
        @NotNull @Min(0) Integer round,
        @NotBlank String  nonce,
        String            brief,
        List<String>      checks,
        @JsonProperty("evaluation_url") String evaluationUrl,
        List<@Valid AttachmentRequest> attachments
) {

    /** The Task value the pipeline works on. The secret does not travel further. */
    public Task toTask() {
        List<Attachment> converted = attachments == null ? List.of()
                : attachments.stream().map(a -> new Attachment(a.name(), a.url())).toList();
        return new Task(email, task, round, nonce, brief, checks, converted, evaluationUrl);
    }
}
