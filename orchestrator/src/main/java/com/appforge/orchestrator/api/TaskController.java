package com.appforge.orchestrator.api;

import com.appforge.orchestrator.api.dto.SubmitTaskRequest;
import com.appforge.orchestrator.api.dto.SubmitTaskResponse;
import com.appforge.orchestrator.api.dto.TaskResponse;
import com.appforge.orchestrator.metrics.TaskMetrics;
import com.appforge.orchestrator.model.TaskRecord;
import com.appforge.orchestrator.service.TaskService;
import com.appforge.orchestrator.service.TaskSubmissionService;
import com.appforge.orchestrator.service.TaskSubmissionService.WorkersBusyException;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

/**
 * REST API for task submission.
 *
 * POST /tasks       : submit a task; answers 202 once it is queued
 * GET  /tasks/{id}  : poll state and outcome of a submitted task
 */
@RestController
@RequestMapping("/tasks")
public class TaskController {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private final TaskSubmissionService submissionService;
    private final TaskService           taskService;
    private final SharedSecretVerifier  secretVerifier;
    private final TaskMetrics           metrics;

    public TaskController(TaskSubmissionService submissionService,
                          TaskService taskService,
                          SharedSecretVerifier secretVerifier,
                          TaskMetrics metrics) {
        this.submissionService = submissionService;
        this.taskService       = taskService;
        this.secretVerifier    = secretVerifier;
        this.metrics           = metrics;
    }

    /**
     * Submit a task.
     *
     * HTTP 202: accepted and queued; the outcome goes to evaluation_url
     * HTTP 400: malformed body
     * HTTP 401: wrong secret, or no secret configured on the server
     * HTTP 503: every worker is busy and the queue is full
     */
    @PostMapping
    public ResponseEntity<SubmitTaskResponse> submit(@Valid @RequestBody SubmitTaskRequest req) {
        if (!secretVerifier.isConfigured()) {
            metrics.recordRejection("no_secret_configured");
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "No server-side secret configured");
        }
        if (!secretVerifier.matches(req.secret())) {
            log.warn("Rejected submission for task {} from {}: invalid secret", req.task(), req.email());
            metrics.recordRejection("invalid_secret");
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid secret");
        }

        try {
            TaskRecord record = submissionService.submit(req.toTask());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(SubmitTaskResponse.from(record));
        } catch (WorkersBusyException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
        }
    }

    /**
     * Current state of a task. Returns 404 if the id is unknown.
     */
    @GetMapping("/{id}")
    public TaskResponse getTask(@PathVariable UUID id) {
        return taskService.findById(id)
                .map(TaskResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Task not found: " + id));
    }
}
