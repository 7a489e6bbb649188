package com.appforge.orchestrator.service;

import com.appforge.orchestrator.model.*;
import com.appforge.orchestrator.repository.TaskRecordRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence side of the task lifecycle.
 *
 * The orchestrator only ever holds a task id; every change goes through one
 * short transaction here, so concurrent tasks never share an entity.
 */
@Service
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private static final EnumSet<TaskState> IN_PROGRESS = EnumSet.of(
            TaskState.RECEIVED,
            TaskState.GENERATING,
            TaskState.PUBLISHING,
            TaskState.NOTIFYING
    );

    private final TaskRecordRepository taskRepo;
    private final ObjectMapper         objectMapper;

    public TaskService(TaskRecordRepository taskRepo, ObjectMapper objectMapper) {
        this.taskRepo     = taskRepo;
        this.objectMapper = objectMapper;
    }

    // ------------------------------------------------------------------
    // Intake and lookup
    // ------------------------------------------------------------------

    /**
     * Persist a freshly accepted task in state RECEIVED, with the repository
     * name it will publish to.
     */
    @Transactional
    public TaskRecord accept(Task task, String repositoryName) {
        TaskRecord record = new TaskRecord(task, writeTask(task));
        record.setRepositoryName(repositoryName);
        record = taskRepo.save(record);
        log.info("Accepted task {} round {} as {} (key {})",
                task.task(), task.round(), record.getId(), task.key());
        return record;
    }

    @Transactional
    public void discard(UUID id) {
        taskRepo.deleteById(id);
    }

    @Transactional(readOnly = true)
    public Optional<TaskRecord> findById(UUID id) {
        return taskRepo.findById(id);
    }

    /** The Task value a record was created from. */
    public Task readTask(TaskRecord record) {
        try {
            return objectMapper.readValue(record.getTaskJson(), Task.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored task JSON for " + record.getId() + " is unreadable", e);
        }
    }

    // ------------------------------------------------------------------
    // Lifecycle (called by the orchestrator on a worker thread)
    // ------------------------------------------------------------------

    /**
     * Move a task forward. Going backwards or standing still is a bug in the
     * caller and is refused.
     */
    @Transactional
    public void transition(UUID id, TaskState next) {
        TaskRecord record = load(id);
        if (next.ordinal() <= record.getState().ordinal()) {
            throw new IllegalStateException(
                    "Task %s cannot move from %s to %s".formatted(id, record.getState(), next));
        }
        record.setState(next);
        record.setHeartbeatAt(Instant.now());
        taskRepo.save(record);
        log.info("Task {} → {}", id, next);
    }

    /** Count an attempt of a step and refresh the heartbeat. */
    @Transactional
    public void recordAttempt(UUID id, PipelineStep step, int attempt) {
        TaskRecord record = load(id);
        switch (step) {
            case GENERATE -> record.setGenerationAttempts(attempt);
            case PUBLISH  -> record.setPublishAttempts(attempt);
            case NOTIFY   -> record.setNotifyAttempts(attempt);
        }
        record.setHeartbeatAt(Instant.now());
        taskRepo.save(record);
    }

    /** Store the terminal outcome and move the task to NOTIFYING. */
    @Transactional
    public void complete(UUID id, TaskOutcome outcome) {
        TaskRecord record = load(id);
        record.applyOutcome(outcome);
        record.setState(TaskState.NOTIFYING);
        record.setHeartbeatAt(Instant.now());
        taskRepo.save(record);
        log.info("Task {} reached outcome {}{}", id, outcome.status(),
                outcome.errorKind() == null ? "" : " (" + outcome.errorKind() + ")");
    }

    /** Record the notification result and close the task. */
    @Transactional
    public void finish(UUID id, TaskOutcome outcome, int notifyAttempts) {
        TaskRecord record = load(id);
        record.applyOutcome(outcome);
        record.setNotifyAttempts(notifyAttempts);
        record.setState(TaskState.DONE);
        record.setHeartbeatAt(Instant.now());
        taskRepo.save(record);
        log.info("Task {} DONE (status={}, notified={})", id, outcome.status(), outcome.notified());
    }

    /**
     * Close a task whose run died on an unexpected exception.
     *
     * The error kind follows the step that was running; a task that had
     * already reached NOTIFYING keeps its outcome.
     */
    @Transactional
    public void abort(UUID id, String reason) {
        TaskRecord record = load(id);
        if (record.getState().isTerminal()) {
            return;
        }
        if (record.getState() != TaskState.NOTIFYING) {
            ErrorKind kind = record.getState() == TaskState.PUBLISHING
                    ? ErrorKind.PUBLISH_FAILED
                    : ErrorKind.GENERATION_FAILED;
            record.applyOutcome(TaskOutcome.failed(kind, reason));
        }
        record.setState(TaskState.DONE);
        record.setHeartbeatAt(Instant.now());
        taskRepo.save(record);
        log.error("Task {} aborted: {}", id, reason);
    }

    // ------------------------------------------------------------------
    // Recovery
    // ------------------------------------------------------------------

    /** Non-terminal tasks that have not shown a heartbeat for stallTimeout. */
    @Transactional(readOnly = true)
    public List<TaskRecord> findStalled(Duration stallTimeout) {
        Instant cutoff = Instant.now().minus(stallTimeout);
        return taskRepo.findByStateInAndHeartbeatAtBefore(IN_PROGRESS, cutoff);
    }

    /**
     * Put a stalled task back to RECEIVED so its replay can walk the state
     * machine from the start. This is the only backwards move, and it only
     * happens for runs that no worker owns any more. A task that has stored
     * its outcome is past the point of replay.
     */
    @Transactional
    public void resetForReplay(UUID id) {
        TaskRecord record = load(id);
        if (record.getState() == TaskState.NOTIFYING || record.getState().isTerminal()) {
            throw new IllegalStateException(
                    "Task %s is %s and cannot be replayed".formatted(id, record.getState()));
        }
        record.setState(TaskState.RECEIVED);
        record.setHeartbeatAt(Instant.now());
        taskRepo.save(record);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private TaskRecord load(UUID id) {
        return taskRepo.findById(id)
                .orElseThrow(() -> new IllegalStateException("Unknown task " + id));
    }

    private String writeTask(Task task) {
        try {
            return objectMapper.writeValueAsString(task);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Task is not serialisable", e);
        }
    }
}
