package com.appforge.orchestrator.service;

import com.appforge.orchestrator.config.AppForgeProperties;
import com.appforge.orchestrator.generator.CodeGenerator;
import com.appforge.orchestrator.generator.GenerationException;
import com.appforge.orchestrator.metrics.TaskMetrics;
import com.appforge.orchestrator.model.*;
import com.appforge.orchestrator.notify.Notifier;
import com.appforge.orchestrator.notify.NotifyResult;
import com.appforge.orchestrator.publisher.PublishException;
import com.appforge.orchestrator.publisher.RepositoryPublisher;
import com.appforge.orchestrator.retry.Retrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs one task through the pipeline:
 *
 *   RECEIVED → GENERATING → PUBLISHING → NOTIFYING → DONE
 *
 * Each step is retried under its own policy. Generation that exhausts its
 * budget ends the task as GENERATION_FAILED without touching GitHub; publish
 * that exhausts its budget ends it as PUBLISH_FAILED. Either way the outcome
 * is then posted to the evaluation URL, and a failed delivery only clears
 * the notified flag.
 *
 * Holds no per-task state between calls, so one instance serves every
 * worker thread.
 */
@Component
public class DeploymentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DeploymentOrchestrator.class);

    private final CodeGenerator         generator;
    private final RepositoryPublisher   publisher;
    private final Notifier              notifier;
    private final TaskService           taskService;
    private final TaskMetrics           metrics;
    private final Retrier               retrier;
    private final AppForgeProperties.Retry policies;

    public DeploymentOrchestrator(CodeGenerator generator,
                                  RepositoryPublisher publisher,
                                  Notifier notifier,
                                  TaskService taskService,
                                  TaskMetrics metrics,
                                  Retrier retrier,
                                  AppForgeProperties properties) {
        this.generator   = generator;
        this.publisher   = publisher;
        this.notifier    = notifier;
        this.taskService = taskService;
        this.metrics     = metrics;
        this.retrier     = retrier;
        this.policies    = properties.retry();
    }

    /**
     * Run the whole pipeline for one accepted task. Blocks the calling worker
     * thread until the task is DONE.
     *
     * @param taskId id of the task's record, currently in state RECEIVED
     * @return the terminal outcome, with notified set from the delivery result
     */
    public TaskOutcome run(UUID taskId, Task task) {
        // Every log line from this worker thread carries the task identity.
        MDC.put("taskId",  taskId.toString());
        MDC.put("taskKey", task.key().substring(0, 12));
        try {
            log.info("Starting pipeline for task {} round {}", task.task(), task.round());

            TaskOutcome outcome = null;
            GeneratedFileSet files = null;
            MDC.put("state", TaskState.GENERATING.name());
            taskService.transition(taskId, TaskState.GENERATING);
            try {
                files = generate(taskId, task);
            } catch (GenerationException e) {
                outcome = TaskOutcome.failed(ErrorKind.GENERATION_FAILED, e.getMessage());
            }

            if (files != null) {
                MDC.put("state", TaskState.PUBLISHING.name());
                taskService.transition(taskId, TaskState.PUBLISHING);
                try {
                    outcome = TaskOutcome.succeeded(publish(taskId, task, files));
                } catch (PublishException e) {
                    // The generated files are dropped; a resubmission regenerates them.
                    outcome = TaskOutcome.failed(ErrorKind.PUBLISH_FAILED, e.getMessage());
                }
            }

            MDC.put("state", TaskState.NOTIFYING.name());
            taskService.complete(taskId, outcome);
            metrics.recordOutcome(outcome.status());
            return notifyAndFinish(taskId, task, outcome);
        } finally {
            // Pool threads are reused; do not leak this task's context.
            MDC.clear();
        }
    }

    /**
     * Redo only the notify step of a task whose outcome is already stored
     * (state NOTIFYING) but whose run died before it was closed.
     */
    public TaskOutcome resumeNotify(UUID taskId, Task task, TaskOutcome stored) {
        MDC.put("taskId",  taskId.toString());
        MDC.put("taskKey", task.key().substring(0, 12));
        MDC.put("state",   TaskState.NOTIFYING.name());
        try {
            log.info("Resuming notification of outcome {} for task {} round {}",
                    stored.status(), task.task(), task.round());
            return notifyAndFinish(taskId, task, stored);
        } finally {
            MDC.clear();
        }
    }

    // ------------------------------------------------------------------
    // Steps
    // ------------------------------------------------------------------

    /** Post the outcome, then close the task. Only the notified flag can change here. */
    private TaskOutcome notifyAndFinish(UUID taskId, Task task, TaskOutcome terminal) {
        NotifyResult result = timed(PipelineStep.NOTIFY, () -> notifier.notify(task, terminal));
        metrics.recordNotification(result.delivered());
        TaskOutcome closed = result.delivered() ? terminal.markNotified() : terminal;
        if (!result.delivered()) {
            log.warn("Outcome {} was not delivered to the evaluation URL: {}",
                    terminal.status(), result.lastError());
        }

        MDC.put("state", TaskState.DONE.name());
        taskService.finish(taskId, closed, result.attempts());
        return closed;
    }

    /**
     * Generate under the generation policy. Each retry is told why the
     * previous attempt failed.
     *
     * @throws GenerationException once the budget is exhausted
     */
    private GeneratedFileSet generate(UUID taskId, Task task) {
        AtomicReference<String> previousFailure = new AtomicReference<>();
        return timed(PipelineStep.GENERATE, () -> retrier.execute(
                "Generate", policies.generation(), GenerationException.class,
                attempt -> {
                    taskService.recordAttempt(taskId, PipelineStep.GENERATE, attempt);
                    GeneratedFileSet files = generator.generate(task, Optional.ofNullable(previousFailure.get()));
                    metrics.recordAttempt(PipelineStep.GENERATE.metricName(), true);
                    return files;
                },
                (attempt, e) -> {
                    previousFailure.set(e.getMessage());
                    metrics.recordAttempt(PipelineStep.GENERATE.metricName(), false);
                }));
    }

    /**
     * Publish under the publish policy. Every attempt targets the same
     * repository, so retries converge rather than duplicate.
     *
     * @throws PublishException once the budget is exhausted, or at once for a naming conflict
     */
    private Deployment publish(UUID taskId, Task task, GeneratedFileSet files) {
        return timed(PipelineStep.PUBLISH, () -> retrier.execute(
                "Publish", policies.publish(), PublishException.class,
                attempt -> {
                    taskService.recordAttempt(taskId, PipelineStep.PUBLISH, attempt);
                    Deployment deployment = publisher.publish(task, files);
                    metrics.recordAttempt(PipelineStep.PUBLISH.metricName(), true);
                    return deployment;
                },
                (attempt, e) -> metrics.recordAttempt(PipelineStep.PUBLISH.metricName(), false)));
    }

    private <T> T timed(PipelineStep step, Supplier<T> body) {
        Instant start = Instant.now();
        try {
            return body.get();
        } finally {
            metrics.recordStepDuration(step.metricName(), Duration.between(start, Instant.now()));
        }
    }
}
