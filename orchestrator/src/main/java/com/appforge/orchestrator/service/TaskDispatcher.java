package com.appforge.orchestrator.service;

import com.appforge.orchestrator.config.AppForgeProperties;
import com.appforge.orchestrator.model.Task;
import com.appforge.orchestrator.model.TaskOutcome;
import com.appforge.orchestrator.model.TaskRecord;
import com.appforge.orchestrator.model.TaskState;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded worker pool that runs task pipelines.
 *
 * One pipeline per accepted submission, at most appforge.workers.count at a
 * time, so concurrent tasks together stay within the upstream rate limits.
 * Submissions beyond the queue capacity are rejected rather than buffered
 * without bound.
 *
 * A periodic sweep re-dispatches tasks whose run died with the process
 * (non-terminal, heartbeat too old, not owned by a local worker). A task
 * that already stored its outcome only has its notification redone.
 */
@Component
@EnableScheduling
public class TaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TaskDispatcher.class);

    private final ThreadPoolExecutor     workers;
    private final Set<UUID>              inFlight = ConcurrentHashMap.newKeySet();
    private final DeploymentOrchestrator orchestrator;
    private final TaskService            taskService;
    private final Duration               stallTimeout;

    public TaskDispatcher(DeploymentOrchestrator orchestrator,
                          TaskService taskService,
                          AppForgeProperties properties) {
        this.orchestrator = orchestrator;
        this.taskService  = taskService;
        AppForgeProperties.Workers config = properties.workers();
        this.stallTimeout = config.stallTimeout();
        this.workers = new ThreadPoolExecutor(
                config.count(), config.count(),
                0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(config.queueCapacity()),
                namedThreads());
    }

    /**
     * Queue a task for execution.
     *
     * @return false when the task is already running or queued in this process
     * @throws RejectedExecutionException when the queue is full
     */
    public boolean dispatch(UUID taskId, Task task) {
        return submit(taskId, () -> orchestrator.run(taskId, task));
    }

    private boolean submit(UUID taskId, Runnable pipeline) {
        if (!inFlight.add(taskId)) {
            return false;
        }
        try {
            workers.execute(() -> runSafely(taskId, pipeline));
            return true;
        } catch (RejectedExecutionException e) {
            inFlight.remove(taskId);
            throw e;
        }
    }

    public boolean isInFlight(UUID taskId) {
        return inFlight.contains(taskId);
    }

    /**
     * Re-dispatch stalled tasks from their stored Task value. Publishing is
     * idempotent per task identity, so a replay converges on the repository
     * the dead run may already have created. A task stalled in NOTIFYING
     * keeps its stored outcome and only retries the notification.
     */
    @Scheduled(fixedDelayString = "${appforge.workers.recovery-interval:60000}",
               initialDelayString = "${appforge.workers.recovery-interval:60000}")
    public void recoverStalledTasks() {
        for (TaskRecord record : taskService.findStalled(stallTimeout)) {
            if (inFlight.contains(record.getId())) {
                continue;
            }
            log.warn("Recovering stalled task {} (state={}, last heartbeat={})",
                    record.getId(), record.getState(), record.getHeartbeatAt());
            try {
                Task task = taskService.readTask(record);
                if (record.getState() == TaskState.NOTIFYING) {
                    TaskOutcome stored = record.storedOutcome();
                    submit(record.getId(), () -> orchestrator.resumeNotify(record.getId(), task, stored));
                } else {
                    taskService.resetForReplay(record.getId());
                    dispatch(record.getId(), task);
                }
            } catch (RejectedExecutionException e) {
                log.warn("Worker queue full, task {} stays stalled until the next sweep", record.getId());
            } catch (IllegalStateException e) {
                log.error("Cannot replay task {}: {}", record.getId(), e.getMessage());
                taskService.abort(record.getId(), "Replay impossible: " + e.getMessage());
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("{} task(s) still running at shutdown; the recovery sweep will replay them",
                        inFlight.size());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** One task's failure must never take a worker thread down with it. */
    private void runSafely(UUID taskId, Runnable pipeline) {
        try {
            pipeline.run();
        } catch (Exception e) {
            log.error("Unhandled error in pipeline for task {}: {}", taskId, e.getMessage(), e);
            try {
                taskService.abort(taskId, "Unhandled exception: " + e.getMessage());
            } catch (Exception abortFailure) {
                log.error("Could not record abort for task {}", taskId, abortFailure);
            }
        } finally {
            inFlight.remove(taskId);
        }
    }

    private static ThreadFactory namedThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "task-worker-" + counter.incrementAndGet());
            t.setDaemon(false);
            return t;
        };
    }
}
