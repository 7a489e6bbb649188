package com.appforge.orchestrator.service;

import com.appforge.orchestrator.config.AppForgeProperties;
import com.appforge.orchestrator.metrics.TaskMetrics;
import com.appforge.orchestrator.model.Task;
import com.appforge.orchestrator.model.TaskRecord;
import com.appforge.orchestrator.publisher.RepositoryNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.RejectedExecutionException;

/**
 * Accepts an authenticated task: persists it, then hands it to a worker.
 *
 * The pipeline runs after this returns; its result reaches the caller
 * through the evaluation URL, never through this call.
 */
@Service
public class TaskSubmissionService {

    private static final Logger log = LoggerFactory.getLogger(TaskSubmissionService.class);

    private final TaskService    taskService;
    private final TaskDispatcher dispatcher;
    private final TaskMetrics    metrics;
    private final String         repoPrefix;

    public TaskSubmissionService(TaskService taskService,
                                 TaskDispatcher dispatcher,
                                 TaskMetrics metrics,
                                 AppForgeProperties properties) {
        this.taskService = taskService;
        this.dispatcher  = dispatcher;
        this.metrics     = metrics;
        this.repoPrefix  = properties.github().repoPrefix();
    }

    /**
     * @throws WorkersBusyException when the worker queue is full; nothing is
     *                              persisted in that case
     */
    public TaskRecord submit(Task task) {
        TaskRecord record = taskService.accept(task, RepositoryNames.forTask(repoPrefix, task));
        try {
            dispatcher.dispatch(record.getId(), task);
        } catch (RejectedExecutionException e) {
            log.warn("Worker queue full, rejecting task {} round {}", task.task(), task.round());
            taskService.discard(record.getId());
            metrics.recordRejection("queue_full");
            throw new WorkersBusyException("All workers are busy; retry later");
        }
        return record;
    }

    /** The worker pool cannot take another task right now. */
    public static class WorkersBusyException extends RuntimeException {
        public WorkersBusyException(String message) {
            super(message);
        }
    }
}
