package com.appforge.orchestrator.service;

import com.appforge.orchestrator.config.AppForgeProperties;
import com.appforge.orchestrator.model.Deployment;
import com.appforge.orchestrator.model.PagesStatus;
import com.appforge.orchestrator.model.Task;
import com.appforge.orchestrator.model.TaskOutcome;
import com.appforge.orchestrator.model.TaskRecord;
import com.appforge.orchestrator.model.TaskState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static com.appforge.orchestrator.TaskFixtures.recordWithId;
import static com.appforge.orchestrator.TaskFixtures.todoTask;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for TaskDispatcher with a real one-thread pool and a queue of one.
 * The orchestrator is mocked; a latch holds the worker busy where a test
 * needs the pool saturated.
 */
@ExtendWith(MockitoExtension.class)
class TaskDispatcherTest {

    private static final Duration STALL = Duration.ofMinutes(20);

    @Mock DeploymentOrchestrator orchestrator;
    @Mock TaskService            taskService;

    TaskDispatcher dispatcher;
    final CountDownLatch release = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        AppForgeProperties properties = new AppForgeProperties(null, null, null, null, null,
                new AppForgeProperties.Workers(1, 1, STALL), null, null);
        dispatcher = new TaskDispatcher(orchestrator, taskService, properties);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        dispatcher.shutdown();
    }

    // ------------------------------------------------------------------
    // dispatch()
    // ------------------------------------------------------------------

    @Test
    void dispatch_runsPipelineOnWorkerAndClearsInFlight() {
        UUID id = UUID.randomUUID();
        Task task = todoTask();

        assertThat(dispatcher.dispatch(id, task)).isTrue();

        verify(orchestrator, timeout(2000)).run(id, task);
        awaitIdle(id);
        assertThat(dispatcher.isInFlight(id)).isFalse();
    }

    @Test
    void dispatch_sameIdWhileInFlight_isIgnored() {
        blockWorker();
        UUID id = UUID.randomUUID();

        assertThat(dispatcher.dispatch(id, todoTask())).isTrue();
        assertThat(dispatcher.dispatch(id, todoTask())).isFalse();
        assertThat(dispatcher.isInFlight(id)).isTrue();
    }

    @Test
    void dispatch_queueFull_rejectsAndForgetsTask() {
        blockWorker();
        dispatcher.dispatch(UUID.randomUUID(), todoTask());   // running
        dispatcher.dispatch(UUID.randomUUID(), todoTask());   // queued
        UUID rejected = UUID.randomUUID();

        assertThatThrownBy(() -> dispatcher.dispatch(rejected, todoTask()))
                .isInstanceOf(RejectedExecutionException.class);
        assertThat(dispatcher.isInFlight(rejected)).isFalse();
    }

    @Test
    void dispatch_pipelineThrows_taskIsAbortedAndWorkerSurvives() {
        UUID failing = UUID.randomUUID();
        UUID next    = UUID.randomUUID();
        when(orchestrator.run(any(), any())).thenAnswer(inv -> {
            if (failing.equals(inv.getArgument(0))) {
                throw new IllegalStateException("db down");
            }
            return null;
        });

        dispatcher.dispatch(failing, todoTask());
        verify(taskService, timeout(2000)).abort(eq(failing), anyString());
        dispatcher.dispatch(next, todoTask());

        verify(orchestrator, timeout(2000)).run(eq(next), any());
    }

    // ------------------------------------------------------------------
    // recoverStalledTasks()
    // ------------------------------------------------------------------

    @Test
    void recoverStalledTasks_replaysStalledTaskFromStoredValue() {
        Task task = todoTask();
        TaskRecord stalled = recordWithId(task, TaskState.PUBLISHING);
        when(taskService.findStalled(STALL)).thenReturn(List.of(stalled));
        when(taskService.readTask(stalled)).thenReturn(task);

        dispatcher.recoverStalledTasks();

        verify(taskService).resetForReplay(stalled.getId());
        verify(orchestrator, timeout(2000)).run(stalled.getId(), task);
    }

    @Test
    void recoverStalledTasks_notifyingTask_redoesOnlyNotificationWithStoredOutcome() {
        Task task = todoTask();
        TaskRecord stalled = recordWithId(task, TaskState.NOTIFYING);
        TaskOutcome stored = TaskOutcome.succeeded(new Deployment("llm-app-todo-app-r1-0123456789",
                "https://github.com/octo/llm-app-todo-app-r1-0123456789",
                "https://octo.github.io/llm-app-todo-app-r1-0123456789/", "c0ffee", PagesStatus.LIVE));
        stalled.applyOutcome(stored);
        when(taskService.findStalled(STALL)).thenReturn(List.of(stalled));
        when(taskService.readTask(stalled)).thenReturn(task);

        dispatcher.recoverStalledTasks();

        verify(orchestrator, timeout(2000)).resumeNotify(stalled.getId(), task, stored);
        verify(orchestrator, never()).run(any(), any());
        verify(taskService, never()).resetForReplay(any());
    }

    @Test
    void recoverStalledTasks_notifyingTaskWithoutOutcome_isAborted() {
        TaskRecord stalled = recordWithId(todoTask(), TaskState.NOTIFYING);
        when(taskService.findStalled(STALL)).thenReturn(List.of(stalled));
        when(taskService.readTask(stalled)).thenReturn(todoTask());

        dispatcher.recoverStalledTasks();

        verify(taskService).abort(eq(stalled.getId()), anyString());
        verifyNoInteractions(orchestrator);
    }

    @Test
    void recoverStalledTasks_skipsTasksOwnedByLocalWorker() {
        blockWorker();
        Task task = todoTask();
        TaskRecord running = recordWithId(task, TaskState.GENERATING);
        dispatcher.dispatch(running.getId(), task);
        when(taskService.findStalled(STALL)).thenReturn(List.of(running));

        dispatcher.recoverStalledTasks();

        verify(taskService, never()).resetForReplay(any());
    }

    @Test
    void recoverStalledTasks_unreadableTask_isAborted() {
        TaskRecord broken = recordWithId(todoTask(), TaskState.RECEIVED);
        when(taskService.findStalled(STALL)).thenReturn(List.of(broken));
        when(taskService.readTask(broken)).thenThrow(new IllegalStateException("unreadable"));

        dispatcher.recoverStalledTasks();

        verify(taskService).abort(eq(broken.getId()), anyString());
        verifyNoInteractions(orchestrator);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void blockWorker() {
        when(orchestrator.run(any(), any())).thenAnswer(inv -> {
            release.await(5, TimeUnit.SECONDS);
            return null;
        });
    }

    private void awaitIdle(UUID id) {
        long deadline = System.currentTimeMillis() + 2000;
        while (dispatcher.isInFlight(id) && System.currentTimeMillis() < deadline) {
            Thread.onSpinWait();
        }
    }
}
