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
import com.appforge.orchestrator.retry.RetryPolicy;
import com.appforge.orchestrator.retry.Sleeper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the pipeline state machine.
 *
 * Generator, publisher, notifier and persistence are mocked; the retrier is
 * real but never sleeps, so every retry budget is exercised exactly.
 */
@ExtendWith(MockitoExtension.class)
class DeploymentOrchestratorTest {

    private static final UUID ID = UUID.randomUUID();

    private static final Task TODO_TASK = new Task("student@example.com", "todo-app", 1, "nonce-1",
            "Build a to-do list app", List.of("Page has a #todos list"), List.of(),
            "https://eval.example.com/notify");

    private static final GeneratedFileSet TODO_FILES = GeneratedFileSet.ofText(Map.of(
            "index.html", "<ul id='todos'></ul>",
            "README.md",  "# Todo"));

    private static final Deployment DEPLOYMENT = new Deployment("llm-app-todo-app-r1-0123456789",
            "https://github.com/octo/llm-app-todo-app-r1-0123456789",
            "https://octo.github.io/llm-app-todo-app-r1-0123456789/",
            "c0ffee", PagesStatus.PENDING);

    @Mock CodeGenerator       generator;
    @Mock RepositoryPublisher publisher;
    @Mock Notifier            notifier;
    @Mock TaskService         taskService;

    SimpleMeterRegistry    registry;
    DeploymentOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        AppForgeProperties properties = new AppForgeProperties(null, null, null, null, null, null, null,
                new AppForgeProperties.Retry(RetryPolicy.immediate(3), RetryPolicy.immediate(3), null));
        orchestrator = new DeploymentOrchestrator(generator, publisher, notifier, taskService,
                new TaskMetrics(registry), new Retrier(Sleeper.NONE), properties);
    }

    // ------------------------------------------------------------------
    // Happy path
    // ------------------------------------------------------------------

    @Test
    void run_todoApp_succeedsAndIsNotified() {
        when(generator.generate(eq(TODO_TASK), any())).thenReturn(TODO_FILES);
        when(publisher.publish(TODO_TASK, TODO_FILES)).thenReturn(DEPLOYMENT);
        when(notifier.notify(eq(TODO_TASK), any())).thenReturn(NotifyResult.delivered(1));

        TaskOutcome outcome = orchestrator.run(ID, TODO_TASK);

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.SUCCEEDED);
        assertThat(outcome.deployment()).isEqualTo(DEPLOYMENT);
        assertThat(outcome.deployment().pagesStatus()).isEqualTo(PagesStatus.PENDING);
        assertThat(outcome.notified()).isTrue();

        InOrder order = inOrder(taskService, generator, publisher, notifier);
        order.verify(taskService).transition(ID, TaskState.GENERATING);
        order.verify(generator).generate(TODO_TASK, Optional.empty());
        order.verify(taskService).transition(ID, TaskState.PUBLISHING);
        order.verify(publisher).publish(TODO_TASK, TODO_FILES);
        order.verify(taskService).complete(eq(ID), any());
        order.verify(notifier).notify(eq(TODO_TASK), any());
        order.verify(taskService).finish(ID, outcome, 1);

        assertThat(registry.get("appforge.tasks.completed").tag("status", "succeeded").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void run_notifierSeesOutcomeBeforeNotifiedFlag() {
        when(generator.generate(eq(TODO_TASK), any())).thenReturn(TODO_FILES);
        when(publisher.publish(TODO_TASK, TODO_FILES)).thenReturn(DEPLOYMENT);
        when(notifier.notify(eq(TODO_TASK), any())).thenReturn(NotifyResult.delivered(1));

        orchestrator.run(ID, TODO_TASK);

        ArgumentCaptor<TaskOutcome> sent = ArgumentCaptor.forClass(TaskOutcome.class);
        verify(notifier).notify(eq(TODO_TASK), sent.capture());
        assertThat(sent.getValue().notified()).isFalse();
        assertThat(sent.getValue().status()).isEqualTo(OutcomeStatus.SUCCEEDED);
    }

    // ------------------------------------------------------------------
    // Generation failures
    // ------------------------------------------------------------------

    @Test
    void run_generationTimesOutEveryAttempt_failsWithoutPublishing() {
        when(generator.generate(eq(TODO_TASK), any())).thenThrow(
                new GenerationException(GenerationException.Kind.UPSTREAM_TIMEOUT, "timed out"));
        when(notifier.notify(eq(TODO_TASK), any())).thenReturn(NotifyResult.delivered(1));

        TaskOutcome outcome = orchestrator.run(ID, TODO_TASK);

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(outcome.errorKind()).isEqualTo(ErrorKind.GENERATION_FAILED);
        assertThat(outcome.errorDetail()).contains("timed out");
        verify(generator, times(3)).generate(eq(TODO_TASK), any());
        verifyNoInteractions(publisher);
        verify(notifier, times(1)).notify(eq(TODO_TASK), any());
        verify(taskService, never()).transition(ID, TaskState.PUBLISHING);
        verify(taskService).recordAttempt(ID, PipelineStep.GENERATE, 3);
    }

    @Test
    void run_malformedThenValid_regeneratesWithPreviousFailure() {
        GenerationException malformed = new GenerationException(
                GenerationException.Kind.MALFORMED_RESPONSE, "Response contains no file listing");
        when(generator.generate(eq(TODO_TASK), any())).thenThrow(malformed).thenReturn(TODO_FILES);
        when(publisher.publish(TODO_TASK, TODO_FILES)).thenReturn(DEPLOYMENT);
        when(notifier.notify(eq(TODO_TASK), any())).thenReturn(NotifyResult.delivered(1));

        TaskOutcome outcome = orchestrator.run(ID, TODO_TASK);

        assertThat(outcome.succeeded()).isTrue();
        InOrder order = inOrder(generator);
        order.verify(generator).generate(TODO_TASK, Optional.empty());
        order.verify(generator).generate(TODO_TASK, Optional.of(malformed.getMessage()));
    }

    // ------------------------------------------------------------------
    // Publish failures
    // ------------------------------------------------------------------

    @Test
    void run_namingConflict_failsOnFirstOccurrence() {
        when(generator.generate(eq(TODO_TASK), any())).thenReturn(TODO_FILES);
        when(publisher.publish(TODO_TASK, TODO_FILES)).thenThrow(
                new PublishException(PublishException.Kind.NAMING_CONFLICT, "taken"));
        when(notifier.notify(eq(TODO_TASK), any())).thenReturn(NotifyResult.delivered(1));

        TaskOutcome outcome = orchestrator.run(ID, TODO_TASK);

        assertThat(outcome.errorKind()).isEqualTo(ErrorKind.PUBLISH_FAILED);
        assertThat(outcome.errorDetail()).contains("NAMING_CONFLICT");
        verify(publisher, times(1)).publish(any(), any());
    }

    @Test
    void run_publishRateLimitedThroughout_exhaustsExactBudget() {
        when(generator.generate(eq(TODO_TASK), any())).thenReturn(TODO_FILES);
        when(publisher.publish(TODO_TASK, TODO_FILES)).thenThrow(
                new PublishException(PublishException.Kind.RATE_LIMITED, "slow down"));
        when(notifier.notify(eq(TODO_TASK), any())).thenReturn(NotifyResult.delivered(1));

        TaskOutcome outcome = orchestrator.run(ID, TODO_TASK);

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(outcome.errorKind()).isEqualTo(ErrorKind.PUBLISH_FAILED);
        assertThat(outcome.deployment()).isNull();
        verify(publisher, times(3)).publish(any(), any());
        verify(generator, times(1)).generate(any(), any());
    }

    @Test
    void run_publishSucceedsOnRetry_succeeds() {
        when(generator.generate(eq(TODO_TASK), any())).thenReturn(TODO_FILES);
        when(publisher.publish(TODO_TASK, TODO_FILES))
                .thenThrow(new PublishException(PublishException.Kind.UPSTREAM_ERROR, "502"))
                .thenReturn(DEPLOYMENT);
        when(notifier.notify(eq(TODO_TASK), any())).thenReturn(NotifyResult.delivered(1));

        TaskOutcome outcome = orchestrator.run(ID, TODO_TASK);

        assertThat(outcome.succeeded()).isTrue();
        verify(taskService).recordAttempt(ID, PipelineStep.PUBLISH, 2);
    }

    // ------------------------------------------------------------------
    // Notification
    // ------------------------------------------------------------------

    @Test
    void run_notifyFails_keepsStatusAndClearsNotified() {
        when(generator.generate(eq(TODO_TASK), any())).thenReturn(TODO_FILES);
        when(publisher.publish(TODO_TASK, TODO_FILES)).thenReturn(DEPLOYMENT);
        when(notifier.notify(eq(TODO_TASK), any())).thenReturn(NotifyResult.undelivered(6, "HTTP 500"));

        TaskOutcome outcome = orchestrator.run(ID, TODO_TASK);

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.SUCCEEDED);
        assertThat(outcome.notified()).isFalse();
        verify(taskService).finish(ID, outcome, 6);
        assertThat(registry.get("appforge.notify.deliveries").tag("delivered", "false").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void resumeNotify_storedOutcome_isOnlyRedeliveredThenClosed() {
        TaskOutcome stored = TaskOutcome.failed(ErrorKind.PUBLISH_FAILED, "rate limited");
        when(notifier.notify(TODO_TASK, stored)).thenReturn(NotifyResult.delivered(2));

        TaskOutcome closed = orchestrator.resumeNotify(ID, TODO_TASK, stored);

        assertThat(closed).isEqualTo(stored.markNotified());
        verify(taskService).finish(ID, closed, 2);
        verify(taskService, never()).transition(any(), any());
        verify(taskService, never()).complete(any(), any());
        verifyNoInteractions(generator, publisher);
    }

    @Test
    void run_unexpectedError_propagatesToDispatcher() {
        doThrow(new IllegalStateException("db down")).when(taskService).transition(ID, TaskState.GENERATING);

        assertThatThrownBy(() -> orchestrator.run(ID, TODO_TASK))
                .isInstanceOf(IllegalStateException.class);
        verify(generator, never()).generate(any(), any());
        verify(taskService, never()).complete(any(), any());
        verify(taskService, never()).recordAttempt(any(), any(), anyInt());
    }
}
