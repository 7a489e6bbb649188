package com.appforge.orchestrator.notify;

import com.appforge.orchestrator.config.AppForgeProperties;
import com.appforge.orchestrator.model.Deployment;
import com.appforge.orchestrator.model.ErrorKind;
import com.appforge.orchestrator.model.PagesStatus;
import com.appforge.orchestrator.model.Task;
import com.appforge.orchestrator.model.TaskOutcome;
import com.appforge.orchestrator.retry.Retrier;
import com.appforge.orchestrator.retry.Sleeper;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for Notifier. HttpClient is mocked and the retrier never
 * sleeps, so the full six-attempt budget runs instantly.
 */
@ExtendWith(MockitoExtension.class)
class NotifierTest {

    private static final Deployment DEPLOYMENT = new Deployment("llm-app-todo-r1-abc",
            "https://github.com/octo/llm-app-todo-r1-abc", "https://octo.github.io/llm-app-todo-r1-abc/",
            "c0ffee", PagesStatus.PENDING);

    @Mock HttpClient           http;
    @Mock HttpResponse<String> ok;
    @Mock HttpResponse<String> unavailable;

    Notifier notifier;

    @BeforeEach
    void setUp() {
        AppForgeProperties properties = new AppForgeProperties(null, null, null, null, null, null, null, null);
        notifier = new Notifier(http, new ObjectMapper(), new Retrier(Sleeper.NONE), properties);
    }

    @Test
    void notify_withoutEvaluationUrl_skipsAndReportsUndelivered() {
        NotifyResult result = notifier.notify(task(null), TaskOutcome.succeeded(DEPLOYMENT));

        assertThat(result.delivered()).isFalse();
        assertThat(result.attempts()).isZero();
        verifyNoInteractions(http);
    }

    @Test
    void notify_2xx_deliveredOnFirstAttempt() throws Exception {
        when(ok.statusCode()).thenReturn(202);
        doReturn(ok).when(http).send(any(), any());

        NotifyResult result = notifier.notify(task("https://eval.example.com/notify"),
                TaskOutcome.succeeded(DEPLOYMENT));

        assertThat(result).isEqualTo(NotifyResult.delivered(1));
        ArgumentCaptor<HttpRequest> req = ArgumentCaptor.forClass(HttpRequest.class);
        verify(http).send(req.capture(), any());
        assertThat(req.getValue().uri()).isEqualTo(URI.create("https://eval.example.com/notify"));
        assertThat(req.getValue().method()).isEqualTo("POST");
        assertThat(req.getValue().headers().firstValue("Content-Type")).contains("application/json");
    }

    @Test
    void notify_transientFailures_retriedUntilDelivered() throws Exception {
        when(unavailable.statusCode()).thenReturn(503);
        when(ok.statusCode()).thenReturn(200);
        doThrow(new HttpTimeoutException("slow"))
                .doReturn(unavailable)
                .doReturn(ok)
                .when(http).send(any(), any());

        NotifyResult result = notifier.notify(task("https://eval.example.com/notify"),
                TaskOutcome.failed(ErrorKind.GENERATION_FAILED, "timed out"));

        assertThat(result.delivered()).isTrue();
        assertThat(result.attempts()).isEqualTo(3);
    }

    @Test
    void notify_alwaysFailing_stopsAtSixAttemptsWithoutThrowing() throws Exception {
        when(unavailable.statusCode()).thenReturn(500);
        doReturn(unavailable).when(http).send(any(), any());

        NotifyResult result = notifier.notify(task("https://eval.example.com/notify"),
                TaskOutcome.succeeded(DEPLOYMENT));

        assertThat(result.delivered()).isFalse();
        assertThat(result.attempts()).isEqualTo(6);
        assertThat(result.lastError()).contains("HTTP 500");
        verify(http, times(6)).send(any(), any());
    }

    @Test
    void notify_malformedUrl_reportsUndeliveredWithoutSending() {
        NotifyResult result = notifier.notify(task("not a url"), TaskOutcome.succeeded(DEPLOYMENT));

        assertThat(result.delivered()).isFalse();
        verifyNoInteractions(http);
    }

    @ParameterizedTest
    @ValueSource(strings = {"eval.example.com/notify", "ftp://eval.example.com/notify", "https:///notify"})
    void notify_urlHttpClientCannotSend_reportsUndeliveredWithoutSending(String url) {
        NotifyResult result = notifier.notify(task(url), TaskOutcome.failed(ErrorKind.UPSTREAM_ERROR, "boom"));

        assertThat(result.delivered()).isFalse();
        assertThat(result.attempts()).isZero();
        assertThat(result.lastError()).contains("http");
        verifyNoInteractions(http);
    }

    // ------------------------------------------------------------------
    // Payload
    // ------------------------------------------------------------------

    @Test
    void payload_succeeded_carriesDeploymentAndNoError() {
        JsonNode json = new ObjectMapper().valueToTree(
                CallbackPayload.of(task("https://x"), TaskOutcome.succeeded(DEPLOYMENT)));

        assertThat(json.get("status").asText()).isEqualTo("succeeded");
        assertThat(json.get("repo_url").asText()).isEqualTo(DEPLOYMENT.repositoryUrl());
        assertThat(json.get("commit_sha").asText()).isEqualTo("c0ffee");
        assertThat(json.get("pages_url").asText()).isEqualTo(DEPLOYMENT.pagesUrl());
        assertThat(json.get("pages_status").asText()).isEqualTo("pending");
        assertThat(json.get("round").asInt()).isEqualTo(1);
        assertThat(json.has("error_kind")).isFalse();
    }

    @Test
    void payload_failed_carriesErrorAndNoDeployment() {
        JsonNode json = new ObjectMapper().valueToTree(
                CallbackPayload.of(task("https://x"), TaskOutcome.failed(ErrorKind.PUBLISH_FAILED, "rate limited")));

        assertThat(json.get("status").asText()).isEqualTo("failed");
        assertThat(json.get("error_kind").asText()).isEqualTo("publish-failed");
        assertThat(json.get("error_detail").asText()).isEqualTo("rate limited");
        assertThat(json.has("repo_url")).isFalse();
    }

    private static Task task(String evaluationUrl) {
        return new Task("student@example.com", "todo-app", 1, "nonce-1", "brief",
                List.of(), List.of(), evaluationUrl);
    }
}
