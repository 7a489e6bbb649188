package com.appforge.orchestrator.notify;

import com.appforge.orchestrator.config.AppForgeProperties;
import com.appforge.orchestrator.model.Task;
import com.appforge.orchestrator.model.TaskOutcome;
import com.appforge.orchestrator.retry.Retrier;
import com.appforge.orchestrator.retry.RetryPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delivers a task outcome to the caller's evaluation URL.
 *
 * Has its own retry budget (appforge.retry.notify) because the callback
 * endpoint is outside our control and flakier than the APIs we depend on.
 * Never throws: an undelivered outcome is logged and reported back as
 * {@code delivered = false}, and the task's status stays as it was.
 */
@Component
public class Notifier {

    private static final Logger log = LoggerFactory.getLogger(Notifier.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final Retrier      retrier;
    private final RetryPolicy  policy;
    private final Duration     timeout;

    public Notifier(HttpClient httpClient, ObjectMapper objectMapper, Retrier retrier,
                    AppForgeProperties properties) {
        this.http    = httpClient;
        this.json    = objectMapper;
        this.retrier = retrier;
        this.policy  = properties.retry().notification();
        this.timeout = properties.notification().requestTimeout();
    }

    public NotifyResult notify(Task task, TaskOutcome outcome) {
        if (!task.hasEvaluationUrl()) {
            log.warn("Task has no evaluation URL; outcome {} not delivered", outcome.status());
            return NotifyResult.undelivered(0, "No evaluation URL");
        }

        URI target;
        String body;
        try {
            target = URI.create(task.evaluationUrl());
            // HttpRequest.Builder rejects anything else, and it must not do so inside the retrier
            if (!"http".equalsIgnoreCase(target.getScheme()) && !"https".equalsIgnoreCase(target.getScheme())
                    || target.getHost() == null) {
                throw new IllegalArgumentException("Evaluation URL must be an absolute http(s) URL: " + target);
            }
            body   = json.writeValueAsString(CallbackPayload.of(task, outcome));
        } catch (IllegalArgumentException | JsonProcessingException e) {
            log.warn("Cannot notify {}: {}", task.evaluationUrl(), e.getMessage());
            return NotifyResult.undelivered(0, e.getMessage());
        }

        AtomicInteger attempts = new AtomicInteger();
        try {
            retrier.execute("Notify", policy, NotifyException.class,
                    n -> {
                        attempts.set(n);
                        post(target, body);
                        return null;
                    });
            log.info("Posted outcome {} to {} (attempt {})", outcome.status(), target, attempts.get());
            return NotifyResult.delivered(attempts.get());
        } catch (NotifyException e) {
            log.warn("Giving up on {} after {} attempts: {}", target, attempts.get(), e.getMessage());
            return NotifyResult.undelivered(attempts.get(), e.getMessage());
        }
    }

    private void post(URI target, String body) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(target)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new NotifyException(NotifyException.Kind.UPSTREAM_TIMEOUT, "Callback timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotifyException(NotifyException.Kind.UPSTREAM_ERROR, "Interrupted", e);
        } catch (IOException e) {
            throw new NotifyException(NotifyException.Kind.UPSTREAM_ERROR, e.getMessage(), e);
        }
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new NotifyException(NotifyException.Kind.UPSTREAM_ERROR,
                    "Callback answered HTTP " + resp.statusCode(), null);
        }
    }
}
