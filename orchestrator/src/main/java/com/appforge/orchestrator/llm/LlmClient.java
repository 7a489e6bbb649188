package com.appforge.orchestrator.llm;

import com.appforge.orchestrator.config.AppForgeProperties;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
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
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the Anthropic Messages API.
 *
 * One call, one user turn: the generator sends a system prompt and a single
 * user message and gets the assistant's text back. Retrying is the
 * orchestrator's business, so nothing here loops.
 */
@Component
public class LlmClient {

    private static final Logger log = LoggerFactory.getLogger(LlmClient.class);

    /** A single message in a conversation. role is "user" or "assistant". */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content, String stop_reason) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** Concatenates every text block; the model may split long output. */
        public String text() {
            if (content == null) return "";
            StringBuilder sb = new StringBuilder();
            content.stream()
                    .filter(b -> "text".equals(b.type()) && b.text() != null)
                    .forEach(b -> sb.append(b.text()));
            return sb.toString();
        }
    }

    private static final String API_VER = "2023-06-01";

    private final HttpClient             http;
    private final ObjectMapper           json;
    private final AppForgeProperties.Llm config;

    public LlmClient(HttpClient httpClient, ObjectMapper objectMapper, AppForgeProperties properties) {
        this.http   = httpClient;
        this.json   = objectMapper;
        this.config = properties.llm();
    }

    /**
     * Send one prompt and return the assistant's text reply.
     *
     * @throws LlmApiException on timeout, transport failure or non-200 status
     */
    public String complete(String systemPrompt, String userPrompt) {
        try {
            String requestBody = json.writeValueAsString(Map.of(
                    "model",      config.model(),
                    "max_tokens", config.maxTokens(),
                    "system",     systemPrompt,
                    "messages",   List.of(new Message("user", userPrompt))
            ));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(config.baseUrl() + "/v1/messages"))
                    .timeout(config.requestTimeout())
                    .header("content-type",      "application/json")
                    .header("x-api-key",         config.apiKey() == null ? "" : config.apiKey())
                    .header("anthropic-version", API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                throw new LlmApiException(response.statusCode(), response.body(), false);
            }

            MessagesResponse parsed = json.readValue(response.body(), MessagesResponse.class);
            if ("max_tokens".equals(parsed.stop_reason())) {
                log.warn("Completion hit max_tokens ({}); the file listing is probably truncated",
                        config.maxTokens());
            }
            return parsed.text();

        } catch (LlmApiException e) {
            throw e;
        } catch (HttpTimeoutException e) {
            throw new LlmApiException("LLM request timed out after " + config.requestTimeout(), e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmApiException("LLM request interrupted", e, false);
        } catch (IOException e) {
            throw new LlmApiException("LLM request failed: " + e.getMessage(), e, false);
        }
    }

    // -------------------------------------------------------------------------
    // Exception type
    // -------------------------------------------------------------------------

    public static class LlmApiException extends RuntimeException {
        private final int     statusCode;
        private final boolean timedOut;

        public LlmApiException(int statusCode, String body, boolean timedOut) {
            super("LLM API error %d: %s".formatted(statusCode, body));
            this.statusCode = statusCode;
            this.timedOut   = timedOut;
        }

        public LlmApiException(String message, Throwable cause, boolean timedOut) {
            super(message, cause);
            this.statusCode = -1;
            this.timedOut   = timedOut;
        }

        /** HTTP status, or -1 when no response arrived. */
        public int     statusCode() { return statusCode; }
        public boolean timedOut()   { return timedOut; }
    }
}
