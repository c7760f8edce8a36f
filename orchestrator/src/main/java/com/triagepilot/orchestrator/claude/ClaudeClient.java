package com.triagepilot.orchestrator.claude;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the Anthropic Messages API: the reasoning collaborator
 * behind every pipeline stage.
 *
 * This client makes exactly one HTTP call per invocation and never retries.
 * Retry, backoff and fallback live in
 * {@link com.triagepilot.orchestrator.resilience.ResilientInvoker}, which wraps
 * each call site explicitly.
 *
 * Non-200 responses surface as {@link ClaudeApiException} so the invoker can
 * tell an overload (429/503/529) from a permanent failure by status code.
 */
@Component
public class ClaudeClient {

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /**
     * A single message in a conversation.
     * role must be "user" or "assistant".
     */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /**
         * Text of the first text block, or an empty string when the model
         * returned none. Empty output is the invoker's problem, not ours.
         */
        public String firstText() {
            if (content == null) return "";
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElse("");
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String API_VER    = "2023-06-01";
    private static final int    MAX_TOKENS = 2048;

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final String       apiUrl;

    public ClaudeClient(@Value("${anthropic.api-key}") String apiKey,
                        @Value("${triagepilot.claude.base-url:https://api.anthropic.com}") String baseUrl,
                        ObjectMapper objectMapper) {
        this.apiKey = apiKey;
        this.apiUrl = baseUrl + "/v1/messages";
        this.json   = objectMapper;
        this.http   = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Send a conversation to Claude and return the assistant's text reply.
     *
     * @param model    model id, e.g. from triagepilot.claude.model
     * @param messages conversation so far (user + assistant turns)
     * @param system   role-specific system prompt, or null for none
     * @return the assistant's text content; may be empty
     * @throws ClaudeApiException on any non-200 response
     */
    public String complete(String model, List<Message> messages, String system) {
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model",      model);
            body.put("max_tokens", MAX_TOKENS);
            if (system != null && !system.isBlank()) {
                body.put("system", system);
            }
            body.put("messages",   messages);

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl))
                    .timeout(Duration.ofSeconds(60))
                    .header("content-type",      "application/json")
                    .header("x-api-key",          apiKey)
                    .header("anthropic-version",  API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                throw new ClaudeApiException(response.statusCode(), response.body());
            }

            return json.readValue(response.body(), MessagesResponse.class).firstText();

        } catch (ClaudeApiException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Claude API call interrupted", e);
        } catch (Exception e) {
            throw new RuntimeException("Claude API call failed", e);
        }
    }

    // -------------------------------------------------------------------------
    // Exception type
    // -------------------------------------------------------------------------

    public static class ClaudeApiException extends RuntimeException {
        private final int statusCode;
        public ClaudeApiException(int statusCode, String body) {
            super("Claude API error %d: %s".formatted(statusCode, body));
            this.statusCode = statusCode;
        }
        public int statusCode() { return statusCode; }
    }
}
