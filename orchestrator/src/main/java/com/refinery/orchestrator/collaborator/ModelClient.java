package com.refinery.orchestrator.collaborator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around an OpenAI-compatible chat-completions endpoint.
 *
 * Raw HttpClient rather than an SDK: one POST, and the status code is all the
 * retry policy needs to see.
 */
@Component
public class ModelClient {

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /** role is "system", "user" or "assistant". */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CompletionResponse(List<Choice> choices) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Choice(Message message) {}

        /** Text of the first choice. */
        public String firstText() {
            if (choices == null || choices.isEmpty() || choices.get(0).message() == null) {
                throw new IllegalStateException("No choices in completion response");
            }
            return choices.get(0).message().content();
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       apiKey;
    private final int          maxTokens;

    public ModelClient(@Value("${refinery.model.base-url}") String baseUrl,
                       @Value("${refinery.model.api-key:}") String apiKey,
                       @Value("${refinery.model.max-tokens:8192}") int maxTokens,
                       ObjectMapper objectMapper) {
        this.baseUrl   = baseUrl;
        this.apiKey    = apiKey;
        this.maxTokens = maxTokens;
        this.json      = objectMapper;
        this.http      = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Send a conversation and return the assistant's text reply.
     *
     * @throws ModelApiException on a non-200 status
     * @throws IOException       if the endpoint is unreachable or the reply is not JSON
     */
    public String complete(String model, List<Message> messages, Double temperature)
            throws IOException, InterruptedException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("max_tokens", maxTokens);
        body.put("messages", messages);
        if (temperature != null) body.put("temperature", temperature);

        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/chat/completions"))
                .timeout(Duration.ofMinutes(5))
                .header("content-type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)));
        if (!apiKey.isBlank()) {
            request.header("authorization", "Bearer " + apiKey);
        }

        HttpResponse<String> response = http.send(request.build(), HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new ModelApiException(response.statusCode(), response.body());
        }
        return json.readValue(response.body(), CompletionResponse.class).firstText();
    }

    // -------------------------------------------------------------------------
    // Exception type
    // -------------------------------------------------------------------------

    public static class ModelApiException extends RuntimeException {
        private final int statusCode;
        public ModelApiException(int statusCode, String body) {
            super("Model API error %d: %s".formatted(statusCode, body));
            this.statusCode = statusCode;
        }
        public int statusCode() { return statusCode; }

        /** Rate limits, timeouts and server errors are worth another attempt. */
        public boolean isRetryable() {
            return statusCode == 408 || statusCode == 429 || statusCode >= 500;
        }
    }
}
