package com.forgeloop.orchestrator.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgeloop.orchestrator.config.ForgeloopProperties;
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
 * Thin wrapper around the Anthropic Messages API. One call is one turn of a
 * capability conversation.
 */
@Component
public class ClaudeClient {

    /**
     * A single message in a conversation.
     * role must be "user" or "assistant".
     */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** Text of the first text block. */
        public String firstText() {
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No text block in response"));
        }
    }

    private static final String API_VER = "2023-06-01";

    // Overloaded (529), rate limited (429) and unavailable (503) are retried.
    private static final int  MAX_RETRIES  = 2;
    private static final long BACKOFF_MS   = 2_000;

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiUrl;
    private final String       apiKey;
    private final int          maxTokens;

    public ClaudeClient(ForgeloopProperties properties, ObjectMapper objectMapper) {
        this.apiUrl    = properties.getClaude().getApiUrl();
        this.apiKey    = properties.getClaude().getApiKey();
        this.maxTokens = properties.getClaude().getMaxTokens();
        this.json      = objectMapper;
        this.http      = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Send a conversation and return the assistant's text reply.
     *
     * @param model    e.g. "claude-sonnet-4-6"
     * @param messages the full conversation so far
     * @param system   system prompt for the capability
     */
    public String complete(String model, List<Message> messages, String system) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("forgeloop.claude.api-key is not configured");
        }
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model", model);
            body.put("max_tokens", maxTokens);
            body.put("system", system);
            body.put("messages", messages);

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl))
                    .timeout(Duration.ofSeconds(120))
                    .header("content-type",      "application/json")
                    .header("x-api-key",         apiKey)
                    .header("anthropic-version", API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            for (int retry = 1; retry <= MAX_RETRIES && isTransient(response.statusCode()); retry++) {
                Thread.sleep(BACKOFF_MS * retry);
                response = http.send(request, HttpResponse.BodyHandlers.ofString());
            }
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

    private static boolean isTransient(int status) {
        return status == 429 || status == 503 || status == 529;
    }

    public static class ClaudeApiException extends RuntimeException {
        private final int statusCode;
        public ClaudeApiException(int statusCode, String body) {
            super("Claude API error %d: %s".formatted(statusCode, body));
            this.statusCode = statusCode;
        }
        public int statusCode() { return statusCode; }
    }
}
