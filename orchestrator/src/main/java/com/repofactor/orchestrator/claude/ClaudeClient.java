package com.repofactor.orchestrator.claude;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
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
import java.util.Set;

/**
 * Thin wrapper around the Anthropic Messages API.
 *
 * Raw java.net.http instead of an SDK: the endpoint is a single POST and we
 * want to see exactly what goes over the wire.
 *
 * Overloaded / rate-limited responses (429, 503, 529) are retried up to
 * {@link #MAX_ATTEMPTS} times with exponential backoff; anything else non-200
 * is thrown as {@link ClaudeApiException} straight away.
 */
@Component
public class ClaudeClient {

    private static final Logger log = LoggerFactory.getLogger(ClaudeClient.class);

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /**
     * A single message in a conversation.
     * role must be "user" or "assistant".
     */
    public record Message(String role, String content) {}

    /** The subset of the API response we care about. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** Extracts the text from the first text content block. */
        public String firstText() {
            if (content == null) {
                throw new IllegalStateException("No content in response");
            }
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No text block in response"));
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String API_URL = "https://api.anthropic.com/v1/messages";
    private static final String API_VER = "2023-06-01";

    static final int MAX_ATTEMPTS = 3;
    private static final Set<Integer> RETRYABLE = Set.of(429, 503, 529);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final String       defaultModel;
    private final int          maxTokens;

    @Autowired
    public ClaudeClient(@Value("${anthropic.api-key}") String apiKey,
                        @Value("${repofactor.agent.model:claude-sonnet-4-6}") String defaultModel,
                        @Value("${repofactor.agent.max-tokens:4096}") int maxTokens,
                        ObjectMapper objectMapper) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                apiKey, defaultModel, maxTokens, objectMapper);
    }

    ClaudeClient(HttpClient http, String apiKey, String defaultModel, int maxTokens, ObjectMapper objectMapper) {
        this.http         = http;
        this.apiKey       = apiKey;
        this.defaultModel = defaultModel;
        this.maxTokens    = maxTokens;
        this.json         = objectMapper;
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /** Same as {@link #complete(String, List, String)} with the configured model. */
    public String complete(List<Message> messages, String system) {
        return complete(defaultModel, messages, system);
    }

    /**
     * Send a conversation to Claude and return the assistant's text reply.
     *
     * @param model    e.g. "claude-sonnet-4-6"
     * @param messages the conversation so far (user + assistant turns)
     * @param system   system prompt; omitted from the request when null
     * @return the assistant's text content
     * @throws ClaudeApiException on a non-200 answer that is not retried (or retries ran out)
     */
    public String complete(String model, List<Message> messages, String system) {
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model",      model);
            body.put("max_tokens", maxTokens);
            if (system != null) {
                body.put("system", system);
            }
            body.put("messages",   messages);

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(API_URL))
                    .timeout(Duration.ofSeconds(120))
                    .header("content-type",      "application/json")
                    .header("x-api-key",         apiKey)
                    .header("anthropic-version", API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)))
                    .build();

            HttpResponse<String> response = sendWithRetry(request);
            if (response.statusCode() != 200) {
                throw new ClaudeApiException(response.statusCode(), response.body());
            }

            // Full response shape: { id, type, role, content: [{type, text}], ... }
            MessagesResponse parsed = json.readValue(response.body(), MessagesResponse.class);
            return parsed.firstText();

        } catch (ClaudeApiException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Claude API call interrupted", e);
        } catch (Exception e) {
            // The transport's own message is what ends up in last_error_message.
            throw new RuntimeException(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
        }
    }

    private HttpResponse<String> sendWithRetry(HttpRequest request) throws IOException, InterruptedException {
        HttpResponse<String> response = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
            if (!RETRYABLE.contains(response.statusCode()) || attempt == MAX_ATTEMPTS) {
                return response;
            }
            long backoffMs = 1000L << (attempt - 1);
            log.warn("Claude API returned {} (attempt {}/{}), retrying in {} ms",
                    response.statusCode(), attempt, MAX_ATTEMPTS, backoffMs);
            Thread.sleep(backoffMs);
        }
        return response;
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
