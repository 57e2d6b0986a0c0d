package com.repofactor.orchestrator.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repofactor.orchestrator.claude.ClaudeClient;
import com.repofactor.orchestrator.claude.ClaudeClient.ClaudeApiException;
import com.repofactor.orchestrator.claude.ClaudeClient.Message;
import com.repofactor.orchestrator.model.AgentRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shared plumbing of the Claude-backed agents: one single-turn call, then
 * boundary validation of the {@code <result>} JSON.
 *
 * Errors are mapped to the pipeline's taxonomy here:
 *   - API / transport failure          → {@link AgentCallException}
 *   - no result tag, bad JSON, missing
 *     required field, wrong type       → {@link MalformedResponseException}
 */
abstract class ClaudeBackedAgent {

    private static final Logger log = LoggerFactory.getLogger(ClaudeBackedAgent.class);

    // Keeps prompts bounded for large repositories.
    static final int MAX_FILES       = 40;
    static final int MAX_FILE_CHARS  = 8_000;

    private final AgentRole     role;
    private final ClaudeClient  claude;
    private final SystemPrompts systemPrompts;
    protected final ObjectMapper json;

    protected ClaudeBackedAgent(AgentRole role,
                                ClaudeClient claude,
                                SystemPrompts systemPrompts,
                                ObjectMapper json) {
        this.role          = role;
        this.claude        = claude;
        this.systemPrompts = systemPrompts;
        this.json          = json;
    }

    /**
     * Send one user prompt and return the parsed JSON object from the reply.
     */
    protected JsonNode ask(String userPrompt) {
        String reply;
        try {
            reply = claude.complete(List.of(new Message("user", userPrompt)), systemPrompts.get(role));
        } catch (ClaudeApiException e) {
            throw new AgentCallException(role, e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new AgentCallException(role,
                    e.getMessage() != null ? e.getMessage() : "Claude API call failed", e);
        }

        String payload = ResponseParser.extractJson(reply).orElseThrow(() ->
                new MalformedResponseException(role, role.key() + " agent response has no <result> block"));
        try {
            JsonNode node = json.readTree(payload);
            if (node == null || !node.isObject()) {
                throw new MalformedResponseException(role, role.key() + " agent result is not a JSON object");
            }
            log.debug("{} agent answered with fields {}", role.key(), fieldNames(node));
            return node;
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException(role,
                    role.key() + " agent result is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** Bind a validated node to its result record. */
    protected <T> T convert(JsonNode node, Class<T> type) {
        try {
            return json.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedResponseException(role,
                    role.key() + " agent result does not match " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    protected void requireArray(JsonNode node, String field) {
        if (!node.path(field).isArray()) {
            throw new MalformedResponseException(role,
                    role.key() + " agent result is missing array field '" + field + "'");
        }
    }

    protected void requireBoolean(JsonNode node, String field) {
        if (!node.path(field).isBoolean()) {
            throw new MalformedResponseException(role,
                    role.key() + " agent result is missing boolean field '" + field + "'");
        }
    }

    /** Every element of an array field must be an object with a non-blank text field. */
    protected void requireTextInEach(JsonNode node, String arrayField, String textField) {
        for (JsonNode element : node.path(arrayField)) {
            JsonNode value = element.path(textField);
            if (!value.isTextual() || value.asText().isBlank()) {
                throw new MalformedResponseException(role,
                        role.key() + " agent result has an entry in '" + arrayField
                        + "' without '" + textField + "'");
            }
        }
    }

    /**
     * Render repository files for a prompt, first {@link #MAX_FILES} only,
     * each cut at {@link #MAX_FILE_CHARS}.
     */
    protected static String renderFiles(Map<String, String> files) {
        StringBuilder sb = new StringBuilder();
        int shown = 0;
        for (Map.Entry<String, String> file : files.entrySet()) {
            if (shown == MAX_FILES) {
                sb.append("(").append(files.size() - MAX_FILES).append(" more files not shown)\n");
                break;
            }
            String content = file.getValue() == null ? "" : file.getValue();
            if (content.length() > MAX_FILE_CHARS) {
                content = content.substring(0, MAX_FILE_CHARS) + "\n... (truncated)";
            }
            sb.append("--- ").append(file.getKey()).append(" ---\n")
              .append(content).append("\n\n");
            shown++;
        }
        return sb.toString();
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
