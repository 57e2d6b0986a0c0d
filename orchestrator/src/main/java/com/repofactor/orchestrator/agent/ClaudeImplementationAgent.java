package com.repofactor.orchestrator.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repofactor.orchestrator.agent.dto.AffectedFile;
import com.repofactor.orchestrator.agent.dto.ImplementationRequest;
import com.repofactor.orchestrator.agent.dto.ImplementationResult;
import com.repofactor.orchestrator.claude.ClaudeClient;
import com.repofactor.orchestrator.model.AgentRole;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Implementation agent backed by Claude.
 *
 * Only the files named in the analysis plan are sent (all files when the
 * plan names none), so retries stay within the prompt budget.
 */
@Component
public class ClaudeImplementationAgent extends ClaudeBackedAgent implements ImplementationAgent {

    public ClaudeImplementationAgent(ClaudeClient claude, SystemPrompts systemPrompts, ObjectMapper objectMapper) {
        super(AgentRole.IMPLEMENTATION, claude, systemPrompts, objectMapper);
    }

    @Override
    public ImplementationResult implement(ImplementationRequest request) {
        JsonNode node = ask(buildPrompt(request));
        requireBoolean(node, "success");
        if (node.has("modified_files")) {
            requireArray(node, "modified_files");
            requireTextInEach(node, "modified_files", "path");
        }
        return convert(node, ImplementationResult.class);
    }

    String buildPrompt(ImplementationRequest request) {
        return "Repository: " + request.snapshot().repoName() + "\n\n"
             + "=== INSTRUCTIONS ===\n"
             + request.instructions() + "\n"
             + "=== END INSTRUCTIONS ===\n\n"
             + "=== ANALYSIS PLAN ===\n"
             + planJson(request) + "\n"
             + "=== END PLAN ===\n\n"
             + "=== FILES ===\n"
             + renderFiles(relevantFiles(request))
             + "=== END FILES ===\n\n"
             + "Apply the plan and report the result.";
    }

    private String planJson(ImplementationRequest request) {
        try {
            return json.writerWithDefaultPrettyPrinter().writeValueAsString(request.analysis());
        } catch (JsonProcessingException e) {
            throw new AgentCallException(AgentRole.IMPLEMENTATION, "Could not serialise analysis plan", e);
        }
    }

    private static Map<String, String> relevantFiles(ImplementationRequest request) {
        Map<String, String> all = request.snapshot().files();
        if (request.analysis() == null || request.analysis().files().isEmpty()) {
            return all;
        }
        Set<String> planned = request.analysis().files().stream()
                .map(AffectedFile::path)
                .collect(Collectors.toSet());
        Map<String, String> selected = new TreeMap<>();
        all.forEach((path, content) -> {
            if (planned.contains(path)) selected.put(path, content);
        });
        return selected.isEmpty() ? all : selected;
    }
}
