package com.repofactor.orchestrator.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repofactor.orchestrator.agent.dto.AnalysisRequest;
import com.repofactor.orchestrator.agent.dto.AnalysisResult;
import com.repofactor.orchestrator.claude.ClaudeClient;
import com.repofactor.orchestrator.model.AgentRole;
import org.springframework.stereotype.Component;

/** Analysis agent backed by Claude. */
@Component
public class ClaudeAnalysisAgent extends ClaudeBackedAgent implements AnalysisAgent {

    public ClaudeAnalysisAgent(ClaudeClient claude, SystemPrompts systemPrompts, ObjectMapper objectMapper) {
        super(AgentRole.ANALYSIS, claude, systemPrompts, objectMapper);
    }

    @Override
    public AnalysisResult analyze(AnalysisRequest request) {
        JsonNode node = ask(buildPrompt(request));
        requireArray(node, "files");
        requireTextInEach(node, "files", "path");
        return convert(node, AnalysisResult.class);
    }

    static String buildPrompt(AnalysisRequest request) {
        return "Repository: " + request.snapshot().repoName() + "\n"
             + "Files in repository: " + request.snapshot().fileCount() + "\n\n"
             + "=== INTEGRATION INSTRUCTIONS ===\n"
             + request.instructions() + "\n"
             + "=== END INSTRUCTIONS ===\n\n"
             + "=== REPOSITORY FILES ===\n"
             + renderFiles(request.snapshot().files())
             + "=== END FILES ===\n\n"
             + "Analyse the repository and produce the integration plan.";
    }
}
