package com.repofactor.orchestrator.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repofactor.orchestrator.agent.dto.ResearchRequest;
import com.repofactor.orchestrator.agent.dto.ResearchResult;
import com.repofactor.orchestrator.claude.ClaudeClient;
import com.repofactor.orchestrator.model.AgentRole;
import org.springframework.stereotype.Component;

/** Research agent backed by Claude. */
@Component
public class ClaudeResearchAgent extends ClaudeBackedAgent implements ResearchAgent {

    public ClaudeResearchAgent(ClaudeClient claude, SystemPrompts systemPrompts, ObjectMapper objectMapper) {
        super(AgentRole.RESEARCH, claude, systemPrompts, objectMapper);
    }

    @Override
    public ResearchResult research(ResearchRequest request) {
        JsonNode node = ask(buildPrompt(request));
        requireArray(node, "solutions");
        return convert(node, ResearchResult.class);
    }

    static String buildPrompt(ResearchRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Problem Context\n")
          .append("- Task: ").append(request.originalContext()).append('\n')
          .append("- Error: ").append(request.errorMessage()).append("\n\n");

        if (!request.executionLogsTail().isEmpty()) {
            sb.append("## Execution Logs (last ").append(request.executionLogsTail().size()).append(" lines)\n");
            request.executionLogsTail().forEach(line -> sb.append(line).append('\n'));
            sb.append('\n');
        }

        sb.append("Find the root cause and propose ranked fixes.");
        return sb.toString();
    }
}
