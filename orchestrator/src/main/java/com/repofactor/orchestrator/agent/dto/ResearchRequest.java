package com.repofactor.orchestrator.agent.dto;

import java.util.List;

/**
 * Input of the research agent: the last failure, the most recent execution
 * log lines (not the full history), and the user's original instructions.
 */
public record ResearchRequest(String errorMessage,
                              List<String> executionLogsTail,
                              String originalContext) {

    public ResearchRequest {
        executionLogsTail = executionLogsTail == null ? List.of() : List.copyOf(executionLogsTail);
    }
}
