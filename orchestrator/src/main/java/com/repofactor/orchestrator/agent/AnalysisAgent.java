package com.repofactor.orchestrator.agent;

import com.repofactor.orchestrator.agent.dto.AnalysisRequest;
import com.repofactor.orchestrator.agent.dto.AnalysisResult;

/** Produces the change plan for a repository snapshot and instructions. */
public interface AnalysisAgent {

    /**
     * @throws AgentCallException          on transport or backend failure
     * @throws MalformedResponseException  if the answer cannot be parsed
     */
    AnalysisResult analyze(AnalysisRequest request);
}
