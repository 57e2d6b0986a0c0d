package com.repofactor.orchestrator.agent;

import com.repofactor.orchestrator.agent.dto.ResearchRequest;
import com.repofactor.orchestrator.agent.dto.ResearchResult;

/** Looks for ranked fixes for a failed implementation attempt. */
public interface ResearchAgent {

    /**
     * @throws AgentCallException          on transport or backend failure
     * @throws MalformedResponseException  if the answer cannot be parsed
     */
    ResearchResult research(ResearchRequest request);
}
