package com.repofactor.orchestrator.agent;

import com.repofactor.orchestrator.agent.dto.ImplementationRequest;
import com.repofactor.orchestrator.agent.dto.ImplementationResult;

/**
 * Applies an analysis plan to the snapshot.
 *
 * A semantic failure is reported as {@code success = false} in the result,
 * not as an exception.
 */
public interface ImplementationAgent {

    /**
     * @throws AgentCallException          on transport or backend failure
     * @throws MalformedResponseException  if the answer cannot be parsed
     */
    ImplementationResult implement(ImplementationRequest request);
}
