package com.repofactor.orchestrator.agent;

import com.repofactor.orchestrator.agent.dto.DiffRequest;
import com.repofactor.orchestrator.agent.dto.DiffResult;

/** Computes the unified diff between the original and the modified files. */
public interface DiffAgent {

    /** @throws AgentCallException if the diff cannot be produced */
    DiffResult diff(DiffRequest request);
}
