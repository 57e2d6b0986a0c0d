package com.repofactor.orchestrator.agent;

import com.repofactor.orchestrator.model.AgentRole;

/**
 * The agent answered, but its output could not be parsed into the expected
 * result shape. Handled exactly like a transport failure: no part of a
 * malformed response is trusted.
 */
public class MalformedResponseException extends AgentCallException {

    public MalformedResponseException(AgentRole role, String message) {
        super(role, message);
    }

    public MalformedResponseException(AgentRole role, String message, Throwable cause) {
        super(role, message, cause);
    }
}
