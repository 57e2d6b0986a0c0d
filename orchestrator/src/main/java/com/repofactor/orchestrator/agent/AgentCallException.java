package com.repofactor.orchestrator.agent;

import com.repofactor.orchestrator.model.AgentRole;

/**
 * Thrown when an agent call fails at the transport or backend level
 * (network, auth, quota, non-2xx status).
 *
 * The Driver records {@link #getMessage()} verbatim as the run's last error.
 */
public class AgentCallException extends RuntimeException {

    private final AgentRole role;

    public AgentCallException(AgentRole role, String message) {
        super(message);
        this.role = role;
    }

    public AgentCallException(AgentRole role, String message, Throwable cause) {
        super(message, cause);
        this.role = role;
    }

    public AgentRole role() {
        return role;
    }
}
