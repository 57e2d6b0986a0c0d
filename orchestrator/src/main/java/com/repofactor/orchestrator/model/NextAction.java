package com.repofactor.orchestrator.model;

import java.util.Locale;
import java.util.Optional;

/**
 * What the Driver should do next, as decided by the decision function.
 *
 * Four actions invoke an agent; REPORT_FAILURE and DONE end the run.
 */
public enum NextAction {
    ANALYSIS(AgentRole.ANALYSIS),
    IMPLEMENTATION(AgentRole.IMPLEMENTATION),
    RESEARCH(AgentRole.RESEARCH),
    DIFF(AgentRole.DIFF),
    REPORT_FAILURE(null),
    DONE(null);

    private final AgentRole agent;

    NextAction(AgentRole agent) {
        this.agent = agent;
    }

    /** The agent this action invokes; empty for terminal actions. */
    public Optional<AgentRole> agent() {
        return Optional.ofNullable(agent);
    }

    public boolean isTerminal() {
        return agent == null;
    }

    /** The terminal stage this action ends in. Only valid for terminal actions. */
    public PipelineStage terminalStage() {
        return switch (this) {
            case DONE           -> PipelineStage.DONE;
            case REPORT_FAILURE -> PipelineStage.REPORT_FAILURE;
            default -> throw new IllegalStateException(this + " is not a terminal action");
        };
    }

    /** Printed form, e.g. "report_failure". */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
