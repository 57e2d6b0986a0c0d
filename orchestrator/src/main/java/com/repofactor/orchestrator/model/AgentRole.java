package com.repofactor.orchestrator.model;

import java.util.Locale;

/**
 * The four agents of the integration pipeline.
 *
 * Each role is one request/response call against an external backend.
 * The Driver stores each role's latest output under this key in
 * {@link PipelineState#results()}.
 */
public enum AgentRole {
    ANALYSIS,        // Reads the snapshot, produces the change plan
    IMPLEMENTATION,  // Applies the plan, reports success or failure + logs
    RESEARCH,        // Looks for fixes after a failed implementation
    DIFF;            // Unified diff between original and modified files

    /** Lower-case name used as the key in persisted results. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
