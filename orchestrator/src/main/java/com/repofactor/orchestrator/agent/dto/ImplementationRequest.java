package com.repofactor.orchestrator.agent.dto;

import com.repofactor.orchestrator.model.RepoSnapshot;

/**
 * Input of the implementation agent. {@code instructions} is the run's
 * accumulated instructions, recovery notes included.
 */
public record ImplementationRequest(AnalysisResult analysis,
                                    RepoSnapshot snapshot,
                                    String instructions) {}
