package com.repofactor.orchestrator.agent.dto;

import com.repofactor.orchestrator.model.RepoSnapshot;

/** Input of the analysis agent. */
public record AnalysisRequest(RepoSnapshot snapshot, String instructions) {}
