package com.repofactor.orchestrator.api.dto;

import com.repofactor.orchestrator.model.PipelineRun;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for POST /runs and GET /runs/{id}.
 * Enough for a caller to poll a run until it finishes.
 */
public record RunResponse(
        UUID    id,
        String  repoName,
        String  status,
        String  stage,
        int     retryCount,
        String  lastErrorMessage,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt
) {
    public static RunResponse from(PipelineRun run) {
        return new RunResponse(
                run.getId(),
                run.getRepoName(),
                run.getStatus().name(),
                run.getStage(),
                run.getRetryCount(),
                run.getLastErrorMessage(),
                run.getCreatedAt(),
                run.getStartedAt(),
                run.getFinishedAt()
        );
    }
}
