package com.repofactor.orchestrator.api.dto;

import java.util.Map;

/**
 * Request body for POST /runs.
 *
 * Required: instructions
 * Optional: repoName (defaults to "unnamed"), files as path → content
 *   (defaults to an empty repository).
 */
public record SubmitRunRequest(String repoName, String instructions, Map<String, String> files) {

    public SubmitRunRequest {
        if (files == null) files = Map.of();
    }
}
