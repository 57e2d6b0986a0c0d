package com.repofactor.orchestrator.agent.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of one implementation attempt.
 *
 * success=false is a semantic failure: the agent ran but could not apply the
 * plan. errorMessage and executionLogs then describe what went wrong.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ImplementationResult(
        @JsonProperty("modified_files") List<ModifiedFile> modifiedFiles,
        @JsonProperty("success")        boolean            success,
        @JsonProperty("error_message")  String             errorMessage,
        @JsonProperty("execution_logs") List<String>       executionLogs
) {
    public ImplementationResult {
        modifiedFiles = modifiedFiles == null ? List.of() : List.copyOf(modifiedFiles);
        executionLogs = executionLogs == null ? List.of() : List.copyOf(executionLogs);
    }

    public static ImplementationResult succeeded(List<ModifiedFile> files, List<String> logs) {
        return new ImplementationResult(files, true, null, logs);
    }

    public static ImplementationResult failed(String errorMessage, List<String> logs) {
        return new ImplementationResult(List.of(), false, errorMessage, logs);
    }
}
