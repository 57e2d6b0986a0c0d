package com.repofactor.orchestrator.agent.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The analysis plan: files to change, new dependencies, risks, and the
 * ordered implementation steps.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisResult(
        @JsonProperty("files")        List<AffectedFile> files,
        @JsonProperty("dependencies") List<String>       dependencies,
        @JsonProperty("risks")        List<String>       risks,
        @JsonProperty("steps")        List<String>       steps
) {
    public AnalysisResult {
        files        = files == null ? List.of() : List.copyOf(files);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        risks        = risks == null ? List.of() : List.copyOf(risks);
        steps        = steps == null ? List.of() : List.copyOf(steps);
    }

    /** Files the analysis is confident about (confidence above 0.8). */
    public List<AffectedFile> highConfidenceFiles() {
        return files.stream().filter(f -> f.confidence() > 0.8).toList();
    }
}
