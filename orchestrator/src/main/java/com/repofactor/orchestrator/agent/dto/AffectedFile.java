package com.repofactor.orchestrator.agent.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One file the analysis expects to touch. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AffectedFile(
        @JsonProperty("path")        String     path,
        @JsonProperty("reason")      String     reason,
        @JsonProperty("change_type") ChangeType changeType,
        @JsonProperty("confidence")  Double     confidence
) {
    public static final double DEFAULT_CONFIDENCE = 0.5;

    public AffectedFile {
        reason     = reason == null ? "" : reason;
        changeType = changeType == null ? ChangeType.MODIFY : changeType;
        confidence = confidence == null ? DEFAULT_CONFIDENCE : confidence;
    }
}
