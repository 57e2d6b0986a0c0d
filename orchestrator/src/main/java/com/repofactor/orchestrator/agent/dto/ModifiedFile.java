package com.repofactor.orchestrator.agent.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** New full content of one file written by the implementation agent. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModifiedFile(
        @JsonProperty("path")             String path,
        @JsonProperty("modified_content") String modifiedContent
) {}
