package com.repofactor.orchestrator.agent.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One ranked fix proposed by the research agent. Rank 1 is the best;
 * a missing rank sorts last.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Solution(
        @JsonProperty("description")  String  description,
        @JsonProperty("code_snippet") String  codeSnippet,
        @JsonProperty("rank")         Integer rank
) {
    /** A solution is usable when it carries any text to act on. */
    @JsonIgnore
    public boolean isUsable() {
        return (description != null && !description.isBlank())
            || (codeSnippet != null && !codeSnippet.isBlank());
    }

    @JsonIgnore
    public int rankOrLast() {
        return rank == null ? Integer.MAX_VALUE : rank;
    }
}
