package com.repofactor.orchestrator.agent.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/** Ranked fixes and the search queries the research agent used. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResearchResult(
        @JsonProperty("solutions")      List<Solution> solutions,
        @JsonProperty("search_queries") List<String>   searchQueries
) {
    public ResearchResult {
        solutions     = solutions == null ? List.of() : List.copyOf(solutions);
        searchQueries = searchQueries == null ? List.of() : List.copyOf(searchQueries);
    }

    /**
     * The single best-ranked usable solution. Ties keep the agent's order.
     * Empty when nothing usable was found.
     */
    public Optional<Solution> bestRecommendation() {
        return solutions.stream()
                .filter(Solution::isUsable)
                .min(Comparator.comparingInt(Solution::rankOrLast));
    }
}
