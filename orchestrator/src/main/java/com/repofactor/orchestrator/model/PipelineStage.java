package com.repofactor.orchestrator.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Named points in the pipeline's control-flow graph.
 *
 * Transitions (happy path):
 *   START → ANALYSIS_COMPLETE → IMPLEMENTATION_COMPLETE → DIFF_COMPLETE → DONE
 *
 * Recovery cycle:
 *   IMPLEMENTATION_FAILED → IMPLEMENTATION_RETRY → IMPLEMENTATION_COMPLETE | IMPLEMENTATION_FAILED
 *
 * REPORT_FAILURE and DONE are terminal.
 */
public enum PipelineStage {
    START,
    ANALYSIS_COMPLETE,
    IMPLEMENTATION_COMPLETE,
    IMPLEMENTATION_FAILED,
    IMPLEMENTATION_RETRY,
    DIFF_COMPLETE,
    REPORT_FAILURE,
    DONE;

    /** Serialized form, e.g. "analysis_complete". */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a serialized stage name. Case and surrounding whitespace are ignored.
     * Returns empty for null, blank or unknown text; never throws.
     */
    public static Optional<PipelineStage> fromWireName(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        String normalized = text.strip().toUpperCase(Locale.ROOT);
        for (PipelineStage stage : values()) {
            if (stage.name().equals(normalized)) {
                return Optional.of(stage);
            }
        }
        return Optional.empty();
    }
}
