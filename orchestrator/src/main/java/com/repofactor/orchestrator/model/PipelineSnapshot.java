package com.repofactor.orchestrator.model;

import java.util.List;
import java.util.Map;

/**
 * Serialized form of a {@link PipelineState}: one flat JSON object per run,
 * stored on the run row when the run reaches a terminal stage.
 */
public record PipelineSnapshot(
        String             currentStage,
        int                retryCount,
        String             lastErrorMessage,
        List<String>       executionLogs,
        String             originalInstructions,
        String             accumulatedInstructions,
        List<RecoveryNote> recoveryNotes,
        Map<String, Object> results
) {}
