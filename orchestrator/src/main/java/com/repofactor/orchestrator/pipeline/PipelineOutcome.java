package com.repofactor.orchestrator.pipeline;

import com.repofactor.orchestrator.model.NextAction;
import com.repofactor.orchestrator.model.PipelineStage;
import com.repofactor.orchestrator.model.PipelineState;

import java.util.Optional;

/**
 * What a finished run hands back to its caller: the terminal action and the
 * final state. Failures are reported here, never thrown.
 */
public record PipelineOutcome(NextAction terminalAction, PipelineState finalState) {

    public boolean succeeded() {
        return terminalAction == NextAction.DONE;
    }

    public PipelineStage finalStage() {
        return finalState.currentStage();
    }

    public Optional<String> lastErrorMessage() {
        return finalState.lastErrorMessage();
    }
}
