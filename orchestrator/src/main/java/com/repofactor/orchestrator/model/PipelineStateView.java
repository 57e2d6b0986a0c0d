package com.repofactor.orchestrator.model;

/**
 * Read-only view of a run's state handed to the decision function.
 *
 * Only the two fields the decision depends on are exposed, so the decision
 * cannot read (or write) anything else.
 */
public interface PipelineStateView {

    PipelineStage currentStage();

    int retryCount();
}
