package com.repofactor.orchestrator.model;

/**
 * Execution status of a submitted run (the row, not the pipeline stage).
 *
 * Transitions:
 *   PENDING → RUNNING   (claimed by a worker)
 *   RUNNING → SUCCEEDED (pipeline ended in DONE)
 *   RUNNING → FAILED    (pipeline ended in REPORT_FAILURE, or crashed)
 */
public enum RunStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED;

    public boolean isFinished() {
        return this == SUCCEEDED || this == FAILED;
    }
}
