package com.repofactor.orchestrator.pipeline;

/**
 * Internal signal that the run's deadline passed or its thread was
 * interrupted. Never escapes {@link PipelineDriver}.
 */
class RunCancelledException extends RuntimeException {

    static final String PREFIX = "cancelled: ";

    RunCancelledException(String reason) {
        super(PREFIX + reason);
    }
}
