package com.repofactor.orchestrator.pipeline;

import com.repofactor.orchestrator.model.NextAction;
import com.repofactor.orchestrator.model.PipelineStage;
import com.repofactor.orchestrator.model.PipelineStateView;

/**
 * Decides which agent runs next, from the current stage and retry count only.
 *
 * <pre>
 *   start                                   → analysis
 *   analysis_complete                       → implementation
 *   implementation_complete                 → diff
 *   implementation_failed, retries &lt; 3      → research
 *   implementation_failed, retries &gt;= 3     → report_failure
 *   implementation_retry                    → implementation
 *   diff_complete                           → done
 *   done / report_failure                   → themselves
 *   anything else                           → report_failure
 * </pre>
 *
 * Pure: no I/O, no state, never throws. The same input always gives the
 * same output, which is what lets a checkpointed run be re-decided safely.
 */
public final class DecisionFunction {

    /** Research → implementation cycles allowed before the run is given up. */
    public static final int MAX_RETRIES = 3;

    private DecisionFunction() {}

    public static NextAction decide(PipelineStateView state) {
        if (state == null) return NextAction.REPORT_FAILURE;
        return decide(state.currentStage(), state.retryCount());
    }

    public static NextAction decide(PipelineStage stage, int retryCount) {
        if (stage == null) return NextAction.REPORT_FAILURE;
        return switch (stage) {
            case START                   -> NextAction.ANALYSIS;
            case ANALYSIS_COMPLETE       -> NextAction.IMPLEMENTATION;
            case IMPLEMENTATION_COMPLETE -> NextAction.DIFF;
            case IMPLEMENTATION_FAILED   -> retryCount < MAX_RETRIES
                                                ? NextAction.RESEARCH
                                                : NextAction.REPORT_FAILURE;
            case IMPLEMENTATION_RETRY    -> NextAction.IMPLEMENTATION;
            case DIFF_COMPLETE           -> NextAction.DONE;
            case DONE                    -> NextAction.DONE;
            case REPORT_FAILURE          -> NextAction.REPORT_FAILURE;
        };
    }

    /**
     * Decide from a serialized stage name (CLI, REST, checkpoints).
     * Unrecognized text yields REPORT_FAILURE so a corrupt stage never proceeds.
     */
    public static NextAction decide(String stageName, int retryCount) {
        return PipelineStage.fromWireName(stageName)
                .map(stage -> decide(stage, retryCount))
                .orElse(NextAction.REPORT_FAILURE);
    }
}
