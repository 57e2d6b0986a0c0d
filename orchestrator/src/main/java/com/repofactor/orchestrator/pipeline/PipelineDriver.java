package com.repofactor.orchestrator.pipeline;

import com.repofactor.orchestrator.agent.AgentCallException;
import com.repofactor.orchestrator.agent.AnalysisAgent;
import com.repofactor.orchestrator.agent.DiffAgent;
import com.repofactor.orchestrator.agent.ImplementationAgent;
import com.repofactor.orchestrator.agent.MalformedResponseException;
import com.repofactor.orchestrator.agent.ResearchAgent;
import com.repofactor.orchestrator.agent.dto.AnalysisRequest;
import com.repofactor.orchestrator.agent.dto.AnalysisResult;
import com.repofactor.orchestrator.agent.dto.DiffRequest;
import com.repofactor.orchestrator.agent.dto.DiffResult;
import com.repofactor.orchestrator.agent.dto.ImplementationRequest;
import com.repofactor.orchestrator.agent.dto.ImplementationResult;
import com.repofactor.orchestrator.agent.dto.ModifiedFile;
import com.repofactor.orchestrator.agent.dto.ResearchRequest;
import com.repofactor.orchestrator.agent.dto.ResearchResult;
import com.repofactor.orchestrator.agent.dto.Solution;
import com.repofactor.orchestrator.model.AgentRole;
import com.repofactor.orchestrator.model.NextAction;
import com.repofactor.orchestrator.model.PipelineStage;
import com.repofactor.orchestrator.model.PipelineState;
import com.repofactor.orchestrator.model.RecoveryNote;
import com.repofactor.orchestrator.model.RepoSnapshot;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The run loop of the integration pipeline.
 *
 * For one run, this class repeatedly:
 *   1. Asks {@link DecisionFunction} what to do next
 *   2. Stops if the answer is terminal (done / report_failure)
 *   3. Otherwise calls the matching agent with a request built from state
 *   4. Folds the agent's answer back into {@link PipelineState}
 *
 * It is the only writer of PipelineState and the only component that
 * performs I/O. Agent calls are strictly sequential: each one finishes (or
 * is cancelled) before the next decision is taken.
 *
 * Failure handling:
 *   - implementation fails (semantic or transport) → implementation_failed,
 *     then research and retry until the ceiling in DecisionFunction
 *   - analysis, research or diff fails            → report_failure
 *   - deadline passes or thread is interrupted    → report_failure,
 *     last error starts with "cancelled:"; stored results are kept
 */
@Component
public class PipelineDriver {

    private static final Logger log = LoggerFactory.getLogger(PipelineDriver.class);

    private final AnalysisAgent       analysisAgent;
    private final ImplementationAgent implementationAgent;
    private final ResearchAgent       researchAgent;
    private final DiffAgent           diffAgent;
    private final MeterRegistry       meterRegistry;
    private final int                 researchLogTail;

    // Agent calls run here so the loop can stop waiting at the deadline.
    private final ExecutorService agentCalls;

    public PipelineDriver(AnalysisAgent analysisAgent,
                          ImplementationAgent implementationAgent,
                          ResearchAgent researchAgent,
                          DiffAgent diffAgent,
                          MeterRegistry meterRegistry,
                          @Value("${repofactor.pipeline.research-log-tail:10}") int researchLogTail) {
        this.analysisAgent       = analysisAgent;
        this.implementationAgent = implementationAgent;
        this.researchAgent       = researchAgent;
        this.diffAgent           = diffAgent;
        this.meterRegistry       = meterRegistry;
        this.researchLogTail     = researchLogTail;
        this.agentCalls          = Executors.newCachedThreadPool(agentCallThreads());
    }

    @PreDestroy
    public void shutdown() {
        agentCalls.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    /**
     * Run the pipeline from the start stage until it terminates.
     *
     * @param snapshot     repository content the agents work on
     * @param instructions the user's integration instructions
     * @param deadline     when to give up waiting; {@link Deadline#none()} for no limit
     * @return the terminal outcome with the final state; never throws for agent failures
     */
    public PipelineOutcome run(RepoSnapshot snapshot, String instructions, Deadline deadline) {
        PipelineState state = new PipelineState(instructions);
        log.info("Pipeline starting: repo={} files={}", snapshot.repoName(), snapshot.fileCount());
        try {
            return drive(state, snapshot, deadline);
        } finally {
            MDC.remove("action");
        }
    }

    private PipelineOutcome drive(PipelineState state, RepoSnapshot snapshot, Deadline deadline) {
        while (true) {
            NextAction action = DecisionFunction.decide(state);
            if (action.isTerminal()) {
                state.advanceTo(action.terminalStage());
                if (action == NextAction.DONE) {
                    log.info("Pipeline DONE after {} retries", state.retryCount());
                } else {
                    log.error("Pipeline ended in REPORT_FAILURE (retries={}): {}",
                            state.retryCount(), state.lastErrorMessage().orElse("no error recorded"));
                }
                return new PipelineOutcome(action, state);
            }

            MDC.put("action", action.wireName());
            log.debug("Stage {} (retry {}) → {}", state.currentStage().wireName(), state.retryCount(),
                    action.wireName());
            AgentRole role = action.agent()
                    .orElseThrow(() -> new IllegalStateException("Non-terminal action without an agent: " + action));
            try {
                switch (role) {
                    case ANALYSIS       -> runAnalysis(state, snapshot, deadline);
                    case IMPLEMENTATION -> runImplementation(state, snapshot, deadline);
                    case RESEARCH       -> runResearch(state, deadline);
                    case DIFF           -> runDiff(state, snapshot, deadline);
                }
            } catch (RunCancelledException e) {
                log.warn("Run cancelled during {}: {}", action.wireName(), e.getMessage());
                reportFailure(state, e.getMessage());
            } catch (RuntimeException e) {
                // A bug here must still end the run with a structured outcome.
                log.error("Unexpected error while running {}: {}", action.wireName(), e.getMessage(), e);
                reportFailure(state, "internal error during " + action.wireName() + ": " + describe(e));
            }
        }
    }

    // ------------------------------------------------------------------
    // Per-action steps
    // ------------------------------------------------------------------

    private void runAnalysis(PipelineState state, RepoSnapshot snapshot, Deadline deadline) {
        AnalysisRequest request = new AnalysisRequest(snapshot, state.originalInstructions());
        try {
            AnalysisResult result = call(AgentRole.ANALYSIS, () -> analysisAgent.analyze(request), deadline);
            state.putResult(AgentRole.ANALYSIS, result);
            state.advanceTo(PipelineStage.ANALYSIS_COMPLETE);
            log.info("Analysis complete: {} files, {} steps", result.files().size(), result.steps().size());
        } catch (AgentCallException e) {
            log.error("Analysis agent failed: {}", e.getMessage());
            reportFailure(state, e.getMessage());
        }
    }

    /**
     * Run one implementation attempt. Semantic failures and transport errors
     * both end in implementation_failed; a transport error's message is kept
     * verbatim so research can reason about it.
     */
    private void runImplementation(PipelineState state, RepoSnapshot snapshot, Deadline deadline) {
        AnalysisResult analysis = state.result(AgentRole.ANALYSIS, AnalysisResult.class)
                .orElseThrow(() -> new IllegalStateException("implementation requested before analysis"));
        ImplementationRequest request =
                new ImplementationRequest(analysis, snapshot, state.accumulatedInstructions());
        try {
            ImplementationResult result =
                    call(AgentRole.IMPLEMENTATION, () -> implementationAgent.implement(request), deadline);
            state.putResult(AgentRole.IMPLEMENTATION, result);
            state.appendLogs(result.executionLogs());
            if (result.success()) {
                state.advanceTo(PipelineStage.IMPLEMENTATION_COMPLETE);
                log.info("Implementation succeeded: {} files modified (retry {})",
                        result.modifiedFiles().size(), state.retryCount());
            } else {
                String reason = result.errorMessage() == null || result.errorMessage().isBlank()
                        ? "implementation agent reported failure without an error message"
                        : result.errorMessage();
                state.recordError(reason);
                state.advanceTo(PipelineStage.IMPLEMENTATION_FAILED);
                log.warn("Implementation failed (retry {}): {}", state.retryCount(), reason);
            }
        } catch (AgentCallException e) {
            state.recordError(e.getMessage());
            state.advanceTo(PipelineStage.IMPLEMENTATION_FAILED);
            log.warn("Implementation agent call failed (retry {}): {}", state.retryCount(), e.getMessage());
        }
    }

    /**
     * One research cycle: ask for fixes, keep the best-ranked one as a
     * recovery note, and count the retry. When nothing usable comes back the
     * retry still proceeds, with the instructions unchanged.
     */
    private void runResearch(PipelineState state, Deadline deadline) {
        ResearchRequest request = new ResearchRequest(
                state.lastErrorMessage().orElse(""),
                state.executionLogTail(researchLogTail),
                state.originalInstructions());
        ResearchResult result;
        try {
            result = call(AgentRole.RESEARCH, () -> researchAgent.research(request), deadline);
        } catch (AgentCallException e) {
            log.error("Research agent failed: {}", e.getMessage());
            reportFailure(state, e.getMessage());
            return;
        }

        state.putResult(AgentRole.RESEARCH, result);
        int retryIndex = state.retryCount() + 1;
        Optional<Solution> best = result.bestRecommendation();
        if (best.isPresent()) {
            state.addRecoveryNote(new RecoveryNote(retryIndex, best.get().description(), best.get().codeSnippet()));
            log.info("Research cycle {} added a recovery note (rank {})", retryIndex, best.get().rank());
        } else {
            log.warn("Research cycle {} found no usable recommendation; retrying with unchanged instructions",
                    retryIndex);
        }
        state.incrementRetryCount();
        state.advanceTo(PipelineStage.IMPLEMENTATION_RETRY);
    }

    private void runDiff(PipelineState state, RepoSnapshot snapshot, Deadline deadline) {
        ImplementationResult implementation = state.result(AgentRole.IMPLEMENTATION, ImplementationResult.class)
                .orElseThrow(() -> new IllegalStateException("diff requested before implementation"));
        DiffRequest request = new DiffRequest(snapshot.files(), applyModifications(snapshot, implementation));
        try {
            DiffResult result = call(AgentRole.DIFF, () -> diffAgent.diff(request), deadline);
            state.putResult(AgentRole.DIFF, result);
            state.advanceTo(PipelineStage.DIFF_COMPLETE);
            log.info("Diff complete: {}", result.summary());
        } catch (AgentCallException e) {
            log.error("Diff agent failed: {}", e.getMessage());
            reportFailure(state, e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Invoke one agent on the call executor and wait for it, at most until the
     * deadline. Every call is timed and counted:
     * <pre>
     *   repofactor.agent.calls{agent, status="success|failure|error|malformed|cancelled"}
     *   repofactor.agent.duration{agent}
     * </pre>
     */
    private <T> T call(AgentRole role, Callable<T> agentCall, Deadline deadline) {
        if (Thread.currentThread().isInterrupted()) {
            throw new RunCancelledException("interrupted before " + role.key() + " agent call");
        }
        if (deadline.isExpired()) {
            throw new RunCancelledException("deadline exceeded before " + role.key() + " agent call");
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "error";
        Future<T> future = agentCalls.submit(withMdc(agentCall));
        try {
            Optional<Duration> remaining = deadline.remaining();
            T result = remaining.isPresent()
                    ? future.get(remaining.get().toMillis(), TimeUnit.MILLISECONDS)
                    : future.get();
            if (result == null) {
                status = "malformed";
                throw new MalformedResponseException(role, role.key() + " agent returned no result");
            }
            status = result instanceof ImplementationResult r && !r.success() ? "failure" : "success";
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            status = "cancelled";
            throw new RunCancelledException("deadline exceeded during " + role.key() + " agent call");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            status = "cancelled";
            throw new RunCancelledException("interrupted during " + role.key() + " agent call");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof MalformedResponseException malformed) {
                status = "malformed";
                throw malformed;
            }
            if (cause instanceof AgentCallException callError) {
                throw callError;
            }
            throw new AgentCallException(role, describe(cause), cause);
        } finally {
            sample.stop(meterRegistry.timer("repofactor.agent.duration", "agent", role.key()));
            meterRegistry.counter("repofactor.agent.calls", "agent", role.key(), "status", status).increment();
        }
    }

    /** Carry the run's MDC (runId, action) onto the agent-call thread. */
    private static <T> Callable<T> withMdc(Callable<T> agentCall) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            if (context != null) MDC.setContextMap(context);
            try {
                return agentCall.call();
            } finally {
                MDC.clear();
            }
        };
    }

    private static void reportFailure(PipelineState state, String message) {
        state.recordError(message);
        state.advanceTo(PipelineStage.REPORT_FAILURE);
    }

    /**
     * Overlay the implementation's output on the snapshot. A modified file
     * with null content is a deletion.
     */
    private static Map<String, String> applyModifications(RepoSnapshot snapshot, ImplementationResult result) {
        Map<String, String> modified = new TreeMap<>(snapshot.files());
        for (ModifiedFile file : result.modifiedFiles()) {
            if (file.modifiedContent() == null) {
                modified.remove(file.path());
            } else {
                modified.put(file.path(), file.modifiedContent());
            }
        }
        return modified;
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private static ThreadFactory agentCallThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "agent-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
