package com.repofactor.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repofactor.orchestrator.model.PipelineRun;
import com.repofactor.orchestrator.model.PipelineSnapshot;
import com.repofactor.orchestrator.model.RunStatus;
import com.repofactor.orchestrator.pipeline.PipelineOutcome;
import com.repofactor.orchestrator.repository.PipelineRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Lifecycle of submitted runs: submission, claiming, and recording the
 * final pipeline state.
 *
 * The pipeline itself runs outside any transaction (it can take minutes);
 * only the short bookkeeping methods here are @Transactional.
 */
@Service
public class PipelineService {

    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    private static final TypeReference<Map<String, Object>> STATE_TYPE = new TypeReference<>() {};

    private final PipelineRunRepository runRepo;
    private final ObjectMapper          objectMapper;

    public PipelineService(PipelineRunRepository runRepo, ObjectMapper objectMapper) {
        this.runRepo      = runRepo;
        this.objectMapper = objectMapper;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Store a new run as PENDING; the scheduler picks it up on its next tick.
     *
     * @throws IllegalArgumentException if instructions are blank
     */
    @Transactional
    public PipelineRun submit(String repoName, String instructions, Map<String, String> files) {
        if (instructions == null || instructions.isBlank()) {
            throw new IllegalArgumentException("instructions must not be blank");
        }
        String name = repoName == null || repoName.isBlank() ? "unnamed" : repoName;
        PipelineRun run = runRepo.save(new PipelineRun(name, instructions, toJson(files == null ? Map.of() : files)));
        log.info("Run {} submitted for repo '{}' ({} files)", run.getId(), name, files == null ? 0 : files.size());
        return run;
    }

    public Optional<PipelineRun> findById(UUID id) {
        return runRepo.findById(id);
    }

    // ------------------------------------------------------------------
    // Claiming (called by the scheduler in a background thread)
    // ------------------------------------------------------------------

    /**
     * Claim the oldest PENDING run for execution.
     *
     * The lock taken by the repository query is held until this method's
     * transaction commits, by which time the run is RUNNING.
     */
    @Transactional
    public Optional<PipelineRun> claimNextRun(String workerId) {
        Optional<PipelineRun> opt = runRepo.claimNextPendingRun();
        opt.ifPresent(run -> {
            run.setStatus(RunStatus.RUNNING);
            run.setWorkerId(workerId);
            run.setStartedAt(Instant.now());
            runRepo.save(run);
            log.info("Worker '{}' claimed run {}", workerId, run.getId());
        });
        return opt;
    }

    // ------------------------------------------------------------------
    // Completion
    // ------------------------------------------------------------------

    /**
     * Record the pipeline's terminal outcome on the run row: flat columns for
     * querying plus the whole state as JSON for audit.
     */
    @Transactional
    public void complete(PipelineRun run, PipelineOutcome outcome) {
        PipelineSnapshot snapshot = outcome.finalState().snapshot();
        run.setStatus(outcome.succeeded() ? RunStatus.SUCCEEDED : RunStatus.FAILED);
        run.setStage(snapshot.currentStage());
        run.setRetryCount(snapshot.retryCount());
        run.setLastErrorMessage(snapshot.lastErrorMessage());
        run.setStateJson(toJson(snapshot));
        run.setFinishedAt(Instant.now());
        run.setWorkerId(null);
        runRepo.save(run);
        if (outcome.succeeded()) {
            log.info("Run {} SUCCEEDED (retries={})", run.getId(), snapshot.retryCount());
        } else {
            log.error("Run {} FAILED at stage {} (retries={}): {}",
                    run.getId(), snapshot.currentStage(), snapshot.retryCount(), snapshot.lastErrorMessage());
        }
    }

    /**
     * Mark a run FAILED without a pipeline outcome (e.g. the stored snapshot
     * could not be read, or the runner crashed).
     */
    @Transactional
    public void failRun(PipelineRun run, String reason) {
        run.setStatus(RunStatus.FAILED);
        run.setLastErrorMessage(reason);
        run.setFinishedAt(Instant.now());
        run.setWorkerId(null);
        runRepo.save(run);
        log.error("Run {} FAILED: {}", run.getId(), reason);
    }

    // ------------------------------------------------------------------
    // Recovery (called by the scheduler)
    // ------------------------------------------------------------------

    /**
     * Fail RUNNING runs that started longer ago than {@code staleAfter}.
     *
     * A run that outlives its own deadline by that much lost its worker
     * (crash or redeploy). It is failed rather than requeued: the agent
     * calls it already made are not repeatable for free.
     *
     * @return the number of runs failed
     */
    @Transactional
    public int recoverStalledRuns(Duration staleAfter) {
        Instant cutoff = Instant.now().minus(staleAfter);
        List<PipelineRun> stalled = runRepo.findByStatusAndStartedAtBefore(RunStatus.RUNNING, cutoff);
        for (PipelineRun run : stalled) {
            log.warn("Run {} stalled on worker '{}' (started {}), marking FAILED",
                    run.getId(), run.getWorkerId(), run.getStartedAt());
            failRun(run, "stalled: no result within " + staleAfter + " of start");
        }
        return stalled.size();
    }

    /**
     * The persisted final state of a finished run as a JSON map.
     * Empty while the run has not finished or if it ended without a state.
     */
    @Transactional(readOnly = true)
    public Optional<Map<String, Object>> finalState(UUID id) {
        return runRepo.findById(id)
                .map(PipelineRun::getStateJson)
                .map(this::parseState);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Map<String, Object> parseState(String stateJson) {
        try {
            return objectMapper.readValue(stateJson, STATE_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored pipeline state is not valid JSON", e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }
}
