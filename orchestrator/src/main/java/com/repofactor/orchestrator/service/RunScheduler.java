package com.repofactor.orchestrator.service;

import com.repofactor.orchestrator.model.PipelineRun;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Background scheduler that feeds PENDING runs to a fixed worker pool.
 *
 * The database is the queue: claiming is a SELECT ... FOR UPDATE SKIP LOCKED,
 * so no broker is needed and several instances can poll the same table.
 * Each worker executes one run at a time; within a run, agent calls are
 * strictly sequential.
 */
@Component
@EnableScheduling
public class RunScheduler {

    private static final Logger log = LoggerFactory.getLogger(RunScheduler.class);

    private final ExecutorService workers;

    /** Slack on top of the run timeout before a RUNNING run counts as stalled. */
    static final Duration STALL_GRACE = Duration.ofMinutes(5);

    private final PipelineService pipelineService;
    private final PipelineRunner  runner;
    private final Duration        runTimeout;

    public RunScheduler(PipelineService pipelineService,
                        PipelineRunner runner,
                        @Value("${repofactor.scheduler.workers:2}") int workerCount,
                        @Value("${repofactor.pipeline.run-timeout:PT30M}") Duration runTimeout) {
        this.pipelineService = pipelineService;
        this.runner          = runner;
        this.runTimeout      = runTimeout;
        this.workers         = Executors.newFixedThreadPool(workerCount);
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }

    /**
     * Tick: claim one PENDING run (if any) and dispatch it to a worker.
     *
     * fixedDelay waits 2 s after the previous tick finishes, so an idle
     * service does not hammer the database.
     */
    @Scheduled(fixedDelayString = "${repofactor.scheduler.poll-delay-ms:2000}")
    public void tick() {
        String workerId = "worker-" + UUID.randomUUID().toString().substring(0, 8);

        Optional<PipelineRun> claimed = pipelineService.claimNextRun(workerId);
        claimed.ifPresent(run ->
                workers.submit(() -> {
                    try {
                        runner.run(run);
                    } catch (Exception e) {
                        log.error("Unhandled error while executing run {}: {}",
                                run.getId(), e.getMessage(), e);
                        pipelineService.failRun(run, "Unhandled exception: " + e.getMessage());
                    }
                })
        );
    }

    /**
     * Fail runs left RUNNING by a worker that died. A live worker always
     * finishes within the run timeout, so anything older is orphaned.
     */
    @Scheduled(fixedDelayString = "${repofactor.scheduler.stall-check-ms:60000}")
    public void recoverStalledRuns() {
        int failed = pipelineService.recoverStalledRuns(runTimeout.plus(STALL_GRACE));
        if (failed > 0) {
            log.warn("Marked {} stalled run(s) FAILED", failed);
        }
    }
}
