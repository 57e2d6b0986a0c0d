package com.repofactor.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repofactor.orchestrator.model.PipelineRun;
import com.repofactor.orchestrator.model.RepoSnapshot;
import com.repofactor.orchestrator.pipeline.Deadline;
import com.repofactor.orchestrator.pipeline.PipelineDriver;
import com.repofactor.orchestrator.pipeline.PipelineOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

/**
 * Executes one claimed run: rebuilds the repository snapshot from the row,
 * drives the pipeline with the configured deadline, and hands the outcome
 * to {@link PipelineService} for recording.
 */
@Component
public class PipelineRunner {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    private static final TypeReference<Map<String, String>> FILES_TYPE = new TypeReference<>() {};

    private final PipelineDriver  driver;
    private final PipelineService pipelineService;
    private final ObjectMapper    objectMapper;
    private final Duration        runTimeout;

    public PipelineRunner(PipelineDriver driver,
                          PipelineService pipelineService,
                          ObjectMapper objectMapper,
                          @Value("${repofactor.pipeline.run-timeout:PT30M}") Duration runTimeout) {
        this.driver          = driver;
        this.pipelineService = pipelineService;
        this.objectMapper    = objectMapper;
        this.runTimeout      = runTimeout;
    }

    public void run(PipelineRun run) {
        // Every log line of this run, including the agent-call threads, carries the run id.
        MDC.put("runId", run.getId().toString());
        try {
            Map<String, String> files;
            try {
                files = objectMapper.readValue(run.getFilesJson(), FILES_TYPE);
            } catch (JsonProcessingException e) {
                pipelineService.failRun(run, "Stored repository snapshot is not valid JSON: " + e.getOriginalMessage());
                return;
            }

            log.info("Starting run {} (timeout {})", run.getId(), runTimeout);
            PipelineOutcome outcome = driver.run(
                    new RepoSnapshot(run.getRepoName(), files),
                    run.getInstructions(),
                    Deadline.after(runTimeout));
            pipelineService.complete(run, outcome);
        } finally {
            MDC.clear();
        }
    }
}
