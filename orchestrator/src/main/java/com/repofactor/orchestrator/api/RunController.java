package com.repofactor.orchestrator.api;

import com.repofactor.orchestrator.api.dto.DecisionResponse;
import com.repofactor.orchestrator.api.dto.RunResponse;
import com.repofactor.orchestrator.api.dto.SubmitRunRequest;
import com.repofactor.orchestrator.model.NextAction;
import com.repofactor.orchestrator.model.PipelineRun;
import com.repofactor.orchestrator.pipeline.DecisionFunction;
import com.repofactor.orchestrator.service.PipelineService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for integration runs.
 *
 * POST /runs               submit a repository snapshot and instructions
 * GET  /runs/{id}          poll the current status of a run
 * GET  /runs/{id}/state    the persisted pipeline state of a finished run
 * POST /runs/decide        ask the decision function what would run next
 */
@RestController
@RequestMapping("/runs")
public class RunController {

    private final PipelineService pipelineService;

    public RunController(PipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    /**
     * Submit a new run.
     *
     * Example:
     *   curl -X POST http://localhost:8080/runs \
     *     -H "Content-Type: application/json" \
     *     -d '{"repoName":"demo","instructions":"Add input validation","files":{"app.py":"..."}}'
     */
    @PostMapping
    public ResponseEntity<RunResponse> submit(@RequestBody SubmitRunRequest req) {
        try {
            PipelineRun run = pipelineService.submit(req.repoName(), req.instructions(), req.files());
            return ResponseEntity.status(HttpStatus.CREATED).body(RunResponse.from(run));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    @GetMapping("/{id}")
    public RunResponse getRun(@PathVariable UUID id) {
        return RunResponse.from(findOr404(id));
    }

    /**
     * HTTP 200 with the final state once the run has finished,
     * HTTP 202 with the current status while it is still queued or running.
     */
    @GetMapping("/{id}/state")
    public ResponseEntity<Map<String, Object>> getState(@PathVariable UUID id) {
        PipelineRun run = findOr404(id);
        if (!run.getStatus().isFinished()) {
            return ResponseEntity.accepted()
                    .body(Map.of("status", run.getStatus().name(), "stage", run.getStage()));
        }
        return pipelineService.finalState(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.ok(withoutState(run)));
    }

    @PostMapping("/decide")
    public DecisionResponse decide(@RequestParam String stage,
                                   @RequestParam(defaultValue = "0") int retryCount) {
        if (retryCount < 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "retryCount must not be negative");
        }
        NextAction action = DecisionFunction.decide(stage, retryCount);
        return new DecisionResponse(stage, retryCount, action.wireName());
    }

    /** Body for a run that ended without a stored state; no error means no key. */
    private static Map<String, Object> withoutState(PipelineRun run) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", run.getStatus().name());
        if (run.getLastErrorMessage() != null) {
            body.put("lastErrorMessage", run.getLastErrorMessage());
        }
        return body;
    }

    private PipelineRun findOr404(UUID id) {
        return pipelineService.findById(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + id));
    }
}
