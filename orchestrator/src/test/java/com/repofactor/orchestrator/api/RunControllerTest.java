package com.repofactor.orchestrator.api;

import com.repofactor.orchestrator.model.PipelineRun;
import com.repofactor.orchestrator.model.RunStatus;
import com.repofactor.orchestrator.service.PipelineService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for RunController.
 *
 * @WebMvcTest starts only the web layer (no DB, no scheduler, no Claude);
 * PipelineService is a mock.
 */
@WebMvcTest(RunController.class)
class RunControllerTest {

    @Autowired MockMvc          mockMvc;
    @MockitoBean PipelineService pipelineService;

    // ------------------------------------------------------------------
    // POST /runs
    // ------------------------------------------------------------------

    @Test
    void submitRun_validRequest_returns201Pending() throws Exception {
        PipelineRun run = fakeRun(RunStatus.PENDING);
        when(pipelineService.submit(eq("shop"), eq("add discounts"), anyMap())).thenReturn(run);

        mockMvc.perform(post("/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"repoName":"shop","instructions":"add discounts","files":{"cart.py":"x = 1"}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(run.getId().toString()))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.stage").value("start"));
    }

    @Test
    void submitRun_blankInstructions_returns400() throws Exception {
        when(pipelineService.submit(any(), any(), any()))
                .thenThrow(new IllegalArgumentException("instructions must not be blank"));

        mockMvc.perform(post("/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"repoName":"shop","instructions":""}
                                """))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // GET /runs/{id}
    // ------------------------------------------------------------------

    @Test
    void getRun_existingId_returns200() throws Exception {
        PipelineRun run = fakeRun(RunStatus.FAILED);
        run.setStage("report_failure");
        run.setRetryCount(3);
        run.setLastErrorMessage("tests failed");
        when(pipelineService.findById(run.getId())).thenReturn(Optional.of(run));

        mockMvc.perform(get("/runs/{id}", run.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FAILED"))
                .andExpect(jsonPath("$.stage").value("report_failure"))
                .andExpect(jsonPath("$.retryCount").value(3))
                .andExpect(jsonPath("$.lastErrorMessage").value("tests failed"));
    }

    @Test
    void getRun_unknownId_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(pipelineService.findById(unknown)).thenReturn(Optional.empty());

        mockMvc.perform(get("/runs/{id}", unknown))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // GET /runs/{id}/state
    // ------------------------------------------------------------------

    @Test
    void getState_runningRun_returns202() throws Exception {
        PipelineRun run = fakeRun(RunStatus.RUNNING);
        when(pipelineService.findById(run.getId())).thenReturn(Optional.of(run));

        mockMvc.perform(get("/runs/{id}/state", run.getId()))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("RUNNING"));
        verify(pipelineService, never()).finalState(any());
    }

    @Test
    void getState_finishedRun_returns200WithState() throws Exception {
        PipelineRun run = fakeRun(RunStatus.SUCCEEDED);
        when(pipelineService.findById(run.getId())).thenReturn(Optional.of(run));
        when(pipelineService.finalState(run.getId()))
                .thenReturn(Optional.of(Map.of("currentStage", "done", "retryCount", 1)));

        mockMvc.perform(get("/runs/{id}/state", run.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentStage").value("done"))
                .andExpect(jsonPath("$.retryCount").value(1));
    }

    @Test
    void getState_finishedWithoutStateOrError_omitsErrorKey() throws Exception {
        PipelineRun run = fakeRun(RunStatus.FAILED);
        when(pipelineService.findById(run.getId())).thenReturn(Optional.of(run));
        when(pipelineService.finalState(run.getId())).thenReturn(Optional.empty());

        mockMvc.perform(get("/runs/{id}/state", run.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FAILED"))
                .andExpect(jsonPath("$.lastErrorMessage").doesNotExist());
    }

    @Test
    void getState_finishedWithoutState_reportsStoredError() throws Exception {
        PipelineRun run = fakeRun(RunStatus.FAILED);
        run.setLastErrorMessage("Stored repository snapshot is not valid JSON");
        when(pipelineService.findById(run.getId())).thenReturn(Optional.of(run));
        when(pipelineService.finalState(run.getId())).thenReturn(Optional.empty());

        mockMvc.perform(get("/runs/{id}/state", run.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lastErrorMessage").value("Stored repository snapshot is not valid JSON"));
    }

    @Test
    void getState_unknownId_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(pipelineService.findById(unknown)).thenReturn(Optional.empty());

        mockMvc.perform(get("/runs/{id}/state", unknown))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // POST /runs/decide
    // ------------------------------------------------------------------

    @Test
    void decide_returnsNextAction() throws Exception {
        mockMvc.perform(post("/runs/decide")
                        .param("stage", "implementation_failed")
                        .param("retryCount", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stage").value("implementation_failed"))
                .andExpect(jsonPath("$.retryCount").value(3))
                .andExpect(jsonPath("$.action").value("report_failure"));
    }

    @Test
    void decide_unknownStage_returnsReportFailure() throws Exception {
        mockMvc.perform(post("/runs/decide").param("stage", "bogus_stage"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("report_failure"));
    }

    @Test
    void decide_negativeRetryCount_returns400() throws Exception {
        mockMvc.perform(post("/runs/decide")
                        .param("stage", "start")
                        .param("retryCount", "-1"))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private PipelineRun fakeRun(RunStatus status) {
        PipelineRun run = new PipelineRun("shop", "add discounts", "{}");
        run.setStatus(status);
        try {
            var f = run.getClass().getDeclaredField("id");
            f.setAccessible(true);
            f.set(run, UUID.randomUUID());
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return run;
    }
}
