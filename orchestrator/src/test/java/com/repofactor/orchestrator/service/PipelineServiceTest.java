package com.repofactor.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.repofactor.orchestrator.model.NextAction;
import com.repofactor.orchestrator.model.PipelineRun;
import com.repofactor.orchestrator.model.PipelineStage;
import com.repofactor.orchestrator.model.PipelineState;
import com.repofactor.orchestrator.model.RecoveryNote;
import com.repofactor.orchestrator.model.RunStatus;
import com.repofactor.orchestrator.pipeline.PipelineOutcome;
import com.repofactor.orchestrator.repository.PipelineRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PipelineService.
 *
 * The repository is mocked with Mockito; JSON goes through a real
 * ObjectMapper. No Spring context, no database.
 */
@ExtendWith(MockitoExtension.class)
class PipelineServiceTest {

    @Mock PipelineRunRepository runRepo;

    PipelineService service;

    @BeforeEach
    void setUp() {
        service = new PipelineService(runRepo, new ObjectMapper());
    }

    // ------------------------------------------------------------------
    // submit()
    // ------------------------------------------------------------------

    @Test
    void submit_storesPendingRunWithFilesAsJson() {
        when(runRepo.save(any())).thenAnswer(inv -> withId(inv.getArgument(0)));

        PipelineRun run = service.submit("shop", "add discounts", Map.of("cart.py", "x = 1\n"));

        assertThat(run.getId()).isNotNull();
        assertThat(run.getStatus()).isEqualTo(RunStatus.PENDING);
        assertThat(run.getStage()).isEqualTo("start");
        assertThat(run.getRetryCount()).isZero();
        assertThat(run.getFilesJson()).isEqualTo("{\"cart.py\":\"x = 1\\n\"}");
    }

    @Test
    void submit_missingRepoNameAndFiles_useDefaults() {
        when(runRepo.save(any())).thenAnswer(inv -> withId(inv.getArgument(0)));

        PipelineRun run = service.submit(null, "add discounts", null);

        assertThat(run.getRepoName()).isEqualTo("unnamed");
        assertThat(run.getFilesJson()).isEqualTo("{}");
    }

    @Test
    void submit_blankInstructions_rejected() {
        assertThatThrownBy(() -> service.submit("shop", "  ", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        verify(runRepo, never()).save(any());
    }

    // ------------------------------------------------------------------
    // claimNextRun()
    // ------------------------------------------------------------------

    @Test
    void claimNextRun_nothingPending_returnsEmpty() {
        when(runRepo.claimNextPendingRun()).thenReturn(Optional.empty());

        assertThat(service.claimNextRun("worker-1")).isEmpty();
        verify(runRepo, never()).save(any());
    }

    @Test
    void claimNextRun_marksRunRunning() {
        PipelineRun pending = withId(new PipelineRun("shop", "x", "{}"));
        when(runRepo.claimNextPendingRun()).thenReturn(Optional.of(pending));

        Optional<PipelineRun> claimed = service.claimNextRun("worker-1");

        assertThat(claimed).contains(pending);
        assertThat(pending.getStatus()).isEqualTo(RunStatus.RUNNING);
        assertThat(pending.getWorkerId()).isEqualTo("worker-1");
        assertThat(pending.getStartedAt()).isNotNull();
        verify(runRepo).save(pending);
    }

    // ------------------------------------------------------------------
    // complete() / failRun()
    // ------------------------------------------------------------------

    @Test
    void complete_done_marksSucceededAndStoresState() {
        PipelineRun run = withId(new PipelineRun("shop", "add discounts", "{}"));
        PipelineState state = new PipelineState("add discounts");
        state.advanceTo(PipelineStage.DONE);

        service.complete(run, new PipelineOutcome(NextAction.DONE, state));

        assertThat(run.getStatus()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(run.getStage()).isEqualTo("done");
        assertThat(run.getFinishedAt()).isNotNull();
        assertThat(run.getStateJson()).contains("\"currentStage\":\"done\"");
        verify(runRepo).save(run);
    }

    @Test
    void complete_reportFailure_marksFailedWithLastErrorAndRetries() {
        PipelineRun run = withId(new PipelineRun("shop", "add discounts", "{}"));
        PipelineState state = new PipelineState("add discounts");
        state.addRecoveryNote(new RecoveryNote(1, "pin version", null));
        state.incrementRetryCount();
        state.incrementRetryCount();
        state.incrementRetryCount();
        state.recordError("tests failed");
        state.advanceTo(PipelineStage.REPORT_FAILURE);

        service.complete(run, new PipelineOutcome(NextAction.REPORT_FAILURE, state));

        ArgumentCaptor<PipelineRun> captor = ArgumentCaptor.forClass(PipelineRun.class);
        verify(runRepo).save(captor.capture());
        PipelineRun saved = captor.getValue();
        assertThat(saved.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(saved.getStage()).isEqualTo("report_failure");
        assertThat(saved.getRetryCount()).isEqualTo(3);
        assertThat(saved.getLastErrorMessage()).isEqualTo("tests failed");
        assertThat(saved.getStateJson()).contains("pin version");
    }

    @Test
    void failRun_recordsReason() {
        PipelineRun run = withId(new PipelineRun("shop", "x", "{}"));
        run.setStatus(RunStatus.RUNNING);
        run.setWorkerId("worker-1");

        service.failRun(run, "Unhandled exception: boom");

        assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(run.getLastErrorMessage()).isEqualTo("Unhandled exception: boom");
        assertThat(run.getWorkerId()).isNull();
        verify(runRepo).save(run);
    }

    // ------------------------------------------------------------------
    // recoverStalledRuns()
    // ------------------------------------------------------------------

    @Test
    void recoverStalledRuns_failsRunningRunsOlderThanCutoff() {
        PipelineRun stalled = withId(new PipelineRun("shop", "x", "{}"));
        stalled.setStatus(RunStatus.RUNNING);
        stalled.setWorkerId("worker-dead");
        stalled.setStartedAt(Instant.now().minus(Duration.ofHours(2)));
        when(runRepo.findByStatusAndStartedAtBefore(eq(RunStatus.RUNNING), any())).thenReturn(List.of(stalled));

        Instant before = Instant.now();
        int failed = service.recoverStalledRuns(Duration.ofMinutes(35));

        assertThat(failed).isEqualTo(1);
        assertThat(stalled.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(stalled.getLastErrorMessage()).startsWith("stalled: ");
        assertThat(stalled.getWorkerId()).isNull();
        assertThat(stalled.getFinishedAt()).isNotNull();
        verify(runRepo).save(stalled);

        ArgumentCaptor<Instant> cutoff = ArgumentCaptor.forClass(Instant.class);
        verify(runRepo).findByStatusAndStartedAtBefore(eq(RunStatus.RUNNING), cutoff.capture());
        assertThat(cutoff.getValue())
                .isBeforeOrEqualTo(before.minus(Duration.ofMinutes(35)).plusSeconds(5))
                .isAfterOrEqualTo(before.minus(Duration.ofMinutes(35)).minusSeconds(5));
    }

    @Test
    void recoverStalledRuns_nothingStalled_savesNothing() {
        when(runRepo.findByStatusAndStartedAtBefore(eq(RunStatus.RUNNING), any())).thenReturn(List.of());

        assertThat(service.recoverStalledRuns(Duration.ofMinutes(35))).isZero();
        verify(runRepo, never()).save(any());
    }

    // ------------------------------------------------------------------
    // finalState()
    // ------------------------------------------------------------------

    @Test
    void finalState_parsesStoredJson() {
        PipelineRun run = withId(new PipelineRun("shop", "x", "{}"));
        run.setStateJson("{\"currentStage\":\"done\",\"retryCount\":0,\"executionLogs\":[]}");
        when(runRepo.findById(run.getId())).thenReturn(Optional.of(run));

        Optional<Map<String, Object>> state = service.finalState(run.getId());

        assertThat(state).isPresent();
        assertThat(state.get()).containsEntry("currentStage", "done").containsEntry("retryCount", 0);
        assertThat(state.get().get("executionLogs")).isEqualTo(List.of());
    }

    @Test
    void finalState_unfinishedRun_isEmpty() {
        PipelineRun run = withId(new PipelineRun("shop", "x", "{}"));
        when(runRepo.findById(run.getId())).thenReturn(Optional.of(run));

        assertThat(service.finalState(run.getId())).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static PipelineRun withId(PipelineRun run) {
        try {
            var f = PipelineRun.class.getDeclaredField("id");
            f.setAccessible(true);
            f.set(run, UUID.randomUUID());
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return run;
    }
}
