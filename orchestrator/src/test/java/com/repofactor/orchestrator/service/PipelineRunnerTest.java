package com.repofactor.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.repofactor.orchestrator.model.NextAction;
import com.repofactor.orchestrator.model.PipelineRun;
import com.repofactor.orchestrator.model.PipelineState;
import com.repofactor.orchestrator.model.RepoSnapshot;
import com.repofactor.orchestrator.pipeline.Deadline;
import com.repofactor.orchestrator.pipeline.PipelineDriver;
import com.repofactor.orchestrator.pipeline.PipelineOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PipelineRunnerTest {

    @Mock PipelineDriver  driver;
    @Mock PipelineService pipelineService;

    PipelineRunner runner;

    @BeforeEach
    void setUp() {
        runner = new PipelineRunner(driver, pipelineService, new ObjectMapper(), Duration.ofMinutes(5));
    }

    @Test
    void run_drivesPipelineAndRecordsOutcome() {
        PipelineRun run = PipelineServiceTest.withId(
                new PipelineRun("shop", "add discounts", "{\"cart.py\":\"x = 1\\n\"}"));
        PipelineOutcome outcome = new PipelineOutcome(NextAction.DONE, new PipelineState("add discounts"));
        when(driver.run(any(), anyString(), any())).thenReturn(outcome);

        runner.run(run);

        ArgumentCaptor<RepoSnapshot> snapshot = ArgumentCaptor.forClass(RepoSnapshot.class);
        ArgumentCaptor<Deadline> deadline = ArgumentCaptor.forClass(Deadline.class);
        verify(driver).run(snapshot.capture(), eq("add discounts"), deadline.capture());
        assertThat(snapshot.getValue().repoName()).isEqualTo("shop");
        assertThat(snapshot.getValue().files()).containsEntry("cart.py", "x = 1\n");
        assertThat(deadline.getValue().remaining()).isPresent();
        verify(pipelineService).complete(run, outcome);
        assertThat(MDC.get("runId")).isNull();
    }

    @Test
    void run_corruptSnapshot_failsRunWithoutDriving() {
        PipelineRun run = PipelineServiceTest.withId(new PipelineRun("shop", "x", "not json"));

        runner.run(run);

        verify(pipelineService).failRun(eq(run), contains("not valid JSON"));
        verifyNoInteractions(driver);
        verify(pipelineService, never()).complete(any(), any());
    }
}
