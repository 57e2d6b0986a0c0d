package com.repofactor.orchestrator.repository;

import com.repofactor.orchestrator.model.PipelineRun;
import com.repofactor.orchestrator.model.RunStatus;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + scheduler queries for the pipeline_runs table.
 *
 * Spring Data JPA generates the implementation at startup.
 */
public interface PipelineRunRepository extends JpaRepository<PipelineRun, UUID> {

    /**
     * Claim the oldest PENDING run.
     *
     * PESSIMISTIC_WRITE with lock timeout -2 is rendered by Hibernate as
     * SELECT ... FOR UPDATE SKIP LOCKED, so several workers can poll
     * concurrently without claiming the same run.
     * Must be called inside a @Transactional method that sets status=RUNNING
     * before commit.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("""
            SELECT r FROM PipelineRun r
            WHERE r.status = 'PENDING'
            ORDER BY r.createdAt ASC
            LIMIT 1
            """)
    Optional<PipelineRun> claimNextPendingRun();

    /**
     * Runs in the given status that started before the cutoff.
     * Used with RUNNING to find runs whose worker died mid-pipeline.
     */
    List<PipelineRun> findByStatusAndStartedAtBefore(RunStatus status, Instant cutoff);
}
