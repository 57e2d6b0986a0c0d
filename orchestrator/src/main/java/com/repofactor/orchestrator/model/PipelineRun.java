package com.repofactor.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One submitted integration run.
 *
 * Holds the run's input (repo name, instructions, snapshot as JSON) and,
 * once finished, the final pipeline state as an audit record.
 *
 * DB table: pipeline_runs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "pipeline_runs")
public class PipelineRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "repo_name", nullable = false)
    private String repoName;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String instructions;

    // RepoSnapshot.files serialised as a JSON object {path: content}.
    @Column(name = "files_json", nullable = false, columnDefinition = "TEXT")
    private String filesJson;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunStatus status = RunStatus.PENDING;

    // Flat copies of the final state for querying; stage uses the wire name.
    @Column(name = "stage", nullable = false)
    private String stage = PipelineStage.START.wireName();

    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Column(name = "last_error_message", columnDefinition = "TEXT")
    private String lastErrorMessage;

    // Full PipelineSnapshot as JSON, written when the run finishes.
    @Column(name = "state_json", columnDefinition = "TEXT")
    private String stateJson;

    @Column(name = "worker_id")
    private String workerId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected PipelineRun() {}   // required by JPA

    public PipelineRun(String repoName, String instructions, String filesJson) {
        this.repoName     = repoName;
        this.instructions = instructions;
        this.filesJson    = filesJson;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID      getId()               { return id; }
    public String    getRepoName()         { return repoName; }
    public String    getInstructions()     { return instructions; }
    public String    getFilesJson()        { return filesJson; }
    public RunStatus getStatus()           { return status; }
    public String    getStage()            { return stage; }
    public int       getRetryCount()       { return retryCount; }
    public String    getLastErrorMessage() { return lastErrorMessage; }
    public String    getStateJson()        { return stateJson; }
    public String    getWorkerId()         { return workerId; }
    public Instant   getCreatedAt()        { return createdAt; }
    public Instant   getStartedAt()        { return startedAt; }
    public Instant   getFinishedAt()       { return finishedAt; }
    public Instant   getUpdatedAt()        { return updatedAt; }

    public void setStatus(RunStatus status)          { this.status = status; }
    public void setStage(String stage)               { this.stage = stage; }
    public void setRetryCount(int retryCount)        { this.retryCount = retryCount; }
    public void setLastErrorMessage(String v)        { this.lastErrorMessage = v; }
    public void setStateJson(String stateJson)       { this.stateJson = stateJson; }
    public void setWorkerId(String workerId)         { this.workerId = workerId; }
    public void setStartedAt(Instant t)              { this.startedAt = t; }
    public void setFinishedAt(Instant t)             { this.finishedAt = t; }
}
