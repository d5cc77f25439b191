package com.conveyor.engine.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Persisted history of one pipeline run started through the service.
 *
 * The engine itself works on {@link PipelineRun}; this entity is what the
 * REST API reads back afterwards.
 *
 * DB table: pipeline_runs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "pipeline_runs")
public class RunRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "pipeline_name", nullable = false)
    private String pipelineName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunState state = RunState.QUEUED;

    // Raw caller parameters as a JSON object of strings.
    @Column(name = "parameters_json", columnDefinition = "TEXT", nullable = false)
    private String parametersJson;

    @Column(name = "worker_id")
    private String workerId;

    // Configuration error, or the first failing stage's message.
    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @OneToMany(mappedBy = "run", cascade = CascadeType.ALL, fetch = FetchType.LAZY)
    @OrderBy("position ASC")
    private List<StageRecord> stages = new ArrayList<>();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected RunRecord() {}   // required by JPA

    public RunRecord(String pipelineName, String parametersJson) {
        this.pipelineName   = pipelineName;
        this.parametersJson = parametersJson;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID              getId()             { return id; }
    public String            getPipelineName()   { return pipelineName; }
    public RunState          getState()          { return state; }
    public String            getParametersJson() { return parametersJson; }
    public String            getWorkerId()       { return workerId; }
    public String            getErrorMessage()   { return errorMessage; }
    public Instant           getCreatedAt()      { return createdAt; }
    public Instant           getStartedAt()      { return startedAt; }
    public Instant           getFinishedAt()     { return finishedAt; }
    public Instant           getUpdatedAt()      { return updatedAt; }
    public List<StageRecord> getStages()         { return stages; }

    public void setState(RunState state)           { this.state = state; }
    public void setWorkerId(String workerId)       { this.workerId = workerId; }
    public void setErrorMessage(String message)    { this.errorMessage = message; }
    public void setStartedAt(Instant t)            { this.startedAt = t; }
    public void setFinishedAt(Instant t)           { this.finishedAt = t; }

    public void addStage(StageRecord stage) {
        stages.add(stage);
    }
}
