package com.conveyor.engine.model;

import jakarta.persistence.*;
import java.util.UUID;

/**
 * Persisted {@link StageResult} of one run.
 *
 * DB table: stage_results  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "stage_results")
public class StageRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "run_id", nullable = false)
    private RunRecord run;

    // Execution order within the run, starting at 0.
    @Column(nullable = false)
    private int position;

    @Column(name = "stage_id", nullable = false)
    private String stageId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StageStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_policy", nullable = false)
    private FailurePolicy failurePolicy;

    @Column(name = "exit_code")
    private Integer exitCode;

    @Column(name = "duration_ms", nullable = false)
    private long durationMs;

    @Column(nullable = false)
    private int attempts;

    @Column(columnDefinition = "TEXT")
    private String message;

    @Column(name = "outputs_json", columnDefinition = "TEXT")
    private String outputsJson;

    protected StageRecord() {}   // required by JPA

    public StageRecord(RunRecord run, int position, StageResult result, String outputsJson) {
        this.run           = run;
        this.position      = position;
        this.stageId       = result.stageId();
        this.status        = result.status();
        this.failurePolicy = result.failurePolicy();
        this.exitCode      = result.exitCode();
        this.durationMs    = result.durationMs();
        this.attempts      = result.attempts();
        this.message       = result.message();
        this.outputsJson   = outputsJson;
    }

    public UUID          getId()            { return id; }
    public RunRecord     getRun()           { return run; }
    public int           getPosition()      { return position; }
    public String        getStageId()       { return stageId; }
    public StageStatus   getStatus()        { return status; }
    public FailurePolicy getFailurePolicy() { return failurePolicy; }
    public Integer       getExitCode()      { return exitCode; }
    public long          getDurationMs()    { return durationMs; }
    public int           getAttempts()      { return attempts; }
    public String        getMessage()       { return message; }
    public String        getOutputsJson()   { return outputsJson; }
}
