package com.conveyor.engine.service;

import com.conveyor.engine.exception.ConfigurationException;
import com.conveyor.engine.model.PipelineRun;
import com.conveyor.engine.model.RunRecord;
import com.conveyor.engine.model.RunState;
import com.conveyor.engine.model.StageRecord;
import com.conveyor.engine.model.StageResult;
import com.conveyor.engine.pipeline.PipelineDefinition;
import com.conveyor.engine.repository.RunRecordRepository;
import com.conveyor.engine.repository.StageRecordRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Queue and history of runs started through the REST API.
 *
 * The database is the queue: {@link #submit} inserts a QUEUED row and the
 * {@link RunScheduler} claims it. All public methods that touch the DB are
 * {@code @Transactional} so a claim and its state change commit together.
 */
@Service
@ConditionalOnProperty(prefix = "conveyor.cli", name = "enabled", havingValue = "false", matchIfMissing = true)
public class RunService {

    private static final Logger log = LoggerFactory.getLogger(RunService.class);

    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

    private final RunRecordRepository   runRepo;
    private final StageRecordRepository stageRepo;
    private final PipelineDefinition    definition;
    private final ObjectMapper          json;

    public RunService(RunRecordRepository runRepo,
                      StageRecordRepository stageRepo,
                      PipelineDefinition definition,
                      ObjectMapper objectMapper) {
        this.runRepo    = runRepo;
        this.stageRepo  = stageRepo;
        this.definition = definition;
        this.json       = objectMapper;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Queue a run. Parameters are validated when the run executes, so a bad
     * value ends as CONFIGURATION_ERROR in the history rather than a 4xx.
     */
    @Transactional
    public RunRecord submit(Map<String, String> parameters) {
        RunRecord run = runRepo.save(new RunRecord(definition.name(), toJson(parameters)));
        log.info("Queued run {} of pipeline '{}'", run.getId(), definition.name());
        return run;
    }

    public Optional<RunRecord> findById(UUID id) {
        return runRepo.findById(id);
    }

    public List<StageRecord> getStages(UUID runId) {
        return stageRepo.findByRunIdOrderByPositionAsc(runId);
    }

    public Map<String, String> parametersOf(RunRecord run) {
        try {
            return json.readValue(run.getParametersJson(), STRING_MAP);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Stored parameters of run " + run.getId() + " are not valid JSON", e);
        }
    }

    public PipelineDefinition definition() {
        return definition;
    }

    // ------------------------------------------------------------------
    // Claiming and completion (called by the scheduler)
    // ------------------------------------------------------------------

    @Transactional
    public Optional<RunRecord> claimNextQueuedRun(String workerId) {
        Optional<RunRecord> opt = runRepo.claimNextQueuedRun();
        opt.ifPresent(run -> {
            run.setState(RunState.RUNNING);
            run.setWorkerId(workerId);
            run.setStartedAt(Instant.now());
            runRepo.save(run);
            log.info("Worker '{}' claimed run {}", workerId, run.getId());
        });
        return opt;
    }

    /** Record the finished run and every stage result. */
    @Transactional
    public void complete(UUID runId, PipelineRun result) {
        RunRecord run = runRepo.findById(runId)
                .orElseThrow(() -> new IllegalStateException("Run " + runId + " vanished"));
        run.setState(RunState.of(result));
        run.setFinishedAt(result.endTime());
        run.setErrorMessage(result.firstFailureMessage().orElse(null));

        List<StageResult> stages = result.stages();
        for (int i = 0; i < stages.size(); i++) {
            StageResult stage = stages.get(i);
            run.addStage(new StageRecord(run, i, stage, toJson(stage.producedOutputs())));
        }
        runRepo.save(run);
        log.info("Run {} recorded as {}", runId, run.getState());
    }

    /** The engine crashed on this run; nothing more specific is known. */
    @Transactional
    public void fail(UUID runId, String message) {
        runRepo.findById(runId).ifPresent(run -> {
            run.setState(RunState.FAILURE);
            run.setFinishedAt(Instant.now());
            run.setErrorMessage(message);
            runRepo.save(run);
            log.warn("Run {} marked FAILURE: {}", runId, message);
        });
    }

    /**
     * Runs are not resumable. Anything still RUNNING when the engine starts
     * was cut off by a crash or restart.
     */
    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void abandonInterruptedRuns() {
        for (RunRecord run : runRepo.findByState(RunState.RUNNING)) {
            run.setState(RunState.FAILURE);
            run.setFinishedAt(Instant.now());
            run.setErrorMessage("Interrupted by engine restart");
            runRepo.save(run);
            log.warn("Run {} was RUNNING at startup; marked FAILURE", run.getId());
        }
    }

    private String toJson(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }
}
