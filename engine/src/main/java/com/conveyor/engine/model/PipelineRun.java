package com.conveyor.engine.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A finalized run: every stage's result in execution order plus the derived
 * overall status. Built once, when the run ends (normally or early).
 *
 * @param configurationError set when the run was rejected before any stage ran
 * @param state              snapshot of the pipeline state at the end of the run
 */
public record PipelineRun(
        String              runId,
        String              pipelineName,
        List<StageResult>   stages,
        RunStatus           status,
        Instant             startTime,
        Instant             endTime,
        String              configurationError,
        Map<String, Object> state
) {
    public static final int EXIT_SUCCESS      = 0;
    public static final int EXIT_FAILURE      = 1;
    public static final int EXIT_CONFIG_ERROR = 2;

    public PipelineRun {
        stages = List.copyOf(stages);
        state  = state == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(state));
    }

    public static PipelineRun rejected(String runId, String pipelineName, String error,
                                       Instant startTime, Instant endTime) {
        return new PipelineRun(runId, pipelineName, List.of(), RunStatus.FAILURE,
                startTime, endTime, error, Map.of());
    }

    /** Worst contribution across all stages; SUCCESS for an empty list. */
    public static RunStatus deriveStatus(List<StageResult> results) {
        RunStatus status = RunStatus.SUCCESS;
        for (StageResult r : results) {
            status = status.worse(r.contribution());
        }
        return status;
    }

    public boolean isConfigurationError() {
        return configurationError != null;
    }

    /** True when no stage actually ran (all skipped, or none at all). */
    public boolean allSkipped() {
        return stages.stream().noneMatch(StageResult::executed);
    }

    public Optional<StageResult> result(String stageId) {
        return stages.stream().filter(r -> r.stageId().equals(stageId)).findFirst();
    }

    public long durationMs() {
        return Duration.between(startTime, endTime).toMillis();
    }

    /**
     * Process exit code for CLI use: 0 success, 1 failure, 2 configuration error.
     *
     * @param unstableIsSuccess whether an UNSTABLE run should exit 0
     */
    public int exitCode(boolean unstableIsSuccess) {
        if (isConfigurationError()) return EXIT_CONFIG_ERROR;
        return switch (status) {
            case SUCCESS  -> EXIT_SUCCESS;
            case UNSTABLE -> unstableIsSuccess ? EXIT_SUCCESS : EXIT_FAILURE;
            case FAILURE  -> EXIT_FAILURE;
        };
    }

    /** First non-ignored failure message, used as the run's headline error. */
    public Optional<String> firstFailureMessage() {
        if (isConfigurationError()) return Optional.of(configurationError);
        return stages.stream()
                .filter(r -> r.contribution() == RunStatus.FAILURE)
                .map(StageResult::message)
                .filter(m -> m != null)
                .findFirst();
    }
}
