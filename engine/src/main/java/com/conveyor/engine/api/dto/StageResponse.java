package com.conveyor.engine.api.dto;

import com.conveyor.engine.model.FailurePolicy;
import com.conveyor.engine.model.StageRecord;
import com.conveyor.engine.model.StageStatus;

/**
 * Read-only view of one stage result returned by GET /runs/{id}/stages.
 */
public record StageResponse(
        int           position,
        String        stageId,
        StageStatus   status,
        FailurePolicy failurePolicy,
        Integer       exitCode,
        long          durationMs,
        int           attempts,
        String        message,
        String        outputsJson
) {
    public static StageResponse from(StageRecord s) {
        return new StageResponse(
                s.getPosition(),
                s.getStageId(),
                s.getStatus(),
                s.getFailurePolicy(),
                s.getExitCode(),
                s.getDurationMs(),
                s.getAttempts(),
                s.getMessage(),
                s.getOutputsJson()
        );
    }
}
