package com.conveyor.engine.api.dto;

import com.conveyor.engine.model.RunRecord;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for POST /runs and GET /runs/{id}.
 */
public record RunResponse(
        UUID    id,
        String  pipeline,
        String  state,
        String  errorMessage,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt
) {
    public static RunResponse from(RunRecord run) {
        return new RunResponse(
                run.getId(),
                run.getPipelineName(),
                run.getState().name(),
                run.getErrorMessage(),
                run.getCreatedAt(),
                run.getStartedAt(),
                run.getFinishedAt()
        );
    }
}
