package com.conveyor.engine.model;

/**
 * Lifecycle of a persisted run (see {@link RunRecord}).
 *
 * Transitions:
 *   QUEUED → RUNNING (claimed by a worker)
 *   RUNNING → SUCCESS | UNSTABLE | FAILURE | CONFIGURATION_ERROR
 *
 * Runs are not resumable: a RUNNING run found at startup is marked FAILURE.
 */
public enum RunState {
    QUEUED,
    RUNNING,
    SUCCESS,
    UNSTABLE,
    FAILURE,
    CONFIGURATION_ERROR;

    public boolean isTerminal() {
        return this != QUEUED && this != RUNNING;
    }

    public static RunState of(PipelineRun run) {
        if (run.isConfigurationError()) return CONFIGURATION_ERROR;
        return switch (run.status()) {
            case SUCCESS  -> SUCCESS;
            case UNSTABLE -> UNSTABLE;
            case FAILURE  -> FAILURE;
        };
    }
}
