package com.conveyor.engine.model;

import java.util.Map;

/**
 * Immutable record of how one stage ended.
 *
 * @param exitCode        exit code of the tool that decided the outcome, if any
 * @param producedOutputs state keys the stage wrote (subset of its declared outputs)
 * @param message         failure message of the deepest cause, or the skip reason
 * @param attempts        number of times the body ran; 0 when skipped
 */
public record StageResult(
        String              stageId,
        StageStatus         status,
        Integer             exitCode,
        long                durationMs,
        Map<String, Object> producedOutputs,
        String              message,
        FailurePolicy       failurePolicy,
        int                 attempts
) {
    public StageResult {
        producedOutputs = producedOutputs == null ? Map.of() : Map.copyOf(producedOutputs);
    }

    public static StageResult skipped(String stageId, FailurePolicy policy, String reason) {
        return new StageResult(stageId, StageStatus.SKIPPED, null, 0, Map.of(), reason, policy, 0);
    }

    /** How this stage weighs on the overall run status. IGNORED failures weigh nothing. */
    public RunStatus contribution() {
        return switch (status) {
            case SUCCESS, SKIPPED -> RunStatus.SUCCESS;
            case UNSTABLE         -> RunStatus.UNSTABLE;
            case FAILURE          -> failurePolicy == FailurePolicy.IGNORED ? RunStatus.SUCCESS : RunStatus.FAILURE;
        };
    }

    public boolean executed() {
        return status != StageStatus.SKIPPED;
    }
}
