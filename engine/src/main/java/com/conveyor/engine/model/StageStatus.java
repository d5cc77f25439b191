package com.conveyor.engine.model;

/**
 * Terminal status of one stage in one run.
 *
 * Transitions:
 *   PENDING → SKIPPED  (predicate false, or run aborting and stage not alwaysRun)
 *   PENDING → RUNNING → SUCCESS | UNSTABLE | FAILURE
 *
 * PENDING and RUNNING are never recorded; a StageResult is only written once
 * the stage reaches a terminal state.
 */
public enum StageStatus {
    SUCCESS,
    FAILURE,
    UNSTABLE,
    SKIPPED
}
