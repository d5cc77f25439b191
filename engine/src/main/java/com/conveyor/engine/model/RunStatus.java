package com.conveyor.engine.model;

/**
 * Overall status of a finalized run. Worst wins: FAILURE > UNSTABLE > SUCCESS.
 */
public enum RunStatus {
    SUCCESS,
    UNSTABLE,
    FAILURE;

    /** The more severe of the two. */
    public RunStatus worse(RunStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
