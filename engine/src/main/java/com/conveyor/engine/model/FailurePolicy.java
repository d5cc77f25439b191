package com.conveyor.engine.model;

/**
 * What a stage failure does to the run.
 */
public enum FailurePolicy {
    FATAL,      // stage FAILURE, run aborts; only alwaysRun stages still execute
    UNSTABLE,   // stage UNSTABLE, run continues, overall status at best UNSTABLE
    IGNORED     // stage FAILURE is logged and reported but does not affect overall status
}
