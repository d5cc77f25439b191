package com.conveyor.engine.pipeline;

/**
 * The work of a stage: an ordered sequence of collaborator calls.
 *
 * Outputs are written through {@link StageContext#put}; they reach the
 * shared state only after the stage (or its parallel group) completes.
 */
@FunctionalInterface
public interface StageBody {

    StageOutcome execute(StageContext context);
}
