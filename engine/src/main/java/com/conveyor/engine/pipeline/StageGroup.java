package com.conveyor.engine.pipeline;

import java.util.List;

/**
 * One step of the stage graph: a single sequential stage, or a parallel
 * fan-out whose members all finish before the next group starts.
 *
 * @param id parallel group id, or null for a lone sequential stage
 */
public record StageGroup(String id, List<Stage> stages) {

    public StageGroup {
        stages = List.copyOf(stages);
    }

    public boolean parallel() {
        return id != null;
    }
}
