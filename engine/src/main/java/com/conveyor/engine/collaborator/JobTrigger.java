package com.conveyor.engine.collaborator;

import java.util.Map;

/** Starts a downstream job on the CI server. */
public interface JobTrigger {

    /** @return whether the CI server accepted the request */
    boolean triggerJob(String jobName, Map<String, String> params);
}
