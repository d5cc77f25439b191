package com.conveyor.engine.collaborator;

import java.nio.file.Path;

public interface SourceControl {

    /**
     * Check out a branch into the workspace.
     *
     * @param credentialsRef opaque reference handed to the tool as-is
     * @return the checked-out working tree
     */
    Path checkout(String branch, String credentialsRef);
}
