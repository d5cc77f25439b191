package com.conveyor.engine.collaborator;

import java.nio.file.Path;

public interface StaticAnalyzer {

    /** @return reference to the published analysis (dashboard URL) */
    String analyze(Path binariesPath, String projectKey, String orgKey);
}
