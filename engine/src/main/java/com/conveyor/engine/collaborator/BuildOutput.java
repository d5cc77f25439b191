package com.conveyor.engine.collaborator;

import java.nio.file.Path;
import java.util.List;

/**
 * @param binariesPath compiled classes, handed to static analysis
 * @param artifactPaths packaged artifacts, in the order the build tool reports them
 */
public record BuildOutput(Path binariesPath, List<Path> artifactPaths) {

    public BuildOutput {
        artifactPaths = List.copyOf(artifactPaths);
    }
}
