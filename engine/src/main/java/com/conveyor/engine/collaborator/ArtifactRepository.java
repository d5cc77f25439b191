package com.conveyor.engine.collaborator;

import java.net.URI;
import java.nio.file.Path;

/** Binary repository for build outputs (Nexus, Artifactory, ...). */
public interface ArtifactRepository {

    /** @return where the artifact can be downloaded from */
    URI publish(Path artifact, ArtifactCoordinates coordinates);

    /** @return the downloaded file inside {@code targetDir} */
    Path fetch(ArtifactCoordinates coordinates, Path targetDir);
}
