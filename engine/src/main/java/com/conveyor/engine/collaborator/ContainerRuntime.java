package com.conveyor.engine.collaborator;

import java.nio.file.Path;

/** Builds images and manages the containers started from them. */
public interface ContainerRuntime {

    void build(Path contextDir, Path dockerfile, String imageRef);

    /**
     * Start a detached container publishing {@code hostPort} → {@code containerPort}.
     *
     * @return the container id
     */
    String run(String imageRef, String containerName, int hostPort, int containerPort);

    void stop(String containerName);

    void remove(String containerName);

    void removeImage(String imageRef);
}
