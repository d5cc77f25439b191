package com.conveyor.engine.collaborator;

import java.net.URI;
import java.nio.file.Path;

public interface ObjectStorage {

    /** @return location of the uploaded object */
    URI upload(Path localPath, String remoteKey);
}
