package com.conveyor.engine.collaborator;

public interface ImageRegistry {

    /** @return whether the registry accepted the image */
    boolean push(String imageRef);
}
