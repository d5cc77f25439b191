package com.conveyor.engine.collaborator;

/** Maven-style identity of a published artifact. */
public record ArtifactCoordinates(String groupId, String artifactId, String version, String packaging) {

    /** {@code group:artifact:version:packaging}, as {@code dependency:copy} expects it. */
    public String gav() {
        return groupId + ":" + artifactId + ":" + version + ":" + packaging;
    }

    public String fileName() {
        return artifactId + "-" + version + "." + packaging;
    }
}
