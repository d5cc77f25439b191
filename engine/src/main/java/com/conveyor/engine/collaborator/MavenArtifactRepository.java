package com.conveyor.engine.collaborator;

import com.conveyor.engine.tool.ToolAdapter;
import com.conveyor.engine.tool.ToolInvocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Deploys and retrieves artifacts through Maven's deploy and dependency
 * plugins. Server credentials come from the {@code settings.xml} entry
 * matching the repository id.
 */
@Component
public class MavenArtifactRepository implements ArtifactRepository {

    private static final Logger log = LoggerFactory.getLogger(MavenArtifactRepository.class);

    private final ToolAdapter tools;
    private final String      repositoryUrl;
    private final String      repositoryId;

    public MavenArtifactRepository(ToolAdapter tools,
                                   @Value("${conveyor.artifacts.repository-url:}") String repositoryUrl,
                                   @Value("${conveyor.artifacts.repository-id:nexus}") String repositoryId) {
        this.tools         = tools;
        this.repositoryUrl = repositoryUrl;
        this.repositoryId  = repositoryId;
    }

    @Override
    public URI publish(Path artifact, ArtifactCoordinates coordinates) {
        log.info("Deploying {} as {} to {}", artifact, coordinates.gav(), repositoryUrl);
        tools.invoke(ToolInvocation.of(
                        "mvn", "-B", "deploy:deploy-file",
                        "-Durl=" + repositoryUrl,
                        "-DrepositoryId=" + repositoryId,
                        "-Dfile=" + artifact,
                        "-DgroupId=" + coordinates.groupId(),
                        "-DartifactId=" + coordinates.artifactId(),
                        "-Dversion=" + coordinates.version(),
                        "-Dpackaging=" + coordinates.packaging())
                        .withTimeout(Duration.ofMinutes(10)))
                .orThrow("Deploy of " + coordinates.gav());
        return URI.create(repositoryUrl + "/" + coordinates.groupId().replace('.', '/')
                + "/" + coordinates.artifactId() + "/" + coordinates.version() + "/" + coordinates.fileName());
    }

    @Override
    public Path fetch(ArtifactCoordinates coordinates, Path targetDir) {
        tools.invoke(ToolInvocation.of(
                        "mvn", "-B", "dependency:copy",
                        "-Dartifact=" + coordinates.gav(),
                        "-DoutputDirectory=" + targetDir,
                        "-DremoteRepositories=" + repositoryId + "::default::" + repositoryUrl)
                        .withTimeout(Duration.ofMinutes(10)))
                .orThrow("Fetch of " + coordinates.gav());
        return targetDir.resolve(coordinates.fileName());
    }
}
