package com.conveyor.engine.collaborator;

import com.conveyor.engine.tool.ToolAdapter;
import com.conveyor.engine.tool.ToolInvocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

@Component
public class DockerContainerRuntime implements ContainerRuntime {

    private static final Logger log = LoggerFactory.getLogger(DockerContainerRuntime.class);

    private final ToolAdapter tools;

    public DockerContainerRuntime(ToolAdapter tools) {
        this.tools = tools;
    }

    @Override
    public void build(Path contextDir, Path dockerfile, String imageRef) {
        log.info("Building image {} from {}", imageRef, dockerfile);
        tools.invoke(ToolInvocation.of("docker", "build", "--pull", "-t", imageRef, "-f", dockerfile.toString(), ".")
                        .withTimeout(Duration.ofMinutes(30))
                        .in(contextDir))
                .orThrow("docker build of " + imageRef);
    }

    @Override
    public String run(String imageRef, String containerName, int hostPort, int containerPort) {
        log.info("Starting {} as {} on port {}", imageRef, containerName, hostPort);
        String containerId = tools.invoke(ToolInvocation.of(
                        "docker", "run", "-d",
                        "--name", containerName,
                        "-p", hostPort + ":" + containerPort,
                        imageRef))
                .orThrow("docker run of " + imageRef)
                .stdout();
        return containerId == null ? "" : containerId.strip();
    }

    @Override
    public void stop(String containerName) {
        tools.invoke(ToolInvocation.of("docker", "stop", containerName)).orThrow("docker stop " + containerName);
    }

    @Override
    public void remove(String containerName) {
        tools.invoke(ToolInvocation.of("docker", "rm", "-f", containerName)).orThrow("docker rm " + containerName);
    }

    @Override
    public void removeImage(String imageRef) {
        tools.invoke(ToolInvocation.of("docker", "rmi", "-f", imageRef)).orThrow("docker rmi " + imageRef);
    }
}
