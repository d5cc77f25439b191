package com.conveyor.engine.collaborator;

import com.conveyor.engine.tool.ToolAdapter;
import com.conveyor.engine.tool.ToolInvocation;
import com.conveyor.engine.tool.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class DockerImageRegistry implements ImageRegistry {

    private static final Logger log = LoggerFactory.getLogger(DockerImageRegistry.class);

    private final ToolAdapter tools;

    public DockerImageRegistry(ToolAdapter tools) {
        this.tools = tools;
    }

    @Override
    public boolean push(String imageRef) {
        ToolResult result = tools.invoke(ToolInvocation.of("docker", "push", imageRef)
                .withTimeout(Duration.ofMinutes(15)));
        if (!result.succeeded()) {
            log.warn("docker push {} rejected:\n{}", imageRef, result.summary());
        }
        return result.succeeded();
    }
}
