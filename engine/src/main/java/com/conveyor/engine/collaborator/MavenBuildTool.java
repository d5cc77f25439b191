package com.conveyor.engine.collaborator;

import com.conveyor.engine.exception.ToolFailureException;
import com.conveyor.engine.tool.ToolAdapter;
import com.conveyor.engine.tool.ToolInvocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/** Packages a Maven project with {@code mvn -B package}. */
@Component
public class MavenBuildTool implements BuildTool {

    private static final Logger log = LoggerFactory.getLogger(MavenBuildTool.class);

    private static final Duration BUILD_TIMEOUT = Duration.ofMinutes(30);

    private final ToolAdapter tools;

    public MavenBuildTool(ToolAdapter tools) {
        this.tools = tools;
    }

    @Override
    public BuildOutput build(Path projectPath, boolean skipTests) {
        List<String> command = new ArrayList<>(List.of("mvn", "-B", "package"));
        if (skipTests) {
            command.add("-DskipTests");
        }
        tools.invoke(ToolInvocation.of(command).withTimeout(BUILD_TIMEOUT).in(projectPath))
                .orThrow("Maven build");

        Path target = projectPath.resolve("target");
        List<Path> artifacts = artifactsIn(target);
        if (artifacts.isEmpty()) {
            throw new ToolFailureException("Maven build produced no artifact in " + target);
        }
        log.info("Build produced {}", artifacts);
        return new BuildOutput(target.resolve("classes"), artifacts);
    }

    private static List<Path> artifactsIn(Path target) {
        if (!Files.isDirectory(target)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(target)) {
            return files
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return (name.endsWith(".jar") || name.endsWith(".war"))
                                && !name.endsWith("-sources.jar")
                                && !name.endsWith("-javadoc.jar")
                                && !name.startsWith("original-");
                    })
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list build output in " + target, e);
        }
    }
}
