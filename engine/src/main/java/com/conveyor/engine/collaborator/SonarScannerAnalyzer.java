package com.conveyor.engine.collaborator;

import com.conveyor.engine.tool.ToolAdapter;
import com.conveyor.engine.tool.ToolInvocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Runs {@code sonar-scanner} from the project root (two levels above
 * {@code target/classes}).
 */
@Component
public class SonarScannerAnalyzer implements StaticAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SonarScannerAnalyzer.class);

    private final ToolAdapter tools;
    private final String      hostUrl;

    public SonarScannerAnalyzer(ToolAdapter tools,
                                @Value("${conveyor.sonar.host-url:https://sonarcloud.io}") String hostUrl) {
        this.tools   = tools;
        this.hostUrl = hostUrl;
    }

    @Override
    public String analyze(Path binariesPath, String projectKey, String orgKey) {
        Path projectRoot = projectRoot(binariesPath);
        log.info("Analyzing {} as {}/{}", projectRoot, orgKey, projectKey);
        tools.invoke(ToolInvocation.of(
                        "sonar-scanner",
                        "-Dsonar.host.url=" + hostUrl,
                        "-Dsonar.organization=" + orgKey,
                        "-Dsonar.projectKey=" + projectKey,
                        "-Dsonar.sources=.",
                        "-Dsonar.java.binaries=" + binariesPath)
                        .withTimeout(Duration.ofMinutes(20))
                        .in(projectRoot))
                .orThrow("Sonar analysis of " + projectKey);
        return hostUrl + "/dashboard?id=" + projectKey;
    }

    private static Path projectRoot(Path binariesPath) {
        Path target = binariesPath.getParent();
        return target != null && target.getParent() != null ? target.getParent() : binariesPath;
    }
}
