package com.conveyor.engine.collaborator;

import com.conveyor.engine.tool.ToolAdapter;
import com.conveyor.engine.tool.ToolInvocation;
import com.conveyor.engine.tool.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
public class GitleaksScanner implements SecretScanner {

    private static final Logger log = LoggerFactory.getLogger(GitleaksScanner.class);

    private final ToolAdapter tools;

    public GitleaksScanner(ToolAdapter tools) {
        this.tools = tools;
    }

    @Override
    public int scan(Path sourcePath, Path reportPath) {
        ToolResult result = tools.invoke(ToolInvocation.of(
                "gitleaks", "detect",
                "--source", sourcePath.toString(),
                "--report-format", "json",
                "--report-path", reportPath.toString(),
                "--no-banner"));
        log.info("gitleaks exited {} for {} (report: {})", result.exitCode(), sourcePath, reportPath);
        return result.exitCode();
    }
}
