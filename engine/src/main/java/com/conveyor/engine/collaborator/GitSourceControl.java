package com.conveyor.engine.collaborator;

import com.conveyor.engine.tool.ToolAdapter;
import com.conveyor.engine.tool.ToolInvocation;
import com.conveyor.engine.tool.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Clones the configured repository, or refreshes an existing clone, with the
 * {@code git} CLI. The credentials reference is exported as
 * {@code GIT_CREDENTIALS_REF} for the credential helper to resolve.
 */
@Component
public class GitSourceControl implements SourceControl {

    private static final Logger log = LoggerFactory.getLogger(GitSourceControl.class);

    private static final Duration GIT_TIMEOUT = Duration.ofMinutes(5);

    private final ToolAdapter tools;
    private final String      repositoryUrl;
    private final Path        workspace;

    public GitSourceControl(ToolAdapter tools,
                            @Value("${conveyor.scm.repository-url:}") String repositoryUrl,
                            @Value("${conveyor.workspace.dir:work/source}") Path workspace) {
        this.tools         = tools;
        this.repositoryUrl = repositoryUrl;
        this.workspace     = workspace;
    }

    @Override
    public Path checkout(String branch, String credentialsRef) {
        if (Files.isDirectory(workspace.resolve(".git"))) {
            log.info("Refreshing {} to origin/{}", workspace, branch);
            git(credentialsRef, "fetch", "--prune", "origin").orThrow("git fetch");
            git(credentialsRef, "checkout", "-B", branch, "origin/" + branch).orThrow("git checkout " + branch);
        } else {
            log.info("Cloning {} @ {} into {}", repositoryUrl, branch, workspace);
            tools.invoke(ToolInvocation.of("git", "clone", "--branch", branch, repositoryUrl, workspace.toString())
                            .withEnv("GIT_CREDENTIALS_REF", credentialsRef == null ? "" : credentialsRef)
                            .withTimeout(GIT_TIMEOUT))
                    .orThrow("git clone of " + repositoryUrl);
        }
        return workspace;
    }

    private ToolResult git(String credentialsRef, String... args) {
        String[] command = new String[args.length + 1];
        command[0] = "git";
        System.arraycopy(args, 0, command, 1, args.length);
        return tools.invoke(ToolInvocation.of(command)
                .withEnv("GIT_CREDENTIALS_REF", credentialsRef == null ? "" : credentialsRef)
                .withTimeout(GIT_TIMEOUT)
                .in(workspace));
    }
}
