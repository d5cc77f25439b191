package com.conveyor.engine.tool;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One external command to run.
 *
 * @param command          program and arguments, never passed through a shell
 * @param envOverrides     variables added to (or replacing) the inherited environment
 * @param timeout          wall-clock deadline; the process is killed after this
 * @param workingDirectory directory to run in, or null for the engine's own
 */
public record ToolInvocation(
        List<String>        command,
        Map<String, String> envOverrides,
        Duration            timeout,
        Path                workingDirectory
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(10);

    public ToolInvocation {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        command      = List.copyOf(command);
        envOverrides = envOverrides == null ? Map.of() : Map.copyOf(envOverrides);
        timeout      = timeout == null ? DEFAULT_TIMEOUT : timeout;
    }

    public static ToolInvocation of(String... command) {
        return new ToolInvocation(List.of(command), Map.of(), DEFAULT_TIMEOUT, null);
    }

    public static ToolInvocation of(List<String> command) {
        return new ToolInvocation(command, Map.of(), DEFAULT_TIMEOUT, null);
    }

    public ToolInvocation withEnv(String name, String value) {
        Map<String, String> env = new HashMap<>(envOverrides);
        env.put(name, value);
        return new ToolInvocation(command, env, timeout, workingDirectory);
    }

    public ToolInvocation withTimeout(Duration newTimeout) {
        return new ToolInvocation(command, envOverrides, newTimeout, workingDirectory);
    }

    public ToolInvocation in(Path directory) {
        return new ToolInvocation(command, envOverrides, timeout, directory);
    }

    /** Command line as a single string, for logs and error messages. */
    public String displayCommand() {
        return String.join(" ", command);
    }
}
