package com.conveyor.engine.tool;

import com.conveyor.engine.exception.ToolFailureException;

/**
 * What an external tool produced. A nonzero exit code is a normal result;
 * the adapter never interprets output.
 */
public record ToolResult(
        int    exitCode,
        String stdout,
        String stderr,
        long   durationMs
) {
    public boolean succeeded() {
        return exitCode == 0;
    }

    /**
     * @return this result when the exit code is zero
     * @throws ToolFailureException carrying the summary and exit code otherwise
     */
    public ToolResult orThrow(String operation) {
        if (!succeeded()) {
            throw new ToolFailureException(operation + " failed\n" + summary(), exitCode);
        }
        return this;
    }

    /**
     * Render stdout, stderr and the exit code as one block of text, used in
     * logs and as the failure message of the owning stage.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        if (stdout != null && !stdout.isBlank()) {
            sb.append("stdout:\n").append(stdout.stripTrailing());
        }
        if (stderr != null && !stderr.isBlank()) {
            if (!sb.isEmpty()) sb.append("\n\n");
            sb.append("stderr:\n").append(stderr.stripTrailing());
        }
        if (sb.isEmpty()) sb.append("(no output)");
        sb.append("\n\nexit_code: ").append(exitCode);
        return sb.toString();
    }
}
