package com.conveyor.engine.tool;

import com.conveyor.engine.exception.LaunchFailureException;

/**
 * Uniform way to invoke an external command-line collaborator.
 */
public interface ToolAdapter {

    /**
     * Run the command and capture its output.
     *
     * @return the result, whatever the exit code
     * @throws LaunchFailureException if the process could not be started or
     *                                did not finish before the invocation's timeout
     */
    ToolResult invoke(ToolInvocation invocation);
}
