package com.conveyor.engine.exception;

/**
 * A collaborator ran but reported an error: nonzero exit, non-2xx response,
 * or an error payload. How bad this is depends on the owning stage's
 * failure policy.
 */
public class ToolFailureException extends RuntimeException {

    private final Integer exitCode;

    public ToolFailureException(String message) {
        this(message, null, null);
    }

    public ToolFailureException(String message, Integer exitCode) {
        this(message, exitCode, null);
    }

    public ToolFailureException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public ToolFailureException(String message, Integer exitCode, Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
    }

    /** Exit code of the failed tool, or null for HTTP/remote collaborators. */
    public Integer getExitCode() { return exitCode; }
}
