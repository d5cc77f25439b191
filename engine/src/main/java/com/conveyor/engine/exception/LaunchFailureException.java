package com.conveyor.engine.exception;

/**
 * Thrown when an external tool could not be started or did not finish before
 * its deadline. A tool that ran and exited nonzero is NOT a launch failure.
 */
public class LaunchFailureException extends RuntimeException {

    private final String command;

    public LaunchFailureException(String command, String message) {
        super(command + ": " + message);
        this.command = command;
    }

    public LaunchFailureException(String command, String message, Throwable cause) {
        super(command + ": " + message, cause);
        this.command = command;
    }

    public String getCommand() { return command; }
}
