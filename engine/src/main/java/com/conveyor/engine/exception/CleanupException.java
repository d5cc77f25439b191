package com.conveyor.engine.exception;

/**
 * Failure while releasing resources (containers, images). Always logged,
 * never escalated.
 */
public class CleanupException extends RuntimeException {

    public CleanupException(String message, Throwable cause) {
        super(message, cause);
    }
}
