package com.conveyor.engine.exception;

/**
 * Bad or missing parameter, or a stage referencing an undeclared state key.
 *
 * Always fatal before any stage runs: the executor turns it into a run with
 * a configuration error and zero executed stages (CLI exit code 2).
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
