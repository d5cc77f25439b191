package com.conveyor.engine.exception;

/**
 * Network hiccup talking to a remote collaborator (connection refused, reset,
 * read timeout). Eligible for retry; once retries are exhausted the
 * {@link com.conveyor.engine.retry.Retrier} escalates it to a
 * {@link ToolFailureException}.
 */
public class TransientNetworkException extends RuntimeException {

    public TransientNetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
