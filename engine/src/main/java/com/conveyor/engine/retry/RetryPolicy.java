package com.conveyor.engine.retry;

import java.time.Duration;

/**
 * How often to try an operation and how long to wait in between.
 *
 * @param maxAttempts total number of invocations, not additional ones; at least 1
 * @param delay       fixed pause between two attempts
 */
public record RetryPolicy(int maxAttempts, Duration delay) {

    private static final RetryPolicy NONE = new RetryPolicy(1, Duration.ZERO);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be zero or positive");
        }
    }

    /** A single attempt, no retry. */
    public static RetryPolicy none() {
        return NONE;
    }

    public static RetryPolicy of(int maxAttempts, Duration delay) {
        return new RetryPolicy(maxAttempts, delay);
    }
}
