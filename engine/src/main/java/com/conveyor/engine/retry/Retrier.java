package com.conveyor.engine.retry;

import com.conveyor.engine.exception.ToolFailureException;
import com.conveyor.engine.exception.TransientNetworkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Predicate;

/**
 * Re-invokes an operation until it succeeds or the attempts run out.
 *
 * An attempt fails when it throws, or when its result does not satisfy the
 * caller's success predicate (e.g. a {@code ToolResult} with a nonzero exit).
 * The first success is returned immediately. After the last attempt the last
 * failure is surfaced: a failing result is returned as-is, an exception is
 * rethrown. A {@link TransientNetworkException} that survives every attempt
 * is escalated to a {@link ToolFailureException}.
 *
 * Delays are fixed, not exponential.
 */
public final class Retrier {

    private static final Logger log = LoggerFactory.getLogger(Retrier.class);

    private Retrier() {}

    /** One attempt of the operation being retried. */
    @FunctionalInterface
    public interface Attempt<T> {
        T run();
    }

    /** Retry on exceptions only; any returned value counts as success. */
    public static <T> T withRetry(String name, Attempt<T> op, RetryPolicy policy) {
        return withRetry(name, op, result -> true, policy, new AbortSignal());
    }

    public static <T> T withRetry(String name, Attempt<T> op, Predicate<? super T> succeeded,
                                  RetryPolicy policy) {
        return withRetry(name, op, succeeded, policy, new AbortSignal());
    }

    /**
     * @param name      label for log lines
     * @param op        the operation
     * @param succeeded decides whether a returned value is a success
     * @param policy    attempt count and delay
     * @param abort     cancels the wait between attempts; no further attempt is
     *                  made once it is raised
     */
    public static <T> T withRetry(String name, Attempt<T> op, Predicate<? super T> succeeded,
                                  RetryPolicy policy, AbortSignal abort) {
        int max = policy.maxAttempts();
        RuntimeException lastError = null;
        T lastResult = null;
        int made = 0;

        for (int attempt = 1; attempt <= max; attempt++) {
            made = attempt;
            try {
                T result = op.run();
                if (succeeded.test(result)) {
                    if (attempt > 1) {
                        log.info("{} succeeded on attempt {}/{}", name, attempt, max);
                    }
                    return result;
                }
                lastResult = result;
                lastError  = null;
                log.warn("{} attempt {}/{} was unsuccessful", name, attempt, max);
            } catch (RuntimeException e) {
                lastError  = e;
                lastResult = null;
                log.warn("{} attempt {}/{} failed: {}", name, attempt, max, e.getMessage());
            }

            if (attempt < max && !pause(policy, abort)) {
                log.info("Retries of {} cancelled after attempt {}/{}: {}",
                        name, attempt, max, abort.reason());
                break;
            }
        }

        if (lastError instanceof TransientNetworkException) {
            throw new ToolFailureException(
                    name + " failed after " + made + " attempt(s): " + lastError.getMessage(), lastError);
        }
        if (lastError != null) {
            throw lastError;
        }
        return lastResult;
    }

    private static boolean pause(RetryPolicy policy, AbortSignal abort) {
        if (abort.isAborted()) {
            return false;
        }
        try {
            return abort.sleep(policy.delay());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
