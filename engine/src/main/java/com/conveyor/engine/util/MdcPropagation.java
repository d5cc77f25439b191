package com.conveyor.engine.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Carries the SLF4J MDC (runId, stageId, attempt) from the submitting thread
 * into pool threads, so parallel stage logs stay correlated with their run.
 *
 * Wrap the pool once: {@code MdcPropagation.wrapExecutor(Executors.newFixedThreadPool(n))}.
 */
public final class MdcPropagation {

    private MdcPropagation() {
    }

    /**
     * Captures the current MDC and returns a Runnable that installs it for the
     * duration of the task. The worker's MDC is cleared afterwards, including
     * keys the task itself added.
     */
    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            MDC.clear();
            contextMap.forEach(MDC::put);
            try {
                task.run();
            } finally {
                MDC.clear();
            }
        };
    }

    /** Every {@code execute}/{@code submit} on the returned executor propagates the caller's MDC. */
    public static ExecutorService wrapExecutor(ExecutorService delegate) {
        return new MdcPropagatingExecutor(delegate);
    }

    /** Copy of the current thread's MDC; never null. */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    private static final class MdcPropagatingExecutor extends AbstractExecutorService {
        private final ExecutorService delegate;

        MdcPropagatingExecutor(ExecutorService delegate) {
            this.delegate = delegate;
        }

        @Override
        public void execute(Runnable command) {
            delegate.execute(wrapRunnable(command));
        }

        @Override
        public void shutdown() {
            delegate.shutdown();
        }

        @Override
        public List<Runnable> shutdownNow() {
            return delegate.shutdownNow();
        }

        @Override
        public boolean isShutdown() {
            return delegate.isShutdown();
        }

        @Override
        public boolean isTerminated() {
            return delegate.isTerminated();
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.awaitTermination(timeout, unit);
        }
    }
}
