package com.conveyor.engine.retry;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot flag raised when a run is aborted.
 *
 * Blocking waits in the engine (retry delays) go through {@link #sleep} so an
 * abort wakes them up immediately instead of letting them run out the clock.
 */
public final class AbortSignal {

    private final CountDownLatch latch = new CountDownLatch(1);
    private volatile String reason;

    /** Raise the signal. Only the first reason is kept. */
    public synchronized void abort(String reason) {
        if (latch.getCount() > 0) {
            this.reason = reason;
            latch.countDown();
        }
    }

    public boolean isAborted() {
        return latch.getCount() == 0;
    }

    /** Why the signal was raised, or null while it has not been. */
    public String reason() {
        return reason;
    }

    /**
     * Sleep for the given duration unless the signal is raised first.
     *
     * @return true if the whole delay elapsed, false if woken by an abort
     */
    public boolean sleep(Duration delay) throws InterruptedException {
        if (delay.isZero()) {
            return !isAborted();
        }
        return !latch.await(delay.toMillis(), TimeUnit.MILLISECONDS);
    }
}
