package com.crewmind.core.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * External cancellation signal for a run. Once cancelled, no further task is dispatched;
 * tasks already running finish and keep their results.
 */
public class RunCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public static RunCancellation none() {
        return new RunCancellation();
    }
}
