package com.deepansh.react.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one run.
 * Checked by the loop between steps; in-flight model and tool calls are not interrupted.
 */
public class RunCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static RunCancellation none() {
        return new RunCancellation();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
