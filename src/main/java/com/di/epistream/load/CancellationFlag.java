package com.di.epistream.load;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stops partitions that have not started yet. Partitions already running finish normally.
 */
public class CancellationFlag {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
