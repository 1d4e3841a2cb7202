package com.fundradar.timeseries;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for bulk fetches. Checked between windows and between symbols;
 * a window already in flight completes and stays persisted.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
