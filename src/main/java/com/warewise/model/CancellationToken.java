package com.warewise.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one analysis run. Checked between rule evaluations.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * A fresh token nobody else holds, so it is never cancelled.
     */
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
