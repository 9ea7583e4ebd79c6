package com.vidnyan.codegraph.domain.pipeline;

import com.vidnyan.codegraph.exception.OperationCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag. Long-running work polls it at safe
 * boundaries; nothing is ever interrupted preemptively.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * A token nobody holds a reference to cancel.
     */
    public static CancellationToken none() {
        return NONE;
    }

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        if (this != NONE) {
            cancelled.set(true);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled(String where) {
        if (cancelled.get()) {
            throw new OperationCancelledException("Cancelled during " + where);
        }
    }
}
