package com.supplier.matching.api;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for a running match. The engine checks it between
 * phases and between scoring chunks.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws MatchingCancelledException if cancellation was requested
     */
    public void throwIfCancelled(String phase) {
        if (cancelled.get()) {
            throw new MatchingCancelledException(phase);
        }
    }
}
