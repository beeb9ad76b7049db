package com.platform.discovery.discovery;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag shared between the caller that requests a stop and the worker that polls.
 * Once set it stays set.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * @return true if this call set the flag, false if it was already set
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
