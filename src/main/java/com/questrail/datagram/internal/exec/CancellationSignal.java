package com.questrail.datagram.internal.exec;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * CancellationSignal
 * =============================================================================
 * One-shot broadcast used for cooperative shutdown.
 *
 * <p>The signal is set once and observed by any number of threads. Nothing is
 * interrupted when it fires: each loop checks {@link #isCancelled()} at its
 * blocking points, which are all timed.</p>
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * Fire the signal.
     *
     * @return {@code true} if this call fired it; {@code false} if it was already fired
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
