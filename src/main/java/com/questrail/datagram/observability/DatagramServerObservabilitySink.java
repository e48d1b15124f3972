package com.questrail.datagram.observability;

/**
 * Out-of-band reporting channel for a datagram server.
 *
 * <p>Implementations can provide logging, metrics, or tracing. Callbacks arrive
 * from the reader and worker threads concurrently, so implementations must be
 * thread-safe. An exception thrown from a callback is logged and otherwise
 * ignored; it never disturbs the pipeline.</p>
 */
public interface DatagramServerObservabilitySink {
    /**
     * Called when the server reaches a lifecycle milestone.
     * @param event the lifecycle event
     */
    void onLifecycleEvent(ServerLifecycleEvent event);

    /**
     * Called when a datagram, a response or the socket read fails.
     * @param event the error event
     */
    void onError(ServerErrorEvent event);
}
