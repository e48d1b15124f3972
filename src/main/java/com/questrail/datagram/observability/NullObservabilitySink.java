package com.questrail.datagram.observability;

/**
 * No-op implementation of DatagramServerObservabilitySink.
 */
public final class NullObservabilitySink implements DatagramServerObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onLifecycleEvent(ServerLifecycleEvent event) {}

    @Override
    public void onError(ServerErrorEvent event) {}
}
