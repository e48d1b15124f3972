package com.questrail.datagram.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of DatagramServerObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jDatagramServerObservabilitySink implements DatagramServerObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jDatagramServerObservabilitySink.class);

    public static final Slf4jDatagramServerObservabilitySink INSTANCE = new Slf4jDatagramServerObservabilitySink();

    @Override
    public void onLifecycleEvent(ServerLifecycleEvent event) {
        if (event.kind() == ServerLifecycleEvent.Kind.READER_STOPPED) {
            log.error("Datagram server {}: reader stopped, no further datagrams will be read from {}",
                event.serverName(), event.localAddress());
            return;
        }
        log.info("Datagram server {}: {} (state {}, address {})",
            event.serverName(), event.kind(), event.state(), event.localAddress());
    }

    @Override
    public void onError(ServerErrorEvent event) {
        switch (event.kind()) {
            case READ:
            case INTERNAL:
                log.error("Datagram server {}: {} error: {}",
                    event.serverName(), event.kind(), event.message(), event.cause());
                break;
            case ABANDONED:
                log.warn("Datagram server {}: {}", event.serverName(), event.message());
                break;
            default:
                log.warn("Datagram server {}: {} error for peer {}: {}",
                    event.serverName(), event.kind(), event.peer(), event.message(), event.cause());
                break;
        }
    }
}
