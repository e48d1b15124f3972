package com.questrail.datagram.internal.exec;

import com.questrail.datagram.api.ServerState;
import com.questrail.datagram.observability.DatagramServerObservabilitySink;
import com.questrail.datagram.observability.ErrorKind;
import com.questrail.datagram.observability.ServerErrorEvent;
import com.questrail.datagram.observability.ServerLifecycleEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.Objects;

/**
 * Stamps events with the server name and time and forwards them to the sink.
 *
 * <p>A sink that throws must not take a worker or the reader down with it, so
 * sink failures are logged here and go no further.</p>
 */
public final class ObservabilityReporter {
    private static final Logger log = LoggerFactory.getLogger(ObservabilityReporter.class);

    private final String serverName;
    private final DatagramServerObservabilitySink sink;

    public ObservabilityReporter(String serverName, DatagramServerObservabilitySink sink) {
        this.serverName = Objects.requireNonNull(serverName, "serverName");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public void error(ErrorKind kind, InetSocketAddress peer, String message, Throwable cause) {
        ServerErrorEvent event = new ServerErrorEvent(Instant.now(), serverName, kind, peer, message, cause);
        try {
            sink.onError(event);
        } catch (RuntimeException e) {
            log.warn("Observability sink rejected error event {}", event, e);
        }
    }

    public void lifecycle(ServerLifecycleEvent.Kind kind, ServerState state, InetSocketAddress localAddress) {
        ServerLifecycleEvent event = new ServerLifecycleEvent(Instant.now(), serverName, kind, state, localAddress);
        try {
            sink.onLifecycleEvent(event);
        } catch (RuntimeException e) {
            log.warn("Observability sink rejected lifecycle event {}", event, e);
        }
    }
}
