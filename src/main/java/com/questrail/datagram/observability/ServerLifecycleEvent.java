package com.questrail.datagram.observability;

import com.questrail.datagram.api.ServerState;

import java.net.InetSocketAddress;
import java.time.Instant;

/**
 * Record representing a lifecycle milestone of a server.
 *
 * @param timestamp    when the milestone occurred
 * @param serverName   name of the server
 * @param kind         what happened
 * @param state        server state after the milestone
 * @param localAddress bound address, {@code null} before a successful start
 */
public record ServerLifecycleEvent(
    Instant timestamp,
    String serverName,
    Kind kind,
    ServerState state,
    InetSocketAddress localAddress
) {
    public enum Kind {
        STARTED,
        STOPPING,
        STOPPED,
        /** The reader gave up on the socket and no longer produces work. */
        READER_STOPPED
    }
}
