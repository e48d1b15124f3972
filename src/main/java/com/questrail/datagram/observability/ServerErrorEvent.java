package com.questrail.datagram.observability;

import java.net.InetSocketAddress;
import java.time.Instant;

/**
 * Record representing an isolated failure inside a running server.
 *
 * @param timestamp  when the failure was observed
 * @param serverName name of the reporting server
 * @param kind       failure classification
 * @param peer       remote peer involved, or {@code null} if none
 * @param message    human readable description
 * @param cause      underlying exception, may be {@code null}
 */
public record ServerErrorEvent(
    Instant timestamp,
    String serverName,
    ErrorKind kind,
    InetSocketAddress peer,
    String message,
    Throwable cause
) {
}
