package com.questrail.datagram.internal.exec;

import com.questrail.datagram.api.RawDatagram;

import java.time.Instant;
import java.util.Objects;

/**
 * A datagram as queued by the reader for the request workers.
 */
public record ReceivedDatagram(RawDatagram datagram, Instant receivedAt) {
    public ReceivedDatagram {
        Objects.requireNonNull(datagram, "datagram");
        Objects.requireNonNull(receivedAt, "receivedAt");
    }
}
