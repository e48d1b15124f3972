package com.questrail.datagram.api;

import java.net.InetSocketAddress;
import java.util.Arrays;
import java.util.Objects;

/**
 * A datagram exactly as taken off the socket: the sender and the payload bytes.
 *
 * <p>The payload array is owned by the holder of this value. The reader hands
 * each instance to exactly one request worker. Equality compares payload
 * contents.</p>
 */
public record RawDatagram(InetSocketAddress sender, byte[] payload) {
    public RawDatagram {
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(payload, "payload");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RawDatagram)) {
            return false;
        }
        RawDatagram other = (RawDatagram) o;
        return sender.equals(other.sender) && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * sender.hashCode() + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "RawDatagram[sender=" + sender + ", length=" + payload.length + "]";
    }
}
