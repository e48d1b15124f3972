package com.questrail.datagram.api;

import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Request
 * -----------------------------------------------------------------------------
 * One received datagram after {@link RequestHandler#read(RawDatagram, Instant)}.
 *
 * <p>A request is owned by the single worker processing it and is never shared
 * across workers. {@code context} is an optional slot for whatever the handler's
 * read step decoded from the payload; the engine never looks at it. Equality
 * compares payload contents.</p>
 *
 * @param sender     address the datagram came from
 * @param payload    raw payload bytes
 * @param receivedAt time the reader took the datagram off the socket
 * @param context    handler-defined decoded form, may be {@code null}
 */
public record Request(InetSocketAddress sender, byte[] payload, Instant receivedAt, Object context) {
    public Request {
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(receivedAt, "receivedAt");
    }

    /**
     * Builds a request carrying the raw payload only.
     */
    public static Request of(RawDatagram datagram, Instant receivedAt) {
        Objects.requireNonNull(datagram, "datagram");
        return new Request(datagram.sender(), datagram.payload(), receivedAt, null);
    }

    /**
     * @return a copy of this request with the given decoded context
     */
    public Request withContext(Object context) {
        return new Request(sender, payload, receivedAt, context);
    }

    /**
     * Typed access to the decoded context.
     *
     * @throws ClassCastException if the context is not of the requested type
     */
    public <T> T context(Class<T> type) {
        return type.cast(context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Request)) {
            return false;
        }
        Request other = (Request) o;
        return sender.equals(other.sender)
                && Arrays.equals(payload, other.payload)
                && receivedAt.equals(other.receivedAt)
                && Objects.equals(context, other.context);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(sender, receivedAt, context);
        return 31 * result + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Request[sender=" + sender + ", length=" + payload.length + ", receivedAt=" + receivedAt + "]";
    }
}
