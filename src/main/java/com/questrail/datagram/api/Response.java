package com.questrail.datagram.api;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * An outbound reply: where to send it and what to send. Equality compares
 * payload contents.
 */
public record Response(InetSocketAddress destination, byte[] payload) {
    public Response {
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(payload, "payload");
    }

    /**
     * Builds a reply addressed to the sender of {@code request}.
     */
    public static Response replyTo(Request request, byte[] payload) {
        Objects.requireNonNull(request, "request");
        return new Response(request.sender(), payload);
    }

    /**
     * Builds a reply addressed to the sender of {@code request} carrying UTF-8 text.
     */
    public static Response replyTo(Request request, String text) {
        Objects.requireNonNull(text, "text");
        return replyTo(request, text.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Response)) {
            return false;
        }
        Response other = (Response) o;
        return destination.equals(other.destination) && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * destination.hashCode() + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Response[destination=" + destination + ", length=" + payload.length + "]";
    }
}
