package com.questrail.datagram.api;

import com.questrail.datagram.transport.DatagramSocketHandle;

import java.io.IOException;

/**
 * ResponseHandler
 * -----------------------------------------------------------------------------
 * Capability that writes a reply to the server's socket.
 *
 * <p>Called once per produced response on a response worker thread. Several
 * response workers write through the same socket concurrently; datagram sends
 * are independent and {@link DatagramSocketHandle#send} is safe for concurrent
 * callers.</p>
 *
 * <p>A failure is isolated to that response. A
 * {@link java.net.SocketTimeoutException} is reported as a write timeout, any
 * other exception as a write failure.</p>
 */
@FunctionalInterface
public interface ResponseHandler {
    /**
     * Write {@code response} using {@code socket}.
     *
     * @throws IOException if the write fails or times out
     */
    void write(DatagramSocketHandle socket, Response response) throws IOException;
}
