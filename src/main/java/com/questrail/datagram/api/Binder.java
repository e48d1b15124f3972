package com.questrail.datagram.api;

import com.questrail.datagram.transport.DatagramSocketHandle;

import java.io.IOException;

/**
 * Binder
 * -----------------------------------------------------------------------------
 * Capability that produces a bound, ready-to-use datagram socket.
 *
 * <p>The server invokes {@link #bind} exactly once per start attempt,
 * synchronously, on the thread calling {@code start()}. A failure leaves the
 * server in its created state so that start may be retried.</p>
 *
 * @see com.questrail.datagram.transport.udp.netty.NettyDatagramBinder
 */
@FunctionalInterface
public interface Binder {
    /**
     * Bind a datagram socket.
     *
     * @param family      network family from configuration
     * @param bindAddress bind address string from configuration ({@code host:port})
     * @return the bound socket; ownership passes to the server
     * @throws IOException if the socket cannot be bound
     */
    DatagramSocketHandle bind(NetworkFamily family, String bindAddress) throws IOException;
}
