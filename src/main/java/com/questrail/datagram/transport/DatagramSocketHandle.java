package com.questrail.datagram.transport;

import com.questrail.datagram.api.RawDatagram;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;

/**
 * DatagramSocketHandle
 * -----------------------------------------------------------------------------
 * Minimal port for a bound datagram socket as the server engine sees it.
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test harness.</p>
 *
 * <h2>Threading contract</h2>
 * <ul>
 *   <li>{@link #receive()} is called by exactly one thread (the server's reader)</li>
 *   <li>{@link #send} may be called by many threads concurrently</li>
 *   <li>{@link #shutdownInput()} and {@link #close()} may be called from any thread
 *       and must unblock a pending {@link #receive()}</li>
 * </ul>
 */
public interface DatagramSocketHandle extends Closeable
{
    /**
     * @return the local address the socket is bound to
     */
    InetSocketAddress localAddress();

    /**
     * Block until a datagram arrives.
     *
     * <p>The returned payload is a private copy owned by the caller.</p>
     *
     * @return the next datagram in kernel delivery order
     * @throws java.nio.channels.ClosedChannelException once input has been shut
     *         down or the socket closed
     * @throws java.io.InterruptedIOException if the calling thread is interrupted
     * @throws IOException on any other read failure
     */
    RawDatagram receive() throws IOException;

    /**
     * Send a datagram using the handle's default write timeout.
     *
     * @throws java.net.SocketTimeoutException if the write does not complete in time
     * @throws IOException on any other write failure
     */
    void send(SocketAddress remote, byte[] payload) throws IOException;

    /**
     * Send a datagram, failing if the write has not completed within {@code timeout}.
     *
     * <p>A zero or negative timeout is a deadline that has already passed: the
     * call fails with {@link java.net.SocketTimeoutException} without writing.</p>
     *
     * @throws java.net.SocketTimeoutException if the write does not complete in time
     * @throws IOException on any other write failure
     */
    void send(SocketAddress remote, byte[] payload, Duration timeout) throws IOException;

    /**
     * Stop delivering datagrams. Pending and future {@link #receive()} calls fail
     * with {@link java.nio.channels.ClosedChannelException}; sends keep working
     * until {@link #close()}.
     */
    void shutdownInput();

    /**
     * @return {@code true} until {@link #close()} has been called or the socket failed
     */
    boolean isOpen();

    /**
     * Close the socket and release every resource (threads included) it holds.
     * Idempotent. Blocks until those resources are released.
     */
    @Override
    void close();
}
