package com.questrail.datagram.api;

/**
 * The binder failed to produce a socket during {@code start()}.
 *
 * <p>The server stays in {@link ServerState#CREATED}; start may be retried.</p>
 */
public final class ServerBindException extends DatagramServerException {
    public ServerBindException(String message, Throwable cause) {
        super(message, cause);
    }
}
