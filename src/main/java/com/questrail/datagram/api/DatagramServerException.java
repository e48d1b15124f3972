package com.questrail.datagram.api;

/**
 * Base type for errors the datagram server reports synchronously to its caller.
 *
 * <p>Only construction and lifecycle calls throw these. Per-datagram and
 * per-response failures never propagate to the caller; they go to the
 * server's observability sink instead.</p>
 */
public class DatagramServerException extends RuntimeException {
    public DatagramServerException(String message) {
        super(message);
    }

    public DatagramServerException(String message, Throwable cause) {
        super(message, cause);
    }
}
