package com.questrail.datagram.observability;

/**
 * Classifies steady-state failures reported by a running server.
 */
public enum ErrorKind {
    /** The socket read failed. */
    READ,
    /** The request handler threw while reading or processing a datagram. */
    REQUEST,
    /** The response handler failed to write a reply. */
    RESPONSE_WRITE,
    /** The response handler's write did not complete before its deadline. */
    WRITE_TIMEOUT,
    /** Queued work was dropped because shutdown's grace period ran out. */
    ABANDONED,
    /** An unexpected failure inside the server itself. */
    INTERNAL
}
