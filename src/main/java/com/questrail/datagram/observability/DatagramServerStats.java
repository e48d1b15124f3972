package com.questrail.datagram.observability;

/**
 * Point-in-time snapshot of a server's traffic counters.
 *
 * @param datagramsReceived datagrams taken off the socket
 * @param requestsDispatched datagrams accepted onto the request queue
 * @param requestFailures    datagrams whose handler threw
 * @param responsesQueued    replies accepted onto the response queue
 * @param responsesWritten   replies written successfully
 * @param writeFailures      replies whose write failed (timeouts excluded)
 * @param writeTimeouts      replies whose write timed out
 * @param readErrors         failed socket reads
 * @param abandoned          datagrams or replies dropped by shutdown
 */
public record DatagramServerStats(
    long datagramsReceived,
    long requestsDispatched,
    long requestFailures,
    long responsesQueued,
    long responsesWritten,
    long writeFailures,
    long writeTimeouts,
    long readErrors,
    long abandoned
) {
}
