package com.questrail.datagram.internal.exec;

import com.questrail.datagram.observability.DatagramServerStats;

import java.util.concurrent.atomic.LongAdder;

/**
 * Traffic counters shared by the reader and both worker pools.
 */
public final class ServerCounters {
    final LongAdder datagramsReceived = new LongAdder();
    final LongAdder requestsDispatched = new LongAdder();
    final LongAdder requestFailures = new LongAdder();
    final LongAdder responsesQueued = new LongAdder();
    final LongAdder responsesWritten = new LongAdder();
    final LongAdder writeFailures = new LongAdder();
    final LongAdder writeTimeouts = new LongAdder();
    final LongAdder readErrors = new LongAdder();
    final LongAdder abandoned = new LongAdder();

    public void addAbandoned(long count) {
        abandoned.add(count);
    }

    public DatagramServerStats snapshot() {
        return new DatagramServerStats(
            datagramsReceived.sum(),
            requestsDispatched.sum(),
            requestFailures.sum(),
            responsesQueued.sum(),
            responsesWritten.sum(),
            writeFailures.sum(),
            writeTimeouts.sum(),
            readErrors.sum(),
            abandoned.sum()
        );
    }
}
