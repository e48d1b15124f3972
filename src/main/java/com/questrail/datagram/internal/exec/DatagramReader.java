package com.questrail.datagram.internal.exec;

import com.questrail.datagram.api.RawDatagram;
import com.questrail.datagram.observability.ErrorKind;
import com.questrail.datagram.transport.DatagramSocketHandle;

import java.io.IOException;
import java.nio.channels.ClosedChannelException;
import java.time.Instant;
import java.util.Objects;

/**
 * DatagramReader
 * =============================================================================
 * The single thread that reads from the server's socket.
 *
 * <h2>Why one reader</h2>
 * Datagram reads on one socket are serialized so that datagrams leave the
 * socket in kernel delivery order. Every datagram read here is handed to the
 * request pool; processing order after that is not guaranteed.
 *
 * <h2>Backpressure</h2>
 * When the request queue is full the reader blocks in
 * {@link BoundedWorkerPool#submit}. While it is blocked no further reads are
 * issued and the kernel receive buffer absorbs (or drops) the excess.
 *
 * <h2>Termination</h2>
 * <ul>
 *   <li>Cancellation fired: exit quietly, whatever the read outcome.</li>
 *   <li>Socket closed without cancellation: report and exit.</li>
 *   <li>Other read failures: report and keep reading, until
 *       {@code maxConsecutiveErrors} failures in a row.</li>
 * </ul>
 * On any exit that was not caused by cancellation, {@code onReaderStopped}
 * runs so the controller knows no more work will arrive.
 */
public final class DatagramReader implements Runnable {

    private final DatagramSocketHandle socket;
    private final BoundedWorkerPool<ReceivedDatagram> requestPool;
    private final CancellationSignal cancellation;
    private final int maxConsecutiveErrors;
    private final ObservabilityReporter reporter;
    private final ServerCounters counters;
    private final Runnable onReaderStopped;

    public DatagramReader(DatagramSocketHandle socket,
                          BoundedWorkerPool<ReceivedDatagram> requestPool,
                          CancellationSignal cancellation,
                          int maxConsecutiveErrors,
                          ObservabilityReporter reporter,
                          ServerCounters counters,
                          Runnable onReaderStopped) {
        if (maxConsecutiveErrors <= 0) {
            throw new IllegalArgumentException("maxConsecutiveErrors must be positive");
        }
        this.socket = Objects.requireNonNull(socket, "socket");
        this.requestPool = Objects.requireNonNull(requestPool, "requestPool");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
        this.maxConsecutiveErrors = maxConsecutiveErrors;
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.counters = Objects.requireNonNull(counters, "counters");
        this.onReaderStopped = Objects.requireNonNull(onReaderStopped, "onReaderStopped");
    }

    @Override
    public void run() {
        int consecutiveErrors = 0;

        while (!cancellation.isCancelled()) {
            final RawDatagram datagram;
            try {
                datagram = socket.receive();
            } catch (ClosedChannelException e) {
                if (!cancellation.isCancelled()) {
                    counters.readErrors.increment();
                    reporter.error(ErrorKind.READ, null, "socket closed unexpectedly", e);
                    onReaderStopped.run();
                }
                return;
            } catch (IOException e) {
                if (cancellation.isCancelled()) {
                    return;
                }
                counters.readErrors.increment();
                consecutiveErrors++;
                reporter.error(ErrorKind.READ, null,
                        "read failed (" + consecutiveErrors + " consecutive): " + e.getMessage(), e);
                if (consecutiveErrors >= maxConsecutiveErrors) {
                    onReaderStopped.run();
                    return;
                }
                // An interrupt that is not a shutdown must not poison the next read.
                Thread.interrupted();
                continue;
            }

            consecutiveErrors = 0;
            counters.datagramsReceived.increment();

            try {
                if (requestPool.submit(new ReceivedDatagram(datagram, Instant.now()), cancellation)) {
                    counters.requestsDispatched.increment();
                } else {
                    counters.abandoned.increment();
                    reporter.error(ErrorKind.ABANDONED, datagram.sender(),
                            "datagram dropped: server is shutting down", null);
                }
            } catch (InterruptedException e) {
                counters.abandoned.increment();
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
}
