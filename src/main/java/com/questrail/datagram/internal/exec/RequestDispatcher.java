package com.questrail.datagram.internal.exec;

import com.questrail.datagram.api.RawDatagram;
import com.questrail.datagram.api.Request;
import com.questrail.datagram.api.RequestHandler;
import com.questrail.datagram.api.Response;
import com.questrail.datagram.observability.ErrorKind;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Request worker body: runs the request handler for one datagram and queues
 * the reply, if any.
 *
 * <p>A handler failure is confined to its datagram. It is reported and the
 * datagram gets no reply; the worker carries on with the next one. Exceptions
 * are reported as {@link ErrorKind#REQUEST}. Anything else the pool catches
 * around this body, such as an {@link Error}, arrives through
 * {@link #onFailure} and is reported as {@link ErrorKind#INTERNAL}.</p>
 *
 * <p>A reply is queued only after {@link RequestHandler#process} returned, so
 * it can never be written before its request was fully processed. When the
 * response queue is full this worker blocks; replies are not dropped unless
 * shutdown abandons them.</p>
 */
public final class RequestDispatcher implements Consumer<ReceivedDatagram> {

    private final RequestHandler requestHandler;
    private final BoundedWorkerPool<Response> responsePool;
    private final ObservabilityReporter reporter;
    private final ServerCounters counters;

    public RequestDispatcher(RequestHandler requestHandler,
                             BoundedWorkerPool<Response> responsePool,
                             ObservabilityReporter reporter,
                             ServerCounters counters) {
        this.requestHandler = Objects.requireNonNull(requestHandler, "requestHandler");
        this.responsePool = Objects.requireNonNull(responsePool, "responsePool");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.counters = Objects.requireNonNull(counters, "counters");
    }

    @Override
    public void accept(ReceivedDatagram received) {
        RawDatagram datagram = received.datagram();

        final Optional<Response> response;
        try {
            Request request = requestHandler.read(datagram, received.receivedAt());
            if (request == null) {
                throw new IllegalStateException("request handler returned no request");
            }
            response = requestHandler.process(request);
            if (response == null) {
                throw new IllegalStateException("request handler returned null instead of Optional.empty()");
            }
        } catch (RuntimeException e) {
            counters.requestFailures.increment();
            reporter.error(ErrorKind.REQUEST, datagram.sender(), "request handler failed: " + e.getMessage(), e);
            return;
        }

        if (response.isEmpty()) {
            return;
        }

        Response reply = response.get();
        try {
            if (responsePool.submit(reply, null)) {
                counters.responsesQueued.increment();
            } else {
                counters.abandoned.increment();
                reporter.error(ErrorKind.ABANDONED, reply.destination(),
                        "reply dropped: server is shutting down", null);
            }
        } catch (InterruptedException e) {
            counters.abandoned.increment();
            reporter.error(ErrorKind.ABANDONED, reply.destination(),
                    "reply dropped: interrupted while queueing", e);
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Failure callback for the request pool.
     */
    public void onFailure(ReceivedDatagram received, Throwable failure) {
        counters.requestFailures.increment();
        reporter.error(ErrorKind.INTERNAL, received.datagram().sender(),
                "request worker failed: " + failure, failure);
    }
}
