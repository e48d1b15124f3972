package com.questrail.datagram.internal.exec;

import com.questrail.datagram.api.Response;
import com.questrail.datagram.api.ResponseHandler;
import com.questrail.datagram.observability.ErrorKind;
import com.questrail.datagram.transport.DatagramSocketHandle;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Response worker body: hands one reply to the response handler.
 *
 * <p>Timeouts and other write failures are confined to their reply and
 * reported under separate {@link ErrorKind}s. Anything the pool catches
 * around this body, such as an {@link Error}, arrives through
 * {@link #onFailure} and is reported as {@link ErrorKind#INTERNAL}.</p>
 */
public final class ResponseWriter implements Consumer<Response> {

    private final ResponseHandler responseHandler;
    private final DatagramSocketHandle socket;
    private final ObservabilityReporter reporter;
    private final ServerCounters counters;

    public ResponseWriter(ResponseHandler responseHandler,
                          DatagramSocketHandle socket,
                          ObservabilityReporter reporter,
                          ServerCounters counters) {
        this.responseHandler = Objects.requireNonNull(responseHandler, "responseHandler");
        this.socket = Objects.requireNonNull(socket, "socket");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.counters = Objects.requireNonNull(counters, "counters");
    }

    @Override
    public void accept(Response response) {
        try {
            responseHandler.write(socket, response);
            counters.responsesWritten.increment();
        } catch (SocketTimeoutException e) {
            counters.writeTimeouts.increment();
            reporter.error(ErrorKind.WRITE_TIMEOUT, response.destination(), "write timed out: " + e.getMessage(), e);
        } catch (IOException | RuntimeException e) {
            counters.writeFailures.increment();
            reporter.error(ErrorKind.RESPONSE_WRITE, response.destination(), "write failed: " + e.getMessage(), e);
        }
    }

    /**
     * Failure callback for the response pool.
     */
    public void onFailure(Response response, Throwable failure) {
        counters.writeFailures.increment();
        reporter.error(ErrorKind.INTERNAL, response.destination(),
                "response worker failed: " + failure, failure);
    }
}
