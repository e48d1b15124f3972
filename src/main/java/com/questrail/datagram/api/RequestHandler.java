package com.questrail.datagram.api;

import java.time.Instant;
import java.util.Optional;

/**
 * RequestHandler
 * -----------------------------------------------------------------------------
 * Capability that interprets a received datagram and decides on a reply.
 *
 * <p>Both methods are called once per datagram, in order, on a request worker
 * thread. Several workers call into the same handler concurrently, so any state
 * shared between invocations needs the implementation's own synchronization.</p>
 *
 * <p>Any exception thrown from either method is isolated to that datagram: it is
 * reported through the server's observability sink and the datagram gets no
 * reply. Other datagrams are unaffected.</p>
 */
public interface RequestHandler {
    /**
     * Turn a raw datagram into a {@link Request}.
     *
     * <p>The default keeps the payload as-is and stamps the receive time.
     * Handlers that decode the payload up front attach the result with
     * {@link Request#withContext(Object)}.</p>
     */
    default Request read(RawDatagram datagram, Instant receivedAt) {
        return Request.of(datagram, receivedAt);
    }

    /**
     * Process a request.
     *
     * @return the reply to send, or empty if no reply should be sent
     */
    Optional<Response> process(Request request);
}
