package com.questrail.datagram.transport.udp;

import com.questrail.datagram.api.Response;
import com.questrail.datagram.api.ResponseHandler;
import com.questrail.datagram.transport.DatagramSocketHandle;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * Writes each response payload to its destination unchanged.
 *
 * <p>Without an explicit timeout the socket's default write timeout applies.</p>
 */
public final class VerbatimResponseHandler implements ResponseHandler {

    private final Duration writeTimeout;

    public VerbatimResponseHandler() {
        this.writeTimeout = null;
    }

    public VerbatimResponseHandler(Duration writeTimeout) {
        this.writeTimeout = Objects.requireNonNull(writeTimeout, "writeTimeout");
    }

    @Override
    public void write(DatagramSocketHandle socket, Response response) throws IOException {
        if (writeTimeout == null) {
            socket.send(response.destination(), response.payload());
        } else {
            socket.send(response.destination(), response.payload(), writeTimeout);
        }
    }
}
