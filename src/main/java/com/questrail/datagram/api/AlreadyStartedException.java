package com.questrail.datagram.api;

/**
 * {@code start()} was called on a server that is not in {@link ServerState#CREATED}.
 */
public final class AlreadyStartedException extends DatagramServerException {
    private final ServerState state;

    public AlreadyStartedException(String serverName, ServerState state) {
        super("server " + serverName + " already started (state " + state + ")");
        this.state = state;
    }

    public ServerState state() {
        return state;
    }
}
