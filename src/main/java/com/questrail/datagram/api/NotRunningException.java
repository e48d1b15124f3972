package com.questrail.datagram.api;

/**
 * {@code stop()} was called on a server that is not in {@link ServerState#RUNNING}.
 */
public final class NotRunningException extends DatagramServerException {
    private final ServerState state;

    public NotRunningException(String serverName, ServerState state) {
        super("server " + serverName + " is not running (state " + state + ")");
        this.state = state;
    }

    public ServerState state() {
        return state;
    }
}
