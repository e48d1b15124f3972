package com.questrail.datagram.api;

/**
 * Lifecycle states of a {@code DatagramServer}.
 *
 * <pre>
 *   CREATED ──start()──▶ RUNNING ──stop()──▶ STOPPING ──▶ STOPPED
 * </pre>
 *
 * <p>Transitions only move forward. {@code STOPPED} is terminal; a stopped
 * server cannot be restarted.</p>
 */
public enum ServerState {
    CREATED,
    RUNNING,
    STOPPING,
    STOPPED
}
