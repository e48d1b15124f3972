package com.questrail.datagram.api;

import java.util.Objects;

/**
 * Indicates that a server configuration was rejected at construction.
 *
 * <p>Nothing has been bound or started when this is thrown.</p>
 */
public final class InvalidConfigException extends DatagramServerException {
    private final String field;

    public InvalidConfigException(String field, String message) {
        super(field + ": " + message);
        this.field = Objects.requireNonNull(field, "field");
    }

    public InvalidConfigException(String field, String message, Throwable cause) {
        super(field + ": " + message, cause);
        this.field = Objects.requireNonNull(field, "field");
    }

    /**
     * @return the name of the configuration field that failed validation
     */
    public String field() {
        return field;
    }
}
