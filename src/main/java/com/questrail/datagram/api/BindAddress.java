package com.questrail.datagram.api;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.util.Objects;

/**
 * BindAddress
 * -----------------------------------------------------------------------------
 * Parsed form of a {@code host:port} bind address string.
 *
 * <p>Accepted forms:</p>
 * <ul>
 *   <li>{@code ""} or {@code ":"} (wildcard host, OS-assigned port)</li>
 *   <li>{@code ":9000"} (wildcard host)</li>
 *   <li>{@code "127.0.0.1:0"}, {@code "localhost:9000"}</li>
 *   <li>{@code "[::1]:9000"} (IPv6 literals must be bracketed when a port follows)</li>
 *   <li>{@code "127.0.0.1"} (port omitted, OS-assigned)</li>
 * </ul>
 *
 * <p>Parsing is purely syntactic. Host names are resolved only by
 * {@link #resolve(NetworkFamily)}, which binders call during start.</p>
 *
 * @param host host name or literal, empty for the wildcard address
 * @param port port number in {@code [0, 65535]}, {@code 0} meaning OS-assigned
 */
public record BindAddress(String host, int port) {

    public BindAddress {
        Objects.requireNonNull(host, "host");
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    /**
     * Parses a bind address string.
     *
     * @throws IllegalArgumentException if the string is malformed
     */
    public static BindAddress parse(String address) {
        if (address == null) {
            throw new IllegalArgumentException("address must not be null");
        }
        String s = address.trim();
        if (s.isEmpty()) {
            return new BindAddress("", 0);
        }

        if (s.startsWith("[")) {
            int close = s.indexOf(']');
            if (close < 0) {
                throw new IllegalArgumentException("missing ']' in address: " + address);
            }
            String host = s.substring(1, close);
            String rest = s.substring(close + 1);
            if (rest.isEmpty()) {
                return new BindAddress(host, 0);
            }
            if (!rest.startsWith(":")) {
                throw new IllegalArgumentException("unexpected characters after ']' in address: " + address);
            }
            return new BindAddress(host, parsePort(rest.substring(1), address));
        }

        int first = s.indexOf(':');
        if (first < 0) {
            return new BindAddress(s, 0);
        }
        if (first != s.lastIndexOf(':')) {
            // Bare IPv6 literal without a port.
            return new BindAddress(s, 0);
        }
        return new BindAddress(s.substring(0, first), parsePort(s.substring(first + 1), address));
    }

    private static int parsePort(String port, String original) {
        if (port.isEmpty()) {
            return 0;
        }
        final int value;
        try {
            value = Integer.parseInt(port);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid port in address: " + original, e);
        }
        if (value < 0 || value > 65535) {
            throw new IllegalArgumentException("port out of range in address: " + original);
        }
        return value;
    }

    /**
     * @return {@code true} if no host was given
     */
    public boolean isWildcard() {
        return host.isEmpty();
    }

    /**
     * Resolves this address for the given family.
     *
     * <p>A wildcard host maps to {@code 0.0.0.0} for {@code udp4}, {@code ::}
     * for {@code udp6} and the platform's any-local address for {@code udp}.
     * A named host must resolve to an address of the requested family.</p>
     *
     * @throws UnknownHostException if the host cannot be resolved for the family
     */
    public InetSocketAddress resolve(NetworkFamily family) throws UnknownHostException {
        Objects.requireNonNull(family, "family");

        if (isWildcard()) {
            switch (family) {
                case UDP4:
                    return new InetSocketAddress(InetAddress.getByName("0.0.0.0"), port);
                case UDP6:
                    return new InetSocketAddress(InetAddress.getByName("::"), port);
                default:
                    return new InetSocketAddress(port);
            }
        }

        for (InetAddress candidate : InetAddress.getAllByName(host)) {
            if (family.accepts(candidate)) {
                return new InetSocketAddress(candidate, port);
            }
        }
        throw new UnknownHostException("no " + family + " address for host " + host);
    }

    @Override
    public String toString() {
        return host.indexOf(':') >= 0 ? "[" + host + "]:" + port : host + ":" + port;
    }
}
