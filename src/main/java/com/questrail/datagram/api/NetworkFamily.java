package com.questrail.datagram.api;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.util.Optional;

/**
 * NetworkFamily
 * -----------------------------------------------------------------------------
 * The datagram network families a server may bind to.
 *
 * <p>{@link #UDP} lets the platform choose between IPv4 and IPv6 for the
 * wildcard or the resolved host; {@link #UDP4} and {@link #UDP6} pin the
 * protocol family.</p>
 */
public enum NetworkFamily {
    UDP("udp"),
    UDP4("udp4"),
    UDP6("udp6");

    private final String networkName;

    NetworkFamily(String networkName) {
        this.networkName = networkName;
    }

    /**
     * @return the configuration name of this family ({@code udp}, {@code udp4}, {@code udp6})
     */
    public String networkName() {
        return networkName;
    }

    /**
     * @return {@code true} if an address of this kind may be bound under this family
     */
    public boolean accepts(InetAddress address) {
        switch (this) {
            case UDP4:
                return address instanceof Inet4Address;
            case UDP6:
                return address instanceof Inet6Address;
            default:
                return true;
        }
    }

    /**
     * Looks up a family by its exact configuration name ({@code udp},
     * {@code udp4} or {@code udp6}; lower case, no surrounding whitespace).
     *
     * @param name configuration name, may be null
     * @return the matching family, or empty if the name is not recognized
     */
    public static Optional<NetworkFamily> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (NetworkFamily family : values()) {
            if (family.networkName.equals(name)) {
                return Optional.of(family);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return networkName;
    }
}
