package com.platform.discovery.model;

import java.util.Optional;

/**
 * Identifies one splunkd instance by management address and port.
 * 
 * Addresses are compared as exact strings: "idx1", "IDX1" and "10.0.0.5"
 * are three different keys even if they resolve to the same host.
 */
public record InstanceKey(String address, int port) implements Comparable<InstanceKey> {

    public static final int DEFAULT_MANAGEMENT_PORT = 8089;

    public InstanceKey {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Instance address must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Instance port out of range: " + port);
        }
    }

    /**
     * Parse a reference such as "https://host:8089", "host:8089" or "host".
     * Returns empty for placeholders splunkd reports when nothing is configured
     * ("(none)", "self", blank) and for values that cannot be read as host:port.
     */
    public static Optional<InstanceKey> parse(String reference) {
        if (reference == null) {
            return Optional.empty();
        }
        String value = reference.trim();
        if (value.isEmpty() || value.equalsIgnoreCase("self") || value.startsWith("(")) {
            return Optional.empty();
        }

        int schemeEnd = value.indexOf("://");
        if (schemeEnd >= 0) {
            value = value.substring(schemeEnd + 3);
        }
        int pathStart = value.indexOf('/');
        if (pathStart >= 0) {
            value = value.substring(0, pathStart);
        }
        if (value.isEmpty()) {
            return Optional.empty();
        }

        String host = value;
        int port = DEFAULT_MANAGEMENT_PORT;
        int colon = value.lastIndexOf(':');
        if (colon >= 0) {
            host = value.substring(0, colon);
            try {
                port = Integer.parseInt(value.substring(colon + 1));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        if (host.isBlank() || port < 1 || port > 65535) {
            return Optional.empty();
        }
        return Optional.of(new InstanceKey(host, port));
    }

    @Override
    public int compareTo(InstanceKey other) {
        int byAddress = address.compareTo(other.address);
        return byAddress != 0 ? byAddress : Integer.compare(port, other.port);
    }

    @Override
    public String toString() {
        return address + ":" + port;
    }
}
