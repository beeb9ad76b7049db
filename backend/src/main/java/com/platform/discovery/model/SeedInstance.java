package com.platform.discovery.model;

/**
 * One row of a discovery seed list: where to connect and with which credentials.
 */
public record SeedInstance(
    String address,
    int port,
    String username,
    String password
) {
    public InstanceKey key() {
        return new InstanceKey(address, port);
    }

    @Override
    public String toString() {
        return "SeedInstance[" + address + ":" + port + ", username=" + username + "]";
    }
}
