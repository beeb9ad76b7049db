package com.platform.discovery.model;

import java.util.List;

/**
 * Listening ports and installed app count of one instance.
 * Port lists are empty when the instance has no such inputs; kvStorePort is null when the KV store is absent.
 */
public record InstanceInventory(
    List<Integer> receivingPorts,
    List<Integer> tcpInputPorts,
    List<Integer> udpInputPorts,
    Integer kvStorePort,
    Integer appCount
) {
    public InstanceInventory {
        receivingPorts = receivingPorts == null ? List.of() : List.copyOf(receivingPorts);
        tcpInputPorts = tcpInputPorts == null ? List.of() : List.copyOf(tcpInputPorts);
        udpInputPorts = udpInputPorts == null ? List.of() : List.copyOf(udpInputPorts);
    }

    public static InstanceInventory empty() {
        return new InstanceInventory(List.of(), List.of(), List.of(), null, null);
    }
}
