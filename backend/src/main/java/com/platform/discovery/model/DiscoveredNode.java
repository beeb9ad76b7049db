package com.platform.discovery.model;

/**
 * Instance referenced by another instance's adjacency list but never polled in the run.
 */
public record DiscoveredNode(
    InstanceKey key,
    InstanceKey referencedBy,
    Relation relation
) {
}
