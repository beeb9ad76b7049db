package com.platform.discovery.topology;

import com.platform.discovery.model.InstanceKey;
import com.platform.discovery.model.PollOutcome;

import java.util.Set;

/**
 * Node of the topology graph: a polled instance or a discovered placeholder.
 */
public record TopologyNode(
    InstanceKey key,
    NodeKind kind,
    RoleLayer layer,
    String label,
    PollOutcome outcome,
    String errorDetail,
    Set<String> roles
) {
    public enum NodeKind {
        POLLED,
        DISCOVERED
    }

    public TopologyNode {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }

    public static TopologyNode discovered(InstanceKey key) {
        return new TopologyNode(key, NodeKind.DISCOVERED, RoleLayer.DISCOVERED_NODE, key.toString(), null, null, Set.of());
    }

    public boolean isPolled() {
        return kind == NodeKind.POLLED;
    }
}
