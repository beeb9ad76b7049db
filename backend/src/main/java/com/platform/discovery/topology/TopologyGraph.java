package com.platform.discovery.topology;

import com.platform.discovery.model.InstanceKey;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Layered graph description handed to renderers. Contains no coordinates.
 * 
 * {@code layers} lists only non-empty layers, ordered by rank; nodes inside a
 * layer keep the order they were first seen in the run.
 */
public record TopologyGraph(
    List<TopologyNode> nodes,
    List<TopologyEdge> edges,
    Map<RoleLayer, List<TopologyNode>> layers
) {
    public TopologyGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public Optional<TopologyNode> node(InstanceKey key) {
        return nodes.stream().filter(n -> n.key().equals(key)).findFirst();
    }

    public List<TopologyEdge> edgesBetween(InstanceKey a, InstanceKey b) {
        return edges.stream().filter(e -> e.connects(a, b)).toList();
    }
}
