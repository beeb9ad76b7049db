package com.platform.discovery.topology;

import com.platform.discovery.discovery.DiscoveryResult;
import com.platform.discovery.model.Adjacency;
import com.platform.discovery.model.DiscoveredNode;
import com.platform.discovery.model.InstanceKey;
import com.platform.discovery.model.InstanceReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns the reports and placeholders of a run into a layered topology graph.
 * 
 * Edges are deduplicated by their unordered pair of endpoints: when A reports a
 * relation to B and B reports one to A, the graph keeps only the first.
 */
@Slf4j
@Component
public class TopologyBuilder {
    
    private final RoleClassifier roleClassifier;
    
    public TopologyBuilder(RoleClassifier roleClassifier) {
        this.roleClassifier = roleClassifier;
    }
    
    public TopologyGraph build(DiscoveryResult result) {
        return build(result.reports(), result.placeholders(), result.adjacencies());
    }
    
    public TopologyGraph build(
            Collection<InstanceReport> reports,
            Collection<DiscoveredNode> placeholders,
            Collection<Adjacency> adjacencies) {
        
        Map<InstanceKey, TopologyNode> nodes = new LinkedHashMap<>();
        for (InstanceReport report : reports) {
            nodes.putIfAbsent(report.getKey(), polledNode(report));
        }
        for (DiscoveredNode placeholder : placeholders) {
            nodes.putIfAbsent(placeholder.key(), TopologyNode.discovered(placeholder.key()));
        }
        
        Set<EndpointPair> seen = new HashSet<>();
        List<TopologyEdge> edges = new ArrayList<>();
        int duplicates = 0;
        for (Adjacency adjacency : adjacencies) {
            if (adjacency.isSelfReference()) {
                continue;
            }
            if (!seen.add(EndpointPair.of(adjacency.from(), adjacency.to()))) {
                duplicates++;
                continue;
            }
            nodes.computeIfAbsent(adjacency.from(), TopologyNode::discovered);
            nodes.computeIfAbsent(adjacency.to(), TopologyNode::discovered);
            edges.add(new TopologyEdge(adjacency.from(), adjacency.to(), adjacency.relation()));
        }
        
        Map<RoleLayer, List<TopologyNode>> layers = new EnumMap<>(RoleLayer.class);
        for (TopologyNode node : nodes.values()) {
            layers.computeIfAbsent(node.layer(), layer -> new ArrayList<>()).add(node);
        }
        layers.replaceAll((layer, members) -> List.copyOf(members));
        
        log.debug("Built topology: {} nodes, {} edges ({} duplicate edges dropped), {} layers",
            nodes.size(), edges.size(), duplicates, layers.size());
        
        return new TopologyGraph(new ArrayList<>(nodes.values()), edges, Collections.unmodifiableMap(layers));
    }
    
    private TopologyNode polledNode(InstanceReport report) {
        return new TopologyNode(
            report.getKey(),
            TopologyNode.NodeKind.POLLED,
            roleClassifier.classify(report.getRoles()),
            report.getServerName().orElse(report.getKey().toString()),
            report.getOutcome(),
            report.getErrorDetail(),
            report.getRoles()
        );
    }
    
    /**
     * Unordered pair of endpoints.
     */
    private record EndpointPair(InstanceKey low, InstanceKey high) {
        static EndpointPair of(InstanceKey a, InstanceKey b) {
            return a.compareTo(b) <= 0 ? new EndpointPair(a, b) : new EndpointPair(b, a);
        }
    }
}
