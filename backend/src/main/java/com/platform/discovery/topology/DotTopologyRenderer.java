package com.platform.discovery.topology;

import com.platform.discovery.model.PollOutcome;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Renders a topology graph as Graphviz DOT text.
 * 
 * Each non-empty layer becomes a {@code cluster_layer_N} subgraph with
 * {@code rank=same}, so Graphviz stacks layers top to bottom by rank and draws
 * a labelled box around each one. The {@code cluster_} prefix is what makes
 * Graphviz draw the box and its label. Failed instances are outlined red,
 * partial ones orange, and discovered placeholders are dashed.
 */
@Component
public class DotTopologyRenderer {
    
    public String render(TopologyGraph graph, TopologyStyle style) {
        StringBuilder dot = new StringBuilder();
        dot.append("digraph splunk_topology {\n");
        dot.append("  rankdir=TB;\n");
        dot.append("  node [shape=box, style=\"rounded,filled\", fontname=\"Helvetica\"];\n");
        dot.append("  edge [fontname=\"Helvetica\", fontsize=9];\n");
        
        int index = 0;
        for (Map.Entry<RoleLayer, List<TopologyNode>> layer : graph.layers().entrySet()) {
            dot.append("\n  subgraph cluster_layer_").append(index++).append(" {\n");
            dot.append("    rank=same;\n");
            dot.append("    label=").append(quote(style.labelFor(layer.getKey()))).append(";\n");
            dot.append("    style=\"rounded,dashed\";\n");
            dot.append("    color=\"gray60\";\n");
            for (TopologyNode node : layer.getValue()) {
                dot.append("    ").append(quote(node.key().toString()))
                    .append(" [").append(nodeAttributes(node, style)).append("];\n");
            }
            dot.append("  }\n");
        }
        
        if (!graph.edges().isEmpty()) {
            dot.append('\n');
        }
        for (TopologyEdge edge : graph.edges()) {
            dot.append("  ").append(quote(edge.from().toString()))
                .append(" -> ").append(quote(edge.to().toString()))
                .append(" [label=").append(quote(edge.getRelationLabel())).append("];\n");
        }
        
        dot.append("}\n");
        return dot.toString();
    }
    
    private String nodeAttributes(TopologyNode node, TopologyStyle style) {
        StringBuilder attrs = new StringBuilder();
        String label = node.label().equals(node.key().toString())
            ? node.label()
            : node.label() + "\\n" + node.key();
        attrs.append("label=").append(quote(label, false));
        attrs.append(", fillcolor=").append(quote(style.colorFor(node.layer())));
        attrs.append(", tooltip=").append(quote(tooltip(node, style)));
        
        if (!node.isPolled()) {
            attrs.append(", style=\"rounded,filled,dashed\"");
        } else if (node.outcome() == PollOutcome.FAILED) {
            attrs.append(", color=\"red\", penwidth=2");
        } else if (node.outcome() == PollOutcome.PARTIAL) {
            attrs.append(", color=\"orange\", penwidth=2");
        }
        return attrs.toString();
    }
    
    private String tooltip(TopologyNode node, TopologyStyle style) {
        if (!node.isPolled()) {
            return "Discovered, not polled";
        }
        String text = style.labelFor(node.layer()) + " (" + node.outcome() + ")";
        return node.errorDetail() != null ? text + ": " + node.errorDetail() : text;
    }
    
    private static String quote(String value) {
        return quote(value, true);
    }
    
    private static String quote(String value, boolean escapeBackslash) {
        String escaped = escapeBackslash ? value.replace("\\", "\\\\") : value;
        return "\"" + escaped.replace("\"", "\\\"") + "\"";
    }
}
