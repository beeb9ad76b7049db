package com.platform.discovery.topology;

import com.platform.discovery.model.InstanceKey;
import com.platform.discovery.model.PollOutcome;
import com.platform.discovery.model.Relation;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DotTopologyRenderer}.
 */
class DotTopologyRendererTest {

    private static final InstanceKey SH1 = new InstanceKey("sh1", 8089);
    private static final InstanceKey IDX1 = new InstanceKey("idx1", 8089);
    private static final InstanceKey LM1 = new InstanceKey("lm1", 8089);

    private final DotTopologyRenderer renderer = new DotTopologyRenderer();

    private TopologyGraph graph() {
        TopologyNode sh = new TopologyNode(SH1, TopologyNode.NodeKind.POLLED, RoleLayer.SEARCH_HEAD, "search01",
            PollOutcome.PARTIAL, "MESSAGES: HTTP 500", Set.of("search_head"));
        TopologyNode idx = new TopologyNode(IDX1, TopologyNode.NodeKind.POLLED, RoleLayer.INDEXER, "idx1:8089",
            PollOutcome.FAILED, "Unable to reach idx1:8089", Set.of());
        TopologyNode lm = TopologyNode.discovered(LM1);

        Map<RoleLayer, List<TopologyNode>> layers = new LinkedHashMap<>();
        layers.put(RoleLayer.SEARCH_HEAD, List.of(sh));
        layers.put(RoleLayer.INDEXER, List.of(idx));
        layers.put(RoleLayer.DISCOVERED_NODE, List.of(lm));

        return new TopologyGraph(List.of(sh, idx, lm),
            List.of(new TopologyEdge(IDX1, SH1, Relation.SEARCH_PEER_OF),
                new TopologyEdge(SH1, LM1, Relation.LICENSE_PEER_OF)),
            layers);
    }

    @Test
    void testRender_OneRankSameClusterPerLayerInRankOrder() {
        String dot = renderer.render(graph(), TopologyStyle.defaults());

        assertThat(dot).startsWith("digraph splunk_topology {");
        assertThat(dot).containsSubsequence("label=\"Search Head\"", "label=\"Indexer\"", "label=\"Discovered Node\"");
        assertThat(dot.split("rank=same", -1)).hasSize(4);
        assertThat(dot.split("subgraph cluster_layer_", -1)).hasSize(4);
        assertThat(dot).doesNotContainPattern("subgraph (?!cluster_)");
    }

    @Test
    void testRender_LayerLabelBelongsToItsCluster() {
        String dot = renderer.render(graph(), TopologyStyle.defaults());

        assertThat(dot).containsSubsequence(
            "subgraph cluster_layer_0 {", "label=\"Search Head\";", "\"sh1:8089\" [",
            "subgraph cluster_layer_1 {", "label=\"Indexer\";", "\"idx1:8089\" [",
            "subgraph cluster_layer_2 {", "label=\"Discovered Node\";", "\"lm1:8089\" [");
    }

    @Test
    void testRender_EdgesCarryRelationLabels() {
        String dot = renderer.render(graph(), TopologyStyle.defaults());

        assertThat(dot).contains("\"idx1:8089\" -> \"sh1:8089\" [label=\"search peer of\"]");
        assertThat(dot).contains("\"sh1:8089\" -> \"lm1:8089\" [label=\"license peer of\"]");
    }

    @Test
    void testRender_OutcomeMarkers() {
        String dot = renderer.render(graph(), TopologyStyle.defaults());

        assertThat(dot).containsPattern("\"idx1:8089\" \\[.*color=\"red\"");
        assertThat(dot).containsPattern("\"sh1:8089\" \\[.*color=\"orange\"");
        assertThat(dot).containsPattern("\"lm1:8089\" \\[.*dashed");
    }

    @Test
    void testRender_UsesConfiguredLabelsAndColors() {
        TopologyStyle style = new TopologyStyle(
            Map.of(RoleLayer.INDEXER, "Indexer Tier"),
            Map.of(RoleLayer.INDEXER, "#00FF00"));

        String dot = renderer.render(graph(), style);

        assertThat(dot).contains("label=\"Indexer Tier\"");
        assertThat(dot).containsPattern("\"idx1:8089\" \\[.*fillcolor=\"#00FF00\"");
        assertThat(dot).containsPattern("\"sh1:8089\" \\[.*fillcolor=\"#FFFFFF\"");
    }

    @Test
    void testRender_ServerNameShownAboveKey() {
        String dot = renderer.render(graph(), TopologyStyle.defaults());

        assertThat(dot).contains("label=\"search01\\nsh1:8089\"");
    }
}
