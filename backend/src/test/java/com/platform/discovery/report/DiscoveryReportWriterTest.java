package com.platform.discovery.report;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.platform.discovery.discovery.DiscoveryResult;
import com.platform.discovery.health.HealthMetrics;
import com.platform.discovery.model.Adjacency;
import com.platform.discovery.model.ClusterInfo;
import com.platform.discovery.model.ClusterInfo.SearchHeadClusterStatus;
import com.platform.discovery.model.DeploymentInfo;
import com.platform.discovery.model.DiscoveredNode;
import com.platform.discovery.model.HealthMetric;
import com.platform.discovery.model.HealthStatus;
import com.platform.discovery.model.InstanceInventory;
import com.platform.discovery.model.InstanceKey;
import com.platform.discovery.model.InstanceMessage;
import com.platform.discovery.model.InstanceReport;
import com.platform.discovery.model.PollOutcome;
import com.platform.discovery.model.Relation;
import com.platform.discovery.model.ReportSection;
import com.platform.discovery.model.ServerInfo;
import com.platform.discovery.model.WebSettings;
import com.platform.discovery.topology.RoleClassifier;
import com.platform.discovery.topology.TopologyBuilder;
import com.platform.discovery.topology.TopologyGraph;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DiscoveryReportWriter}.
 */
class DiscoveryReportWriterTest {

    private static final InstanceKey SH1 = new InstanceKey("sh1", 8089);
    private static final InstanceKey IDX1 = new InstanceKey("idx1", 8089);
    private static final InstanceKey DS1 = new InstanceKey("ds1", 8089);

    private final CsvMapper csvMapper = new CsvMapper();
    private final DiscoveryReportWriter writer = new DiscoveryReportWriter(csvMapper);
    private final TopologyBuilder topologyBuilder = new TopologyBuilder(new RoleClassifier());

    private DiscoveryResult result() {
        InstanceReport sh = InstanceReport.builder()
            .key(SH1)
            .username("admin")
            .outcome(PollOutcome.PARTIAL)
            .errorDetail("DISK_USAGE: HTTP 500")
            .serverInfo(new ServerInfo("search01", "guid-1", "9.1.2", "enterprise", "normal", "Linux x86_64",
                Set.of("search_head"), 16, 32768L, null, new WebSettings(true, 8000, true)))
            .role("search_head")
            .deploymentInfo(new DeploymentInfo("https://ds1:8089", List.of(), null))
            .clusterInfo(new ClusterInfo("searchhead", "idxc1", "site1", 3, 2, 9887, null,
                new SearchHeadClusterStatus("shc1", 2, "https://sh2:8089", false, true, true, List.of())))
            .inventory(new InstanceInventory(List.of(9997, 9998), List.of(), List.of(514), 8191, 57))
            .message(new InstanceMessage("restart_required", "WARN", "Restart required", null))
            .adjacency(new Adjacency(SH1, DS1, Relation.DEPLOYMENT_CLIENT_OF))
            .adjacency(new Adjacency(IDX1, SH1, Relation.SEARCH_PEER_OF))
            .healthMetric("cpu_usage_pct", new HealthMetric("cpu_usage_pct", "92", HealthStatus.WARNING))
            .healthMetric("license_usage_pct", new HealthMetric("license_usage_pct", "40", HealthStatus.UNKNOWN))
            .sectionError(ReportSection.DISK_USAGE, "HTTP 500")
            .build();
        InstanceReport idx = InstanceReport.builder()
            .key(IDX1)
            .username("admin")
            .outcome(PollOutcome.FAILED)
            .errorDetail("Unable to reach idx1:8089")
            .build();
        return new DiscoveryResult(List.of(sh, idx),
            List.of(new DiscoveredNode(DS1, SH1, Relation.DEPLOYMENT_CLIENT_OF)),
            false, Instant.now(), Instant.now());
    }

    private List<Map<String, String>> parse(String csv) throws Exception {
        try (MappingIterator<Map<String, String>> rows = csvMapper.readerForMapOf(String.class)
                .with(CsvSchema.emptySchema().withHeader())
                .readValues(csv)) {
            return rows.readAll();
        }
    }

    @Test
    void testWrite_HeaderHasFixedThenKnownThenExtraMetricColumns() {
        DiscoveryResult result = result();
        TopologyGraph graph = topologyBuilder.build(result);

        String csv = writer.write(result, graph, List.of("cpu_usage_pct", "uptime"));

        List<String> expected = new ArrayList<>(DiscoveryReportWriter.FIXED_COLUMNS);
        for (String metric : HealthMetrics.ALL) {
            expected.add(metric);
            expected.add(metric + "_status");
        }
        expected.addAll(List.of("uptime", "uptime_status", "license_usage_pct", "license_usage_pct_status"));
        assertThat(csv.lines().findFirst()).contains(String.join(",", expected));
    }

    @Test
    void testWrite_MeasuredMetricWithoutThresholdStillExported() throws Exception {
        DiscoveryResult result = result();

        List<Map<String, String>> rows = parse(writer.write(result, topologyBuilder.build(result), List.of()));
        Map<String, String> sh = rows.stream().filter(r -> r.get("address").equals("sh1")).findFirst().orElseThrow();

        assertThat(sh.get("cpu_usage_pct")).isEqualTo("92");
        assertThat(sh.get("license_usage_pct")).isEqualTo("40");
        assertThat(sh.get("license_usage_pct_status")).isEqualTo(HealthStatus.UNKNOWN.getLabel());
    }

    @Test
    void testWrite_OneRowPerNode() throws Exception {
        DiscoveryResult result = result();
        TopologyGraph graph = topologyBuilder.build(result);

        List<Map<String, String>> rows = parse(writer.write(result, graph, List.of("cpu_usage_pct")));

        assertThat(rows).hasSize(graph.nodes().size());
        assertThat(rows).extracting(r -> r.get("address")).containsExactlyInAnyOrder("sh1", "idx1", "ds1");
    }

    @Test
    void testWrite_PolledRowCarriesReportFields() throws Exception {
        DiscoveryResult result = result();

        List<Map<String, String>> rows = parse(writer.write(result, topologyBuilder.build(result), List.of("cpu_usage_pct", "uptime")));
        Map<String, String> sh = rows.stream().filter(r -> r.get("address").equals("sh1")).findFirst().orElseThrow();

        assertThat(sh.get("node_type")).isEqualTo("polled");
        assertThat(sh.get("outcome")).isEqualTo("PARTIAL");
        assertThat(sh.get("server_name")).isEqualTo("search01");
        assertThat(sh.get("guid")).isEqualTo("guid-1");
        assertThat(sh.get("type")).isEqualTo("Splunk Enterprise v9.1.2");
        assertThat(sh.get("os")).isEqualTo("Linux x86_64");
        assertThat(sh.get("deployment_server")).isEqualTo("https://ds1:8089");
        assertThat(sh.get("adjacencies")).isEqualTo(
            "sh1:8089 deployment client of ds1:8089;idx1:8089 search peer of sh1:8089");
        assertThat(sh.get("unavailable_sections")).isEqualTo("DISK_USAGE");
        assertThat(sh.get("cpu_usage_pct")).isEqualTo("92");
        assertThat(sh.get("cpu_usage_pct_status")).isEqualTo("Warning");
        assertThat(sh.get("uptime")).isEmpty();
    }

    @Test
    void testWrite_PolledRowCarriesPortsClusterAndCounts() throws Exception {
        DiscoveryResult result = result();

        List<Map<String, String>> rows = parse(writer.write(result, topologyBuilder.build(result), List.of()));
        Map<String, String> sh = rows.stream().filter(r -> r.get("address").equals("sh1")).findFirst().orElseThrow();

        assertThat(sh.get("port")).isEqualTo("8089");
        assertThat(sh.get("web_enabled")).isEqualTo("true");
        assertThat(sh.get("web_port")).isEqualTo("8000");
        assertThat(sh.get("web_ssl")).isEqualTo("true");
        assertThat(sh.get("receiving_ports")).isEqualTo("9997;9998");
        assertThat(sh.get("tcp_input_ports")).isEmpty();
        assertThat(sh.get("udp_input_ports")).isEqualTo("514");
        assertThat(sh.get("replication_port")).isEqualTo("9887");
        assertThat(sh.get("kvstore_port")).isEqualTo("8191");
        assertThat(sh.get("cluster_label")).isEqualTo("idxc1");
        assertThat(sh.get("cluster_mode")).isEqualTo("searchhead");
        assertThat(sh.get("cluster_site")).isEqualTo("site1");
        assertThat(sh.get("cluster_search_factor")).isEqualTo("2");
        assertThat(sh.get("cluster_replication_factor")).isEqualTo("3");
        assertThat(sh.get("shc_label")).isEqualTo("shc1");
        assertThat(sh.get("shc_replication_factor")).isEqualTo("2");
        assertThat(sh.get("message_count")).isEqualTo("1");
        assertThat(sh.get("app_count")).isEqualTo("57");
    }

    @Test
    void testWrite_FailedRowListsEverySectionUnavailable() throws Exception {
        DiscoveryResult result = result();

        List<Map<String, String>> rows = parse(writer.write(result, topologyBuilder.build(result), List.of()));
        Map<String, String> idx = rows.stream().filter(r -> r.get("address").equals("idx1")).findFirst().orElseThrow();

        assertThat(idx.get("outcome")).isEqualTo("FAILED");
        assertThat(idx.get("error")).isEqualTo("Unable to reach idx1:8089");
        assertThat(idx.get("unavailable_sections").split(";")).hasSize(ReportSection.values().length);
        assertThat(idx.get("message_count")).isEmpty();
        assertThat(idx.get("app_count")).isEmpty();
    }

    @Test
    void testWrite_DiscoveredRowOnlyIdentifiesTheNode() throws Exception {
        DiscoveryResult result = result();

        List<Map<String, String>> rows = parse(writer.write(result, topologyBuilder.build(result), List.of()));
        Map<String, String> ds = rows.stream().filter(r -> r.get("address").equals("ds1")).findFirst().orElseThrow();

        assertThat(ds.get("node_type")).isEqualTo("discovered");
        assertThat(ds.get("layer")).isEqualTo("DISCOVERED_NODE");
        assertThat(ds.get("outcome")).isEmpty();
        assertThat(ds.get("username")).isEmpty();
    }
}
