package com.platform.discovery.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.platform.discovery.discovery.DiscoveryResult;
import com.platform.discovery.error.ReportWriteException;
import com.platform.discovery.health.HealthMetrics;
import com.platform.discovery.model.Adjacency;
import com.platform.discovery.model.ClusterInfo;
import com.platform.discovery.model.ClusterInfo.SearchHeadClusterStatus;
import com.platform.discovery.model.HealthMetric;
import com.platform.discovery.model.InstanceInventory;
import com.platform.discovery.model.InstanceReport;
import com.platform.discovery.model.ReportSection;
import com.platform.discovery.model.ServerInfo;
import com.platform.discovery.model.WebSettings;
import com.platform.discovery.topology.TopologyGraph;
import com.platform.discovery.topology.TopologyNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Writes the discovery report CSV: one row per topology node, polled instances first.
 * 
 * Fixed columns are followed by a value and a status column for every known
 * health metric, then for configured or measured metrics outside that set.
 * Discovered nodes only fill the identifying columns. The management port is
 * the {@code port} column.
 */
@Component
public class DiscoveryReportWriter {
    
    static final List<String> FIXED_COLUMNS = List.of(
        "address", "port", "node_type", "layer", "outcome", "error", "username",
        "server_name", "guid", "version", "type", "os", "roles",
        "web_enabled", "web_port", "web_ssl",
        "receiving_ports", "tcp_input_ports", "udp_input_ports", "replication_port", "kvstore_port",
        "deployment_server", "cluster_masters", "shc_deployer",
        "cluster_label", "cluster_mode", "cluster_site", "cluster_search_factor", "cluster_replication_factor",
        "shc_label", "shc_replication_factor",
        "adjacencies", "unavailable_sections", "message_count", "app_count"
    );
    
    private static final String LIST_SEPARATOR = ";";
    
    private final CsvMapper csvMapper;
    
    public DiscoveryReportWriter(CsvMapper csvMapper) {
        this.csvMapper = csvMapper;
    }
    
    public String write(DiscoveryResult result, TopologyGraph graph, Collection<String> configuredMetrics) {
        List<String> metricNames = metricColumns(result, configuredMetrics);
        CsvSchema schema = schema(metricNames);
        
        List<Map<String, Object>> rows = new ArrayList<>();
        for (TopologyNode node : graph.nodes()) {
            Optional<InstanceReport> report = node.isPolled() ? result.report(node.key()) : Optional.empty();
            rows.add(row(node, report.orElse(null), metricNames));
        }
        
        try {
            return csvMapper.writer(schema).writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new ReportWriteException("Unable to write discovery report: " + e.getOriginalMessage(), e);
        }
    }
    
    static List<String> metricColumns(DiscoveryResult result, Collection<String> configuredMetrics) {
        Set<String> names = new LinkedHashSet<>(HealthMetrics.ALL);
        names.addAll(configuredMetrics);
        result.reports().forEach(report -> names.addAll(report.getHealthMetrics().keySet()));
        return new ArrayList<>(names);
    }
    
    static CsvSchema schema(List<String> metricNames) {
        CsvSchema.Builder builder = CsvSchema.builder();
        FIXED_COLUMNS.forEach(builder::addColumn);
        for (String metric : metricNames) {
            builder.addColumn(metric);
            builder.addColumn(metric + "_status");
        }
        return builder.setUseHeader(true).build();
    }
    
    private Map<String, Object> row(TopologyNode node, InstanceReport report, List<String> metricNames) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("address", node.key().address());
        row.put("port", node.key().port());
        row.put("node_type", node.isPolled() ? "polled" : "discovered");
        row.put("layer", node.layer().name());
        
        if (report == null) {
            return row;
        }
        
        Optional<ServerInfo> serverInfo = Optional.ofNullable(report.getServerInfo());
        row.put("outcome", report.getOutcome().name());
        row.put("error", report.getErrorDetail());
        row.put("username", report.getUsername());
        row.put("server_name", report.getServerName().orElse(null));
        row.put("guid", serverInfo.map(ServerInfo::guid).orElse(null));
        row.put("version", serverInfo.map(ServerInfo::version).orElse(null));
        row.put("type", serverInfo.map(ServerInfo::describeType).orElse(null));
        row.put("os", serverInfo.map(ServerInfo::os).orElse(null));
        row.put("roles", String.join(LIST_SEPARATOR, report.getRoles()));
        
        Optional<WebSettings> web = serverInfo.map(ServerInfo::web);
        row.put("web_enabled", web.map(WebSettings::enabled).orElse(null));
        row.put("web_port", web.map(WebSettings::port).orElse(null));
        row.put("web_ssl", web.map(WebSettings::sslEnabled).orElse(null));
        
        Optional<InstanceInventory> inventory = Optional.ofNullable(report.getInventory());
        Optional<ClusterInfo> cluster = Optional.ofNullable(report.getClusterInfo());
        row.put("receiving_ports", inventory.map(i -> joinPorts(i.receivingPorts())).orElse(null));
        row.put("tcp_input_ports", inventory.map(i -> joinPorts(i.tcpInputPorts())).orElse(null));
        row.put("udp_input_ports", inventory.map(i -> joinPorts(i.udpInputPorts())).orElse(null));
        row.put("replication_port", cluster.map(ClusterInfo::replicationPort).orElse(null));
        row.put("kvstore_port", inventory.map(InstanceInventory::kvStorePort).orElse(null));
        
        row.put("deployment_server", report.getDeploymentServerUri().orElse(null));
        row.put("cluster_masters", String.join(LIST_SEPARATOR, report.getClusterMasterUris()));
        row.put("shc_deployer", report.getShcDeployerUri().orElse(null));
        
        row.put("cluster_label", cluster.map(ClusterInfo::label).orElse(null));
        row.put("cluster_mode", cluster.map(ClusterInfo::mode).orElse(null));
        row.put("cluster_site", cluster.map(ClusterInfo::site).orElse(null));
        row.put("cluster_search_factor", cluster.map(ClusterInfo::searchFactor).orElse(null));
        row.put("cluster_replication_factor", cluster.map(ClusterInfo::replicationFactor).orElse(null));
        Optional<SearchHeadClusterStatus> shc = cluster.map(ClusterInfo::searchHeadCluster);
        row.put("shc_label", shc.map(SearchHeadClusterStatus::label).orElse(null));
        row.put("shc_replication_factor", shc.map(SearchHeadClusterStatus::replicationFactor).orElse(null));
        
        row.put("adjacencies", report.getAdjacencies().stream()
            .map(Adjacency::describe)
            .collect(Collectors.joining(LIST_SEPARATOR)));
        row.put("unavailable_sections", report.getUnavailableSections().stream()
            .map(ReportSection::name)
            .collect(Collectors.joining(LIST_SEPARATOR)));
        if (report.isSectionAvailable(ReportSection.MESSAGES)) {
            row.put("message_count", report.getMessages().size());
        }
        row.put("app_count", inventory.map(InstanceInventory::appCount).orElse(null));
        
        for (String metric : metricNames) {
            Optional<HealthMetric> measured = report.getHealthMetric(metric);
            row.put(metric, measured.map(HealthMetric::rawValue).orElse(null));
            row.put(metric + "_status", measured.map(m -> m.status().getLabel()).orElse(null));
        }
        return row;
    }
    
    private static String joinPorts(List<Integer> ports) {
        return ports.stream().map(String::valueOf).collect(Collectors.joining(LIST_SEPARATOR));
    }
}
