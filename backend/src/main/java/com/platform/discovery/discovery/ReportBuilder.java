package com.platform.discovery.discovery;

import com.platform.discovery.client.InstanceClient;
import com.platform.discovery.client.InstanceHandle;
import com.platform.discovery.error.FactFetchException;
import com.platform.discovery.error.InstanceConnectException;
import com.platform.discovery.health.HealthEvaluator;
import com.platform.discovery.health.HealthMetrics;
import com.platform.discovery.health.HealthThresholds;
import com.platform.discovery.model.Adjacency;
import com.platform.discovery.model.ClusterInfo;
import com.platform.discovery.model.ClusterInfo.ClusterMember;
import com.platform.discovery.model.DeploymentInfo;
import com.platform.discovery.model.DiskPartition;
import com.platform.discovery.model.HealthMetric;
import com.platform.discovery.model.InstanceInventory;
import com.platform.discovery.model.InstanceKey;
import com.platform.discovery.model.InstanceMessage;
import com.platform.discovery.model.InstanceReport;
import com.platform.discovery.model.PeerReference;
import com.platform.discovery.model.PollOutcome;
import com.platform.discovery.model.Relation;
import com.platform.discovery.model.ReportSection;
import com.platform.discovery.model.ResourceUsage;
import com.platform.discovery.model.SeedInstance;
import com.platform.discovery.model.ServerInfo;
import com.platform.discovery.observability.MetricsRegistry;
import com.platform.discovery.topology.RoleClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Polls one instance and assembles its {@link InstanceReport}.
 * 
 * A connection failure ends the poll with a FAILED report. After a successful
 * connect every fact category is requested in turn; a failing category is
 * recorded as unavailable and the poll continues with the next one.
 */
@Slf4j
@Component
public class ReportBuilder {
    
    private static final String CLUSTER_SEARCH_HEAD_ROLE = "cluster_search_head";
    
    private static final List<String> CLUSTER_METRICS = List.of(
        HealthMetrics.CLUSTER_MAINTENANCE, HealthMetrics.CLUSTER_ROLLING_RESTART,
        HealthMetrics.CLUSTER_ALL_DATA_SEARCHABLE, HealthMetrics.CLUSTER_SEARCH_FACTOR_MET,
        HealthMetrics.CLUSTER_REPLICATION_FACTOR_MET, HealthMetrics.CLUSTER_PEERS_NOT_SEARCHABLE,
        HealthMetrics.CLUSTER_SEARCH_HEADS_NOT_CONNECTED, HealthMetrics.SHC_ROLLING_RESTART,
        HealthMetrics.SHC_SERVICE_READY, HealthMetrics.SHC_MIN_PEERS_JOINED, HealthMetrics.SHC_MEMBERS_NOT_UP);
    
    private final InstanceClient instanceClient;
    private final HealthEvaluator healthEvaluator;
    private final MetricsRegistry metricsRegistry;
    
    public ReportBuilder(InstanceClient instanceClient, HealthEvaluator healthEvaluator,
                         MetricsRegistry metricsRegistry) {
        this.instanceClient = instanceClient;
        this.healthEvaluator = healthEvaluator;
        this.metricsRegistry = metricsRegistry;
    }
    
    public InstanceReport build(SeedInstance seed, DiscoveryContext context) {
        Instant started = Instant.now();
        InstanceKey key = seed.key();
        
        InstanceReport.InstanceReportBuilder report = InstanceReport.builder()
            .key(key)
            .username(seed.username())
            .polledAt(started);
        
        InstanceHandle handle;
        try {
            handle = instanceClient.connect(seed, context.timeout());
        } catch (InstanceConnectException e) {
            log.warn("Unable to connect to {}: {}", key, e.getMessage());
            long duration = elapsedMs(started);
            metricsRegistry.recordInstancePolled(PollOutcome.FAILED, duration);
            return report
                .outcome(PollOutcome.FAILED)
                .errorDetail(e.getMessage())
                .durationMs(duration)
                .build();
        }
        
        Map<ReportSection, String> errors = new EnumMap<>(ReportSection.class);
        
        Optional<ServerInfo> serverInfo = fetch(ReportSection.ROLES, errors, () -> instanceClient.getServerInfo(handle));
        Optional<List<PeerReference>> references = fetch(ReportSection.ADJACENCIES, errors,
            () -> instanceClient.getAdjacencies(handle));
        Optional<DeploymentInfo> deployment = fetch(ReportSection.DEPLOYMENT, errors,
            () -> instanceClient.getDeploymentInfo(handle));
        Optional<ClusterInfo> cluster = fetch(ReportSection.CLUSTER, errors, () -> instanceClient.getClusterInfo(handle));
        Optional<List<DiskPartition>> disks = fetch(ReportSection.DISK_USAGE, errors,
            () -> instanceClient.getDiskUsage(handle));
        Optional<ResourceUsage> resources = fetch(ReportSection.RESOURCE_USAGE, errors,
            () -> instanceClient.getResourceUsage(handle));
        Optional<List<InstanceMessage>> messages = fetch(ReportSection.MESSAGES, errors,
            () -> instanceClient.getMessages(handle));
        Optional<InstanceInventory> inventory = fetch(ReportSection.INVENTORY, errors,
            () -> instanceClient.getInventory(handle));
        
        Set<String> roles = new LinkedHashSet<>();
        serverInfo.ifPresent(info -> roles.addAll(info.roles()));
        if (context.isDesignated(key)) {
            roles.add(RoleClassifier.USER_DESIGNATED);
        }
        
        List<PeerReference> allReferences = new ArrayList<>(references.orElse(List.of()));
        deployment.ifPresent(info -> allReferences.addAll(deploymentReferences(info, roles)));
        cluster.ifPresent(info -> allReferences.addAll(clusterReferences(info)));
        
        serverInfo.ifPresent(report::serverInfo);
        deployment.ifPresent(report::deploymentInfo);
        cluster.ifPresent(report::clusterInfo);
        disks.ifPresent(report::diskPartitions);
        resources.ifPresent(report::resourceUsage);
        messages.ifPresent(report::messages);
        inventory.ifPresent(report::inventory);
        
        PollOutcome outcome = errors.isEmpty() ? PollOutcome.SUCCESS : PollOutcome.PARTIAL;
        long duration = elapsedMs(started);
        metricsRegistry.recordInstancePolled(outcome, duration);
        if (outcome == PollOutcome.PARTIAL) {
            log.warn("Partial report for {}: unavailable sections {}", key, errors.keySet());
        } else {
            log.info("Polled {} in {}ms", key, duration);
        }
        
        return report
            .outcome(outcome)
            .errorDetail(errors.isEmpty() ? null : describeErrors(errors))
            .roles(roles)
            .adjacencies(normalize(key, allReferences))
            .healthMetrics(measure(serverInfo, cluster, disks, resources, messages, errors, context.thresholds()))
            .sectionErrors(errors)
            .durationMs(duration)
            .build();
    }
    
    // ==================== Sections ====================
    
    private <T> Optional<T> fetch(ReportSection section, Map<ReportSection, String> errors, Supplier<T> call) {
        try {
            return Optional.ofNullable(call.get());
        } catch (FactFetchException e) {
            log.debug("Section {} unavailable: {}", section, e.getMessage());
            errors.put(section, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Unexpected error gathering section {}", section, e);
            errors.put(section, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
        metricsRegistry.recordSectionFailure(section.name());
        return Optional.empty();
    }
    
    private static String describeErrors(Map<ReportSection, String> errors) {
        return errors.entrySet().stream()
            .map(entry -> entry.getKey() + ": " + entry.getValue())
            .collect(Collectors.joining("; "));
    }
    
    // ==================== Adjacencies ====================
    
    private static List<PeerReference> deploymentReferences(DeploymentInfo info, Set<String> roles) {
        List<PeerReference> references = new ArrayList<>();
        if (info.deploymentServerUri() != null) {
            references.add(PeerReference.outbound(info.deploymentServerUri(), Relation.DEPLOYMENT_CLIENT_OF));
        }
        Relation masterRelation = roles.contains(CLUSTER_SEARCH_HEAD_ROLE)
            ? Relation.CLUSTER_SEARCH_HEAD_OF
            : Relation.CLUSTER_MEMBER_OF;
        for (String masterUri : info.clusterMasterUris()) {
            references.add(PeerReference.outbound(masterUri, masterRelation));
        }
        if (info.shcDeployerUri() != null) {
            references.add(PeerReference.outbound(info.shcDeployerUri(), Relation.SHC_DEPLOYER_CLIENT_OF));
        }
        return references;
    }
    
    private static List<PeerReference> clusterReferences(ClusterInfo info) {
        List<PeerReference> references = new ArrayList<>();
        if (info.isMaster()) {
            for (ClusterMember peer : info.master().peers()) {
                references.add(PeerReference.inbound(peer.reference(), Relation.CLUSTER_MEMBER_OF));
            }
            for (ClusterMember searchHead : info.master().searchHeads()) {
                references.add(PeerReference.inbound(searchHead.reference(), Relation.CLUSTER_SEARCH_HEAD_OF));
            }
        }
        if (info.isSearchHeadClusterMember()) {
            for (ClusterMember member : info.searchHeadCluster().members()) {
                references.add(PeerReference.outbound(member.reference(), Relation.SHC_PEER_OF));
            }
        }
        return references;
    }
    
    /**
     * Resolve references to keys, dropping unreadable and self references and exact repeats.
     */
    static List<Adjacency> normalize(InstanceKey self, List<PeerReference> references) {
        Set<Adjacency> adjacencies = new LinkedHashSet<>();
        for (PeerReference reference : references) {
            Optional<InstanceKey> other = InstanceKey.parse(reference.reference());
            if (other.isEmpty()) {
                log.debug("Ignoring unreadable reference '{}' ({})", reference.reference(), reference.relation());
                continue;
            }
            Adjacency adjacency = reference.toAdjacency(self, other.get());
            if (!adjacency.isSelfReference()) {
                adjacencies.add(adjacency);
            }
        }
        return new ArrayList<>(adjacencies);
    }
    
    // ==================== Health ====================
    
    private Map<String, HealthMetric> measure(
            Optional<ServerInfo> serverInfo,
            Optional<ClusterInfo> cluster,
            Optional<List<DiskPartition>> disks,
            Optional<ResourceUsage> resources,
            Optional<List<InstanceMessage>> messages,
            Map<ReportSection, String> errors,
            HealthThresholds thresholds) {
        
        Map<String, Object> values = new LinkedHashMap<>();
        Set<String> unavailable = new LinkedHashSet<>();
        
        if (serverInfo.isPresent()) {
            ServerInfo info = serverInfo.get();
            values.put(HealthMetrics.VERSION, minorVersion(info.version()));
            values.put(HealthMetrics.UPTIME_SECONDS, info.startupTime() != null
                ? Duration.between(info.startupTime(), Instant.now()).getSeconds() : null);
            values.put(HealthMetrics.WEB_SSL_ENABLED, info.webSslEnabled());
            values.put(HealthMetrics.CPU_CORES, info.cores());
            values.put(HealthMetrics.RAM_MB, info.physicalMemoryMb());
        } else {
            unavailable.addAll(List.of(HealthMetrics.VERSION, HealthMetrics.UPTIME_SECONDS,
                HealthMetrics.WEB_SSL_ENABLED, HealthMetrics.CPU_CORES, HealthMetrics.RAM_MB));
        }
        
        if (messages.isPresent()) {
            values.put(HealthMetrics.MESSAGES_COUNT, messages.get().stream().filter(m -> !m.isInformational()).count());
        } else {
            unavailable.add(HealthMetrics.MESSAGES_COUNT);
        }
        
        if (resources.isPresent()) {
            ResourceUsage usage = resources.get();
            values.put(HealthMetrics.CPU_USAGE_PCT, usage.cpuUsagePct());
            values.put(HealthMetrics.MEM_USAGE_PCT, usage.memUsagePct());
            values.put(HealthMetrics.SWAP_USAGE_PCT, usage.swapUsagePct());
        } else {
            unavailable.addAll(List.of(HealthMetrics.CPU_USAGE_PCT, HealthMetrics.MEM_USAGE_PCT,
                HealthMetrics.SWAP_USAGE_PCT));
        }
        
        // Worst partition decides
        if (disks.isPresent()) {
            values.put(HealthMetrics.DISK_USAGE_PCT,
                disks.get().stream().map(DiskPartition::usedPercent).max(Double::compare).orElse(null));
            values.put(HealthMetrics.DISK_FREE_GB,
                disks.get().stream().map(DiskPartition::freeGb).min(Double::compare).orElse(null));
        } else {
            unavailable.addAll(List.of(HealthMetrics.DISK_USAGE_PCT, HealthMetrics.DISK_FREE_GB));
        }
        
        if (cluster.isPresent()) {
            ClusterInfo info = cluster.get();
            if (info.isMaster()) {
                ClusterInfo.MasterStatus master = info.master();
                values.put(HealthMetrics.CLUSTER_MAINTENANCE, master.maintenanceMode());
                values.put(HealthMetrics.CLUSTER_ROLLING_RESTART, master.rollingRestart());
                values.put(HealthMetrics.CLUSTER_ALL_DATA_SEARCHABLE, master.allDataSearchable());
                values.put(HealthMetrics.CLUSTER_SEARCH_FACTOR_MET, master.searchFactorMet());
                values.put(HealthMetrics.CLUSTER_REPLICATION_FACTOR_MET, master.replicationFactorMet());
                values.put(HealthMetrics.CLUSTER_PEERS_NOT_SEARCHABLE, master.peersNotSearchable());
                values.put(HealthMetrics.CLUSTER_SEARCH_HEADS_NOT_CONNECTED, master.searchHeadsNotConnected());
            }
            if (info.isSearchHeadClusterMember()) {
                ClusterInfo.SearchHeadClusterStatus shc = info.searchHeadCluster();
                values.put(HealthMetrics.SHC_ROLLING_RESTART, shc.rollingRestart());
                values.put(HealthMetrics.SHC_SERVICE_READY, shc.serviceReady());
                values.put(HealthMetrics.SHC_MIN_PEERS_JOINED, shc.minPeersJoined());
                values.put(HealthMetrics.SHC_MEMBERS_NOT_UP, shc.membersNotUp());
            }
        } else if (errors.containsKey(ReportSection.CLUSTER)) {
            unavailable.addAll(CLUSTER_METRICS);
        }
        
        Map<String, HealthMetric> metrics = new LinkedHashMap<>();
        values.forEach((name, value) -> metrics.put(name, healthEvaluator.measure(name, value, thresholds)));
        unavailable.forEach(name -> metrics.put(name, HealthMetric.unknown(name)));
        return metrics;
    }
    
    /**
     * "9.1.2" becomes 9.1; versions that do not start with a number are unknown.
     */
    static Double minorVersion(String version) {
        if (version == null) {
            return null;
        }
        String[] parts = version.trim().split("\\.");
        try {
            int major = Integer.parseInt(parts[0]);
            int minor = parts.length > 1 ? Integer.parseInt(parts[1].replaceAll("\\D.*$", "")) : 0;
            return Double.parseDouble(major + "." + minor);
        } catch (NumberFormatException e) {
            return null;
        }
    }
    
    private static long elapsedMs(Instant started) {
        return Duration.between(started, Instant.now()).toMillis();
    }
}
