package com.platform.discovery.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Normalized result of polling one instance during a discovery run.
 * Built once by the report builder and never modified afterwards.
 */
@Value
@Builder
public class InstanceReport {

    InstanceKey key;

    /**
     * Username the instance was polled with. The password is never kept.
     */
    String username;

    PollOutcome outcome;

    /**
     * Connection error for FAILED reports, summary of failed sections for PARTIAL ones.
     */
    String errorDetail;

    ServerInfo serverInfo;

    @Singular
    Set<String> roles;

    DeploymentInfo deploymentInfo;

    ClusterInfo clusterInfo;

    @Singular
    List<DiskPartition> diskPartitions;

    ResourceUsage resourceUsage;

    @Singular
    List<InstanceMessage> messages;

    InstanceInventory inventory;

    @Singular("adjacency")
    List<Adjacency> adjacencies;

    @Singular
    Map<String, HealthMetric> healthMetrics;

    /**
     * Sections that could not be gathered, with the error each one failed with.
     */
    @Singular
    Map<ReportSection, String> sectionErrors;

    Instant polledAt;

    long durationMs;

    public boolean isSectionAvailable(ReportSection section) {
        return outcome != PollOutcome.FAILED && !sectionErrors.containsKey(section);
    }

    public Set<ReportSection> getUnavailableSections() {
        if (outcome == PollOutcome.FAILED) {
            return EnumSet.allOf(ReportSection.class);
        }
        return sectionErrors.isEmpty() ? EnumSet.noneOf(ReportSection.class) : EnumSet.copyOf(sectionErrors.keySet());
    }

    public Optional<String> getServerName() {
        return Optional.ofNullable(serverInfo).map(ServerInfo::serverName);
    }

    public Optional<String> getDeploymentServerUri() {
        return Optional.ofNullable(deploymentInfo).map(DeploymentInfo::deploymentServerUri);
    }

    public List<String> getClusterMasterUris() {
        return deploymentInfo == null ? List.of() : deploymentInfo.clusterMasterUris();
    }

    public Optional<String> getShcDeployerUri() {
        return Optional.ofNullable(deploymentInfo).map(DeploymentInfo::shcDeployerUri);
    }

    public Optional<HealthMetric> getHealthMetric(String name) {
        return Optional.ofNullable(healthMetrics.get(name));
    }
}
