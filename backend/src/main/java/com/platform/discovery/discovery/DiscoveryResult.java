package com.platform.discovery.discovery;

import com.platform.discovery.model.Adjacency;
import com.platform.discovery.model.DiscoveredNode;
import com.platform.discovery.model.InstanceKey;
import com.platform.discovery.model.InstanceReport;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Everything one discovery run accumulated: reports in poll order and
 * placeholders in the order they were first referenced.
 */
public record DiscoveryResult(
    List<InstanceReport> reports,
    List<DiscoveredNode> placeholders,
    boolean cancelled,
    Instant startedAt,
    Instant finishedAt
) {
    public DiscoveryResult {
        reports = List.copyOf(reports);
        placeholders = List.copyOf(placeholders);
    }

    /**
     * All adjacencies reported by polled instances, in report order.
     */
    public List<Adjacency> adjacencies() {
        return reports.stream()
            .flatMap(report -> report.getAdjacencies().stream())
            .toList();
    }

    public Optional<InstanceReport> report(InstanceKey key) {
        return reports.stream().filter(r -> r.getKey().equals(key)).findFirst();
    }

    public Optional<DiscoveredNode> placeholder(InstanceKey key) {
        return placeholders.stream().filter(p -> p.key().equals(key)).findFirst();
    }
}
