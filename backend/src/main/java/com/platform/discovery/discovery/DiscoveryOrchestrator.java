package com.platform.discovery.discovery;

import com.platform.discovery.error.InvalidSeedListException;
import com.platform.discovery.model.Adjacency;
import com.platform.discovery.model.DiscoveredNode;
import com.platform.discovery.model.InstanceKey;
import com.platform.discovery.model.InstanceReport;
import com.platform.discovery.model.PollOutcome;
import com.platform.discovery.model.SeedInstance;
import com.platform.discovery.observability.LoggingContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Polls a seed list sequentially and accumulates reports and placeholders.
 * 
 * Instances referenced by a report but absent from the seed list become
 * placeholders; they are never polled. A placeholder that is later reached as
 * a seed is polled and replaced by its report.
 */
@Slf4j
@Component
public class DiscoveryOrchestrator {
    
    private final ReportBuilder reportBuilder;
    
    public DiscoveryOrchestrator(ReportBuilder reportBuilder) {
        this.reportBuilder = reportBuilder;
    }
    
    /**
     * Reject seed lists that cannot be polled. Rows are numbered from 1.
     * @throws InvalidSeedListException on an empty list or an invalid row
     */
    public static void validate(List<SeedInstance> seeds) {
        if (seeds == null || seeds.isEmpty()) {
            throw new InvalidSeedListException("Seed list is empty");
        }
        for (int i = 0; i < seeds.size(); i++) {
            SeedInstance seed = seeds.get(i);
            int row = i + 1;
            if (seed == null) {
                throw new InvalidSeedListException(row, "address", "Seed is missing");
            }
            if (seed.address() == null || seed.address().isBlank()) {
                throw new InvalidSeedListException(row, "address", "Address must not be blank");
            }
            if (seed.port() < 1 || seed.port() > 65535) {
                throw new InvalidSeedListException(row, "port", "Port must be between 1 and 65535, got " + seed.port());
            }
            if (seed.username() == null || seed.username().isBlank()) {
                throw new InvalidSeedListException(row, "username", "Username must not be blank");
            }
        }
    }
    
    public DiscoveryResult run(List<SeedInstance> seeds, DiscoveryContext context,
                               CancellationToken token, DiscoveryProgressListener listener) {
        validate(seeds);
        Instant startedAt = Instant.now();
        
        Map<InstanceKey, SeedInstance> distinct = new LinkedHashMap<>();
        for (SeedInstance seed : seeds) {
            if (distinct.putIfAbsent(seed.key(), seed) != null) {
                log.info("Skipping duplicate seed {}", seed.key());
            }
        }
        
        Map<InstanceKey, InstanceReport> reports = new LinkedHashMap<>();
        Map<InstanceKey, DiscoveredNode> placeholders = new LinkedHashMap<>();
        int total = distinct.size();
        int index = 0;
        boolean cancelled = false;
        
        log.info("Starting discovery of {} instances", total);
        
        for (SeedInstance seed : distinct.values()) {
            if (token.isCancelled()) {
                cancelled = true;
                log.info("Discovery cancelled after {} of {} instances", index, total);
                break;
            }
            index++;
            InstanceKey key = seed.key();
            
            LoggingContext.setInstanceContext(key);
            try {
                InstanceReport report = reportBuilder.build(seed, context);
                reports.put(key, report);
                
                if (placeholders.remove(key) != null) {
                    log.debug("Placeholder {} replaced by its report", key);
                }
                for (Adjacency adjacency : report.getAdjacencies()) {
                    InstanceKey other = adjacency.from().equals(key) ? adjacency.to() : adjacency.from();
                    if (!reports.containsKey(other) && !placeholders.containsKey(other)) {
                        placeholders.put(other, new DiscoveredNode(other, key, adjacency.relation()));
                    }
                }
                
                listener.onProgress(new DiscoveryProgress(index, total, key, report.getOutcome(),
                    progressMessage(report), placeholders.size(), Instant.now()));
            } finally {
                LoggingContext.clearInstanceContext();
            }
        }
        
        log.info("Discovery {}: {} reports, {} discovered instances",
            cancelled ? "cancelled" : "finished", reports.size(), placeholders.size());
        
        return new DiscoveryResult(
            new ArrayList<>(reports.values()),
            new ArrayList<>(placeholders.values()),
            cancelled,
            startedAt,
            Instant.now()
        );
    }
    
    private static String progressMessage(InstanceReport report) {
        if (report.getOutcome() == PollOutcome.SUCCESS) {
            return "Polled " + report.getServerName().orElse(report.getKey().toString());
        }
        return report.getErrorDetail();
    }
}
