package com.platform.discovery.discovery;

import com.platform.discovery.config.DiscoveryRunConfig;
import com.platform.discovery.config.HealthCheckConfig;
import com.platform.discovery.config.SplunkClientConfig;
import com.platform.discovery.config.TopologyConfig;
import com.platform.discovery.error.ResourceNotFoundException;
import com.platform.discovery.error.RunNotFinishedException;
import com.platform.discovery.model.SeedInstance;
import com.platform.discovery.observability.LoggingContext;
import com.platform.discovery.observability.MetricsRegistry;
import com.platform.discovery.report.DiscoveryReportWriter;
import com.platform.discovery.topology.DotTopologyRenderer;
import com.platform.discovery.topology.TopologyBuilder;
import com.platform.discovery.topology.TopologyGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Starts discovery runs on the background worker and serves their results.
 * 
 * Configuration is snapshotted when a run starts, so edits made while a run is
 * in progress only affect later runs. Progress is appended to the run and
 * published on {@code /topic/discovery/{runId}}.
 */
@Slf4j
@Service
public class DiscoveryRunService {
    
    static final String PROGRESS_TOPIC = "/topic/discovery/";
    
    private final DiscoveryOrchestrator orchestrator;
    private final TopologyBuilder topologyBuilder;
    private final DotTopologyRenderer dotRenderer;
    private final DiscoveryReportWriter reportWriter;
    private final SimpMessagingTemplate messagingTemplate;
    private final MetricsRegistry metricsRegistry;
    private final ExecutorService discoveryExecutor;
    private final SplunkClientConfig clientConfig;
    private final HealthCheckConfig healthCheckConfig;
    private final TopologyConfig topologyConfig;
    private final DiscoveryRunConfig runConfig;
    
    // Insertion order is start order; guarded by itself
    private final Map<String, DiscoveryRun> runs = new LinkedHashMap<>();
    
    public DiscoveryRunService(
            DiscoveryOrchestrator orchestrator,
            TopologyBuilder topologyBuilder,
            DotTopologyRenderer dotRenderer,
            DiscoveryReportWriter reportWriter,
            SimpMessagingTemplate messagingTemplate,
            MetricsRegistry metricsRegistry,
            ExecutorService discoveryExecutor,
            SplunkClientConfig clientConfig,
            HealthCheckConfig healthCheckConfig,
            TopologyConfig topologyConfig,
            DiscoveryRunConfig runConfig) {
        this.orchestrator = orchestrator;
        this.topologyBuilder = topologyBuilder;
        this.dotRenderer = dotRenderer;
        this.reportWriter = reportWriter;
        this.messagingTemplate = messagingTemplate;
        this.metricsRegistry = metricsRegistry;
        this.discoveryExecutor = discoveryExecutor;
        this.clientConfig = clientConfig;
        this.healthCheckConfig = healthCheckConfig;
        this.topologyConfig = topologyConfig;
        this.runConfig = runConfig;
    }
    
    // ==================== Run Lifecycle ====================
    
    /**
     * Validate the seeds and queue a run. A run the worker refuses is returned already FAILED.
     * @throws com.platform.discovery.error.InvalidSeedListException before anything is queued
     */
    public DiscoveryRun start(List<SeedInstance> seeds) {
        DiscoveryOrchestrator.validate(seeds);
        
        DiscoveryContext context = snapshotContext();
        String runId = UUID.randomUUID().toString();
        int distinctSeeds = (int) seeds.stream().map(SeedInstance::key).distinct().count();
        DiscoveryRun run = new DiscoveryRun(runId, distinctSeeds, context);
        List<SeedInstance> seedSnapshot = List.copyOf(seeds);
        
        synchronized (runs) {
            runs.put(runId, run);
        }
        metricsRegistry.recordRunStarted();
        log.info("Queued discovery run {} with {} seeds", runId, distinctSeeds);
        
        try {
            discoveryExecutor.submit(() -> execute(run, seedSnapshot));
        } catch (RejectedExecutionException e) {
            log.error("Discovery worker rejected run {}", runId, e);
            Instant now = Instant.now();
            run.fail("Discovery worker rejected the run: " + e.getMessage(),
                new DiscoveryResult(List.of(), List.of(), false, now, now));
            metricsRegistry.recordRunFinished(run.getState().name(), 0, 0);
        }
        return run;
    }
    
    private DiscoveryContext snapshotContext() {
        return new DiscoveryContext(
            healthCheckConfig.toThresholds(),
            clientConfig.getRequestTimeout(),
            topologyConfig.designatedKeys(),
            topologyConfig.toStyle()
        );
    }
    
    private void execute(DiscoveryRun run, List<SeedInstance> seeds) {
        LoggingContext.setRunContext(run.getId());
        try {
            run.markRunning();
            DiscoveryResult result = orchestrator.run(seeds, run.getContext(), run.getToken(), progress -> {
                run.record(progress);
                publish(run.getId(), progress);
            });
            run.complete(result);
            log.info("Discovery run {} {}: {} reports, {} discovered instances", run.getId(),
                run.getState().name().toLowerCase(), result.reports().size(), result.placeholders().size());
            metricsRegistry.recordRunFinished(run.getState().name(), result.reports().size(),
                result.placeholders().size());
        } catch (RuntimeException e) {
            log.error("Discovery run {} failed", run.getId(), e);
            Instant now = Instant.now();
            run.fail(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(),
                new DiscoveryResult(List.of(), List.of(), false, now, now));
            metricsRegistry.recordRunFinished(run.getState().name(), 0, 0);
        } finally {
            evictFinishedRuns();
            LoggingContext.clearRunContext();
        }
    }
    
    private void publish(String runId, DiscoveryProgress progress) {
        try {
            messagingTemplate.convertAndSend(PROGRESS_TOPIC + runId, progress);
        } catch (RuntimeException e) {
            log.warn("Unable to publish progress for run {}: {}", runId, e.getMessage());
        }
    }
    
    /**
     * Keep at most the configured number of finished runs, dropping the oldest first.
     */
    private void evictFinishedRuns() {
        synchronized (runs) {
            long finished = runs.values().stream().filter(DiscoveryRun::isFinished).count();
            Iterator<DiscoveryRun> iterator = runs.values().iterator();
            while (finished > runConfig.getRetained() && iterator.hasNext()) {
                DiscoveryRun run = iterator.next();
                if (run.isFinished()) {
                    iterator.remove();
                    finished--;
                    log.debug("Evicted discovery run {}", run.getId());
                }
            }
        }
    }
    
    /**
     * Request cancellation. The worker stops before the next instance.
     */
    public DiscoveryRun cancel(String runId) {
        DiscoveryRun run = get(runId);
        if (run.isFinished()) {
            log.debug("Run {} already finished, cancel ignored", runId);
        } else if (run.getToken().cancel()) {
            log.info("Cancellation requested for discovery run {}", runId);
        }
        return run;
    }
    
    public DiscoveryRun get(String runId) {
        synchronized (runs) {
            DiscoveryRun run = runs.get(runId);
            if (run == null) {
                throw ResourceNotFoundException.run(runId);
            }
            return run;
        }
    }
    
    public List<DiscoveryRun> list() {
        synchronized (runs) {
            return new ArrayList<>(runs.values());
        }
    }
    
    // ==================== Exports ====================
    
    public DiscoveryResult result(String runId) {
        DiscoveryRun run = get(runId);
        if (!run.isFinished()) {
            throw new RunNotFinishedException(runId);
        }
        return run.getResult();
    }
    
    public TopologyGraph topology(String runId) {
        return topologyBuilder.build(result(runId));
    }
    
    public String topologyDot(String runId) {
        DiscoveryResult result = result(runId);
        return dotRenderer.render(topologyBuilder.build(result), get(runId).getContext().style());
    }
    
    public String reportCsv(String runId) {
        DiscoveryResult result = result(runId);
        DiscoveryRun run = get(runId);
        return reportWriter.write(result, topologyBuilder.build(result), run.getContext().thresholds().metricNames());
    }
}
