package com.platform.discovery.api;

import com.platform.discovery.discovery.DiscoveryProgress;
import com.platform.discovery.discovery.DiscoveryResult;
import com.platform.discovery.discovery.DiscoveryRun;
import com.platform.discovery.discovery.DiscoveryRunService;
import com.platform.discovery.model.InstanceReport;
import com.platform.discovery.model.SeedInstance;
import com.platform.discovery.report.SeedListReader;
import com.platform.discovery.topology.TopologyGraph;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * REST API for discovery runs.
 */
@Slf4j
@RestController
@RequestMapping("/api/discovery")
@RequiredArgsConstructor
public class DiscoveryController {
    
    static final String TEXT_CSV = "text/csv";
    static final String TEXT_VND_GRAPHVIZ = "text/vnd.graphviz";
    
    private final DiscoveryRunService runService;
    private final SeedListReader seedListReader;
    
    /**
     * Start a run from a JSON seed list.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RunSummary> startDiscovery(@Valid @RequestBody DiscoveryRequest request) {
        List<SeedInstance> seeds = request.getSeeds().stream()
            .map(SeedRequest::toSeed)
            .toList();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(RunSummary.of(runService.start(seeds), false));
    }
    
    /**
     * Start a run from a seed CSV (header: address,port,username,password).
     */
    @PostMapping(path = "/csv", consumes = TEXT_CSV)
    public ResponseEntity<RunSummary> startDiscoveryFromCsv(@RequestBody String csv) {
        List<SeedInstance> seeds = seedListReader.read(csv);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(RunSummary.of(runService.start(seeds), false));
    }
    
    /**
     * All retained runs, oldest first.
     */
    @GetMapping
    public List<RunSummary> getRuns() {
        return runService.list().stream()
            .map(run -> RunSummary.of(run, false))
            .toList();
    }
    
    /**
     * Run state with its progress log.
     */
    @GetMapping("/{runId}")
    public RunSummary getRun(@PathVariable String runId) {
        return RunSummary.of(runService.get(runId), true);
    }
    
    @PostMapping("/{runId}/cancel")
    public RunSummary cancelRun(@PathVariable String runId) {
        return RunSummary.of(runService.cancel(runId), false);
    }
    
    @GetMapping("/{runId}/reports")
    public List<InstanceReport> getReports(@PathVariable String runId) {
        return runService.result(runId).reports();
    }
    
    @GetMapping(path = "/{runId}/report.csv", produces = TEXT_CSV)
    public ResponseEntity<String> getReportCsv(@PathVariable String runId) {
        String csv = runService.reportCsv(runId);
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"discovery-" + runId + ".csv\"")
            .contentType(MediaType.parseMediaType(TEXT_CSV))
            .body(csv);
    }
    
    @GetMapping("/{runId}/topology")
    public TopologyGraph getTopology(@PathVariable String runId) {
        return runService.topology(runId);
    }
    
    @GetMapping(path = "/{runId}/topology.dot", produces = TEXT_VND_GRAPHVIZ)
    public ResponseEntity<String> getTopologyDot(@PathVariable String runId) {
        return ResponseEntity.ok()
            .contentType(MediaType.parseMediaType(TEXT_VND_GRAPHVIZ))
            .body(runService.topologyDot(runId));
    }
    
    // DTOs
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DiscoveryRequest {
        @NotEmpty(message = "At least one seed is required")
        private List<@Valid @NotNull SeedRequest> seeds;
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SeedRequest {
        @NotBlank
        private String address;
        
        @Min(1)
        @Max(65535)
        private int port = 8089;
        
        @NotBlank
        private String username;
        
        private String password;
        
        SeedInstance toSeed() {
            return new SeedInstance(address.trim(), port, username.trim(), password != null ? password : "");
        }
    }
    
    public record RunSummary(
        String runId,
        DiscoveryRun.State state,
        int seeds,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt,
        Integer reports,
        Integer discovered,
        boolean cancelled,
        String failure,
        List<DiscoveryProgress> progress
    ) {
        static RunSummary of(DiscoveryRun run, boolean withProgress) {
            DiscoveryResult result = run.getResult();
            return new RunSummary(
                run.getId(),
                run.getState(),
                run.getSeedCount(),
                run.getCreatedAt(),
                run.getStartedAt(),
                run.getFinishedAt(),
                result != null ? result.reports().size() : null,
                result != null ? result.placeholders().size() : null,
                run.getToken().isCancelled(),
                run.getFailure(),
                withProgress ? run.getProgress() : null
            );
        }
    }
}
