package com.platform.discovery.observability;

import com.platform.discovery.model.PollOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Central registry for discovery metrics: instance polls, poll latency and run outcomes.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Timer pollTimer;
    private final AtomicInteger activeRuns;
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.activeRuns = new AtomicInteger(0);
        this.pollTimer = Timer.builder("discovery.instance.poll.latency")
            .description("Time spent polling one instance")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);
        
        Gauge.builder("discovery.run.active", activeRuns, AtomicInteger::get)
            .description("Discovery runs queued or in progress")
            .register(meterRegistry);
        
        log.info("Metrics registry initialized");
    }
    
    /**
     * Record one polled instance and how long the poll took.
     */
    public void recordInstancePolled(PollOutcome outcome, long durationMs) {
        incrementCounter("discovery.instance.polled", "outcome", outcome.name().toLowerCase());
        pollTimer.record(Duration.ofMillis(durationMs));
    }
    
    /**
     * Record a failed fact-category call.
     */
    public void recordSectionFailure(String section) {
        incrementCounter("discovery.instance.section.failure", "section", section.toLowerCase());
    }
    
    public void recordRunStarted() {
        activeRuns.incrementAndGet();
        incrementCounter("discovery.run.started");
    }
    
    public void recordRunFinished(String state, int reports, int placeholders) {
        activeRuns.decrementAndGet();
        incrementCounter("discovery.run.completed", "state", state.toLowerCase());
        log.debug("Recorded run finished: state={}, reports={}, placeholders={}", state, reports, placeholders);
    }
    
    /**
     * Increment a counter.
     */
    public void incrementCounter(String name) {
        counters.computeIfAbsent(name, k -> 
            Counter.builder(name)
                .register(meterRegistry))
            .increment();
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k -> 
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
}
