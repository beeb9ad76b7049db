package com.platform.discovery.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of threshold rules, keyed by metric name.
 * Snapshotted from configuration before a discovery run and shared read-only.
 */
public final class HealthThresholds {

    private final Map<String, ThresholdRule> rules;

    private HealthThresholds(Map<String, ThresholdRule> rules) {
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    public static HealthThresholds of(Map<String, ThresholdRule> rules) {
        return new HealthThresholds(rules);
    }

    public static HealthThresholds empty() {
        return new HealthThresholds(Map.of());
    }

    public Optional<ThresholdRule> ruleFor(String metric) {
        return Optional.ofNullable(rules.get(metric));
    }

    /**
     * Configured metric names, in configuration order.
     */
    public List<String> metricNames() {
        return List.copyOf(rules.keySet());
    }

    public Map<String, ThresholdRule> asMap() {
        return rules;
    }

    @Override
    public String toString() {
        return "HealthThresholds" + rules.keySet();
    }
}
