package com.platform.discovery.config;

import com.platform.discovery.health.Direction;
import com.platform.discovery.health.HealthThresholds;
import com.platform.discovery.health.ThresholdRule;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health check thresholds, keyed by metric name.
 * 
 * <pre>
 * discovery:
 *   health:
 *     thresholds:
 *       disk_usage_pct: { direction: ABOVE, caution: 80, warning: 90 }
 * </pre>
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "discovery.health")
public class HealthCheckConfig {
    
    private Map<String, Threshold> thresholds = new LinkedHashMap<>();
    
    /**
     * Immutable snapshot of the configured rules.
     */
    public HealthThresholds toThresholds() {
        Map<String, ThresholdRule> rules = new LinkedHashMap<>();
        thresholds.forEach((metric, threshold) -> rules.put(metric, threshold.toRule(metric)));
        return HealthThresholds.of(rules);
    }
    
    @Data
    public static class Threshold {
        private Direction direction;
        private Double caution;
        private Double warning;
        
        ThresholdRule toRule(String metric) {
            try {
                return new ThresholdRule(caution, warning, direction);
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid health threshold for " + metric + ": " + e.getMessage(), e);
            }
        }
    }
}
