package com.platform.discovery.health;

import com.platform.discovery.model.HealthMetric;
import com.platform.discovery.model.HealthStatus;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Maps a raw metric value to Normal, Caution, Warning or Unknown.
 * 
 * Stateless: the outcome depends only on the metric name, the value and the
 * thresholds passed in. Booleans count as 1 (true) and 0 (false), so flag
 * checks are expressed as ordinary thresholds.
 */
@Component
public class HealthEvaluator {
    
    /**
     * Evaluate one metric.
     * Metrics with no configured rule are always NORMAL; a configured metric with a
     * missing or unparseable value is UNKNOWN.
     */
    public HealthStatus evaluate(String metric, Object rawValue, HealthThresholds thresholds) {
        Optional<ThresholdRule> rule = thresholds.ruleFor(metric);
        if (rule.isEmpty()) {
            return HealthStatus.NORMAL;
        }
        
        Double value = toNumber(rawValue);
        if (value == null) {
            return HealthStatus.UNKNOWN;
        }
        
        ThresholdRule r = rule.get();
        if (r.warning() != null && r.direction().triggers(value, r.warning())) {
            return HealthStatus.WARNING;
        }
        if (r.caution() != null && r.direction().triggers(value, r.caution())) {
            return HealthStatus.CAUTION;
        }
        return HealthStatus.NORMAL;
    }
    
    /**
     * Evaluate and package a metric together with its display value.
     */
    public HealthMetric measure(String metric, Object rawValue, HealthThresholds thresholds) {
        return new HealthMetric(metric, display(rawValue), evaluate(metric, rawValue, thresholds));
    }
    
    static Double toNumber(Object rawValue) {
        if (rawValue == null) {
            return null;
        }
        if (rawValue instanceof Boolean flag) {
            return flag ? 1.0 : 0.0;
        }
        if (rawValue instanceof Number number) {
            double d = number.doubleValue();
            return Double.isNaN(d) ? null : d;
        }
        
        String text = rawValue.toString().trim();
        if (text.endsWith("%")) {
            text = text.substring(0, text.length() - 1).trim();
        }
        if (text.equalsIgnoreCase("true")) {
            return 1.0;
        }
        if (text.equalsIgnoreCase("false")) {
            return 0.0;
        }
        try {
            double d = Double.parseDouble(text);
            return Double.isNaN(d) ? null : d;
        } catch (NumberFormatException e) {
            return null;
        }
    }
    
    private static String display(Object rawValue) {
        if (rawValue == null) {
            return null;
        }
        if (rawValue instanceof Double || rawValue instanceof Float) {
            return BigDecimal.valueOf(((Number) rawValue).doubleValue())
                .setScale(1, RoundingMode.HALF_UP)
                .stripTrailingZeros()
                .toPlainString();
        }
        return rawValue.toString();
    }
}
