package com.platform.discovery.model;

/**
 * Evaluated health metric: the raw value as displayed and its status.
 */
public record HealthMetric(String name, String rawValue, HealthStatus status) {

    public static HealthMetric unknown(String name) {
        return new HealthMetric(name, null, HealthStatus.UNKNOWN);
    }
}
