package com.platform.discovery.model;

/**
 * Health level of one metric.
 */
public enum HealthStatus {
    NORMAL("Normal"),
    CAUTION("Caution"),
    WARNING("Warning"),
    UNKNOWN("Unknown");      // Value missing or unparseable

    private final String label;

    HealthStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
