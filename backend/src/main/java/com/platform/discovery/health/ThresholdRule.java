package com.platform.discovery.health;

/**
 * Caution and warning thresholds for one metric. Either level may be absent.
 */
public record ThresholdRule(Double caution, Double warning, Direction direction) {

    public ThresholdRule {
        if (direction == null) {
            throw new IllegalArgumentException("Threshold direction is required");
        }
        if (caution == null && warning == null) {
            throw new IllegalArgumentException("At least one of caution or warning is required");
        }
    }

    public static ThresholdRule above(Double caution, Double warning) {
        return new ThresholdRule(caution, warning, Direction.ABOVE);
    }

    public static ThresholdRule below(Double caution, Double warning) {
        return new ThresholdRule(caution, warning, Direction.BELOW);
    }
}
