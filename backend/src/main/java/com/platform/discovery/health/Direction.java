package com.platform.discovery.health;

/**
 * Which side of a threshold triggers a health level.
 */
public enum Direction {
    /**
     * Triggers when the value is at or above the threshold (e.g. disk usage percent).
     */
    ABOVE,
    
    /**
     * Triggers when the value is at or below the threshold (e.g. free disk space).
     */
    BELOW;
    
    public boolean triggers(double value, double threshold) {
        return this == ABOVE ? value >= threshold : value <= threshold;
    }
}
