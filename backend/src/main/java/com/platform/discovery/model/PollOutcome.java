package com.platform.discovery.model;

/**
 * Result of polling a single instance.
 */
public enum PollOutcome {
    SUCCESS,      // Every fact category gathered
    PARTIAL,      // Connected, but at least one fact category failed
    FAILED        // Connection or authentication failed, nothing gathered
}
