package com.platform.discovery.model;

/**
 * Fact categories gathered from an instance, in the order they are requested.
 */
public enum ReportSection {
    ROLES,
    ADJACENCIES,
    DEPLOYMENT,
    CLUSTER,
    DISK_USAGE,
    RESOURCE_USAGE,
    MESSAGES,
    INVENTORY
}
