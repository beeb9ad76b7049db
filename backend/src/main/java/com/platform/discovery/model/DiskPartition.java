package com.platform.discovery.model;

/**
 * Filesystem partition usage from /services/server/status/partitions-space.
 */
public record DiskPartition(String mountPoint, String fsType, long capacityMb, long freeMb) {

    public double usedPercent() {
        if (capacityMb <= 0) {
            return 0;
        }
        return (capacityMb - freeMb) * 100.0 / capacityMb;
    }

    public double freeGb() {
        return freeMb / 1024.0;
    }
}
