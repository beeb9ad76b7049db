package com.platform.discovery.health;

import java.util.List;

/**
 * Names of the health metrics computed for every polled instance.
 */
public final class HealthMetrics {

    private HealthMetrics() {
    }

    // Server
    public static final String VERSION = "version";
    public static final String UPTIME_SECONDS = "uptime_seconds";
    public static final String WEB_SSL_ENABLED = "web_ssl_enabled";
    public static final String MESSAGES_COUNT = "messages_count";

    // Resources
    public static final String CPU_CORES = "cpu_cores";
    public static final String RAM_MB = "ram_mb";
    public static final String CPU_USAGE_PCT = "cpu_usage_pct";
    public static final String MEM_USAGE_PCT = "mem_usage_pct";
    public static final String SWAP_USAGE_PCT = "swap_usage_pct";
    public static final String DISK_USAGE_PCT = "disk_usage_pct";
    public static final String DISK_FREE_GB = "disk_free_gb";

    // Indexer cluster (reported by a cluster master)
    public static final String CLUSTER_MAINTENANCE = "cluster_maintenance";
    public static final String CLUSTER_ROLLING_RESTART = "cluster_rolling_restart";
    public static final String CLUSTER_ALL_DATA_SEARCHABLE = "cluster_all_data_searchable";
    public static final String CLUSTER_SEARCH_FACTOR_MET = "cluster_search_factor_met";
    public static final String CLUSTER_REPLICATION_FACTOR_MET = "cluster_replication_factor_met";
    public static final String CLUSTER_PEERS_NOT_SEARCHABLE = "cluster_peers_not_searchable";
    public static final String CLUSTER_SEARCH_HEADS_NOT_CONNECTED = "cluster_search_heads_not_connected";

    // Search head cluster
    public static final String SHC_ROLLING_RESTART = "shc_rolling_restart";
    public static final String SHC_SERVICE_READY = "shc_service_ready";
    public static final String SHC_MIN_PEERS_JOINED = "shc_min_peers_joined";
    public static final String SHC_MEMBERS_NOT_UP = "shc_members_not_up";

    /**
     * Every metric above, in report column order.
     */
    public static final List<String> ALL = List.of(
        VERSION, UPTIME_SECONDS, WEB_SSL_ENABLED, MESSAGES_COUNT,
        CPU_CORES, RAM_MB, CPU_USAGE_PCT, MEM_USAGE_PCT, SWAP_USAGE_PCT, DISK_USAGE_PCT, DISK_FREE_GB,
        CLUSTER_MAINTENANCE, CLUSTER_ROLLING_RESTART, CLUSTER_ALL_DATA_SEARCHABLE, CLUSTER_SEARCH_FACTOR_MET,
        CLUSTER_REPLICATION_FACTOR_MET, CLUSTER_PEERS_NOT_SEARCHABLE, CLUSTER_SEARCH_HEADS_NOT_CONNECTED,
        SHC_ROLLING_RESTART, SHC_SERVICE_READY, SHC_MIN_PEERS_JOINED, SHC_MEMBERS_NOT_UP);
}
