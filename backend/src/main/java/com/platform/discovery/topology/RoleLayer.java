package com.platform.discovery.topology;

/**
 * Layer a node is drawn in, top (rank 0) to bottom.
 * Purely a layout ordering; derived from the node's roles, never stored as a fact.
 */
public enum RoleLayer {
    MANAGEMENT_CONSOLE(0, "Management Console"),
    SHC_DEPLOYER(1, "SHC Deployer"),
    STANDALONE_SEARCH_HEAD(2, "Standalone Search Head"),
    LICENSE_MASTER(3, "License Master"),
    DEPLOYMENT_SERVER(4, "Deployment Server"),
    SEARCH_HEAD(5, "Search Head"),
    CLUSTER_MASTER(6, "Cluster Master"),
    INDEXER(7, "Indexer"),
    HEAVY_FORWARDER(8, "Heavy Forwarder"),
    MANAGED_UNIVERSAL_FORWARDER(9, "Managed Universal Forwarder"),
    INPUT_ONLY(10, "Input-only Instance"),
    OTHER(11, "Other"),
    DISCOVERED_NODE(12, "Discovered Node");      // Never polled, or polled without roles

    private final int rank;
    private final String defaultLabel;

    RoleLayer(int rank, String defaultLabel) {
        this.rank = rank;
        this.defaultLabel = defaultLabel;
    }

    public int getRank() {
        return rank;
    }

    public String getDefaultLabel() {
        return defaultLabel;
    }
}
