package com.platform.discovery.model;

/**
 * Directed relation an instance reports having with another instance.
 */
public enum Relation {
    DEPLOYMENT_CLIENT_OF("deployment client of"),
    CLUSTER_MEMBER_OF("cluster member of"),
    CLUSTER_SEARCH_HEAD_OF("cluster search head of"),
    SHC_DEPLOYER_CLIENT_OF("fetches from SHC deployer"),
    SHC_PEER_OF("SHC peer of"),
    SEARCH_PEER_OF("search peer of"),
    LICENSE_PEER_OF("license peer of");

    private final String label;

    Relation(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
