package com.platform.discovery.model;

import java.util.List;

/**
 * Where an instance takes its configuration from.
 * 
 * A multi-site or multi-cluster search head may report several cluster masters.
 */
public record DeploymentInfo(
    String deploymentServerUri,
    List<String> clusterMasterUris,
    String shcDeployerUri
) {
    public DeploymentInfo {
        clusterMasterUris = clusterMasterUris == null ? List.of() : List.copyOf(clusterMasterUris);
    }

    public static DeploymentInfo none() {
        return new DeploymentInfo(null, List.of(), null);
    }
}
