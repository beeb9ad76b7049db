package com.platform.discovery.client;

import com.platform.discovery.error.FactFetchException;
import com.platform.discovery.error.InstanceConnectException;
import com.platform.discovery.model.ClusterInfo;
import com.platform.discovery.model.DeploymentInfo;
import com.platform.discovery.model.DiskPartition;
import com.platform.discovery.model.InstanceInventory;
import com.platform.discovery.model.InstanceMessage;
import com.platform.discovery.model.PeerReference;
import com.platform.discovery.model.ResourceUsage;
import com.platform.discovery.model.SeedInstance;
import com.platform.discovery.model.ServerInfo;

import java.time.Duration;
import java.util.List;

/**
 * Gathers facts about one splunkd instance, one call per fact category.
 * 
 * Calls are synchronous. Every fact call may fail on its own with a
 * {@link FactFetchException} without invalidating the handle.
 */
public interface InstanceClient {
    
    /**
     * Open a session and verify the credentials.
     * @throws InstanceConnectException when the instance is unreachable, times out or rejects the credentials
     */
    InstanceHandle connect(SeedInstance seed, Duration timeout);
    
    /**
     * Server name, version, OS, hardware and the server roles.
     */
    ServerInfo getServerInfo(InstanceHandle handle);
    
    /**
     * Distributed search peers and license master references.
     */
    List<PeerReference> getAdjacencies(InstanceHandle handle);
    
    /**
     * Deployment server, cluster master(s) and SHC deployer the instance is configured against.
     */
    DeploymentInfo getDeploymentInfo(InstanceHandle handle);
    
    /**
     * Indexer cluster and search head cluster state.
     */
    ClusterInfo getClusterInfo(InstanceHandle handle);
    
    List<DiskPartition> getDiskUsage(InstanceHandle handle);
    
    ResourceUsage getResourceUsage(InstanceHandle handle);
    
    List<InstanceMessage> getMessages(InstanceHandle handle);
    
    /**
     * Receiving, TCP, UDP and KV store ports plus the number of installed apps.
     */
    InstanceInventory getInventory(InstanceHandle handle);
}
