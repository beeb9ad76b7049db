package com.platform.discovery.discovery;

/**
 * Receives progress notifications on the polling thread.
 */
@FunctionalInterface
public interface DiscoveryProgressListener {

    DiscoveryProgressListener NONE = progress -> { };

    void onProgress(DiscoveryProgress progress);
}
