package com.platform.discovery.discovery;

import com.platform.discovery.health.HealthThresholds;
import com.platform.discovery.model.InstanceKey;
import com.platform.discovery.topology.TopologyStyle;

import java.time.Duration;
import java.util.Set;

/**
 * Configuration snapshot taken when a run starts. Never changes while the run is in progress.
 */
public record DiscoveryContext(
    HealthThresholds thresholds,
    Duration timeout,
    Set<InstanceKey> designatedInstances,
    TopologyStyle style
) {
    public DiscoveryContext {
        designatedInstances = designatedInstances == null ? Set.of() : Set.copyOf(designatedInstances);
        thresholds = thresholds == null ? HealthThresholds.empty() : thresholds;
        style = style == null ? TopologyStyle.defaults() : style;
    }

    public boolean isDesignated(InstanceKey key) {
        return designatedInstances.contains(key);
    }
}
