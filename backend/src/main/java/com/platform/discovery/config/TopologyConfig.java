package com.platform.discovery.config;

import com.platform.discovery.model.InstanceKey;
import com.platform.discovery.topology.RoleLayer;
import com.platform.discovery.topology.TopologyStyle;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Topology preferences: designated management instances, layer labels and colors.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "discovery.topology")
public class TopologyConfig {
    
    /**
     * Instances ("host:port") pinned to the top layer regardless of their roles.
     */
    private List<String> designatedInstances = new ArrayList<>();
    
    private Map<RoleLayer, String> layerLabels = new EnumMap<>(RoleLayer.class);
    
    /**
     * Fill colors for the DOT export.
     */
    private Map<RoleLayer, String> layerColors = new EnumMap<>(RoleLayer.class);
    
    public TopologyStyle toStyle() {
        return new TopologyStyle(layerLabels, layerColors);
    }
    
    /**
     * Designated instances that parse as instance keys. Unreadable entries are ignored.
     */
    public Set<InstanceKey> designatedKeys() {
        Set<InstanceKey> keys = new LinkedHashSet<>();
        for (String instance : designatedInstances) {
            InstanceKey.parse(instance).ifPresent(keys::add);
        }
        return Set.copyOf(keys);
    }
}
