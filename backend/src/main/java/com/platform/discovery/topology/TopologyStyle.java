package com.platform.discovery.topology;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable rendering preferences: per-layer labels and fill colors.
 */
public final class TopologyStyle {

    private static final String DEFAULT_COLOR = "#FFFFFF";

    private final Map<RoleLayer, String> labels;
    private final Map<RoleLayer, String> colors;

    public TopologyStyle(Map<RoleLayer, String> labels, Map<RoleLayer, String> colors) {
        this.labels = copy(labels);
        this.colors = copy(colors);
    }

    public static TopologyStyle defaults() {
        return new TopologyStyle(Map.of(), Map.of());
    }

    public String labelFor(RoleLayer layer) {
        return labels.getOrDefault(layer, layer.getDefaultLabel());
    }

    public String colorFor(RoleLayer layer) {
        return colors.getOrDefault(layer, DEFAULT_COLOR);
    }

    private static Map<RoleLayer, String> copy(Map<RoleLayer, String> source) {
        EnumMap<RoleLayer, String> map = new EnumMap<>(RoleLayer.class);
        if (source != null) {
            source.forEach((layer, value) -> {
                if (value != null && !value.isBlank()) {
                    map.put(layer, value);
                }
            });
        }
        return Collections.unmodifiableMap(map);
    }
}
