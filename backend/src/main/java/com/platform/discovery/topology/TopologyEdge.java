package com.platform.discovery.topology;

import com.platform.discovery.model.InstanceKey;
import com.platform.discovery.model.Relation;

/**
 * Edge between two nodes, labelled with the relation that introduced it.
 */
public record TopologyEdge(InstanceKey from, InstanceKey to, Relation relation) {

    public String getRelationLabel() {
        return relation.getLabel();
    }

    public boolean connects(InstanceKey a, InstanceKey b) {
        return (from.equals(a) && to.equals(b)) || (from.equals(b) && to.equals(a));
    }
}
