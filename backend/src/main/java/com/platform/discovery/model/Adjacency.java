package com.platform.discovery.model;

/**
 * Edge reported by one instance: {@code from} stands in {@code relation} to {@code to}.
 */
public record Adjacency(InstanceKey from, InstanceKey to, Relation relation) {

    public boolean isSelfReference() {
        return from.equals(to);
    }

    public String describe() {
        return from + " " + relation.getLabel() + " " + to;
    }
}
