package com.platform.discovery.model;

/**
 * Raw reference to another instance as splunkd reports it, before normalization.
 * 
 * An outbound reference means this instance stands in {@code relation} to the
 * referenced one ("I am a license peer of X"); an inbound reference means the
 * referenced instance stands in {@code relation} to this one ("X is a search
 * peer of me").
 */
public record PeerReference(String reference, Relation relation, boolean inbound) {

    public static PeerReference outbound(String reference, Relation relation) {
        return new PeerReference(reference, relation, false);
    }

    public static PeerReference inbound(String reference, Relation relation) {
        return new PeerReference(reference, relation, true);
    }

    /**
     * Orient the reference relative to {@code self}.
     */
    public Adjacency toAdjacency(InstanceKey self, InstanceKey other) {
        return inbound ? new Adjacency(other, self, relation) : new Adjacency(self, other, relation);
    }
}
