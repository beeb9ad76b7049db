package com.platform.discovery.model;

import java.util.List;

/**
 * Indexer cluster and search head cluster state as seen from one instance.
 * Master-only and SHC-only fields are null when the instance has no such role.
 */
public record ClusterInfo(
    String mode,
    String label,
    String site,
    Integer replicationFactor,
    Integer searchFactor,
    Integer replicationPort,
    MasterStatus master,
    SearchHeadClusterStatus searchHeadCluster
) {
    public static ClusterInfo disabled() {
        return new ClusterInfo("disabled", null, null, null, null, null, null, null);
    }

    public boolean isMaster() {
        return master != null;
    }

    public boolean isSearchHeadClusterMember() {
        return searchHeadCluster != null;
    }

    /**
     * State reported by a cluster master about its peers and search heads.
     */
    public record MasterStatus(
        boolean maintenanceMode,
        boolean rollingRestart,
        boolean allDataSearchable,
        boolean searchFactorMet,
        boolean replicationFactorMet,
        List<ClusterMember> peers,
        List<ClusterMember> searchHeads
    ) {
        public MasterStatus {
            peers = peers == null ? List.of() : List.copyOf(peers);
            searchHeads = searchHeads == null ? List.of() : List.copyOf(searchHeads);
        }

        public long peersNotSearchable() {
            return peers.stream().filter(p -> !p.healthy()).count();
        }

        public long searchHeadsNotConnected() {
            return searchHeads.stream().filter(s -> !s.healthy()).count();
        }
    }

    /**
     * State reported by a search head cluster member.
     */
    public record SearchHeadClusterStatus(
        String label,
        Integer replicationFactor,
        String captainUri,
        boolean rollingRestart,
        boolean serviceReady,
        boolean minPeersJoined,
        List<ClusterMember> members
    ) {
        public SearchHeadClusterStatus {
            members = members == null ? List.of() : List.copyOf(members);
        }

        public long membersNotUp() {
            return members.stream().filter(m -> !m.healthy()).count();
        }
    }

    /**
     * One peer, search head or SHC member; {@code healthy} means searchable, connected or up.
     */
    public record ClusterMember(String label, String reference, String status, boolean healthy) {
    }
}
