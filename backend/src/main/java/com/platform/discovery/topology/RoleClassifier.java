package com.platform.discovery.topology;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Assigns a node its topology layer from the roles it reports.
 * 
 * Walks a fixed priority table and returns the layer of the first matching
 * rule. An empty role set means nothing is known about the node and yields
 * {@link RoleLayer#DISCOVERED_NODE}.
 */
@Component
public class RoleClassifier {
    
    /**
     * Synthetic role added to instances listed as designated in configuration.
     */
    public static final String USER_DESIGNATED = "user_designated";
    
    private static final List<Rule> PRIORITY = List.of(
        new Rule(anyOf(USER_DESIGNATED, "management_console"), RoleLayer.MANAGEMENT_CONSOLE),
        new Rule(anyOf("shc_deployer"), RoleLayer.SHC_DEPLOYER),
        new Rule(anyOf("search_head").and(noneOf("shc_member", "shc_captain", "cluster_search_head", "indexer")),
            RoleLayer.STANDALONE_SEARCH_HEAD),
        new Rule(anyOf("license_master"), RoleLayer.LICENSE_MASTER),
        new Rule(anyOf("deployment_server"), RoleLayer.DEPLOYMENT_SERVER),
        new Rule(anyOf("search_head", "shc_member", "shc_captain", "cluster_search_head"), RoleLayer.SEARCH_HEAD),
        new Rule(anyOf("cluster_master"), RoleLayer.CLUSTER_MASTER),
        new Rule(anyOf("indexer", "cluster_slave", "search_peer"), RoleLayer.INDEXER),
        new Rule(anyOf("heavyweight_forwarder"), RoleLayer.HEAVY_FORWARDER),
        new Rule(allOf("universal_forwarder", "deployment_client"), RoleLayer.MANAGED_UNIVERSAL_FORWARDER),
        new Rule(anyOf("universal_forwarder", "lightweight_forwarder"), RoleLayer.INPUT_ONLY),
        new Rule(roles -> !roles.isEmpty(), RoleLayer.OTHER)
    );
    
    public RoleLayer classify(Set<String> roles) {
        if (roles == null || roles.isEmpty()) {
            return RoleLayer.DISCOVERED_NODE;
        }
        for (Rule rule : PRIORITY) {
            if (rule.matches().test(roles)) {
                return rule.layer();
            }
        }
        return RoleLayer.DISCOVERED_NODE;
    }
    
    private record Rule(Predicate<Set<String>> matches, RoleLayer layer) {
    }
    
    private static Predicate<Set<String>> anyOf(String... roles) {
        return present -> {
            for (String role : roles) {
                if (present.contains(role)) {
                    return true;
                }
            }
            return false;
        };
    }
    
    private static Predicate<Set<String>> allOf(String... roles) {
        return present -> present.containsAll(List.of(roles));
    }
    
    private static Predicate<Set<String>> noneOf(String... roles) {
        return anyOf(roles).negate();
    }
}
