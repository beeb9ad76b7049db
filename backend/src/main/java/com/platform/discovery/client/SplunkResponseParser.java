package com.platform.discovery.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.discovery.error.ResponseParseException;
import com.platform.discovery.model.ClusterInfo;
import com.platform.discovery.model.ClusterInfo.ClusterMember;
import com.platform.discovery.model.ClusterInfo.MasterStatus;
import com.platform.discovery.model.ClusterInfo.SearchHeadClusterStatus;
import com.platform.discovery.model.DiskPartition;
import com.platform.discovery.model.InstanceMessage;
import com.platform.discovery.model.PeerReference;
import com.platform.discovery.model.Relation;
import com.platform.discovery.model.ResourceUsage;
import com.platform.discovery.model.ServerInfo;
import com.platform.discovery.model.WebSettings;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads splunkd JSON responses ({@code output_mode=json}) into fact records.
 * 
 * splunkd wraps every result in an Atom-like feed: {@code {"entry": [{"name": ..., "content": {...}}]}}.
 * Numeric and boolean fields arrive either as JSON scalars or as strings
 * ("1", "0", "true"), so every accessor accepts both.
 */
@Component
public class SplunkResponseParser {
    
    private final ObjectMapper objectMapper;
    
    public SplunkResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    // ==================== Feed Access ====================
    
    /**
     * All entries of a feed. A feed without an entry array is malformed.
     */
    public List<JsonNode> entries(String endpoint, String body) {
        JsonNode root = readTree(endpoint, body);
        JsonNode entry = root.get("entry");
        if (entry == null || !entry.isArray()) {
            throw new ResponseParseException(endpoint, "Response of " + endpoint + " has no entry list");
        }
        List<JsonNode> entries = new ArrayList<>();
        entry.forEach(entries::add);
        return entries;
    }
    
    /**
     * Content of the first entry of a feed that must have exactly one meaningful entry.
     */
    public JsonNode firstContent(String endpoint, String body) {
        List<JsonNode> entries = entries(endpoint, body);
        if (entries.isEmpty()) {
            throw new ResponseParseException(endpoint, "Response of " + endpoint + " has no entries");
        }
        JsonNode content = entries.get(0).get("content");
        if (content == null || !content.isObject()) {
            throw new ResponseParseException(endpoint, "First entry of " + endpoint + " has no content");
        }
        return content;
    }
    
    // ==================== Server ====================
    
    public ServerInfo parseServerInfo(String endpoint, String body, WebSettings web) {
        JsonNode content = firstContent(endpoint, body);
        
        Set<String> roles = new LinkedHashSet<>();
        JsonNode serverRoles = content.get("server_roles");
        if (serverRoles != null && serverRoles.isArray()) {
            serverRoles.forEach(role -> roles.add(role.asText()));
        } else if (serverRoles != null && serverRoles.isTextual()) {
            roles.add(serverRoles.asText());
        }
        
        Long startup = longOrNull(content, "startup_time");
        
        return new ServerInfo(
            text(content, "serverName"),
            text(content, "guid"),
            text(content, "version"),
            text(content, "product_type"),
            text(content, "mode"),
            describeOs(content),
            roles,
            intOrNull(content, "numberOfCores"),
            longOrNull(content, "physicalMemoryMB"),
            startup != null ? Instant.ofEpochSecond(startup) : null,
            web
        );
    }
    
    /**
     * Splunk Web state from {@code server/settings}: startwebserver, httpport and enableSplunkWebSSL.
     */
    public WebSettings parseWebSettings(String endpoint, String body) {
        JsonNode content = firstContent(endpoint, body);
        return new WebSettings(
            content.has("startwebserver") ? flag(content, "startwebserver") : null,
            intOrNull(content, "httpport"),
            content.has("enableSplunkWebSSL") ? flag(content, "enableSplunkWebSSL") : null
        );
    }
    
    private String describeOs(JsonNode content) {
        String extended = text(content, "os_name_extended");
        String arch = text(content, "cpu_arch");
        if (extended != null) {
            return arch != null ? extended + " " + arch : extended;
        }
        StringBuilder os = new StringBuilder();
        for (String field : new String[]{"os_name", "os_version", "cpu_arch", "os_build"}) {
            String value = text(content, field);
            if (value != null) {
                if (os.length() > 0) {
                    os.append(' ');
                }
                os.append(value);
            }
        }
        return os.length() > 0 ? os.toString() : null;
    }
    
    // ==================== Adjacencies ====================
    
    /**
     * Distributed search peers; entry names are "host:port".
     */
    public List<PeerReference> parseSearchPeers(String endpoint, String body) {
        List<PeerReference> peers = new ArrayList<>();
        for (JsonNode entry : entries(endpoint, body)) {
            String name = text(entry, "name");
            if (name != null) {
                peers.add(PeerReference.inbound(name, Relation.SEARCH_PEER_OF));
            }
        }
        return peers;
    }
    
    /**
     * License master URI from the local license peer settings; "self" means this instance.
     */
    public List<PeerReference> parseLicenseMaster(String endpoint, String body) {
        JsonNode content = firstContent(endpoint, body);
        String masterUri = text(content, "master_uri");
        if (masterUri == null) {
            masterUri = text(content, "manager_uri");
        }
        if (masterUri == null || masterUri.equalsIgnoreCase("self")) {
            return List.of();
        }
        return List.of(PeerReference.outbound(masterUri, Relation.LICENSE_PEER_OF));
    }
    
    // ==================== Cluster ====================
    
    /**
     * Cluster membership from {@code cluster/config}, combined with master and SHC state when present.
     */
    public ClusterInfo parseClusterConfig(String endpoint, String body, MasterStatus master,
                                          SearchHeadClusterStatus searchHeadCluster) {
        JsonNode content = firstContent(endpoint, body);
        String mode = text(content, "mode");
        return new ClusterInfo(
            mode != null ? mode : "disabled",
            text(content, "cluster_label"),
            text(content, "site"),
            intOrNull(content, "replication_factor"),
            intOrNull(content, "search_factor"),
            portOrNull(text(content, "replication_port")),
            master,
            searchHeadCluster
        );
    }
    
    /**
     * Master state from {@code cluster/master/info} and {@code cluster/master/generation/master}.
     * Data is fully searchable when the generation has no pending reason.
     */
    public MasterStatus parseMasterStatus(String infoEndpoint, String infoBody,
                                          String generationEndpoint, String generationBody,
                                          List<ClusterMember> peers, List<ClusterMember> searchHeads) {
        JsonNode info = firstContent(infoEndpoint, infoBody);
        JsonNode generation = firstContent(generationEndpoint, generationBody);
        return new MasterStatus(
            flag(info, "maintenance_mode"),
            flag(info, "rolling_restart_flag"),
            text(generation, "pending_last_reason") == null,
            flag(generation, "search_factor_met"),
            flag(generation, "replication_factor_met"),
            peers,
            searchHeads
        );
    }
    
    /**
     * SHC state from {@code shcluster/config} and the captain block of {@code shcluster/status}.
     */
    public SearchHeadClusterStatus parseShcStatus(String configEndpoint, String configBody,
                                                  String statusEndpoint, String statusBody,
                                                  List<ClusterMember> members) {
        JsonNode config = firstContent(configEndpoint, configBody);
        JsonNode captain = firstContent(statusEndpoint, statusBody).get("captain");
        if (captain == null || !captain.isObject()) {
            throw new ResponseParseException(statusEndpoint, "Response of " + statusEndpoint + " has no captain");
        }
        return new SearchHeadClusterStatus(
            text(config, "shcluster_label"),
            intOrNull(config, "replication_factor"),
            text(captain, "mgmt_uri"),
            flag(captain, "rolling_restart_flag"),
            flag(captain, "service_ready_flag"),
            flag(captain, "min_peers_joined_flag"),
            members
        );
    }
    
    public List<ClusterMember> parseClusterPeers(String endpoint, String body) {
        List<ClusterMember> peers = new ArrayList<>();
        for (JsonNode entry : entries(endpoint, body)) {
            JsonNode content = contentOf(endpoint, entry);
            String status = text(content, "status");
            boolean searchable = flag(content, "is_searchable");
            peers.add(new ClusterMember(text(content, "label"), text(content, "host_port_pair"), status, searchable));
        }
        return peers;
    }
    
    public List<ClusterMember> parseClusterSearchHeads(String endpoint, String body) {
        List<ClusterMember> searchHeads = new ArrayList<>();
        for (JsonNode entry : entries(endpoint, body)) {
            JsonNode content = contentOf(endpoint, entry);
            String status = text(content, "status");
            searchHeads.add(new ClusterMember(text(content, "label"), text(content, "host_port_pair"),
                status, "Connected".equalsIgnoreCase(status)));
        }
        return searchHeads;
    }
    
    public List<ClusterMember> parseShcMembers(String endpoint, String body) {
        List<ClusterMember> members = new ArrayList<>();
        for (JsonNode entry : entries(endpoint, body)) {
            JsonNode content = contentOf(endpoint, entry);
            String status = text(content, "status");
            String reference = text(content, "mgmt_uri");
            if (reference == null) {
                reference = text(content, "host_port_pair");
            }
            members.add(new ClusterMember(text(content, "label"), reference, status, "Up".equalsIgnoreCase(status)));
        }
        return members;
    }
    
    // ==================== Resources ====================
    
    public List<DiskPartition> parsePartitions(String endpoint, String body) {
        List<DiskPartition> partitions = new ArrayList<>();
        for (JsonNode entry : entries(endpoint, body)) {
            JsonNode content = contentOf(endpoint, entry);
            Long capacity = longOrNull(content, "capacity");
            Long free = longOrNull(content, "free");
            if (capacity == null || free == null) {
                throw new ResponseParseException(endpoint, "Partition entry without capacity or free space");
            }
            String mount = text(content, "mount_point");
            partitions.add(new DiskPartition(mount != null ? mount : text(entry, "name"),
                text(content, "fs_type"), capacity, free));
        }
        return partitions;
    }
    
    public ResourceUsage parseHostwideUsage(String endpoint, String body) {
        JsonNode content = firstContent(endpoint, body);
        
        Double cpuIdle = doubleOrNull(content, "cpu_idle_pct");
        Integer cpuUsage = cpuIdle != null ? (int) Math.round(100 - cpuIdle) : null;
        
        return new ResourceUsage(
            cpuUsage,
            percent(doubleOrNull(content, "mem_used"), doubleOrNull(content, "mem")),
            percent(doubleOrNull(content, "swap_used"), doubleOrNull(content, "swap"))
        );
    }
    
    private Integer percent(Double used, Double total) {
        if (used == null || total == null || total <= 0) {
            return null;
        }
        return (int) (used / total * 100);
    }
    
    // ==================== Inventory ====================
    
    /**
     * Ports of an input feed. Entry names are "port" or "host:port"; names without a numeric port are skipped.
     */
    public List<Integer> parseInputPorts(String endpoint, String body) {
        Set<Integer> ports = new LinkedHashSet<>();
        for (JsonNode entry : entries(endpoint, body)) {
            Integer port = portOrNull(text(entry, "name"));
            if (port != null) {
                ports.add(port);
            }
        }
        return new ArrayList<>(ports);
    }
    
    /**
     * Port of the running KV store from {@code kvstore/status}.
     */
    public Integer parseKvStorePort(String endpoint, String body) {
        JsonNode current = firstContent(endpoint, body).get("current");
        if (current == null || !current.isObject()) {
            return null;
        }
        return intOrNull(current, "port");
    }
    
    public int countEntries(String endpoint, String body) {
        return entries(endpoint, body).size();
    }
    
    private Integer portOrNull(String name) {
        if (name == null) {
            return null;
        }
        String port = name.substring(name.lastIndexOf(':') + 1).trim();
        try {
            return Integer.valueOf(port);
        } catch (NumberFormatException e) {
            return null;
        }
    }
    
    // ==================== Messages ====================
    
    public List<InstanceMessage> parseMessages(String endpoint, String body) {
        List<InstanceMessage> messages = new ArrayList<>();
        for (JsonNode entry : entries(endpoint, body)) {
            JsonNode content = contentOf(endpoint, entry);
            Long created = longOrNull(content, "timeCreated_epochSecs");
            String severity = text(content, "severity");
            messages.add(new InstanceMessage(
                text(entry, "name"),
                severity != null ? severity.toUpperCase() : null,
                text(content, "message"),
                created != null ? Instant.ofEpochSecond(created) : null
            ));
        }
        return messages;
    }
    
    // ==================== Field Helpers ====================
    
    public String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text.trim();
    }
    
    public boolean flag(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return false;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.intValue() != 0;
        }
        String text = value.asText().trim();
        return text.equals("1") || text.equalsIgnoreCase("true");
    }
    
    public Integer intOrNull(JsonNode node, String field) {
        Double value = doubleOrNull(node, field);
        return value != null ? value.intValue() : null;
    }
    
    public Long longOrNull(JsonNode node, String field) {
        Double value = doubleOrNull(node, field);
        return value != null ? value.longValue() : null;
    }
    
    public Double doubleOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        try {
            return Double.parseDouble(value.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
    
    private JsonNode contentOf(String endpoint, JsonNode entry) {
        JsonNode content = entry.get("content");
        if (content == null || !content.isObject()) {
            throw new ResponseParseException(endpoint, "Entry of " + endpoint + " has no content");
        }
        return content;
    }
    
    private JsonNode readTree(String endpoint, String body) {
        if (body == null || body.isBlank()) {
            throw new ResponseParseException(endpoint, "Empty response from " + endpoint);
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ResponseParseException(endpoint, "Response of " + endpoint + " is not valid JSON", e);
        }
    }
}
