package com.platform.discovery.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.discovery.config.SplunkClientConfig;
import com.platform.discovery.error.ErrorCode;
import com.platform.discovery.error.FactFetchException;
import com.platform.discovery.error.InstanceConnectException;
import com.platform.discovery.model.ClusterInfo;
import com.platform.discovery.model.ClusterInfo.ClusterMember;
import com.platform.discovery.model.ClusterInfo.MasterStatus;
import com.platform.discovery.model.ClusterInfo.SearchHeadClusterStatus;
import com.platform.discovery.model.DeploymentInfo;
import com.platform.discovery.model.DiskPartition;
import com.platform.discovery.model.InstanceInventory;
import com.platform.discovery.model.InstanceMessage;
import com.platform.discovery.model.PeerReference;
import com.platform.discovery.model.ResourceUsage;
import com.platform.discovery.model.SeedInstance;
import com.platform.discovery.model.ServerInfo;
import com.platform.discovery.model.WebSettings;
import com.platform.discovery.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@link InstanceClient} backed by the splunkd REST API on the management port.
 * 
 * Every call is a single GET with basic authentication and
 * {@code output_mode=json&count=-1}. There are no retries: a timeout or an
 * unexpected status fails the call.
 */
@Slf4j
@Component
public class SplunkRestClient implements InstanceClient {
    
    private static final String QUERY = "?output_mode=json&count=-1";
    
    // Feature endpoints answer 404 or 503 when the feature is not configured
    private static final Set<Integer> ABSENT_STATUSES = Set.of(404, 503);
    
    static final String CURRENT_CONTEXT = "/services/authentication/current-context";
    static final String SERVER_INFO = "/services/server/info";
    static final String SERVER_SETTINGS = "/services/server/settings";
    static final String DISTRIBUTED_PEERS = "/services/search/distributed/peers";
    static final String LICENSE_LOCAL_SLAVE = "/services/licenser/localslave";
    static final String LICENSE_LOCAL_PEER = "/services/licenser/localpeer";
    static final String DEPLOYMENT_CLIENT_DISABLED =
        "/services/properties/deploymentclient/target-broker:deploymentServer/disabled";
    static final String DEPLOYMENT_CLIENT_TARGET_URI =
        "/services/properties/deploymentclient/target-broker:deploymentServer/targetUri";
    static final String CLUSTERING_MASTER_URI = "/services/properties/server/clustering/master_uri";
    static final String SHC_DEPLOY_FETCH_URL = "/services/properties/server/shclustering/conf_deploy_fetch_url";
    static final String CLUSTER_CONFIG = "/services/cluster/config";
    static final String CLUSTER_MASTER_INFO = "/services/cluster/master/info";
    static final String CLUSTER_MASTER_GENERATION = "/services/cluster/master/generation/master";
    static final String CLUSTER_MASTER_PEERS = "/services/cluster/master/peers";
    static final String CLUSTER_MASTER_SEARCH_HEADS = "/services/cluster/master/searchheads";
    static final String SHC_CONFIG = "/services/shcluster/config";
    static final String SHC_STATUS = "/services/shcluster/status";
    static final String SHC_MEMBERS = "/services/shcluster/member/members";
    static final String PARTITIONS_SPACE = "/services/server/status/partitions-space";
    static final String HOSTWIDE_USAGE = "/services/server/status/resource-usage/hostwide";
    static final String MESSAGES = "/services/messages";
    static final String INPUTS_TCP_COOKED = "/services/data/inputs/tcp/cooked";
    static final String INPUTS_TCP_RAW = "/services/data/inputs/tcp/raw";
    static final String INPUTS_UDP = "/services/data/inputs/udp";
    static final String KVSTORE_STATUS = "/services/kvstore/status";
    static final String APPS_LOCAL = "/services/apps/local";
    
    private final SplunkClientConfig config;
    private final SplunkResponseParser parser;
    private final MetricsRegistry metricsRegistry;
    private final HttpClient httpClient;
    
    public SplunkRestClient(SplunkClientConfig config, SplunkResponseParser parser,
                            MetricsRegistry metricsRegistry, HttpClient splunkHttpClient) {
        this.config = config;
        this.parser = parser;
        this.metricsRegistry = metricsRegistry;
        this.httpClient = splunkHttpClient;
    }
    
    // ==================== Session ====================
    
    @Override
    public InstanceHandle connect(SeedInstance seed, Duration timeout) {
        URI baseUri = URI.create(String.format("%s://%s:%d", config.getScheme(), seed.address(), seed.port()));
        String credentials = seed.username() + ":" + (seed.password() != null ? seed.password() : "");
        String authorization = "Basic " + Base64.getEncoder()
            .encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
        InstanceHandle handle = new InstanceHandle(seed.key(), baseUri, authorization, timeout);
        
        HttpResponse<String> response;
        try {
            response = send(handle, CURRENT_CONTEXT);
        } catch (IOException e) {
            throw InstanceConnectException.unreachable(seed.key(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw InstanceConnectException.unreachable(seed.key(), e);
        }
        
        int status = response.statusCode();
        if (status == 401 || status == 403) {
            throw InstanceConnectException.authenticationFailed(seed.key(), status);
        }
        if (status != 200) {
            throw new InstanceConnectException(ErrorCode.INSTANCE_UNREACHABLE, seed.key(),
                String.format("Unexpected HTTP %d from %s on %s", status, seed.key(), CURRENT_CONTEXT));
        }
        
        log.debug("Authenticated to {} as {}", seed.key(), seed.username());
        return handle;
    }
    
    // ==================== Fact Categories ====================
    
    @Override
    public ServerInfo getServerInfo(InstanceHandle handle) {
        String info = get(handle, SERVER_INFO);
        WebSettings web = getOptional(handle, SERVER_SETTINGS)
            .map(body -> parser.parseWebSettings(SERVER_SETTINGS, body))
            .orElse(WebSettings.unknown());
        return parser.parseServerInfo(SERVER_INFO, info, web);
    }
    
    @Override
    public List<PeerReference> getAdjacencies(InstanceHandle handle) {
        List<PeerReference> references = new ArrayList<>();
        getOptional(handle, DISTRIBUTED_PEERS)
            .ifPresent(body -> references.addAll(parser.parseSearchPeers(DISTRIBUTED_PEERS, body)));
        
        Optional<String> license = getOptional(handle, LICENSE_LOCAL_SLAVE);
        String licenseEndpoint = LICENSE_LOCAL_SLAVE;
        if (license.isEmpty()) {
            license = getOptional(handle, LICENSE_LOCAL_PEER);
            licenseEndpoint = LICENSE_LOCAL_PEER;
        }
        if (license.isPresent()) {
            references.addAll(parser.parseLicenseMaster(licenseEndpoint, license.get()));
        }
        return references;
    }
    
    @Override
    public DeploymentInfo getDeploymentInfo(InstanceHandle handle) {
        String deploymentServer = null;
        boolean deploymentClientDisabled = getProperty(handle, DEPLOYMENT_CLIENT_DISABLED)
            .map(value -> value.equals("1") || value.equalsIgnoreCase("true"))
            .orElse(false);
        if (!deploymentClientDisabled) {
            deploymentServer = getProperty(handle, DEPLOYMENT_CLIENT_TARGET_URI).orElse(null);
        }
        
        List<String> clusterMasters = new ArrayList<>();
        Optional<String> masterUris = getProperty(handle, CLUSTERING_MASTER_URI);
        if (masterUris.isPresent()) {
            for (String masterUri : masterUris.get().split(",")) {
                resolveMasterUri(handle, masterUri.trim()).ifPresent(clusterMasters::add);
            }
        }
        
        String shcDeployer = getProperty(handle, SHC_DEPLOY_FETCH_URL).orElse(null);
        
        return new DeploymentInfo(deploymentServer, clusterMasters, shcDeployer);
    }
    
    /**
     * Multi-cluster search heads list "clustermaster:&lt;stanza&gt;" names whose stanza holds the URI.
     */
    private Optional<String> resolveMasterUri(InstanceHandle handle, String masterUri) {
        if (masterUri.isEmpty()) {
            return Optional.empty();
        }
        if (masterUri.startsWith("clustermaster:")) {
            return getProperty(handle, "/services/properties/server/" + masterUri + "/master_uri");
        }
        return Optional.of(masterUri);
    }
    
    @Override
    public ClusterInfo getClusterInfo(InstanceHandle handle) {
        Optional<String> clusterConfig = getOptional(handle, CLUSTER_CONFIG);
        
        MasterStatus master = null;
        String mode = clusterConfig
            .map(body -> parser.text(parser.firstContent(CLUSTER_CONFIG, body), "mode"))
            .orElse("disabled");
        if ("master".equalsIgnoreCase(mode) || "manager".equalsIgnoreCase(mode)) {
            master = getMasterStatus(handle);
        }
        
        SearchHeadClusterStatus searchHeadCluster = getSearchHeadClusterStatus(handle);
        
        if (clusterConfig.isEmpty()) {
            return searchHeadCluster == null ? ClusterInfo.disabled()
                : new ClusterInfo("disabled", null, null, null, null, null, null, searchHeadCluster);
        }
        return parser.parseClusterConfig(CLUSTER_CONFIG, clusterConfig.get(), master, searchHeadCluster);
    }
    
    private MasterStatus getMasterStatus(InstanceHandle handle) {
        String info = get(handle, CLUSTER_MASTER_INFO);
        String generation = get(handle, CLUSTER_MASTER_GENERATION);
        List<ClusterMember> peers = parser.parseClusterPeers(CLUSTER_MASTER_PEERS, get(handle, CLUSTER_MASTER_PEERS));
        List<ClusterMember> searchHeads = parser.parseClusterSearchHeads(
            CLUSTER_MASTER_SEARCH_HEADS, get(handle, CLUSTER_MASTER_SEARCH_HEADS));
        return parser.parseMasterStatus(CLUSTER_MASTER_INFO, info, CLUSTER_MASTER_GENERATION, generation,
            peers, searchHeads);
    }
    
    private SearchHeadClusterStatus getSearchHeadClusterStatus(InstanceHandle handle) {
        Optional<String> shcConfig = getOptional(handle, SHC_CONFIG);
        if (shcConfig.isEmpty()) {
            return null;
        }
        JsonNode configContent = parser.firstContent(SHC_CONFIG, shcConfig.get());
        String mode = parser.text(configContent, "mode");
        if (mode == null || "disabled".equalsIgnoreCase(mode)) {
            return null;
        }
        
        Optional<String> status = getOptional(handle, SHC_STATUS);
        if (status.isEmpty()) {
            log.debug("{} is configured for SHC but reports no captain yet", handle.key());
            return null;
        }
        List<ClusterMember> members = getOptional(handle, SHC_MEMBERS)
            .map(body -> parser.parseShcMembers(SHC_MEMBERS, body))
            .orElse(List.of());
        return parser.parseShcStatus(SHC_CONFIG, shcConfig.get(), SHC_STATUS, status.get(), members);
    }
    
    @Override
    public List<DiskPartition> getDiskUsage(InstanceHandle handle) {
        return parser.parsePartitions(PARTITIONS_SPACE, get(handle, PARTITIONS_SPACE));
    }
    
    @Override
    public ResourceUsage getResourceUsage(InstanceHandle handle) {
        return parser.parseHostwideUsage(HOSTWIDE_USAGE, get(handle, HOSTWIDE_USAGE));
    }
    
    @Override
    public List<InstanceMessage> getMessages(InstanceHandle handle) {
        return parser.parseMessages(MESSAGES, get(handle, MESSAGES));
    }
    
    @Override
    public InstanceInventory getInventory(InstanceHandle handle) {
        List<Integer> receiving = inputPorts(handle, INPUTS_TCP_COOKED);
        List<Integer> tcp = inputPorts(handle, INPUTS_TCP_RAW);
        List<Integer> udp = inputPorts(handle, INPUTS_UDP);
        Integer kvStorePort = getOptional(handle, KVSTORE_STATUS)
            .map(body -> parser.parseKvStorePort(KVSTORE_STATUS, body))
            .orElse(null);
        int apps = parser.countEntries(APPS_LOCAL, get(handle, APPS_LOCAL));
        return new InstanceInventory(receiving, tcp, udp, kvStorePort, apps);
    }
    
    private List<Integer> inputPorts(InstanceHandle handle, String endpoint) {
        return getOptional(handle, endpoint)
            .map(body -> parser.parseInputPorts(endpoint, body))
            .orElse(List.of());
    }
    
    // ==================== HTTP ====================
    
    /**
     * GET an endpoint that must exist.
     */
    private String get(InstanceHandle handle, String endpoint) {
        HttpResponse<String> response = execute(handle, endpoint);
        if (response.statusCode() != 200) {
            throw FactFetchException.httpStatus(endpoint, response.statusCode());
        }
        return response.body();
    }
    
    /**
     * GET an endpoint that only exists when the corresponding feature is configured.
     */
    private Optional<String> getOptional(InstanceHandle handle, String endpoint) {
        HttpResponse<String> response = execute(handle, endpoint);
        if (ABSENT_STATUSES.contains(response.statusCode())) {
            return Optional.empty();
        }
        if (response.statusCode() != 200) {
            throw FactFetchException.httpStatus(endpoint, response.statusCode());
        }
        return Optional.of(response.body());
    }
    
    /**
     * Single configuration value; the properties endpoint answers with the bare value.
     */
    private Optional<String> getProperty(InstanceHandle handle, String endpoint) {
        return getOptional(handle, endpoint)
            .map(String::trim)
            .map(SplunkRestClient::unquote)
            .filter(value -> !value.isEmpty());
    }
    
    private HttpResponse<String> execute(InstanceHandle handle, String endpoint) {
        try {
            HttpResponse<String> response = send(handle, endpoint);
            metricsRegistry.incrementCounter("discovery.rest.request", "status", String.valueOf(response.statusCode()));
            return response;
        } catch (IOException e) {
            metricsRegistry.incrementCounter("discovery.rest.request", "status", "error");
            throw new FactFetchException(endpoint,
                String.format("GET %s failed: %s", endpoint, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FactFetchException(endpoint, "GET " + endpoint + " interrupted", e);
        }
    }
    
    private HttpResponse<String> send(InstanceHandle handle, String endpoint) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(handle.baseUri().resolve(endpoint + QUERY))
            .timeout(handle.timeout() != null ? handle.timeout() : config.getRequestTimeout())
            .header("Authorization", handle.authorization())
            .header("Accept", "application/json")
            .GET()
            .build();
        
        log.debug("GET {}{}", handle.baseUri(), endpoint);
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }
    
    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1).trim();
        }
        return value;
    }
}
