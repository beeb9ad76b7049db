package com.platform.discovery.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.discovery.config.SplunkClientConfig;
import com.platform.discovery.error.ErrorCode;
import com.platform.discovery.error.FactFetchException;
import com.platform.discovery.error.InstanceConnectException;
import com.platform.discovery.model.ClusterInfo;
import com.platform.discovery.model.DeploymentInfo;
import com.platform.discovery.model.InstanceInventory;
import com.platform.discovery.model.PeerReference;
import com.platform.discovery.model.Relation;
import com.platform.discovery.model.SeedInstance;
import com.platform.discovery.model.ServerInfo;
import com.platform.discovery.observability.MetricsRegistry;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link SplunkRestClient} against a local HTTP server that answers
 * like splunkd. Paths without a scripted answer return 404.
 */
class SplunkRestClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private HttpServer server;
    private final Map<String, Answer> answers = new ConcurrentHashMap<>();
    private final List<String> requested = new CopyOnWriteArrayList<>();
    private final Map<String, String> authorizations = new ConcurrentHashMap<>();
    private SimpleMeterRegistry meterRegistry;
    private SplunkRestClient client;

    private record Answer(int status, String body) {
    }

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();

        SplunkClientConfig config = new SplunkClientConfig();
        config.setScheme("http");
        meterRegistry = new SimpleMeterRegistry();
        HttpClient httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(TIMEOUT)
            .build();
        client = new SplunkRestClient(config, new SplunkResponseParser(new ObjectMapper()),
            new MetricsRegistry(meterRegistry), httpClient);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        requested.add(path);
        String authorization = exchange.getRequestHeaders().getFirst("Authorization");
        if (authorization != null) {
            authorizations.put(path, authorization);
        }
        Answer answer = answers.getOrDefault(path, new Answer(404, ""));
        byte[] body = answer.body().getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(answer.status(), body.length == 0 ? -1 : body.length);
        if (body.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        }
        exchange.close();
    }

    private void answer(String path, int status, String body) {
        answers.put(path, new Answer(status, body));
    }

    private void answer(String path, String body) {
        answer(path, 200, body);
    }

    private static String feed(String... entries) {
        return "{\"entry\": [" + String.join(",", entries) + "]}";
    }

    private static String entry(String name, String content) {
        return "{\"name\": \"" + name + "\", \"content\": " + content + "}";
    }

    private SeedInstance seed() {
        return new SeedInstance("127.0.0.1", server.getAddress().getPort(), "admin", "changeme");
    }

    private InstanceHandle connected() {
        answer(SplunkRestClient.CURRENT_CONTEXT, feed(entry("admin", "{\"username\": \"admin\"}")));
        return client.connect(seed(), TIMEOUT);
    }

    // ==========================================================================
    // Session
    // ==========================================================================

    @Test
    void testConnect_SendsBasicAuthAndReturnsHandle() {
        InstanceHandle handle = connected();

        assertThat(handle.key()).isEqualTo(seed().key());
        assertThat(handle.baseUri().toString()).isEqualTo("http://127.0.0.1:" + server.getAddress().getPort());
        assertThat(authorizations.get(SplunkRestClient.CURRENT_CONTEXT)).isEqualTo("Basic "
            + Base64.getEncoder().encodeToString("admin:changeme".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testConnect_RejectedCredentialsAreAuthenticationFailures() {
        for (int status : new int[]{401, 403}) {
            answer(SplunkRestClient.CURRENT_CONTEXT, status, "");

            assertThatThrownBy(() -> client.connect(seed(), TIMEOUT))
                .isInstanceOf(InstanceConnectException.class)
                .hasMessageContaining("HTTP " + status)
                .extracting(e -> ((InstanceConnectException) e).getErrorCode())
                .isEqualTo(ErrorCode.AUTHENTICATION_FAILED);
        }
    }

    @Test
    void testConnect_OtherStatusIsUnreachable() {
        answer(SplunkRestClient.CURRENT_CONTEXT, 500, "");

        assertThatThrownBy(() -> client.connect(seed(), TIMEOUT))
            .isInstanceOf(InstanceConnectException.class)
            .hasMessageContaining("HTTP 500")
            .extracting(e -> ((InstanceConnectException) e).getErrorCode())
            .isEqualTo(ErrorCode.INSTANCE_UNREACHABLE);
    }

    @Test
    void testConnect_ClosedPortIsUnreachable() throws IOException {
        int port;
        try (ServerSocket closed = new ServerSocket(0, 1, InetAddress.getByName("127.0.0.1"))) {
            port = closed.getLocalPort();
        }
        SeedInstance seed = new SeedInstance("127.0.0.1", port, "admin", "changeme");

        assertThatThrownBy(() -> client.connect(seed, TIMEOUT))
            .isInstanceOf(InstanceConnectException.class)
            .extracting(e -> ((InstanceConnectException) e).getErrorCode())
            .isEqualTo(ErrorCode.INSTANCE_UNREACHABLE);
    }

    // ==========================================================================
    // Required and optional endpoints
    // ==========================================================================

    @Test
    void testGetServerInfo_ReadsInfoAndWebSettings() {
        InstanceHandle handle = connected();
        answer(SplunkRestClient.SERVER_INFO, feed(entry("server-info",
            "{\"serverName\": \"idx01\", \"version\": \"9.1.2\", \"server_roles\": [\"indexer\"]}")));
        answer(SplunkRestClient.SERVER_SETTINGS, feed(entry("settings",
            "{\"startwebserver\": \"0\", \"httpport\": \"8000\", \"enableSplunkWebSSL\": \"1\"}")));

        ServerInfo info = client.getServerInfo(handle);

        assertThat(info.serverName()).isEqualTo("idx01");
        assertThat(info.roles()).containsExactly("indexer");
        assertThat(info.web().enabled()).isFalse();
        assertThat(info.web().port()).isEqualTo(8000);
        assertThat(info.webSslEnabled()).isTrue();
    }

    @Test
    void testGetServerInfo_AbsentSettingsLeaveWebUnknown() {
        InstanceHandle handle = connected();
        answer(SplunkRestClient.SERVER_INFO, feed(entry("server-info", "{\"serverName\": \"uf01\"}")));
        answer(SplunkRestClient.SERVER_SETTINGS, 503, "");

        ServerInfo info = client.getServerInfo(handle);

        assertThat(info.webSslEnabled()).isNull();
        assertThat(info.web().port()).isNull();
    }

    @Test
    void testRequiredEndpointMissing_IsFactFetchFailure() {
        InstanceHandle handle = connected();

        assertThatThrownBy(() -> client.getServerInfo(handle))
            .isInstanceOf(FactFetchException.class)
            .hasMessageContaining("HTTP 404");
    }

    @Test
    void testOptionalEndpointUnexpectedStatus_IsFactFetchFailure() {
        InstanceHandle handle = connected();
        answer(SplunkRestClient.DISTRIBUTED_PEERS, 500, "");

        assertThatThrownBy(() -> client.getAdjacencies(handle))
            .isInstanceOf(FactFetchException.class)
            .hasMessageContaining(SplunkRestClient.DISTRIBUTED_PEERS)
            .hasMessageContaining("HTTP 500");
        assertThat(meterRegistry.counter("discovery.rest.request", "status", "500").count()).isEqualTo(1.0);
    }

    // ==========================================================================
    // Adjacencies
    // ==========================================================================

    @Test
    void testGetAdjacencies_LocalslaveMissingFallsBackToLocalpeer() {
        InstanceHandle handle = connected();
        answer(SplunkRestClient.DISTRIBUTED_PEERS, feed(entry("idx1:8089", "{}")));
        answer(SplunkRestClient.LICENSE_LOCAL_PEER, feed(entry("license", "{\"manager_uri\": \"https://lm1:8089\"}")));

        List<PeerReference> references = client.getAdjacencies(handle);

        assertThat(requested).containsSubsequence(SplunkRestClient.LICENSE_LOCAL_SLAVE, SplunkRestClient.LICENSE_LOCAL_PEER);
        assertThat(references).containsExactly(
            PeerReference.inbound("idx1:8089", Relation.SEARCH_PEER_OF),
            PeerReference.outbound("https://lm1:8089", Relation.LICENSE_PEER_OF));
    }

    @Test
    void testGetAdjacencies_LocalslavePresentSkipsLocalpeer() {
        InstanceHandle handle = connected();
        answer(SplunkRestClient.LICENSE_LOCAL_SLAVE, feed(entry("license", "{\"master_uri\": \"https://lm1:8089\"}")));

        List<PeerReference> references = client.getAdjacencies(handle);

        assertThat(references).containsExactly(PeerReference.outbound("https://lm1:8089", Relation.LICENSE_PEER_OF));
        assertThat(requested).doesNotContain(SplunkRestClient.LICENSE_LOCAL_PEER);
    }

    // ==========================================================================
    // Deployment
    // ==========================================================================

    @Test
    void testGetDeploymentInfo_ResolvesClusterMasterStanzasAndUnquotes() {
        InstanceHandle handle = connected();
        answer(SplunkRestClient.DEPLOYMENT_CLIENT_TARGET_URI, " \"ds1:8089\" ");
        answer(SplunkRestClient.CLUSTERING_MASTER_URI, "clustermaster:east, https://cm2:8089");
        answer("/services/properties/server/clustermaster:east/master_uri", "\"https://cm1:8089\"");
        answer(SplunkRestClient.SHC_DEPLOY_FETCH_URL, "https://deployer:8089");

        DeploymentInfo info = client.getDeploymentInfo(handle);

        assertThat(info.deploymentServerUri()).isEqualTo("ds1:8089");
        assertThat(info.clusterMasterUris()).containsExactly("https://cm1:8089", "https://cm2:8089");
        assertThat(info.shcDeployerUri()).isEqualTo("https://deployer:8089");
    }

    @Test
    void testGetDeploymentInfo_DisabledDeploymentClientHasNoServer() {
        InstanceHandle handle = connected();
        answer(SplunkRestClient.DEPLOYMENT_CLIENT_DISABLED, "1");
        answer(SplunkRestClient.DEPLOYMENT_CLIENT_TARGET_URI, "ds1:8089");

        DeploymentInfo info = client.getDeploymentInfo(handle);

        assertThat(info.deploymentServerUri()).isNull();
        assertThat(requested).doesNotContain(SplunkRestClient.DEPLOYMENT_CLIENT_TARGET_URI);
    }

    @Test
    void testGetDeploymentInfo_BlankOrAbsentPropertiesAreEmpty() {
        InstanceHandle handle = connected();
        answer(SplunkRestClient.DEPLOYMENT_CLIENT_TARGET_URI, "\"\"");
        answer(SplunkRestClient.CLUSTERING_MASTER_URI, "  ");

        DeploymentInfo info = client.getDeploymentInfo(handle);

        assertThat(info.deploymentServerUri()).isNull();
        assertThat(info.clusterMasterUris()).isEmpty();
        assertThat(info.shcDeployerUri()).isNull();
    }

    // ==========================================================================
    // Cluster and inventory
    // ==========================================================================

    @Test
    void testGetClusterInfo_NoClusteringIsDisabled() {
        InstanceHandle handle = connected();

        ClusterInfo info = client.getClusterInfo(handle);

        assertThat(info.mode()).isEqualTo("disabled");
        assertThat(info.isMaster()).isFalse();
        assertThat(info.isSearchHeadClusterMember()).isFalse();
        assertThat(requested).doesNotContain(SplunkRestClient.CLUSTER_MASTER_INFO);
    }

    @Test
    void testGetClusterInfo_PeerReadsReplicationPort() {
        InstanceHandle handle = connected();
        answer(SplunkRestClient.CLUSTER_CONFIG, feed(entry("config",
            "{\"mode\": \"slave\", \"cluster_label\": \"idxc1\", \"replication_port\": \"9887\"}")));

        ClusterInfo info = client.getClusterInfo(handle);

        assertThat(info.mode()).isEqualTo("slave");
        assertThat(info.label()).isEqualTo("idxc1");
        assertThat(info.replicationPort()).isEqualTo(9887);
        assertThat(info.isMaster()).isFalse();
    }

    @Test
    void testGetInventory_ReadsInputPortsKvStoreAndApps() {
        InstanceHandle handle = connected();
        answer(SplunkRestClient.INPUTS_TCP_COOKED, feed(entry("9997", "{}")));
        answer(SplunkRestClient.INPUTS_UDP, feed(entry("514", "{}")));
        answer(SplunkRestClient.KVSTORE_STATUS, feed(entry("status", "{\"current\": {\"port\": 8191}}")));
        answer(SplunkRestClient.APPS_LOCAL, feed(entry("search", "{}"), entry("launcher", "{}")));

        InstanceInventory inventory = client.getInventory(handle);

        assertThat(inventory.receivingPorts()).containsExactly(9997);
        assertThat(inventory.tcpInputPorts()).isEmpty();
        assertThat(inventory.udpInputPorts()).containsExactly(514);
        assertThat(inventory.kvStorePort()).isEqualTo(8191);
        assertThat(inventory.appCount()).isEqualTo(2);
    }
}
