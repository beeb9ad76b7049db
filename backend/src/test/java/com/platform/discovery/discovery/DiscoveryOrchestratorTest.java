package com.platform.discovery.discovery;

import com.platform.discovery.error.InvalidSeedListException;
import com.platform.discovery.health.HealthEvaluator;
import com.platform.discovery.health.HealthThresholds;
import com.platform.discovery.model.DiscoveredNode;
import com.platform.discovery.model.InstanceKey;
import com.platform.discovery.model.InstanceReport;
import com.platform.discovery.model.PeerReference;
import com.platform.discovery.model.PollOutcome;
import com.platform.discovery.model.Relation;
import com.platform.discovery.model.SeedInstance;
import com.platform.discovery.observability.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DiscoveryOrchestrator}.
 */
class DiscoveryOrchestratorTest {

    private FakeInstanceClient client;
    private DiscoveryOrchestrator orchestrator;
    private DiscoveryContext context;
    private List<DiscoveryProgress> progress;

    @BeforeEach
    void setUp() {
        client = new FakeInstanceClient();
        ReportBuilder reportBuilder = new ReportBuilder(client, new HealthEvaluator(),
            new MetricsRegistry(new SimpleMeterRegistry()));
        orchestrator = new DiscoveryOrchestrator(reportBuilder);
        context = new DiscoveryContext(HealthThresholds.empty(), Duration.ofSeconds(5), Set.of(), null);
        progress = new ArrayList<>();
    }

    private static SeedInstance seed(String address) {
        return new SeedInstance(address, 8089, "admin", "changeme");
    }

    private DiscoveryResult run(List<SeedInstance> seeds, CancellationToken token) {
        return orchestrator.run(seeds, context, token, progress::add);
    }

    // =========================================================================
    // Polling
    // =========================================================================

    @Test
    void testAllReachable_OneSuccessReportPerSeedInSeedOrder() {
        for (String host : List.of("a", "b", "c")) {
            client.instance(host, 8089);
        }

        DiscoveryResult result = run(List.of(seed("a"), seed("b"), seed("c")), new CancellationToken());

        assertThat(result.cancelled()).isFalse();
        assertThat(result.reports()).extracting(r -> r.getKey().address()).containsExactly("a", "b", "c");
        assertThat(result.reports()).extracting(InstanceReport::getOutcome).containsOnly(PollOutcome.SUCCESS);
        assertThat(result.placeholders()).isEmpty();
    }

    @Test
    void testFailedInstance_DoesNotAbortTheRun() {
        client.instance("a", 8089);
        client.instance("c", 8089);

        DiscoveryResult result = run(List.of(seed("a"), seed("unreachable"), seed("c")), new CancellationToken());

        assertThat(result.reports()).extracting(InstanceReport::getOutcome)
            .containsExactly(PollOutcome.SUCCESS, PollOutcome.FAILED, PollOutcome.SUCCESS);
    }

    @Test
    void testDuplicateSeeds_ArePolledOnce() {
        client.instance("a", 8089);

        DiscoveryResult result = run(List.of(seed("a"), seed("a")), new CancellationToken());

        assertThat(result.reports()).hasSize(1);
        assertThat(client.calls("connect")).isEqualTo(1);
    }

    // =========================================================================
    // Placeholders
    // =========================================================================

    @Test
    void testUnseenAdjacencyTargets_BecomePlaceholdersAndAreNeverPolled() {
        client.instance("sh1", 8089).roles("search_head")
            .references(PeerReference.inbound("idx9:8089", Relation.SEARCH_PEER_OF));

        DiscoveryResult result = run(List.of(seed("sh1")), new CancellationToken());

        assertThat(result.placeholders()).containsExactly(
            new DiscoveredNode(new InstanceKey("idx9", 8089), new InstanceKey("sh1", 8089), Relation.SEARCH_PEER_OF));
        assertThat(client.connected()).containsExactly(new InstanceKey("sh1", 8089));
    }

    @Test
    void testPlaceholderLaterSeeded_IsPolledAndReplaced() {
        client.instance("sh1", 8089).references(PeerReference.inbound("idx1:8089", Relation.SEARCH_PEER_OF));
        client.instance("idx1", 8089);

        DiscoveryResult result = run(List.of(seed("sh1"), seed("idx1")), new CancellationToken());

        assertThat(result.reports()).hasSize(2);
        assertThat(result.placeholders()).isEmpty();
    }

    @Test
    void testAdjacencyToAlreadyPolledInstance_AddsNoPlaceholder() {
        client.instance("idx1", 8089);
        client.instance("sh1", 8089).references(PeerReference.inbound("idx1:8089", Relation.SEARCH_PEER_OF));

        DiscoveryResult result = run(List.of(seed("idx1"), seed("sh1")), new CancellationToken());

        assertThat(result.placeholders()).isEmpty();
    }

    // =========================================================================
    // Cancellation
    // =========================================================================

    @Test
    void testCancelAfterTwoOfFive_StopsWithTwoReports() {
        List<SeedInstance> seeds = new ArrayList<>();
        for (String host : List.of("a", "b", "c", "d", "e")) {
            client.instance(host, 8089);
            seeds.add(seed(host));
        }
        CancellationToken token = new CancellationToken();
        client.onConnect(key -> {
            if (key.address().equals("b")) {
                token.cancel();
            }
        });

        DiscoveryResult result = run(seeds, token);

        assertThat(result.cancelled()).isTrue();
        assertThat(result.reports()).hasSize(2);
        assertThat(client.calls("connect")).isEqualTo(2);
        assertThat(progress).hasSize(2);
    }

    @Test
    void testCancelledBeforeStart_PollsNothing() {
        client.instance("a", 8089);
        CancellationToken token = new CancellationToken();
        token.cancel();

        DiscoveryResult result = run(List.of(seed("a")), token);

        assertThat(result.cancelled()).isTrue();
        assertThat(result.reports()).isEmpty();
        assertThat(client.calls("connect")).isZero();
    }

    // =========================================================================
    // Progress
    // =========================================================================

    @Test
    void testProgress_OneNotificationPerInstance() {
        client.instance("a", 8089).references(PeerReference.outbound("lm:8089", Relation.LICENSE_PEER_OF));

        run(List.of(seed("a"), seed("b")), new CancellationToken());

        assertThat(progress).hasSize(2);
        assertThat(progress.get(0).index()).isEqualTo(1);
        assertThat(progress.get(0).total()).isEqualTo(2);
        assertThat(progress.get(0).outcome()).isEqualTo(PollOutcome.SUCCESS);
        assertThat(progress.get(0).discovered()).isEqualTo(1);
        assertThat(progress.get(1).instance()).isEqualTo(new InstanceKey("b", 8089));
        assertThat(progress.get(1).outcome()).isEqualTo(PollOutcome.FAILED);
        assertThat(progress.get(1).message()).contains("Unable to reach");
    }

    // =========================================================================
    // Validation
    // =========================================================================

    @Test
    void testEmptySeedList_IsRejectedWithoutPolling() {
        assertThatThrownBy(() -> run(List.of(), new CancellationToken()))
            .isInstanceOf(InvalidSeedListException.class)
            .hasMessageContaining("empty");
        assertThat(client.calls("connect")).isZero();
    }

    @Test
    void testInvalidRow_IsRejectedNamingRowAndField() {
        List<SeedInstance> seeds = List.of(seed("a"), new SeedInstance("b", 70000, "admin", "x"));

        assertThatThrownBy(() -> run(seeds, new CancellationToken()))
            .isInstanceOfSatisfying(InvalidSeedListException.class, e -> {
                assertThat(e.getRow()).isEqualTo(2);
                assertThat(e.getField()).isEqualTo("port");
            });
        assertThat(client.calls("connect")).isZero();
    }

    @Test
    void testBlankUsername_IsRejected() {
        List<SeedInstance> seeds = List.of(new SeedInstance("a", 8089, " ", "x"));

        assertThatThrownBy(() -> DiscoveryOrchestrator.validate(seeds))
            .isInstanceOf(InvalidSeedListException.class)
            .hasMessageContaining("username");
    }
}
