package io.fleetward.manager.cluster;

import io.fleetward.api.error.NotFoundException;
import io.fleetward.api.error.ValidationException;
import io.fleetward.api.remote.HealthLevel;
import io.fleetward.manager.config.FleetConfig;
import io.fleetward.manager.persistence.JsonDefinitionStore;
import io.fleetward.manager.registry.ServerRegistry;
import io.fleetward.manager.testing.LocalShellConnectionFactory;
import io.fleetward.manager.util.FanOutExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static io.fleetward.manager.testing.LocalShellConnectionFactory.server;

final class ClusterManagerTest {

    private final FanOutExecutor fanOut = new FanOutExecutor("test-cluster");
    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    private ServerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ServerRegistry(new LocalShellConnectionFactory("10.0.0.12"),
                new FleetConfig.SshSettings(), fanOut, null);
        registry.addServer(server("web1", "10.0.0.11"));
        registry.addServer(server("web2", "10.0.0.12"));
        registry.addServer(server("web3", "10.0.0.13"));
    }

    @AfterEach
    void tearDown() {
        fanOut.close();
    }

    private ClusterManager manager(JsonDefinitionStore<Cluster> store) {
        return new ClusterManager(registry, fanOut, store, clock);
    }

    @Test
    void createValidatesNameMembersAndUniqueness() {
        ClusterManager clusters = manager(null);
        clusters.createCluster("web", "frontends", List.of("web1", "web2", "web1"), Map.of("tier", "web"));

        Assertions.assertEquals(List.of("web1", "web2"), clusters.getCluster("web").servers());
        Assertions.assertThrows(ValidationException.class,
                () -> clusters.createCluster("web", null, List.of("web3"), null));
        Assertions.assertThrows(ValidationException.class,
                () -> clusters.createCluster("db", "database tier", List.of(), null));
        Assertions.assertThrows(ValidationException.class,
                () -> clusters.createCluster(" ", null, List.of("web1"), null));
        Assertions.assertFalse(clusters.hasCluster("db"));
    }

    @Test
    void removingLastMemberIsRejected() {
        ClusterManager clusters = manager(null);
        clusters.createCluster("solo", null, List.of("web1"), null);

        Assertions.assertThrows(ValidationException.class, () -> clusters.removeServerFromCluster("solo", "web1"));
        Assertions.assertThrows(NotFoundException.class, () -> clusters.removeServerFromCluster("solo", "web3"));
        Assertions.assertEquals(List.of("web1"), clusters.getCluster("solo").servers());
    }

    @Test
    void membershipChangesKeepOrder() {
        ClusterManager clusters = manager(null);
        clusters.createCluster("web", null, List.of("web1", "web2"), null);

        clusters.addServerToCluster("web", "web3");
        clusters.removeServerFromCluster("web", "web1");

        Assertions.assertEquals(List.of("web2", "web3"), clusters.resolveMembers("web"));
        Assertions.assertThrows(ValidationException.class, () -> clusters.addServerToCluster("web", "web2"));
    }

    @Test
    void updateLeavesNullFieldsUnchanged() {
        ClusterManager clusters = manager(null);
        clusters.createCluster("web", "frontends", List.of("web1"), Map.of("tier", "web"));

        Cluster updated = clusters.updateCluster("web", null, List.of("web1", "web3"), null);

        Assertions.assertEquals("frontends", updated.description());
        Assertions.assertEquals(Map.of("tier", "web"), updated.tags());
        Assertions.assertEquals(2, updated.size());
        Assertions.assertThrows(NotFoundException.class, () -> clusters.updateCluster("ghost", "x", null, null));
    }

    @Test
    void executionReportsPerServerOutcome() {
        ClusterManager clusters = manager(null);
        clusters.createCluster("web", null, List.of("web1", "web2", "web3"), null);

        ClusterExecutionResult result = clusters.executeOnCluster("web", "echo deployed");

        Assertions.assertEquals(3, result.totalServers());
        Assertions.assertEquals(2, result.successCount());
        Assertions.assertEquals(1, result.failureCount());
        Assertions.assertEquals(List.of("web1", "web3"), result.successfulServers());
        Assertions.assertEquals(List.of("web2"), result.failedServers());
        Assertions.assertEquals(2.0 / 3.0 * 100.0, result.successRate(), 0.01);
        Assertions.assertEquals("deployed", result.results().get("web1").output().trim());
    }

    @Test
    void healthLevelFollowsOnlineShare() {
        ClusterManager clusters = manager(null);
        clusters.createCluster("all-up", null, List.of("web1", "web3"), null);
        clusters.createCluster("mixed", null, List.of("web1", "web2"), null);
        clusters.createCluster("down", null, List.of("web2"), null);

        Assertions.assertEquals(HealthLevel.HEALTHY, clusters.checkClusterHealth("all-up").level());
        ClusterHealth mixed = clusters.checkClusterHealth("mixed");
        Assertions.assertEquals(HealthLevel.WARNING, mixed.level());
        Assertions.assertEquals(50.0, mixed.healthyPercent(), 0.001);
        Assertions.assertEquals(1, mixed.offlineServers());
        Assertions.assertEquals(HealthLevel.CRITICAL, clusters.checkClusterHealth("down").level());

        Assertions.assertSame(mixed, clusters.getCluster("mixed").health());
        ClusterStats stats = clusters.getClusterStats();
        Assertions.assertEquals(3, stats.totalClusters());
        Assertions.assertEquals(1, stats.healthyClusters());
        Assertions.assertEquals(1, stats.warningClusters());
        Assertions.assertEquals(1, stats.criticalClusters());
        Assertions.assertEquals(0, stats.uncheckedClusters());
    }

    @Test
    void unregisteredMemberCountsAsCritical() {
        ClusterManager clusters = manager(null);
        clusters.createCluster("web", null, List.of("web1", "ghost"), null);

        ClusterHealth health = clusters.checkClusterHealth("web");

        Assertions.assertEquals(HealthLevel.WARNING, health.level());
        Assertions.assertEquals(HealthLevel.CRITICAL, health.servers().get("ghost").level());
    }

    @Test
    void clustersSurviveRestart() throws Exception {
        Path dir = Files.createTempDirectory("fleetward-test-clusters-");
        ClusterManager first = manager(new JsonDefinitionStore<>(dir, Cluster.class));
        first.createCluster("web", "frontends", List.of("web1", "web2"), Map.of("tier", "web"));
        first.createCluster("tmp", null, List.of("web3"), null);
        first.deleteCluster("tmp");

        ClusterManager second = manager(new JsonDefinitionStore<>(dir, Cluster.class));

        Assertions.assertEquals(1, second.loadPersisted());
        Cluster restored = second.getCluster("web");
        Assertions.assertEquals(List.of("web1", "web2"), restored.servers());
        Assertions.assertEquals("frontends", restored.description());
        Assertions.assertEquals(clock.instant(), restored.createdAt());
        Assertions.assertFalse(second.hasCluster("tmp"));
    }
}
