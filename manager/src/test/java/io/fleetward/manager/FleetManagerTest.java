package io.fleetward.manager;

import io.fleetward.api.remote.RemoteResult;
import io.fleetward.manager.monitor.HealthCheck;
import io.fleetward.manager.monitor.MonitoringTask;
import io.fleetward.manager.sync.SyncProfile;
import io.fleetward.manager.testing.LocalShellConnectionFactory;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;

import static io.fleetward.manager.testing.LocalShellConnectionFactory.server;

final class FleetManagerTest {

    private static FleetManager fleet(Path root) {
        return new FleetManager(root, new LocalShellConnectionFactory(), Clock.systemUTC());
    }

    @Test
    void initializeCreatesConfigAndStateLayout() throws Exception {
        Path root = Files.createTempDirectory("fleetward-test-fleet-");
        FleetManager fleet = fleet(root);
        try {
            fleet.initialize();

            Assertions.assertTrue(Files.exists(root.resolve(FleetManager.CONFIG_FILE)));
            Assertions.assertTrue(Files.isDirectory(root.resolve("state")));
            Assertions.assertTrue(fleet.isInitialized());
            Assertions.assertFalse(fleet.getMonitor().isRunning());
            Assertions.assertThrows(IllegalStateException.class, fleet::initialize);
        } finally {
            fleet.shutdown();
        }
        Assertions.assertFalse(fleet.isInitialized());
        Assertions.assertThrows(IllegalStateException.class, fleet::getRegistry);
    }

    @Test
    void componentsRequireInitialization() {
        FleetManager fleet = fleet(Path.of("unused"));

        Assertions.assertThrows(IllegalStateException.class, fleet::getClusterManager);
        fleet.shutdown();
    }

    @Test
    void definitionsAreRestoredOnNextStart() throws Exception {
        Path root = Files.createTempDirectory("fleetward-test-fleet-");
        FleetManager first = fleet(root);
        first.initialize();
        try {
            first.getRegistry().addServer(server("web1", "10.0.0.11"));
            first.getClusterManager().createCluster("web", "frontends", List.of("web1"), Map.of());
            first.getSyncManager().createSyncProfile(
                    SyncProfile.builder("app", "/srv/app.conf", "/etc/app.conf", List.of("web1")).build());
            first.getMonitor().createMonitoringTask(MonitoringTask.builder("ping")
                    .cluster("web")
                    .check(HealthCheck.of("ping", "true"))
                    .build());
        } finally {
            first.shutdown();
        }

        FleetManager second = fleet(root);
        second.initialize();
        try {
            Assertions.assertTrue(second.getRegistry().hasServer("web1"));
            Assertions.assertTrue(second.getClusterManager().hasCluster("web"));
            Assertions.assertEquals("/etc/app.conf", second.getSyncManager().getSyncProfile("app").targetPath());
            Assertions.assertEquals(List.of("web"), second.getMonitor().getMonitoringTask("ping").clusters());

            RemoteResult result = second.getRegistry().executeCommand("web1", "echo up");
            Assertions.assertTrue(result.success());
        } finally {
            second.shutdown();
        }
    }
}
