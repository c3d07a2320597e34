package io.fleetward.manager.registry;

import io.fleetward.api.error.NetworkException;
import io.fleetward.api.error.NotFoundException;
import io.fleetward.api.error.ValidationException;
import io.fleetward.api.remote.HealthLevel;
import io.fleetward.api.remote.HealthStatus;
import io.fleetward.api.remote.RemoteResult;
import io.fleetward.api.remote.Platform;
import io.fleetward.api.remote.ServerConfig;
import io.fleetward.api.remote.ServerDetails;
import io.fleetward.api.remote.ServerStatus;
import io.fleetward.manager.config.FleetConfig;
import io.fleetward.manager.persistence.JsonDefinitionStore;
import io.fleetward.manager.testing.LocalShellConnectionFactory;
import io.fleetward.manager.util.FanOutExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static io.fleetward.manager.testing.LocalShellConnectionFactory.server;

final class ServerRegistryTest {

    private final FanOutExecutor fanOut = new FanOutExecutor("test-registry");
    private final LocalShellConnectionFactory connections = new LocalShellConnectionFactory("10.0.0.12");

    @AfterEach
    void tearDown() {
        fanOut.close();
    }

    private ServerRegistry registry(JsonDefinitionStore<ServerConfig> store) {
        FleetConfig.SshSettings settings = new FleetConfig.SshSettings();
        settings.setCommandTimeoutSeconds(5);
        settings.setConnectTimeoutSeconds(2);
        return new ServerRegistry(connections, settings, fanOut, store);
    }

    @Test
    void addRejectsDuplicatesAndInvalidConfigs() {
        ServerRegistry registry = registry(null);
        registry.addServer(server("web1", "10.0.0.11"));

        Assertions.assertThrows(ValidationException.class, () -> registry.addServer(server("web1", "10.0.0.99")));
        Assertions.assertThrows(ValidationException.class,
                () -> registry.addServer(ServerConfig.builder().name("bad").host("h").username("u").build()));
        Assertions.assertEquals(1, registry.listServers().size());
        Assertions.assertEquals(ServerStatus.UNKNOWN, registry.getServer("web1").status());
    }

    @Test
    void unknownServerIsNotFound() {
        ServerRegistry registry = registry(null);

        Assertions.assertThrows(NotFoundException.class, () -> registry.executeCommand("ghost", "uptime"));
        Assertions.assertThrows(NotFoundException.class, () -> registry.getServer("ghost"));
        Assertions.assertThrows(NotFoundException.class, () -> registry.removeServer("ghost"));
    }

    @Test
    void executeMarksServerOnlineAndReusesConnection() throws Exception {
        ServerRegistry registry = registry(null);
        registry.addServer(server("web1", "10.0.0.11"));

        RemoteResult first = registry.executeCommand("web1", "echo hello");
        RemoteResult second = registry.executeCommand("web1", "exit 3");

        Assertions.assertTrue(first.success());
        Assertions.assertEquals("hello", first.output().trim());
        Assertions.assertEquals(3, second.exitCode());
        Assertions.assertFalse(second.success());
        Assertions.assertEquals(ServerStatus.ONLINE, registry.getServer("web1").status());
        Assertions.assertTrue(registry.getServer("web1").connected());
        Assertions.assertEquals(1, connections.connectionsCreated());
    }

    @Test
    void commandTimeoutReturnsTimedOutResult() throws Exception {
        ServerRegistry registry = registry(null);
        registry.addServer(server("web1", "10.0.0.11"));

        RemoteResult result = registry.executeCommand("web1", "sleep 5", Duration.ofMillis(200));

        Assertions.assertTrue(result.timedOut());
        Assertions.assertFalse(result.success());
        Assertions.assertEquals(RemoteResult.NO_EXIT_CODE, result.exitCode());
    }

    @Test
    void unreachableServerIsMarkedOffline() {
        ServerRegistry registry = registry(null);
        registry.addServer(server("web2", "10.0.0.12"));

        Assertions.assertThrows(NetworkException.class, () -> registry.executeCommand("web2", "uptime"));
        Assertions.assertEquals(ServerStatus.OFFLINE, registry.getServer("web2").status());
        Assertions.assertNotNull(registry.getServer("web2").lastError());
        Assertions.assertFalse(registry.getServer("web2").connected());
    }

    @Test
    void executeOnServersReportsEveryServer() {
        ServerRegistry registry = registry(null);
        registry.addServer(server("web1", "10.0.0.11"));
        registry.addServer(server("web2", "10.0.0.12"));

        Map<String, RemoteResult> results = registry.executeOnServers(List.of("web1", "web2", "ghost"), "echo ok");

        Assertions.assertEquals(List.of("web1", "web2", "ghost"), List.copyOf(results.keySet()));
        Assertions.assertTrue(results.get("web1").success());
        Assertions.assertFalse(results.get("web2").success());
        Assertions.assertNotNull(results.get("web2").error());
        Assertions.assertFalse(results.get("ghost").success());
    }

    @Test
    void executeOnServersReportsEveryServerWhenAllFail() {
        ServerRegistry registry = registry(null);
        registry.addServer(server("web2", "10.0.0.12"));
        registry.addServer(server("web3", "10.0.0.12"));

        Map<String, RemoteResult> results = registry.executeOnServers(
                List.of("web2", "web3", "ghost", "web2"), "echo ok");

        Assertions.assertEquals(List.of("web2", "web3", "ghost"), List.copyOf(results.keySet()));
        for (RemoteResult result : results.values()) {
            Assertions.assertFalse(result.success());
            Assertions.assertNotNull(result.error());
        }
    }

    @Test
    void executeScriptRunsThroughShell() throws Exception {
        ServerRegistry registry = registry(null);
        registry.addServer(server("web1", "10.0.0.11"));

        RemoteResult result = registry.executeScript("web1", "for i in 1 2 3; do echo \"n=$i\"; done");

        Assertions.assertTrue(result.success());
        Assertions.assertEquals(List.of("n=1", "n=2", "n=3"), List.of(result.output().trim().split("\\R")));
    }

    @Test
    void healthCheckNeverThrowsForUnreachableServer() {
        ServerRegistry registry = registry(null);
        registry.addServer(server("web1", "10.0.0.11"));
        registry.addServer(server("web2", "10.0.0.12"));

        HealthStatus healthy = registry.checkServerHealth("web1");
        HealthStatus down = registry.checkServerHealth("web2");

        Assertions.assertEquals(HealthLevel.HEALTHY, healthy.level());
        Assertions.assertEquals(HealthLevel.CRITICAL, down.level());
        Assertions.assertEquals("Server is not responding", down.message());
    }

    @Test
    void testConnectionDoesNotRegisterServer() throws Exception {
        ServerRegistry registry = registry(null);

        Duration elapsed = registry.testConnection(server("candidate", "10.0.0.50"));

        Assertions.assertNotNull(elapsed);
        Assertions.assertFalse(registry.hasServer("candidate"));
        Assertions.assertThrows(NetworkException.class, () -> registry.testConnection(server("candidate", "10.0.0.12")));
    }

    @Test
    void uploadAndDownloadMoveFileContents() throws Exception {
        ServerRegistry registry = registry(null);
        registry.addServer(server("web1", "10.0.0.11"));
        Path dir = Files.createTempDirectory("fleetward-test-transfer-");
        Path local = dir.resolve("app.conf");
        Files.write(local, "listen 80\n".getBytes(StandardCharsets.UTF_8));

        registry.uploadFile("web1", local, dir.resolve("remote.conf").toString());
        registry.downloadFile("web1", dir.resolve("remote.conf").toString(), dir.resolve("back.conf"));

        Assertions.assertEquals("listen 80\n", Files.readString(dir.resolve("back.conf")));
    }

    @Test
    void updateReplacesConfigAndDropsConnection() throws Exception {
        ServerRegistry registry = registry(null);
        registry.addServer(server("web1", "10.0.0.11"));
        registry.executeCommand("web1", "true");

        registry.updateServer("web1", server("web1", "10.0.0.21"));

        Assertions.assertEquals("10.0.0.21", registry.getServer("web1").config().host());
        Assertions.assertFalse(registry.getServer("web1").connected());
        Assertions.assertThrows(ValidationException.class,
                () -> registry.updateServer("web1", server("web9", "10.0.0.21")));
    }

    @Test
    void definitionsSurviveRestart() throws Exception {
        Path dir = Files.createTempDirectory("fleetward-test-registry-");
        ServerRegistry first = registry(new JsonDefinitionStore<>(dir, ServerConfig.class));
        first.addServer(server("web1", "10.0.0.11"));
        first.addServer(server("web2", "10.0.0.12"));
        first.removeServer("web2");

        ServerRegistry second = registry(new JsonDefinitionStore<>(dir, ServerConfig.class));
        int restored = second.loadPersisted();

        Assertions.assertEquals(1, restored);
        Assertions.assertEquals(server("web1", "10.0.0.11"), second.getServer("web1").config());
        Assertions.assertFalse(second.hasServer("web2"));
    }

    @Test
    void similarNamesSurviveRestartSeparately() throws Exception {
        Path dir = Files.createTempDirectory("fleetward-test-registry-");
        ServerRegistry first = registry(new JsonDefinitionStore<>(dir, ServerConfig.class));
        first.addServer(server("db:1", "10.0.1.1"));
        first.addServer(server("db_1", "10.0.1.2"));

        ServerRegistry second = registry(new JsonDefinitionStore<>(dir, ServerConfig.class));

        Assertions.assertEquals(2, second.loadPersisted());
        Assertions.assertEquals("10.0.1.1", second.getServer("db:1").config().host());
        Assertions.assertEquals("10.0.1.2", second.getServer("db_1").config().host());

        second.removeServer("db:1");
        ServerRegistry third = registry(new JsonDefinitionStore<>(dir, ServerConfig.class));
        Assertions.assertEquals(1, third.loadPersisted());
        Assertions.assertTrue(third.hasServer("db_1"));
    }

    @Test
    void serverDetailsReportLocalPlatform() throws Exception {
        ServerRegistry registry = registry(null);
        registry.addServer(server("web1", "10.0.0.11"));

        ServerDetails details = registry.getServerDetails("web1");

        Assertions.assertEquals("web1", details.name());
        Assertions.assertEquals(ServerStatus.ONLINE, details.info().status());
        String os = System.getProperty("os.name");
        Assertions.assertEquals(os.startsWith("Mac") ? Platform.DARWIN : Platform.LINUX, details.platform());
        Assertions.assertNotNull(details.version());
        if (os.equals("Linux")) {
            Assertions.assertEquals(System.getProperty("os.version"), details.version());
        }
    }

    @Test
    void serverDetailsOfUnreachableServerFail() {
        ServerRegistry registry = registry(null);
        registry.addServer(server("web2", "10.0.0.12"));

        Assertions.assertThrows(NetworkException.class, () -> registry.getServerDetails("web2"));
        Assertions.assertThrows(NotFoundException.class, () -> registry.getServerDetails("ghost"));
    }

    @Test
    void statsCountStatusesAndConnections() throws Exception {
        ServerRegistry registry = registry(null);
        registry.addServer(server("web1", "10.0.0.11"));
        registry.addServer(server("web2", "10.0.0.12"));
        registry.addServer(server("web3", "10.0.0.13"));
        registry.executeCommand("web1", "true");
        registry.checkServerHealth("web2");

        RegistryStats stats = registry.getStats();

        Assertions.assertEquals(3, stats.totalServers());
        Assertions.assertEquals(1, stats.onlineServers());
        Assertions.assertEquals(1, stats.offlineServers());
        Assertions.assertEquals(1, stats.unknownServers());
        Assertions.assertEquals(1, stats.openConnections());

        registry.closeAllConnections();
        Assertions.assertEquals(0, registry.getStats().openConnections());
    }
}
