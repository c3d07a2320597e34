package io.fleetward.manager.metrics;

import io.fleetward.api.error.RemoteException;
import io.fleetward.api.remote.RemoteResult;
import io.fleetward.api.remote.ServerMetrics;
import io.fleetward.api.remote.Tunnel;
import io.fleetward.manager.config.FleetConfig;
import io.fleetward.manager.connection.ConnectionState;
import io.fleetward.manager.connection.RemoteConnection;
import io.fleetward.manager.registry.ServerRegistry;
import io.fleetward.manager.util.Deadline;
import io.fleetward.manager.util.FanOutExecutor;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static io.fleetward.manager.testing.LocalShellConnectionFactory.server;

final class SystemMetricsCollectorTest {

    private static final Map<String, RemoteResult> CANNED = Map.of(
            SystemMetricsCollector.LOAD_AVERAGE, ok("0.50 0.40 0.30 1/200 999\n"),
            SystemMetricsCollector.CPU_IDLE, ok("75.0\n"),
            SystemMetricsCollector.MEMORY, ok("41.2"),
            SystemMetricsCollector.DISK, ok("63\n"),
            SystemMetricsCollector.PROCESSES, RemoteResult.completed("web1", "ps", "", 127, Instant.now()),
            SystemMetricsCollector.UPTIME, ok("3600.00 7000.00\n"));

    private static RemoteResult ok(String output) {
        return RemoteResult.completed("web1", "metric", output, 0, Instant.now());
    }

    @Test
    void fillsParsedFieldsAndLeavesFailedOnesEmpty() {
        try (FanOutExecutor fanOut = new FanOutExecutor("test-metrics")) {
            ServerRegistry registry = new ServerRegistry(config -> new CannedConnection(),
                    new FleetConfig.SshSettings(), fanOut, null);
            registry.addServer(server("web1", "10.0.0.11"));
            ServerMetrics.Builder builder = ServerMetrics.builder("web1");

            new SystemMetricsCollector(Duration.ofSeconds(5))
                    .collect(registry, "web1", Deadline.after(Duration.ofSeconds(30)), builder);
            ServerMetrics metrics = builder.build();

            Assertions.assertEquals(0.5, metrics.loadAverage().oneMinute());
            Assertions.assertEquals(25.0, metrics.cpuPercent());
            Assertions.assertEquals(41.2, metrics.memoryPercent());
            Assertions.assertEquals(63.0, metrics.diskPercent());
            Assertions.assertNull(metrics.processCount());
            Assertions.assertEquals(Duration.ofHours(1), metrics.uptime());
        }
    }

    @Test
    void expiredDeadlineSkipsEveryCommand() {
        try (FanOutExecutor fanOut = new FanOutExecutor("test-metrics")) {
            ServerRegistry registry = new ServerRegistry(config -> new CannedConnection(),
                    new FleetConfig.SshSettings(), fanOut, null);
            registry.addServer(server("web1", "10.0.0.11"));
            ServerMetrics.Builder builder = ServerMetrics.builder("web1");

            new SystemMetricsCollector(Duration.ofSeconds(5))
                    .collect(registry, "web1", Deadline.after(Duration.ZERO), builder);

            Assertions.assertNull(builder.build().loadAverage());
        }
    }

    private static final class CannedConnection implements RemoteConnection {

        private ConnectionState state = ConnectionState.DISCONNECTED;

        @Override
        public String getServerName() {
            return "web1";
        }

        @Override
        public ConnectionState getState() {
            return state;
        }

        @Override
        public void connect(Duration timeout) {
            state = ConnectionState.CONNECTED;
        }

        @Override
        public RemoteResult execute(String command, Duration timeout) throws RemoteException {
            RemoteResult result = CANNED.get(command);
            if (result == null) {
                throw new RemoteException("web1", "execute", "unexpected command: " + command);
            }
            return result;
        }

        @Override
        public void upload(Path localPath, String remotePath, Duration timeout) throws RemoteException {
            throw new RemoteException("web1", "upload", "not supported");
        }

        @Override
        public void download(String remotePath, Path localPath, Duration timeout) throws RemoteException {
            throw new RemoteException("web1", "download", "not supported");
        }

        @Override
        public Tunnel createTunnel(int localPort, String remoteHost, int remotePort) throws RemoteException {
            throw new RemoteException("web1", "tunnel", "not supported");
        }

        @Override
        public boolean isConnected() {
            return state == ConnectionState.CONNECTED;
        }

        @Override
        public void close() {
            state = ConnectionState.DISCONNECTED;
        }
    }
}
