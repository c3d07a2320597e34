package io.fleetward.manager.connection;

import io.fleetward.api.error.AuthenticationException;
import io.fleetward.api.error.NetworkException;
import io.fleetward.api.error.NotConnectedException;
import io.fleetward.api.remote.ServerConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

final class SshConnectionTest {

    private static ServerConfig config(String host, int port) {
        return ServerConfig.builder()
                .name("web1")
                .host(host)
                .port(port)
                .username("deploy")
                .password("secret")
                .build();
    }

    @Test
    void operationsBeforeConnectFailWithNotConnected() throws Exception {
        SshConnection connection = new SshConnection(config("127.0.0.1", 22), false, null);
        Path local = Files.createTempFile("fleetward-test-ssh-", ".txt");

        Assertions.assertEquals(ConnectionState.DISCONNECTED, connection.getState());
        NotConnectedException error = Assertions.assertThrows(NotConnectedException.class,
                () -> connection.execute("uptime", Duration.ofSeconds(1)));
        Assertions.assertEquals("web1", error.getServerName());
        Assertions.assertEquals("execute", error.getOperation());
        Assertions.assertThrows(NotConnectedException.class,
                () -> connection.upload(local, "/tmp/x", Duration.ofSeconds(1)));
        Assertions.assertThrows(NotConnectedException.class,
                () -> connection.createTunnel(0, "localhost", 5432));
        Assertions.assertFalse(connection.isConnected());
    }

    @Test
    void closeIsIdempotent() {
        SshConnection connection = new SshConnection(config("127.0.0.1", 22), false, null);

        connection.close();
        connection.close();

        Assertions.assertEquals(ConnectionState.DISCONNECTED, connection.getState());
    }

    @Test
    void refusedConnectionIsNetworkFailure() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        SshConnection connection = new SshConnection(config("127.0.0.1", port), false, null);

        Assertions.assertThrows(NetworkException.class, () -> connection.connect(Duration.ofSeconds(2)));
        Assertions.assertEquals(ConnectionState.DISCONNECTED, connection.getState());
    }

    @Test
    void unreadableKeyIsAuthenticationFailure() {
        ServerConfig config = ServerConfig.builder()
                .name("web1")
                .host("127.0.0.1")
                .username("deploy")
                .privateKeyPath("/nonexistent/fleetward/id_ed25519")
                .build();
        SshConnection connection = new SshConnection(config, false, null);

        Assertions.assertThrows(AuthenticationException.class, () -> connection.connect(Duration.ofSeconds(2)));
    }
}
