package io.fleetward.manager.testing;

import io.fleetward.api.error.NetworkException;
import io.fleetward.api.error.NotConnectedException;
import io.fleetward.api.error.RemoteException;
import io.fleetward.api.remote.RemoteResult;
import io.fleetward.api.remote.Tunnel;
import io.fleetward.manager.connection.ConnectionState;
import io.fleetward.manager.connection.RemoteConnection;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Connection that runs commands with the local {@code sh} and treats remote
 * paths as local absolute paths.
 */
public final class LocalShellConnection implements RemoteConnection {

    private final String serverName;
    private final String host;
    private final boolean reachable;
    private final LocalShellConnectionFactory factory;
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;

    LocalShellConnection(String serverName, String host, boolean reachable, LocalShellConnectionFactory factory) {
        this.serverName = serverName;
        this.host = host;
        this.reachable = reachable;
        this.factory = factory;
    }

    @Override
    public String getServerName() {
        return serverName;
    }

    @Override
    public ConnectionState getState() {
        return state;
    }

    @Override
    public void connect(Duration timeout) throws RemoteException {
        if (!reachable) {
            throw new NetworkException(serverName, "connect", "connection refused");
        }
        state = ConnectionState.CONNECTED;
    }

    @Override
    public RemoteResult execute(String command, Duration timeout) throws RemoteException {
        requireConnected("execute");
        factory.record(serverName, command);
        Instant started = Instant.now();
        Path output = null;
        try {
            output = Files.createTempFile("fleetward-sh-", ".out");
            Process process = new ProcessBuilder("sh", "-c", factory.toLocal(host, command))
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile())
                    .start();
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor();
                return RemoteResult.timedOut(serverName, command, factory.fromLocal(host, read(output)), started);
            }
            return RemoteResult.completed(serverName, command, factory.fromLocal(host, read(output)),
                    process.exitValue(), started);
        } catch (IOException e) {
            throw new NetworkException(serverName, "execute", e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException(serverName, "execute", "interrupted", e);
        } finally {
            deleteQuietly(output);
        }
    }

    @Override
    public void upload(Path localPath, String remotePath, Duration timeout) throws RemoteException {
        requireConnected("upload");
        factory.record(serverName, "upload " + remotePath);
        try {
            Path target = Paths.get(factory.toLocal(host, remotePath));
            Files.copy(localPath, target, StandardCopyOption.REPLACE_EXISTING);
            if (factory.corrupts(host)) {
                Files.write(target, "# tampered\n".getBytes(StandardCharsets.UTF_8), StandardOpenOption.APPEND);
            }
        } catch (IOException e) {
            throw new RemoteException(serverName, "upload", "upload failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void download(String remotePath, Path localPath, Duration timeout) throws RemoteException {
        requireConnected("download");
        try {
            Files.copy(Paths.get(factory.toLocal(host, remotePath)), localPath, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new RemoteException(serverName, "download", "download failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Tunnel createTunnel(int localPort, String remoteHost, int remotePort) throws RemoteException {
        throw new RemoteException(serverName, "tunnel", "tunnels are not supported by the local shell");
    }

    @Override
    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    @Override
    public void close() {
        state = ConnectionState.DISCONNECTED;
    }

    private void requireConnected(String operation) throws NotConnectedException {
        if (state != ConnectionState.CONNECTED) {
            throw new NotConnectedException(serverName, operation);
        }
    }

    private static String read(Path output) throws IOException {
        return new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException ignored) {
            // temp output file, left for the OS to clean up
        }
    }
}
