package io.fleetward.api.remote;

import io.fleetward.api.error.RemoteException;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Server directory and command dispatcher.
 *
 * <p>The implementation owns every remote connection. Cluster execution,
 * monitoring and config sync go through this interface and never hold a
 * connection themselves, which also lets tests swap in a fake.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * RemoteManager remote = fleet.getRegistry();
 *
 * remote.addServer(ServerConfig.builder()
 *     .name("web1")
 *     .host("10.0.0.11")
 *     .username("deploy")
 *     .privateKeyPath("/home/deploy/.ssh/id_ed25519")
 *     .build());
 *
 * RemoteResult result = remote.executeCommand("web1", "uptime");
 * Map<String, RemoteResult> all = remote.executeOnServers(List.of("web1", "web2"), "df -h /");
 * }</pre>
 *
 * <p>Unknown server names raise {@link io.fleetward.api.error.NotFoundException};
 * invalid configs raise {@link io.fleetward.api.error.ValidationException}.</p>
 */
public interface RemoteManager {

    // ==================== Directory ====================

    /**
     * Register a server. No connection is opened.
     *
     * @param config server definition
     * @throws io.fleetward.api.error.ValidationException if the config is invalid or the name is taken
     */
    void addServer(@Nonnull ServerConfig config);

    /**
     * Remove a server and close its connection.
     *
     * @param name server name
     */
    void removeServer(@Nonnull String name);

    /**
     * Replace a server's definition. The name cannot change.
     *
     * @param name server name
     * @param config new definition
     */
    void updateServer(@Nonnull String name, @Nonnull ServerConfig config);

    /**
     * Get a snapshot of a server.
     *
     * @param name server name
     * @return server snapshot
     */
    @Nonnull
    ServerInfo getServer(@Nonnull String name);

    /**
     * List all servers, sorted by name.
     *
     * @return server snapshots
     */
    @Nonnull
    List<ServerInfo> listServers();

    boolean hasServer(@Nonnull String name);

    // ==================== Execution ====================

    /**
     * Run a command with the default command timeout.
     *
     * @param server server name
     * @param command shell command
     * @return the result; a timeout yields a timed-out result
     * @throws RemoteException if the server cannot be reached
     */
    @Nonnull
    RemoteResult executeCommand(@Nonnull String server, @Nonnull String command) throws RemoteException;

    /**
     * Run a command with an explicit timeout.
     */
    @Nonnull
    RemoteResult executeCommand(@Nonnull String server, @Nonnull String command, @Nonnull Duration timeout)
            throws RemoteException;

    /**
     * Run a multi-line script body through {@code sh -c}.
     */
    @Nonnull
    RemoteResult executeScript(@Nonnull String server, @Nonnull String script) throws RemoteException;

    /**
     * Run a command on several servers concurrently.
     *
     * <p>Returns exactly one result per distinct server name, in the given
     * order. Servers that cannot be reached get a failed result.</p>
     *
     * @param servers server names
     * @param command shell command
     * @return results keyed by server name
     */
    @Nonnull
    Map<String, RemoteResult> executeOnServers(@Nonnull Collection<String> servers, @Nonnull String command);

    // ==================== Transfer ====================

    void uploadFile(@Nonnull String server, @Nonnull Path localPath, @Nonnull String remotePath)
            throws RemoteException;

    void downloadFile(@Nonnull String server, @Nonnull String remotePath, @Nonnull Path localPath)
            throws RemoteException;

    /**
     * Forward a loopback port to {@code remoteHost:remotePort} as seen from the server.
     *
     * @param server server name
     * @param localPort local port, or 0 for an ephemeral one
     * @param remoteHost destination host
     * @param remotePort destination port
     * @return open tunnel handle
     */
    @Nonnull
    Tunnel createTunnel(@Nonnull String server, int localPort, @Nonnull String remoteHost, int remotePort)
            throws RemoteException;

    // ==================== Diagnostics ====================

    /**
     * Connect, probe and disconnect without registering the server.
     *
     * @param config server definition
     * @return probe round-trip time
     * @throws RemoteException if connecting or probing fails
     */
    @Nonnull
    Duration testConnection(@Nonnull ServerConfig config) throws RemoteException;

    /**
     * Probe a server and report its health. Transport failures are reported
     * as {@link HealthLevel#CRITICAL}, not thrown.
     */
    @Nonnull
    HealthStatus checkServerHealth(@Nonnull String server);

    /**
     * Collect standard system metrics from a server.
     */
    @Nonnull
    ServerMetrics getServerMetrics(@Nonnull String server) throws RemoteException;

    /**
     * Discover the platform and kernel version of a server. Discovery is
     * best-effort once the server is reached: unknown facts fall back to
     * {@link Platform#LINUX} and a null version.
     *
     * @throws RemoteException if the server cannot be reached
     */
    @Nonnull
    ServerDetails getServerDetails(@Nonnull String server) throws RemoteException;
}
