package io.fleetward.manager.connection;

import io.fleetward.api.error.RemoteException;
import io.fleetward.api.remote.RemoteResult;
import io.fleetward.api.remote.Tunnel;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.time.Duration;

/**
 * One authenticated session to one remote host.
 *
 * <p>Every remote operation requires a successful {@link #connect(Duration)}
 * first and fails with {@link io.fleetward.api.error.NotConnectedException}
 * otherwise. Nothing is retried. Concurrent callers on one connection are not
 * ordered relative to each other.</p>
 */
public interface RemoteConnection extends AutoCloseable {

    /**
     * Get the name of the server this connection targets.
     *
     * @return server name
     */
    @Nonnull
    String getServerName();

    /**
     * Get the cached lifecycle state. Use {@link #isConnected()} to verify
     * the session is actually alive.
     *
     * @return current state
     */
    @Nonnull
    ConnectionState getState();

    /**
     * Establish the transport and authenticate. Does nothing if already connected.
     *
     * @param timeout connect deadline
     * @throws io.fleetward.api.error.AuthenticationException if credentials are rejected
     * @throws io.fleetward.api.error.RemoteTimeoutException if the deadline expires
     * @throws io.fleetward.api.error.NetworkException on any other transport failure
     */
    void connect(@Nonnull Duration timeout) throws RemoteException;

    /**
     * Run a command in a fresh remote session and capture combined output.
     *
     * <p>If the deadline expires the remote process is sent a termination
     * signal and a timed-out result with exit code -1 is returned.</p>
     *
     * @param command shell command
     * @param timeout execution deadline
     * @return the result
     * @throws RemoteException if the command cannot be started or the session drops
     */
    @Nonnull
    RemoteResult execute(@Nonnull String command, @Nonnull Duration timeout) throws RemoteException;

    /**
     * Copy a whole local file to the remote path.
     */
    void upload(@Nonnull Path localPath, @Nonnull String remotePath, @Nonnull Duration timeout)
            throws RemoteException;

    /**
     * Copy a whole remote file to the local path.
     */
    void download(@Nonnull String remotePath, @Nonnull Path localPath, @Nonnull Duration timeout)
            throws RemoteException;

    /**
     * Listen on a loopback port and forward each accepted connection to
     * {@code remoteHost:remotePort} through this session.
     *
     * @param localPort local port, or 0 for an ephemeral one
     * @param remoteHost destination host as resolved by the server
     * @param remotePort destination port
     * @return tunnel handle; closing it stops the forwarding
     */
    @Nonnull
    Tunnel createTunnel(int localPort, @Nonnull String remoteHost, int remotePort) throws RemoteException;

    /**
     * Probe the session with a trivial command.
     *
     * @return true if the probe succeeded
     */
    boolean isConnected();

    /**
     * Release tunnels, channels and the session. Idempotent.
     */
    @Override
    void close();
}
