package io.fleetward.api.remote;

import javax.annotation.Nonnull;

/**
 * A local port forwarded to a host reachable from a remote server.
 *
 * <p>Closing the tunnel stops accepting new local connections and tears
 * down every piped connection.</p>
 */
public interface Tunnel extends AutoCloseable {

    /**
     * Get the loopback port the tunnel listens on.
     *
     * @return bound local port
     */
    int getLocalPort();

    @Nonnull
    String getRemoteHost();

    int getRemotePort();

    /**
     * Check if the tunnel still accepts connections.
     *
     * @return true until closed
     */
    boolean isOpen();

    @Override
    void close();
}
