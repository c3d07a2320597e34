package io.fleetward.manager.connection;

import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import io.fleetward.api.remote.Tunnel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Local port forward registered on a JSch session.
 *
 * <p>JSch accepts loopback connections on the bound port and opens a
 * direct-tcpip channel per connection. Closing removes the forward, which
 * closes the listening socket.</p>
 */
final class SshTunnel implements Tunnel {

    private static final Logger LOGGER = LoggerFactory.getLogger(SshTunnel.class);

    private final Session session;
    private final int localPort;
    private final String remoteHost;
    private final int remotePort;
    private final Consumer<SshTunnel> onClose;
    private final AtomicBoolean open = new AtomicBoolean(true);

    SshTunnel(Session session, int localPort, String remoteHost, int remotePort, Consumer<SshTunnel> onClose) {
        this.session = session;
        this.localPort = localPort;
        this.remoteHost = remoteHost;
        this.remotePort = remotePort;
        this.onClose = onClose;
    }

    @Override
    public int getLocalPort() {
        return localPort;
    }

    @Override
    @Nonnull
    public String getRemoteHost() {
        return remoteHost;
    }

    @Override
    public int getRemotePort() {
        return remotePort;
    }

    @Override
    public boolean isOpen() {
        return open.get() && session.isConnected();
    }

    @Override
    public void close() {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        try {
            session.delPortForwardingL("127.0.0.1", localPort);
        } catch (JSchException e) {
            LOGGER.debug("Removing forward on port {} failed: {}", localPort, e.getMessage());
        }
        onClose.accept(this);
        LOGGER.debug("Tunnel on port {} closed", localPort);
    }
}
