package io.fleetward.manager.connection;

import com.jcraft.jsch.ChannelExec;
import com.jcraft.jsch.ChannelSftp;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.jcraft.jsch.SftpException;
import com.jcraft.jsch.SftpProgressMonitor;
import io.fleetward.api.error.AuthenticationException;
import io.fleetward.api.error.NetworkException;
import io.fleetward.api.error.NotConnectedException;
import io.fleetward.api.error.RemoteException;
import io.fleetward.api.error.RemoteTimeoutException;
import io.fleetward.api.remote.RemoteResult;
import io.fleetward.api.remote.ServerConfig;
import io.fleetward.api.remote.Tunnel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.ByteArrayOutputStream;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * SSH connection backed by JSch.
 *
 * <p>Connect and close take the write lock; channel operations share the
 * read lock, so several commands can run over one session at once.</p>
 */
public class SshConnection implements RemoteConnection {

    private static final Logger LOGGER = LoggerFactory.getLogger(SshConnection.class);

    private static final long POLL_MILLIS = 20;
    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(5);
    private static final String LOOPBACK = "127.0.0.1";

    private final ServerConfig config;
    private final boolean strictHostKeyChecking;
    private final String knownHostsFile;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<SshTunnel> tunnels = new CopyOnWriteArrayList<>();

    private Session session;

    /**
     * Create an unconnected SSH connection.
     *
     * @param config server definition
     * @param strictHostKeyChecking whether unknown host keys are rejected
     * @param knownHostsFile known hosts file, or null
     */
    public SshConnection(
            @Nonnull ServerConfig config,
            boolean strictHostKeyChecking,
            @Nullable String knownHostsFile) {
        this.config = Objects.requireNonNull(config, "config");
        this.strictHostKeyChecking = strictHostKeyChecking;
        this.knownHostsFile = knownHostsFile;
    }

    @Override
    @Nonnull
    public String getServerName() {
        return config.name();
    }

    @Override
    @Nonnull
    public ConnectionState getState() {
        lock.readLock().lock();
        try {
            return session != null && session.isConnected()
                    ? ConnectionState.CONNECTED
                    : ConnectionState.DISCONNECTED;
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== Lifecycle ====================

    @Override
    public void connect(@Nonnull Duration timeout) throws RemoteException {
        Objects.requireNonNull(timeout, "timeout");
        lock.writeLock().lock();
        try {
            if (session != null && session.isConnected()) {
                return;
            }

            JSch jsch = new JSch();
            if (config.usesKeyAuthentication()) {
                try {
                    jsch.addIdentity(config.privateKeyPath());
                } catch (JSchException e) {
                    throw new AuthenticationException(config.name(),
                            "cannot load private key " + config.privateKeyPath(), e);
                }
            }
            if (knownHostsFile != null && !knownHostsFile.isBlank()) {
                try {
                    jsch.setKnownHosts(knownHostsFile);
                } catch (JSchException e) {
                    throw new NetworkException(config.name(), "connect",
                            "cannot read known hosts file " + knownHostsFile, e);
                }
            }

            Session newSession;
            try {
                newSession = jsch.getSession(config.username(), config.host(), config.port());
            } catch (JSchException e) {
                throw translate("connect", e, timeout);
            }
            if (!config.usesKeyAuthentication()) {
                newSession.setPassword(config.password());
            }
            newSession.setConfig("StrictHostKeyChecking", strictHostKeyChecking ? "yes" : "no");
            newSession.setConfig("PreferredAuthentications",
                    config.usesKeyAuthentication() ? "publickey" : "password,keyboard-interactive");

            try {
                newSession.connect(toMillis(timeout));
            } catch (JSchException e) {
                newSession.disconnect();
                throw translate("connect", e, timeout);
            }

            session = newSession;
            LOGGER.debug("Connected to {} ({}@{}:{})",
                    config.name(), config.username(), config.host(), config.port());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            for (SshTunnel tunnel : tunnels) {
                tunnel.close();
            }
            tunnels.clear();
            if (session != null) {
                session.disconnect();
                session = null;
                LOGGER.debug("Disconnected from {}", config.name());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean isConnected() {
        try {
            RemoteResult probe = execute("echo test", PROBE_TIMEOUT);
            return probe.success();
        } catch (RemoteException e) {
            LOGGER.debug("Probe of {} failed: {}", config.name(), e.getMessage());
            return false;
        }
    }

    // ==================== Execution ====================

    @Override
    @Nonnull
    public RemoteResult execute(@Nonnull String command, @Nonnull Duration timeout) throws RemoteException {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(timeout, "timeout");

        lock.readLock().lock();
        try {
            Session current = requireSession("execute");
            Instant started = Instant.now();
            long deadline = System.nanoTime() + timeout.toNanos();
            ByteArrayOutputStream output = new ByteArrayOutputStream();

            ChannelExec channel;
            try {
                channel = (ChannelExec) current.openChannel("exec");
            } catch (JSchException e) {
                throw translate("execute", e, timeout);
            }

            try {
                channel.setCommand(command);
                channel.setInputStream(null);
                channel.setOutputStream(output, true);
                channel.setErrStream(output, true);
                channel.connect(toMillis(timeout));

                while (!channel.isClosed()) {
                    if (System.nanoTime() >= deadline) {
                        terminate(channel);
                        LOGGER.debug("Command on {} timed out after {}ms: {}",
                                config.name(), timeout.toMillis(), command);
                        return RemoteResult.timedOut(config.name(), command, text(output), started);
                    }
                    Thread.sleep(POLL_MILLIS);
                }

                int exitCode = channel.getExitStatus();
                if (exitCode < 0 && !current.isConnected()) {
                    throw new NetworkException(config.name(), "execute", "session dropped while running command");
                }
                return RemoteResult.completed(config.name(), command, text(output), exitCode, started);
            } catch (JSchException e) {
                throw translate("execute", e, timeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                terminate(channel);
                throw new NetworkException(config.name(), "execute", "interrupted", e);
            } finally {
                channel.disconnect();
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    private void terminate(ChannelExec channel) {
        try {
            channel.sendSignal("TERM");
        } catch (Exception e) {
            LOGGER.debug("Could not signal command on {}: {}", config.name(), e.getMessage());
        }
    }

    // ==================== Transfer ====================

    @Override
    public void upload(@Nonnull Path localPath, @Nonnull String remotePath, @Nonnull Duration timeout)
            throws RemoteException {
        Objects.requireNonNull(localPath, "localPath");
        Objects.requireNonNull(remotePath, "remotePath");
        if (!Files.isRegularFile(localPath)) {
            throw new NetworkException(config.name(), "upload", "local file not found: " + localPath);
        }
        transfer("upload", timeout, (sftp, monitor) ->
                sftp.put(localPath.toString(), remotePath, monitor, ChannelSftp.OVERWRITE));
    }

    @Override
    public void download(@Nonnull String remotePath, @Nonnull Path localPath, @Nonnull Duration timeout)
            throws RemoteException {
        Objects.requireNonNull(remotePath, "remotePath");
        Objects.requireNonNull(localPath, "localPath");
        transfer("download", timeout, (sftp, monitor) ->
                sftp.get(remotePath, localPath.toString(), monitor, ChannelSftp.OVERWRITE));
    }

    private void transfer(String operation, Duration timeout, SftpAction action) throws RemoteException {
        Objects.requireNonNull(timeout, "timeout");
        lock.readLock().lock();
        try {
            Session current = requireSession(operation);
            DeadlineMonitor monitor = new DeadlineMonitor(System.nanoTime() + timeout.toNanos());

            ChannelSftp sftp;
            try {
                sftp = (ChannelSftp) current.openChannel("sftp");
                sftp.connect(toMillis(timeout));
            } catch (JSchException e) {
                throw translate(operation, e, timeout);
            }

            try {
                action.run(sftp, monitor);
            } catch (SftpException e) {
                if (monitor.expired.get()) {
                    throw new RemoteTimeoutException(config.name(), operation, timeout);
                }
                throw new NetworkException(config.name(), operation, e.getMessage(), e);
            } finally {
                sftp.disconnect();
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    @FunctionalInterface
    private interface SftpAction {
        void run(ChannelSftp sftp, SftpProgressMonitor monitor) throws SftpException;
    }

    /**
     * Aborts a transfer once the deadline passes.
     */
    private static final class DeadlineMonitor implements SftpProgressMonitor {
        private final long deadlineNanos;
        private final AtomicBoolean expired = new AtomicBoolean();

        DeadlineMonitor(long deadlineNanos) {
            this.deadlineNanos = deadlineNanos;
        }

        @Override
        public void init(int op, String src, String dest, long max) {
        }

        @Override
        public boolean count(long count) {
            if (System.nanoTime() >= deadlineNanos) {
                expired.set(true);
                return false;
            }
            return true;
        }

        @Override
        public void end() {
        }
    }

    // ==================== Tunnels ====================

    @Override
    @Nonnull
    public Tunnel createTunnel(int localPort, @Nonnull String remoteHost, int remotePort) throws RemoteException {
        Objects.requireNonNull(remoteHost, "remoteHost");
        lock.readLock().lock();
        try {
            Session current = requireSession("tunnel");
            int boundPort;
            try {
                boundPort = current.setPortForwardingL(LOOPBACK, localPort, remoteHost, remotePort);
            } catch (JSchException e) {
                throw new NetworkException(config.name(), "tunnel",
                        "cannot forward " + LOOPBACK + ":" + localPort + " to " + remoteHost + ":" + remotePort, e);
            }
            SshTunnel tunnel = new SshTunnel(current, boundPort, remoteHost, remotePort, tunnels::remove);
            tunnels.add(tunnel);
            LOGGER.info("Tunnel {}:{} -> {}:{} via {}", LOOPBACK, boundPort, remoteHost, remotePort, config.name());
            return tunnel;
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== Helpers ====================

    private Session requireSession(String operation) throws NotConnectedException {
        if (session == null || !session.isConnected()) {
            throw new NotConnectedException(config.name(), operation);
        }
        return session;
    }

    private RemoteException translate(String operation, JSchException e, Duration timeout) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        if (message.startsWith("Auth fail") || message.startsWith("Auth cancel")
                || message.contains("USERAUTH fail")) {
            return new AuthenticationException(config.name(), message, e);
        }
        if (e.getCause() instanceof SocketTimeoutException || message.toLowerCase().contains("timeout")) {
            return new RemoteTimeoutException(config.name(), operation, timeout);
        }
        return new NetworkException(config.name(), operation, message, e);
    }

    private static int toMillis(Duration timeout) {
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1, timeout.toMillis()));
    }

    private static String text(ByteArrayOutputStream output) {
        return output.toString(StandardCharsets.UTF_8);
    }
}
