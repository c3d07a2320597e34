package io.fleetward.manager.registry;

import io.fleetward.api.error.NetworkException;
import io.fleetward.api.error.NotConnectedException;
import io.fleetward.api.error.NotFoundException;
import io.fleetward.api.error.RemoteException;
import io.fleetward.api.error.ValidationException;
import io.fleetward.api.remote.HealthLevel;
import io.fleetward.api.remote.HealthStatus;
import io.fleetward.api.remote.RemoteManager;
import io.fleetward.api.remote.RemoteResult;
import io.fleetward.api.remote.ServerConfig;
import io.fleetward.api.remote.ServerDetails;
import io.fleetward.api.remote.ServerInfo;
import io.fleetward.api.remote.ServerMetrics;
import io.fleetward.api.remote.ServerStatus;
import io.fleetward.api.remote.Tunnel;
import io.fleetward.manager.config.FleetConfig;
import io.fleetward.manager.connection.ConnectionFactory;
import io.fleetward.manager.connection.ConnectionState;
import io.fleetward.manager.connection.RemoteConnection;
import io.fleetward.manager.metrics.SystemMetricsCollector;
import io.fleetward.manager.persistence.JsonDefinitionStore;
import io.fleetward.manager.util.Deadline;
import io.fleetward.manager.util.FanOutExecutor;
import io.fleetward.manager.util.ShellQuoting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Directory of remote servers and the only owner of their connections.
 *
 * <p>Connections are opened lazily on first use and cached per server.
 * A transport failure evicts the cached connection so the next call
 * reconnects; nothing is retried within a call. Everything handed out is a
 * snapshot.</p>
 */
public class ServerRegistry implements RemoteManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServerRegistry.class);

    static final String PROBE_COMMAND = "echo 'connectivity_test'";

    private final Map<String, ServerRecord> servers = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final ConnectionFactory connectionFactory;
    private final FleetConfig.SshSettings settings;
    private final FanOutExecutor fanOut;
    private final SystemMetricsCollector metricsCollector;
    private final JsonDefinitionStore<ServerConfig> store;

    /**
     * Create a registry.
     *
     * @param connectionFactory creates connections for servers
     * @param settings SSH timeouts
     * @param fanOut executor for multi-server commands
     * @param store definition store, or null to keep servers in memory only
     */
    public ServerRegistry(
            @Nonnull ConnectionFactory connectionFactory,
            @Nonnull FleetConfig.SshSettings settings,
            @Nonnull FanOutExecutor fanOut,
            @Nullable JsonDefinitionStore<ServerConfig> store) {
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.fanOut = Objects.requireNonNull(fanOut, "fanOut");
        this.metricsCollector = new SystemMetricsCollector(settings.commandTimeout());
        this.store = store;
    }

    // ==================== Directory ====================

    @Override
    public void addServer(@Nonnull ServerConfig config) {
        Objects.requireNonNull(config, "config");
        config.validate();

        lock.writeLock().lock();
        try {
            if (servers.containsKey(config.name())) {
                throw new ValidationException("Server already exists: " + config.name());
            }
            servers.put(config.name(), new ServerRecord(config));
        } finally {
            lock.writeLock().unlock();
        }

        persist(config);
        LOGGER.info("Added server '{}' ({}@{}:{})", config.name(), config.username(), config.host(), config.port());
    }

    @Override
    public void removeServer(@Nonnull String name) {
        Objects.requireNonNull(name, "name");

        ServerRecord removed;
        lock.writeLock().lock();
        try {
            removed = servers.remove(name);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed == null) {
            throw new NotFoundException("server", name);
        }

        removed.evictConnection();
        unpersist(name);
        LOGGER.info("Removed server '{}'", name);
    }

    @Override
    public void updateServer(@Nonnull String name, @Nonnull ServerConfig config) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(config, "config");
        if (!name.equals(config.name())) {
            throw new ValidationException("Server name cannot be changed: " + name + " -> " + config.name());
        }
        config.validate();

        ServerRecord previous;
        lock.writeLock().lock();
        try {
            previous = servers.get(name);
            if (previous == null) {
                throw new NotFoundException("server", name);
            }
            servers.put(name, new ServerRecord(config));
        } finally {
            lock.writeLock().unlock();
        }

        previous.evictConnection();
        persist(config);
        LOGGER.info("Updated server '{}'", name);
    }

    @Override
    @Nonnull
    public ServerInfo getServer(@Nonnull String name) {
        return requireRecord(name).toInfo();
    }

    @Override
    @Nonnull
    public List<ServerInfo> listServers() {
        List<ServerInfo> result = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (ServerRecord record : servers.values()) {
                result.add(record.toInfo());
            }
        } finally {
            lock.readLock().unlock();
        }
        result.sort(Comparator.comparing(ServerInfo::name));
        return result;
    }

    @Override
    public boolean hasServer(@Nonnull String name) {
        lock.readLock().lock();
        try {
            return servers.containsKey(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== Execution ====================

    @Override
    @Nonnull
    public RemoteResult executeCommand(@Nonnull String server, @Nonnull String command) throws RemoteException {
        return executeCommand(server, command, settings.commandTimeout());
    }

    @Override
    @Nonnull
    public RemoteResult executeCommand(@Nonnull String server, @Nonnull String command, @Nonnull Duration timeout)
            throws RemoteException {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(timeout, "timeout");
        LOGGER.debug("Executing on {}: {}", server, command);
        return withConnection(server, connection -> connection.execute(command, timeout));
    }

    @Override
    @Nonnull
    public RemoteResult executeScript(@Nonnull String server, @Nonnull String script) throws RemoteException {
        Objects.requireNonNull(script, "script");
        return executeCommand(server, "sh -c " + ShellQuoting.quote(script));
    }

    @Override
    @Nonnull
    public Map<String, RemoteResult> executeOnServers(@Nonnull Collection<String> servers, @Nonnull String command) {
        Objects.requireNonNull(servers, "servers");
        Objects.requireNonNull(command, "command");
        Instant started = Instant.now();
        return fanOut.invokeAll(servers,
                name -> {
                    try {
                        return executeCommand(name, command);
                    } catch (RemoteException e) {
                        return RemoteResult.failed(name, command, e.getMessage(), started);
                    }
                },
                (name, error) -> RemoteResult.failed(name, command, String.valueOf(error.getMessage()), started));
    }

    // ==================== Transfer ====================

    @Override
    public void uploadFile(@Nonnull String server, @Nonnull Path localPath, @Nonnull String remotePath)
            throws RemoteException {
        withConnection(server, connection -> {
            connection.upload(localPath, remotePath, settings.transferTimeout());
            return null;
        });
        LOGGER.debug("Uploaded {} to {}:{}", localPath, server, remotePath);
    }

    @Override
    public void downloadFile(@Nonnull String server, @Nonnull String remotePath, @Nonnull Path localPath)
            throws RemoteException {
        withConnection(server, connection -> {
            connection.download(remotePath, localPath, settings.transferTimeout());
            return null;
        });
        LOGGER.debug("Downloaded {}:{} to {}", server, remotePath, localPath);
    }

    @Override
    @Nonnull
    public Tunnel createTunnel(@Nonnull String server, int localPort, @Nonnull String remoteHost, int remotePort)
            throws RemoteException {
        return withConnection(server, connection -> connection.createTunnel(localPort, remoteHost, remotePort));
    }

    // ==================== Diagnostics ====================

    @Override
    @Nonnull
    public Duration testConnection(@Nonnull ServerConfig config) throws RemoteException {
        Objects.requireNonNull(config, "config");
        config.validate();

        RemoteConnection connection = connectionFactory.create(config);
        try {
            connection.connect(settings.connectTimeout());
            RemoteResult probe = connection.execute(PROBE_COMMAND, settings.connectTimeout());
            if (!probe.success()) {
                throw new NetworkException(config.name(), "probe",
                        probe.timedOut() ? "probe timed out" : "probe exited with " + probe.exitCode());
            }
            return probe.duration();
        } finally {
            connection.close();
        }
    }

    @Override
    @Nonnull
    public HealthStatus checkServerHealth(@Nonnull String server) {
        requireRecord(server);
        Instant started = Instant.now();
        try {
            RemoteResult probe = executeCommand(server, PROBE_COMMAND, settings.connectTimeout());
            if (probe.success()) {
                return new HealthStatus(server, HealthLevel.HEALTHY, "Server is responding",
                        probe.duration(), Instant.now(), Map.of());
            }
            return new HealthStatus(server, HealthLevel.CRITICAL,
                    probe.timedOut() ? "Probe timed out" : "Probe exited with " + probe.exitCode(),
                    probe.duration(), Instant.now(), Map.of("output", probe.output()));
        } catch (RemoteException e) {
            return new HealthStatus(server, HealthLevel.CRITICAL, "Server is not responding",
                    Duration.between(started, Instant.now()), Instant.now(),
                    Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @Override
    @Nonnull
    public ServerMetrics getServerMetrics(@Nonnull String server) throws RemoteException {
        RemoteResult probe = executeCommand(server, PROBE_COMMAND, settings.connectTimeout());
        ServerMetrics.Builder metrics = ServerMetrics.builder(server)
                .status(probe.success() ? ServerStatus.ONLINE : ServerStatus.OFFLINE)
                .responseTime(probe.duration());
        if (probe.success()) {
            metricsCollector.collect(this, server, Deadline.after(settings.commandTimeout()), metrics);
        }
        return metrics.lastUpdate(Instant.now()).build();
    }

    @Override
    @Nonnull
    public ServerDetails getServerDetails(@Nonnull String server) throws RemoteException {
        RemoteResult probe = executeCommand(server, PROBE_COMMAND, settings.connectTimeout());
        if (!probe.success()) {
            throw new NetworkException(server, "probe",
                    probe.timedOut() ? "probe timed out" : "probe exited with " + probe.exitCode());
        }
        return metricsCollector.describe(this, getServer(server), Deadline.after(settings.commandTimeout()));
    }

    // ==================== Lifecycle ====================

    /**
     * Restore persisted server definitions. Servers already registered are kept.
     *
     * @return number of servers restored
     * @throws IOException if the store cannot be read
     */
    public int loadPersisted() throws IOException {
        if (store == null) {
            return 0;
        }
        int restored = 0;
        for (ServerConfig config : store.loadAll()) {
            try {
                config.validate();
            } catch (ValidationException e) {
                LOGGER.warn("Ignoring invalid persisted server '{}': {}", config.name(), e.getMessage());
                continue;
            }
            lock.writeLock().lock();
            try {
                if (servers.putIfAbsent(config.name(), new ServerRecord(config)) == null) {
                    restored++;
                }
            } finally {
                lock.writeLock().unlock();
            }
        }
        return restored;
    }

    /**
     * Get registry statistics.
     *
     * @return statistics
     */
    @Nonnull
    public RegistryStats getStats() {
        int online = 0;
        int offline = 0;
        int unknown = 0;
        int connections = 0;

        lock.readLock().lock();
        try {
            for (ServerRecord record : servers.values()) {
                switch (record.getStatus()) {
                    case ONLINE -> online++;
                    case OFFLINE -> offline++;
                    default -> unknown++;
                }
                if (record.getConnection() != null) {
                    connections++;
                }
            }
            return new RegistryStats(servers.size(), online, offline, unknown, connections);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Close every cached connection. Servers stay registered.
     */
    public void closeAllConnections() {
        List<ServerRecord> records;
        lock.readLock().lock();
        try {
            records = new ArrayList<>(servers.values());
        } finally {
            lock.readLock().unlock();
        }
        for (ServerRecord record : records) {
            record.evictConnection();
        }
        LOGGER.debug("Closed {} server connections", records.size());
    }

    // ==================== Internals ====================

    @FunctionalInterface
    private interface ConnectionCall<T> {
        T apply(RemoteConnection connection) throws RemoteException;
    }

    private <T> T withConnection(String server, ConnectionCall<T> call) throws RemoteException {
        ServerRecord record = requireRecord(server);
        RemoteConnection connection = connectionFor(record);
        try {
            T result = call.apply(connection);
            record.markChecked(ServerStatus.ONLINE, null);
            return result;
        } catch (NotConnectedException | NetworkException e) {
            record.markChecked(ServerStatus.OFFLINE, e.getMessage());
            record.evictConnection(connection);
            throw e;
        }
    }

    private RemoteConnection connectionFor(ServerRecord record) throws RemoteException {
        RemoteConnection cached = record.getConnection();
        if (cached != null && cached.getState() == ConnectionState.CONNECTED) {
            return cached;
        }

        record.connectLock().lock();
        try {
            cached = record.getConnection();
            if (cached != null && cached.getState() == ConnectionState.CONNECTED) {
                return cached;
            }

            RemoteConnection connection = connectionFactory.create(record.getConfig());
            try {
                connection.connect(settings.connectTimeout());
            } catch (RemoteException e) {
                connection.close();
                record.markChecked(ServerStatus.OFFLINE, e.getMessage());
                throw e;
            }
            record.setConnection(connection);

            if (!isCurrent(record)) {
                record.evictConnection();
                throw new NotFoundException("server", record.getName());
            }
            LOGGER.debug("Opened connection to '{}'", record.getName());
            return connection;
        } finally {
            record.connectLock().unlock();
        }
    }

    private boolean isCurrent(ServerRecord record) {
        lock.readLock().lock();
        try {
            return servers.get(record.getName()) == record;
        } finally {
            lock.readLock().unlock();
        }
    }

    private ServerRecord requireRecord(String name) {
        Objects.requireNonNull(name, "name");
        lock.readLock().lock();
        try {
            ServerRecord record = servers.get(name);
            if (record == null) {
                throw new NotFoundException("server", name);
            }
            return record;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void persist(ServerConfig config) {
        if (store == null) {
            return;
        }
        try {
            store.save(config.name(), config);
        } catch (IOException e) {
            LOGGER.warn("Failed to persist server '{}': {}", config.name(), e.getMessage());
        }
    }

    private void unpersist(String name) {
        if (store == null) {
            return;
        }
        try {
            store.delete(name);
        } catch (IOException e) {
            LOGGER.warn("Failed to delete persisted server '{}': {}", name, e.getMessage());
        }
    }
}
