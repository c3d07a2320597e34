package io.fleetward.manager;

import io.fleetward.api.remote.RemoteManager;
import io.fleetward.api.remote.ServerConfig;
import io.fleetward.manager.cluster.Cluster;
import io.fleetward.manager.cluster.ClusterManager;
import io.fleetward.manager.config.FleetConfig;
import io.fleetward.manager.connection.ConnectionFactory;
import io.fleetward.manager.connection.SshConnectionFactory;
import io.fleetward.manager.monitor.ClusterMonitor;
import io.fleetward.manager.monitor.MonitoringTask;
import io.fleetward.manager.persistence.JsonDefinitionStore;
import io.fleetward.manager.registry.ServerRegistry;
import io.fleetward.manager.sync.ConfigSyncManager;
import io.fleetward.manager.sync.SyncProfile;
import io.fleetward.manager.util.FanOutExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * Wires the fleet management components under one root directory.
 *
 * <h2>Directory Structure</h2>
 * <pre>
 * root/
 * ├── fleet.yml            # Fleet configuration
 * └── state/               # Persisted definitions, one JSON file each
 *     ├── servers/
 *     ├── clusters/
 *     ├── profiles/
 *     └── tasks/
 * </pre>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * FleetManager fleet = new FleetManager(Paths.get("/var/lib/fleetward"));
 * fleet.initialize();
 *
 * fleet.getClusterManager().executeOnCluster("web", "systemctl reload nginx");
 *
 * fleet.shutdown();
 * }</pre>
 */
public class FleetManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(FleetManager.class);

    public static final String CONFIG_FILE = "fleet.yml";

    private final Path root;
    private final ConnectionFactory connectionFactory;
    private final Clock clock;

    private FleetConfig config;
    private FanOutExecutor fanOut;
    private ServerRegistry registry;
    private ClusterManager clusterManager;
    private ClusterMonitor monitor;
    private ConfigSyncManager syncManager;

    private volatile boolean initialized = false;
    private volatile boolean shutdown = false;

    /**
     * Create a fleet manager that connects over SSH.
     *
     * @param root directory holding configuration and state
     */
    public FleetManager(@Nonnull Path root) {
        this(root, null, Clock.systemDefaultZone());
    }

    /**
     * Create a fleet manager with an explicit connection factory.
     *
     * @param root directory holding configuration and state
     * @param connectionFactory connection factory, or null for SSH from the loaded configuration
     * @param clock time source for schedules, alerts and history
     */
    public FleetManager(@Nonnull Path root, @Nullable ConnectionFactory connectionFactory, @Nonnull Clock clock) {
        this.root = Objects.requireNonNull(root, "root");
        this.connectionFactory = connectionFactory;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // ==================== Initialization ====================

    /**
     * Load configuration, build the components and restore persisted definitions.
     *
     * @throws IOException if the configuration or state cannot be read
     * @throws IllegalStateException if already initialized
     */
    public void initialize() throws IOException {
        if (initialized) {
            throw new IllegalStateException("Fleet manager already initialized");
        }

        LOGGER.info("Initializing fleet manager in {}", root.toAbsolutePath());
        Files.createDirectories(root);

        config = FleetConfig.load(root.resolve(CONFIG_FILE));

        boolean persistent = config.getPersistence().isEnabled();
        Path stateDir = root.resolve(config.getPersistence().getStateDirectory());
        if (persistent) {
            Files.createDirectories(stateDir);
        }

        fanOut = new FanOutExecutor("fleetward-worker");

        ConnectionFactory factory = connectionFactory != null
                ? connectionFactory
                : new SshConnectionFactory(config.getSsh());

        registry = new ServerRegistry(factory, config.getSsh(), fanOut,
                persistent ? new JsonDefinitionStore<>(stateDir.resolve("servers"), ServerConfig.class) : null);
        clusterManager = new ClusterManager(registry, fanOut,
                persistent ? new JsonDefinitionStore<>(stateDir.resolve("clusters"), Cluster.class) : null,
                clock);
        monitor = new ClusterMonitor(registry, clusterManager, config.getMonitor(), fanOut,
                persistent ? new JsonDefinitionStore<>(stateDir.resolve("tasks"), MonitoringTask.class) : null,
                clock);
        syncManager = new ConfigSyncManager(registry, config.getSync(), fanOut,
                persistent ? new JsonDefinitionStore<>(stateDir.resolve("profiles"), SyncProfile.class) : null,
                clock);

        int servers = registry.loadPersisted();
        int clusters = clusterManager.loadPersisted();
        int tasks = monitor.loadPersisted();
        int profiles = syncManager.loadPersisted();

        initialized = true;
        LOGGER.info("Fleet manager initialized");
        LOGGER.info("  Servers: {}", servers);
        LOGGER.info("  Clusters: {}", clusters);
        LOGGER.info("  Monitoring tasks: {}", tasks);
        LOGGER.info("  Sync profiles: {}", profiles);

        if (config.getMonitor().isAutoStart()) {
            monitor.startMonitoring();
        }
    }

    // ==================== Components ====================

    @Nonnull
    public FleetConfig getConfig() {
        checkInitialized();
        return config;
    }

    /**
     * Get the server registry, which is the fleet's {@link RemoteManager}.
     */
    @Nonnull
    public ServerRegistry getRegistry() {
        checkInitialized();
        return registry;
    }

    @Nonnull
    public ClusterManager getClusterManager() {
        checkInitialized();
        return clusterManager;
    }

    @Nonnull
    public ClusterMonitor getMonitor() {
        checkInitialized();
        return monitor;
    }

    @Nonnull
    public ConfigSyncManager getSyncManager() {
        checkInitialized();
        return syncManager;
    }

    @Nonnull
    public Path getRoot() {
        return root;
    }

    public boolean isInitialized() {
        return initialized && !shutdown;
    }

    private void checkInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Fleet manager not initialized");
        }
        if (shutdown) {
            throw new IllegalStateException("Fleet manager has been shut down");
        }
    }

    // ==================== Shutdown ====================

    /**
     * Stop monitoring, release workers and close every connection.
     */
    public void shutdown() {
        if (!initialized || shutdown) {
            return;
        }

        shutdown = true;
        LOGGER.info("Shutting down fleet manager...");

        if (monitor != null && monitor.isRunning()) {
            monitor.stopMonitoring();
        }
        if (fanOut != null) {
            fanOut.close();
        }
        if (registry != null) {
            registry.closeAllConnections();
        }

        LOGGER.info("Fleet manager shut down");
    }
}
