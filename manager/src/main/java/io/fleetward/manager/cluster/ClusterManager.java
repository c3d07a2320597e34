package io.fleetward.manager.cluster;

import io.fleetward.api.error.NotFoundException;
import io.fleetward.api.error.ValidationException;
import io.fleetward.api.remote.HealthLevel;
import io.fleetward.api.remote.HealthStatus;
import io.fleetward.api.remote.RemoteManager;
import io.fleetward.api.remote.RemoteResult;
import io.fleetward.manager.persistence.JsonDefinitionStore;
import io.fleetward.manager.util.FanOutExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * Manages named groups of servers and runs commands across them.
 *
 * <p>Clusters hold server names only; every remote call goes through the
 * {@link RemoteManager}.</p>
 */
public class ClusterManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClusterManager.class);

    private final Map<String, Cluster> clusters = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final RemoteManager remote;
    private final FanOutExecutor fanOut;
    private final JsonDefinitionStore<Cluster> store;
    private final Clock clock;

    /**
     * Create a cluster manager.
     *
     * @param remote server dispatcher
     * @param fanOut executor for per-member health checks
     * @param store definition store, or null to keep clusters in memory only
     * @param clock time source
     */
    public ClusterManager(
            @Nonnull RemoteManager remote,
            @Nonnull FanOutExecutor fanOut,
            @Nullable JsonDefinitionStore<Cluster> store,
            @Nonnull Clock clock) {
        this.remote = Objects.requireNonNull(remote, "remote");
        this.fanOut = Objects.requireNonNull(fanOut, "fanOut");
        this.store = store;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // ==================== CRUD ====================

    /**
     * Create a cluster.
     *
     * @param name unique cluster name
     * @param description free text, may be empty
     * @param servers member server names, at least one
     * @param tags free-form labels
     * @return the created cluster
     * @throws ValidationException if the name is empty or taken, or there are no members
     */
    @Nonnull
    public Cluster createCluster(
            @Nonnull String name,
            @Nullable String description,
            @Nonnull List<String> servers,
            @Nullable Map<String, String> tags) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Cluster name is required");
        }
        List<String> members = normalizeMembers(servers);
        if (members.isEmpty()) {
            throw new ValidationException("Cluster must have at least one server: " + name);
        }

        Instant now = clock.instant();
        Cluster cluster = new Cluster(name, description, members, tags, now, now, null);

        lock.writeLock().lock();
        try {
            if (clusters.containsKey(name)) {
                throw new ValidationException("Cluster already exists: " + name);
            }
            clusters.put(name, cluster);
        } finally {
            lock.writeLock().unlock();
        }

        persist(cluster);
        LOGGER.info("Created cluster '{}' with {} servers", name, members.size());
        return cluster;
    }

    /**
     * Get a cluster by name.
     *
     * @param name cluster name
     * @return the cluster
     * @throws NotFoundException if no such cluster exists
     */
    @Nonnull
    public Cluster getCluster(@Nonnull String name) {
        Objects.requireNonNull(name, "name");
        lock.readLock().lock();
        try {
            Cluster cluster = clusters.get(name);
            if (cluster == null) {
                throw new NotFoundException("cluster", name);
            }
            return cluster;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Check if a cluster exists.
     */
    public boolean hasCluster(@Nonnull String name) {
        lock.readLock().lock();
        try {
            return clusters.containsKey(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * List all clusters sorted by name.
     *
     * @return clusters
     */
    @Nonnull
    public List<Cluster> listClusters() {
        List<Cluster> result;
        lock.readLock().lock();
        try {
            result = new ArrayList<>(clusters.values());
        } finally {
            lock.readLock().unlock();
        }
        result.sort(Comparator.comparing(Cluster::name));
        return result;
    }

    /**
     * Update a cluster. Null arguments leave the field unchanged.
     *
     * @param name cluster name
     * @param description new description, or null
     * @param servers new member list, or null
     * @param tags new tags, or null
     * @return the updated cluster
     */
    @Nonnull
    public Cluster updateCluster(
            @Nonnull String name,
            @Nullable String description,
            @Nullable List<String> servers,
            @Nullable Map<String, String> tags) {
        Objects.requireNonNull(name, "name");
        List<String> members = servers == null ? null : normalizeMembers(servers);
        if (members != null && members.isEmpty()) {
            throw new ValidationException("Cluster must have at least one server: " + name);
        }

        Cluster updated;
        lock.writeLock().lock();
        try {
            Cluster current = clusters.get(name);
            if (current == null) {
                throw new NotFoundException("cluster", name);
            }
            updated = new Cluster(
                    name,
                    description != null ? description : current.description(),
                    members != null ? members : current.servers(),
                    tags != null ? tags : current.tags(),
                    current.createdAt(),
                    clock.instant(),
                    current.health());
            clusters.put(name, updated);
        } finally {
            lock.writeLock().unlock();
        }

        persist(updated);
        LOGGER.info("Updated cluster '{}'", name);
        return updated;
    }

    /**
     * Delete a cluster.
     *
     * @param name cluster name
     * @throws NotFoundException if no such cluster exists
     */
    public void deleteCluster(@Nonnull String name) {
        Objects.requireNonNull(name, "name");
        lock.writeLock().lock();
        try {
            if (clusters.remove(name) == null) {
                throw new NotFoundException("cluster", name);
            }
        } finally {
            lock.writeLock().unlock();
        }

        unpersist(name);
        LOGGER.info("Deleted cluster '{}'", name);
    }

    // ==================== Membership ====================

    /**
     * Add a server to a cluster.
     *
     * @throws ValidationException if the server is already a member
     */
    @Nonnull
    public Cluster addServerToCluster(@Nonnull String clusterName, @Nonnull String server) {
        Objects.requireNonNull(server, "server");
        if (server.isBlank()) {
            throw new ValidationException("Server name is required");
        }
        return changeMembers(clusterName, members -> {
            if (members.contains(server)) {
                throw new ValidationException("Server '" + server + "' is already in cluster " + clusterName);
            }
            members.add(server);
        });
    }

    /**
     * Remove a server from a cluster. The last member cannot be removed.
     *
     * @throws NotFoundException if the server is not a member
     * @throws ValidationException if it is the only member
     */
    @Nonnull
    public Cluster removeServerFromCluster(@Nonnull String clusterName, @Nonnull String server) {
        Objects.requireNonNull(server, "server");
        return changeMembers(clusterName, members -> {
            if (!members.contains(server)) {
                throw new NotFoundException("cluster member", clusterName + "/" + server);
            }
            if (members.size() == 1) {
                throw new ValidationException("Cannot remove the last server from cluster " + clusterName);
            }
            members.remove(server);
        });
    }

    private Cluster changeMembers(String clusterName, Consumer<List<String>> change) {
        Objects.requireNonNull(clusterName, "clusterName");
        Cluster updated;
        lock.writeLock().lock();
        try {
            Cluster current = clusters.get(clusterName);
            if (current == null) {
                throw new NotFoundException("cluster", clusterName);
            }
            List<String> members = new ArrayList<>(current.servers());
            change.accept(members);
            updated = current.withServers(members, clock.instant());
            clusters.put(clusterName, updated);
        } finally {
            lock.writeLock().unlock();
        }
        persist(updated);
        return updated;
    }

    /**
     * Get a cluster's current member names.
     *
     * @param name cluster name
     * @return member names
     */
    @Nonnull
    public List<String> resolveMembers(@Nonnull String name) {
        return getCluster(name).servers();
    }

    // ==================== Execution ====================

    /**
     * Run a command on every member concurrently.
     *
     * <p>Every member gets a result, including members that are unknown to
     * the registry or cannot be reached.</p>
     *
     * @param name cluster name
     * @param command shell command
     * @return per-server breakdown and aggregate success rate
     * @throws NotFoundException if the cluster does not exist
     */
    @Nonnull
    public ClusterExecutionResult executeOnCluster(@Nonnull String name, @Nonnull String command) {
        Objects.requireNonNull(command, "command");
        Cluster cluster = getCluster(name);
        Instant started = clock.instant();

        LOGGER.info("Executing on cluster '{}' ({} servers): {}", name, cluster.size(), command);
        Map<String, RemoteResult> results = remote.executeOnServers(cluster.servers(), command);
        ClusterExecutionResult result = ClusterExecutionResult.from(name, command, results, started);

        LOGGER.info("Cluster '{}' execution finished: {}/{} succeeded",
                name, result.successCount(), result.totalServers());
        return result;
    }

    // ==================== Health ====================

    /**
     * Probe every member and compute the cluster's health. The result is
     * also stored on the cluster.
     *
     * @param name cluster name
     * @return cluster health
     */
    @Nonnull
    public ClusterHealth checkClusterHealth(@Nonnull String name) {
        Cluster cluster = getCluster(name);

        Map<String, HealthStatus> statuses = fanOut.invokeAll(cluster.servers(),
                remote::checkServerHealth,
                (server, error) -> new HealthStatus(server, HealthLevel.CRITICAL,
                        String.valueOf(error.getMessage()), Duration.ZERO, clock.instant(), Map.of()));

        int online = 0;
        Duration totalResponse = Duration.ZERO;
        for (HealthStatus status : statuses.values()) {
            if (status.isHealthy()) {
                online++;
                totalResponse = totalResponse.plus(status.responseTime());
            }
        }
        int total = statuses.size();
        int offline = total - online;

        HealthLevel level;
        if (total > 0 && online == total) {
            level = HealthLevel.HEALTHY;
        } else if (online == 0) {
            level = HealthLevel.CRITICAL;
        } else {
            level = HealthLevel.WARNING;
        }

        ClusterHealth health = new ClusterHealth(
                name,
                level,
                total,
                online,
                offline,
                total == 0 ? 0.0 : online * 100.0 / total,
                online == 0 ? Duration.ZERO : totalResponse.dividedBy(online),
                statuses,
                clock.instant());

        lock.writeLock().lock();
        try {
            Cluster current = clusters.get(name);
            if (current != null) {
                clusters.put(name, current.withHealth(health));
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (level != HealthLevel.HEALTHY) {
            LOGGER.warn("Cluster '{}' is {}: {}/{} servers online", name, level, online, total);
        }
        return health;
    }

    /**
     * Get aggregate statistics across all clusters.
     *
     * @return statistics
     */
    @Nonnull
    public ClusterStats getClusterStats() {
        List<Cluster> all = listClusters();
        Set<String> servers = new HashSet<>();
        int memberships = 0;
        int healthy = 0;
        int warning = 0;
        int critical = 0;
        int unchecked = 0;

        for (Cluster cluster : all) {
            servers.addAll(cluster.servers());
            memberships += cluster.size();
            ClusterHealth health = cluster.health();
            if (health == null) {
                unchecked++;
            } else if (health.level() == HealthLevel.HEALTHY) {
                healthy++;
            } else if (health.level() == HealthLevel.WARNING) {
                warning++;
            } else {
                critical++;
            }
        }

        double average = all.isEmpty() ? 0.0 : (double) memberships / all.size();
        return new ClusterStats(all.size(), servers.size(), average, healthy, warning, critical, unchecked);
    }

    // ==================== Persistence ====================

    /**
     * Restore persisted clusters. Clusters already defined are kept.
     *
     * @return number of clusters restored
     * @throws IOException if the store cannot be read
     */
    public int loadPersisted() throws IOException {
        if (store == null) {
            return 0;
        }
        int restored = 0;
        lock.writeLock().lock();
        try {
            for (Cluster cluster : store.loadAll()) {
                if (cluster.name().isBlank() || cluster.servers().isEmpty()) {
                    LOGGER.warn("Ignoring invalid persisted cluster '{}'", cluster.name());
                    continue;
                }
                if (clusters.putIfAbsent(cluster.name(), cluster) == null) {
                    restored++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        return restored;
    }

    private void persist(Cluster cluster) {
        if (store == null) {
            return;
        }
        try {
            store.save(cluster.name(), cluster);
        } catch (IOException e) {
            LOGGER.warn("Failed to persist cluster '{}': {}", cluster.name(), e.getMessage());
        }
    }

    private void unpersist(String name) {
        if (store == null) {
            return;
        }
        try {
            store.delete(name);
        } catch (IOException e) {
            LOGGER.warn("Failed to delete persisted cluster '{}': {}", name, e.getMessage());
        }
    }

    private static List<String> normalizeMembers(Collection<String> servers) {
        List<String> members = new ArrayList<>();
        if (servers == null) {
            return members;
        }
        for (String server : servers) {
            if (server == null || server.isBlank()) {
                throw new ValidationException("Cluster member names must not be empty");
            }
            if (!members.contains(server)) {
                members.add(server);
            }
        }
        return members;
    }
}
