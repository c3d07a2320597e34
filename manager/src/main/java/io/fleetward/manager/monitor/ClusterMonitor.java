package io.fleetward.manager.monitor;

import io.fleetward.api.error.NotFoundException;
import io.fleetward.api.error.RemoteException;
import io.fleetward.api.error.ValidationException;
import io.fleetward.api.remote.HealthLevel;
import io.fleetward.api.remote.RemoteManager;
import io.fleetward.api.remote.RemoteResult;
import io.fleetward.api.remote.ServerMetrics;
import io.fleetward.api.remote.ServerStatus;
import io.fleetward.manager.cluster.ClusterManager;
import io.fleetward.manager.config.FleetConfig;
import io.fleetward.manager.event.ServerStatusEvent;
import io.fleetward.manager.metrics.MetricLineParser;
import io.fleetward.manager.metrics.SystemMetricsCollector;
import io.fleetward.manager.persistence.JsonDefinitionStore;
import io.fleetward.manager.util.Deadline;
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
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Runs monitoring tasks on a fixed tick and keeps the latest metrics and a
 * bounded alert list.
 *
 * <h2>Scheduling</h2>
 * <p>Every tick dispatches each enabled task whose next run is due. On
 * dispatch the task's last run becomes now and its next run becomes
 * now + interval, so repeated ticks inside one interval run it once. A task
 * whose previous run is still in flight is skipped. Stopping the monitor
 * does not cancel in-flight runs.</p>
 *
 * <h2>Per-server run</h2>
 * <ol>
 *   <li>Connectivity probe; on failure the server is marked offline, a
 *       critical alert is raised and the remaining checks are skipped.</li>
 *   <li>Health checks in order, compared against expected exit code and output.</li>
 *   <li>{@code METRIC:key=value} output lines become custom metrics.</li>
 *   <li>Standard OS metrics, best-effort.</li>
 * </ol>
 * <p>The whole run is bounded by the task timeout.</p>
 */
public class ClusterMonitor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClusterMonitor.class);

    static final String PROBE_COMMAND = "echo 'connectivity_test'";
    static final String CONNECTIVITY_CHECK = "connectivity";

    private final RemoteManager remote;
    private final ClusterManager clusterManager;
    private final FleetConfig.MonitorSettings settings;
    private final FanOutExecutor fanOut;
    private final JsonDefinitionStore<MonitoringTask> store;
    private final Clock clock;
    private final SystemMetricsCollector metricsCollector;

    private final Map<String, MonitoringTask> tasks = new HashMap<>();
    private final Map<String, AtomicBoolean> inFlight = new ConcurrentHashMap<>();
    private final ReentrantReadWriteLock taskLock = new ReentrantReadWriteLock();

    private final LinkedHashMap<String, MonitoringAlert> alerts = new LinkedHashMap<>();
    private final ReentrantReadWriteLock alertLock = new ReentrantReadWriteLock();
    private final AtomicLong alertSequence = new AtomicLong();

    private final Map<String, ServerMetrics> metrics = new ConcurrentHashMap<>();
    private final Map<String, ServerStatus> statuses = new ConcurrentHashMap<>();
    private final List<MonitorListener> listeners = new CopyOnWriteArrayList<>();

    private final Object stateLock = new Object();
    private MonitorState state = MonitorState.STOPPED;
    private ScheduledExecutorService scheduler;

    /**
     * Create a cluster monitor.
     *
     * @param remote server dispatcher
     * @param clusterManager resolves cluster targets
     * @param settings monitor settings
     * @param fanOut executor for task runs and per-server fan-out
     * @param store task definition store, or null to keep tasks in memory only
     * @param clock time source for schedules and alerts
     */
    public ClusterMonitor(
            @Nonnull RemoteManager remote,
            @Nonnull ClusterManager clusterManager,
            @Nonnull FleetConfig.MonitorSettings settings,
            @Nonnull FanOutExecutor fanOut,
            @Nullable JsonDefinitionStore<MonitoringTask> store,
            @Nonnull Clock clock) {
        this.remote = Objects.requireNonNull(remote, "remote");
        this.clusterManager = Objects.requireNonNull(clusterManager, "clusterManager");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.fanOut = Objects.requireNonNull(fanOut, "fanOut");
        this.store = store;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metricsCollector = new SystemMetricsCollector(
                Duration.ofSeconds(settings.getDefaultCheckTimeoutSeconds()));
    }

    // ==================== Lifecycle ====================

    /**
     * Start the scheduler.
     *
     * @throws IllegalStateException if already running
     */
    public void startMonitoring() {
        synchronized (stateLock) {
            if (state == MonitorState.RUNNING) {
                throw new IllegalStateException("Monitoring already running");
            }
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "ClusterMonitor-Scheduler");
                t.setDaemon(true);
                return t;
            });
            long tickMillis = Math.max(1, settings.tickInterval().toMillis());
            scheduler.scheduleAtFixedRate(this::tick, 0, tickMillis, TimeUnit.MILLISECONDS);
            state = MonitorState.RUNNING;
        }
        LOGGER.info("Cluster monitoring started (tick {}s)", settings.getTickIntervalSeconds());
    }

    /**
     * Stop the scheduler. Runs already in flight complete on their own.
     *
     * @throws IllegalStateException if not running
     */
    public void stopMonitoring() {
        synchronized (stateLock) {
            if (state != MonitorState.RUNNING) {
                throw new IllegalStateException("Monitoring not running");
            }
            scheduler.shutdown();
            scheduler = null;
            state = MonitorState.STOPPED;
        }
        LOGGER.info("Cluster monitoring stopped");
    }

    @Nonnull
    public MonitorState getState() {
        synchronized (stateLock) {
            return state;
        }
    }

    public boolean isRunning() {
        return getState() == MonitorState.RUNNING;
    }

    private void tick() {
        try {
            runScheduledTasks();
        } catch (RuntimeException e) {
            LOGGER.error("Monitor tick failed", e);
        }
    }

    // ==================== Scheduling ====================

    /**
     * Dispatch every enabled task that is due and not already in flight.
     * Runs execute in the background.
     *
     * @return names of the dispatched tasks
     */
    @Nonnull
    public List<String> runScheduledTasks() {
        Instant now = clock.instant();
        List<MonitoringTask> due = new ArrayList<>();

        taskLock.writeLock().lock();
        try {
            for (MonitoringTask task : tasks.values()) {
                if (!task.isDue(now)) {
                    continue;
                }
                AtomicBoolean running = inFlight.computeIfAbsent(task.name(), k -> new AtomicBoolean());
                if (!running.compareAndSet(false, true)) {
                    LOGGER.debug("Task '{}' still running, skipping this tick", task.name());
                    continue;
                }
                MonitoringTask dispatched = schedule(task, now);
                tasks.put(task.name(), dispatched);
                due.add(dispatched);
            }
        } finally {
            taskLock.writeLock().unlock();
        }

        List<String> names = new ArrayList<>();
        for (MonitoringTask task : due) {
            names.add(task.name());
            fanOut.runAsync(() -> executeAndRelease(task))
                    .exceptionally(e -> {
                        LOGGER.error("Monitoring task '{}' failed: {}", task.name(), e.getMessage());
                        return null;
                    });
        }
        return names;
    }

    /**
     * Run a task now, on the calling thread.
     *
     * @param name task name
     * @return the run's outcome
     * @throws NotFoundException if the task does not exist
     * @throws IllegalStateException if the task is already running
     */
    @Nonnull
    public TaskRunResult runTask(@Nonnull String name) {
        Objects.requireNonNull(name, "name");
        MonitoringTask dispatched;
        taskLock.writeLock().lock();
        try {
            MonitoringTask task = tasks.get(name);
            if (task == null) {
                throw new NotFoundException("monitoring task", name);
            }
            AtomicBoolean running = inFlight.computeIfAbsent(name, k -> new AtomicBoolean());
            if (!running.compareAndSet(false, true)) {
                throw new IllegalStateException("Monitoring task already running: " + name);
            }
            dispatched = schedule(task, clock.instant());
            tasks.put(name, dispatched);
        } finally {
            taskLock.writeLock().unlock();
        }
        return executeAndRelease(dispatched);
    }

    private MonitoringTask schedule(MonitoringTask task, Instant now) {
        Instant next = now.plus(task.interval());
        if (task.nextRun() != null && task.nextRun().isAfter(next)) {
            next = task.nextRun();
        }
        return task.withSchedule(now, next);
    }

    private TaskRunResult executeAndRelease(MonitoringTask task) {
        try {
            return executeTask(task);
        } finally {
            AtomicBoolean running = inFlight.get(task.name());
            if (running != null) {
                running.set(false);
            }
        }
    }

    // ==================== Execution ====================

    private TaskRunResult executeTask(MonitoringTask task) {
        Instant started = clock.instant();
        long startNanos = System.nanoTime();
        Deadline deadline = Deadline.after(task.timeout());
        List<MonitoringAlert> raised = new CopyOnWriteArrayList<>();

        Set<String> targets = resolveTargets(task);
        LOGGER.debug("Running task '{}' on {} servers", task.name(), targets.size());

        Map<String, ServerMetrics> collected = fanOut.invokeAll(targets,
                server -> monitorServer(task, server, deadline, raised),
                (server, error) -> markUnreachable(server, String.valueOf(error.getMessage()), Duration.ZERO, raised));

        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
        if (!raised.isEmpty()) {
            LOGGER.info("Task '{}' finished in {}ms with {} alerts", task.name(), duration.toMillis(), raised.size());
        }
        return new TaskRunResult(task.name(), started, duration, collected, new ArrayList<>(raised));
    }

    private Set<String> resolveTargets(MonitoringTask task) {
        Set<String> targets = new LinkedHashSet<>(task.servers());
        for (String cluster : task.clusters()) {
            try {
                targets.addAll(clusterManager.resolveMembers(cluster));
            } catch (NotFoundException e) {
                LOGGER.warn("Task '{}' references unknown cluster '{}'", task.name(), cluster);
            }
        }
        return targets;
    }

    private ServerMetrics monitorServer(
            MonitoringTask task,
            String server,
            Deadline deadline,
            List<MonitoringAlert> raised) {
        Duration probeTimeout = deadline.cap(Duration.ofSeconds(settings.getDefaultCheckTimeoutSeconds()));
        long probeStart = System.nanoTime();
        RemoteResult probe;
        try {
            probe = remote.executeCommand(server, PROBE_COMMAND, probeTimeout);
        } catch (RemoteException | NotFoundException e) {
            return markUnreachable(server, e.getMessage(), Duration.ofNanos(System.nanoTime() - probeStart), raised);
        }
        if (!probe.success()) {
            String reason = probe.timedOut() ? "probe timed out" : "probe exited with " + probe.exitCode();
            return markUnreachable(server, reason, probe.duration(), raised);
        }

        updateStatus(server, ServerStatus.ONLINE, null);
        ServerMetrics.Builder builder = ServerMetrics.builder(server)
                .status(ServerStatus.ONLINE)
                .responseTime(probe.duration());

        for (HealthCheck check : task.checks()) {
            if (deadline.isExpired()) {
                LOGGER.debug("Task '{}' timed out on {} before check '{}'", task.name(), server, check.name());
                break;
            }
            runCheck(server, check, deadline, builder, raised);
        }

        if (task.collectSystemMetrics()) {
            metricsCollector.collect(remote, server, deadline, builder);
        }

        ServerMetrics snapshot = builder.lastUpdate(clock.instant()).build();
        metrics.put(server, snapshot);
        return snapshot;
    }

    private void runCheck(
            String server,
            HealthCheck check,
            Deadline deadline,
            ServerMetrics.Builder builder,
            List<MonitoringAlert> raised) {
        HealthLevel failureLevel = check.critical() ? HealthLevel.CRITICAL : HealthLevel.WARNING;
        Duration timeout = check.timeout() != null
                ? check.timeout()
                : Duration.ofSeconds(settings.getDefaultCheckTimeoutSeconds());

        RemoteResult result;
        try {
            result = remote.executeCommand(server, check.command(), deadline.cap(timeout));
        } catch (RemoteException e) {
            // only critical checks alert when the command cannot run
            if (check.critical()) {
                raised.add(raiseAlert(HealthLevel.CRITICAL, server, check.name(),
                        "Health check execution failed: " + e.getMessage(),
                        Map.of("command", check.command(), "error", String.valueOf(e.getMessage()))));
            } else {
                LOGGER.debug("Health check '{}' on {} could not run: {}", check.name(), server, e.getMessage());
            }
            return;
        }

        builder.custom(MetricLineParser.parse(result.output()));

        if (result.timedOut()) {
            raised.add(raiseAlert(failureLevel, server, check.name(),
                    "Health check timed out after " + result.duration().toMillis() + "ms",
                    Map.of("command", check.command(), "output", result.output())));
            return;
        }

        if (result.exitCode() != check.expectedExitCode()) {
            raised.add(raiseAlert(failureLevel, server, check.name(),
                    String.format("Health check exit code mismatch: expected %d, got %d",
                            check.expectedExitCode(), result.exitCode()),
                    Map.of("command", check.command(),
                            "expected_exit", String.valueOf(check.expectedExitCode()),
                            "actual_exit", String.valueOf(result.exitCode()),
                            "output", result.output())));
            return;
        }

        String expected = check.expectedOutput();
        if (expected != null && !expected.isEmpty() && !result.output().contains(expected)) {
            raised.add(raiseAlert(failureLevel, server, check.name(),
                    "Health check output mismatch",
                    Map.of("command", check.command(),
                            "expected_output", expected,
                            "actual_output", result.output())));
        }
    }

    private ServerMetrics markUnreachable(
            String server,
            String reason,
            Duration responseTime,
            List<MonitoringAlert> raised) {
        updateStatus(server, ServerStatus.OFFLINE, reason);
        raised.add(raiseAlert(HealthLevel.CRITICAL, server, CONNECTIVITY_CHECK, "Server is not responding",
                Map.of("error", String.valueOf(reason))));

        ServerMetrics snapshot = ServerMetrics.builder(server)
                .status(ServerStatus.OFFLINE)
                .responseTime(responseTime)
                .lastUpdate(clock.instant())
                .build();
        metrics.put(server, snapshot);
        return snapshot;
    }

    private void updateStatus(String server, ServerStatus newStatus, @Nullable String message) {
        ServerStatus previous = statuses.put(server, newStatus);
        if (previous == null) {
            previous = ServerStatus.UNKNOWN;
        }
        if (previous == newStatus) {
            return;
        }
        ServerStatusEvent event = new ServerStatusEvent(server, previous, newStatus, message, clock.instant());
        if (event.becameUnhealthy()) {
            LOGGER.warn("Server '{}' is offline: {}", server, message);
        } else if (event.recovered()) {
            LOGGER.info("Server '{}' is back online", server);
        }
        for (MonitorListener listener : listeners) {
            try {
                listener.onStatusChange(event);
            } catch (RuntimeException e) {
                LOGGER.warn("Monitor listener failed on status change for '{}': {}", server, e.getMessage());
            }
        }
    }

    // ==================== Alerts ====================

    private MonitoringAlert raiseAlert(
            HealthLevel level,
            String server,
            String checkName,
            String message,
            Map<String, String> metadata) {
        Instant now = clock.instant();
        String id = server + "_" + checkName + "_" + now.getEpochSecond() + "_" + alertSequence.incrementAndGet();
        MonitoringAlert alert = new MonitoringAlert(id, level, server, checkName, message, now, false, null, metadata);

        alertLock.writeLock().lock();
        try {
            alerts.put(id, alert);
            int max = Math.max(1, settings.getMaxAlerts());
            Iterator<String> oldest = alerts.keySet().iterator();
            while (alerts.size() > max && oldest.hasNext()) {
                oldest.next();
                oldest.remove();
            }
        } finally {
            alertLock.writeLock().unlock();
        }

        LOGGER.debug("{} alert on {} [{}]: {}", level, server, checkName, message);
        for (MonitorListener listener : listeners) {
            try {
                listener.onAlert(alert);
            } catch (RuntimeException e) {
                LOGGER.warn("Monitor listener failed on alert {}: {}", id, e.getMessage());
            }
        }
        return alert;
    }

    /**
     * Get all retained alerts, oldest first.
     *
     * @return alerts
     */
    @Nonnull
    public List<MonitoringAlert> getAlerts() {
        alertLock.readLock().lock();
        try {
            return new ArrayList<>(alerts.values());
        } finally {
            alertLock.readLock().unlock();
        }
    }

    /**
     * Get retained alerts filtered by resolution state.
     *
     * @param resolved true for resolved alerts, false for open ones
     * @return matching alerts, oldest first
     */
    @Nonnull
    public List<MonitoringAlert> getAlerts(boolean resolved) {
        List<MonitoringAlert> result = new ArrayList<>();
        for (MonitoringAlert alert : getAlerts()) {
            if (alert.resolved() == resolved) {
                result.add(alert);
            }
        }
        return result;
    }

    /**
     * Mark an alert resolved. Resolving twice keeps the first resolution time.
     *
     * @param id alert id
     * @return the resolved alert
     * @throws NotFoundException if no retained alert has this id
     */
    @Nonnull
    public MonitoringAlert resolveAlert(@Nonnull String id) {
        Objects.requireNonNull(id, "id");
        alertLock.writeLock().lock();
        try {
            MonitoringAlert alert = alerts.get(id);
            if (alert == null) {
                throw new NotFoundException("alert", id);
            }
            if (alert.resolved()) {
                return alert;
            }
            MonitoringAlert resolved = alert.resolve(clock.instant());
            alerts.put(id, resolved);
            return resolved;
        } finally {
            alertLock.writeLock().unlock();
        }
    }

    /**
     * Drop all resolved alerts.
     *
     * @return number of alerts removed
     */
    public int clearResolvedAlerts() {
        alertLock.writeLock().lock();
        try {
            int before = alerts.size();
            alerts.values().removeIf(MonitoringAlert::resolved);
            return before - alerts.size();
        } finally {
            alertLock.writeLock().unlock();
        }
    }

    // ==================== Metrics ====================

    /**
     * Get the latest metrics of every monitored server.
     *
     * @return metrics keyed by server name
     */
    @Nonnull
    public Map<String, ServerMetrics> getServerMetrics() {
        return Collections.unmodifiableMap(new HashMap<>(metrics));
    }

    /**
     * Get the latest metrics of one server.
     *
     * @param server server name
     * @return metrics
     * @throws NotFoundException if the server has not been monitored yet
     */
    @Nonnull
    public ServerMetrics getServerMetrics(@Nonnull String server) {
        ServerMetrics snapshot = metrics.get(server);
        if (snapshot == null) {
            throw new NotFoundException("server metrics", server);
        }
        return snapshot;
    }

    public void addListener(@Nonnull MonitorListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(@Nonnull MonitorListener listener) {
        listeners.remove(listener);
    }

    // ==================== Task CRUD ====================

    /**
     * Register a monitoring task. Missing interval or timeout take the
     * configured defaults; the first run is due immediately.
     *
     * @param task task definition
     * @return the stored task
     * @throws ValidationException if the definition is invalid or the name is taken
     */
    @Nonnull
    public MonitoringTask createMonitoringTask(@Nonnull MonitoringTask task) {
        Objects.requireNonNull(task, "task");
        Instant now = clock.instant();
        MonitoringTask stored = validate(withDefaults(task, now, now));

        taskLock.writeLock().lock();
        try {
            if (tasks.containsKey(stored.name())) {
                throw new ValidationException("Monitoring task already exists: " + stored.name());
            }
            tasks.put(stored.name(), stored);
        } finally {
            taskLock.writeLock().unlock();
        }

        persist(stored);
        LOGGER.info("Created monitoring task '{}' ({} checks, every {}s)",
                stored.name(), stored.checks().size(), stored.interval().toSeconds());
        return stored;
    }

    /**
     * Replace a task's definition, keeping its creation time and schedule.
     *
     * @param task new definition
     * @return the stored task
     */
    @Nonnull
    public MonitoringTask updateMonitoringTask(@Nonnull MonitoringTask task) {
        Objects.requireNonNull(task, "task");
        MonitoringTask stored;
        taskLock.writeLock().lock();
        try {
            MonitoringTask current = tasks.get(task.name());
            if (current == null) {
                throw new NotFoundException("monitoring task", task.name());
            }
            stored = validate(withDefaults(task, current.createdAt(), current.nextRun())
                    .withSchedule(current.lastRun(), current.nextRun()));
            tasks.put(stored.name(), stored);
        } finally {
            taskLock.writeLock().unlock();
        }

        persist(stored);
        LOGGER.info("Updated monitoring task '{}'", stored.name());
        return stored;
    }

    /**
     * Delete a task. A run in flight completes on its own.
     *
     * @param name task name
     */
    public void deleteMonitoringTask(@Nonnull String name) {
        Objects.requireNonNull(name, "name");
        taskLock.writeLock().lock();
        try {
            if (tasks.remove(name) == null) {
                throw new NotFoundException("monitoring task", name);
            }
        } finally {
            taskLock.writeLock().unlock();
        }

        unpersist(name);
        LOGGER.info("Deleted monitoring task '{}'", name);
    }

    /**
     * Enable or disable a task.
     *
     * @param name task name
     * @param enabled new state
     * @return the updated task
     */
    @Nonnull
    public MonitoringTask setTaskEnabled(@Nonnull String name, boolean enabled) {
        MonitoringTask updated;
        taskLock.writeLock().lock();
        try {
            MonitoringTask current = tasks.get(name);
            if (current == null) {
                throw new NotFoundException("monitoring task", name);
            }
            updated = current.withEnabled(enabled);
            tasks.put(name, updated);
        } finally {
            taskLock.writeLock().unlock();
        }
        persist(updated);
        return updated;
    }

    @Nonnull
    public MonitoringTask getMonitoringTask(@Nonnull String name) {
        taskLock.readLock().lock();
        try {
            MonitoringTask task = tasks.get(name);
            if (task == null) {
                throw new NotFoundException("monitoring task", name);
            }
            return task;
        } finally {
            taskLock.readLock().unlock();
        }
    }

    /**
     * List all tasks sorted by name.
     *
     * @return tasks
     */
    @Nonnull
    public List<MonitoringTask> getMonitoringTasks() {
        List<MonitoringTask> result;
        taskLock.readLock().lock();
        try {
            result = new ArrayList<>(tasks.values());
        } finally {
            taskLock.readLock().unlock();
        }
        result.sort(Comparator.comparing(MonitoringTask::name));
        return result;
    }

    /**
     * Check whether a task has a run in flight.
     */
    public boolean isTaskRunning(@Nonnull String name) {
        AtomicBoolean running = inFlight.get(name);
        return running != null && running.get();
    }

    private MonitoringTask withDefaults(MonitoringTask task, Instant createdAt, Instant nextRun) {
        return task.withDefaults(
                Duration.ofSeconds(settings.getDefaultTaskIntervalSeconds()),
                Duration.ofSeconds(settings.getDefaultTaskTimeoutSeconds()),
                createdAt != null ? createdAt : clock.instant(),
                nextRun != null ? nextRun : clock.instant());
    }

    private static MonitoringTask validate(MonitoringTask task) {
        if (task.name().isBlank()) {
            throw new ValidationException("Monitoring task name is required");
        }
        if (task.servers().isEmpty() && task.clusters().isEmpty()) {
            throw new ValidationException("Monitoring task needs at least one server or cluster: " + task.name());
        }
        if (task.checks().isEmpty()) {
            throw new ValidationException("Monitoring task needs at least one health check: " + task.name());
        }
        if (task.interval().isZero() || task.interval().isNegative()) {
            throw new ValidationException("Monitoring task interval must be positive: " + task.name());
        }
        if (task.timeout().isZero() || task.timeout().isNegative()) {
            throw new ValidationException("Monitoring task timeout must be positive: " + task.name());
        }
        for (HealthCheck check : task.checks()) {
            if (check.name().isBlank() || check.command().isBlank()) {
                throw new ValidationException("Health checks need a name and a command: " + task.name());
            }
        }
        return task;
    }

    // ==================== Persistence ====================

    /**
     * Restore persisted tasks. Restored tasks are due immediately.
     *
     * @return number of tasks restored
     * @throws IOException if the store cannot be read
     */
    public int loadPersisted() throws IOException {
        if (store == null) {
            return 0;
        }
        int restored = 0;
        Instant now = clock.instant();
        for (MonitoringTask task : store.loadAll()) {
            MonitoringTask stored;
            try {
                stored = validate(withDefaults(task, task.createdAt(), now).withSchedule(null, now));
            } catch (ValidationException e) {
                LOGGER.warn("Ignoring invalid persisted monitoring task '{}': {}", task.name(), e.getMessage());
                continue;
            }
            taskLock.writeLock().lock();
            try {
                if (tasks.putIfAbsent(stored.name(), stored) == null) {
                    restored++;
                }
            } finally {
                taskLock.writeLock().unlock();
            }
        }
        return restored;
    }

    private void persist(MonitoringTask task) {
        if (store == null) {
            return;
        }
        try {
            store.save(task.name(), task);
        } catch (IOException e) {
            LOGGER.warn("Failed to persist monitoring task '{}': {}", task.name(), e.getMessage());
        }
    }

    private void unpersist(String name) {
        if (store == null) {
            return;
        }
        try {
            store.delete(name);
        } catch (IOException e) {
            LOGGER.warn("Failed to delete persisted monitoring task '{}': {}", name, e.getMessage());
        }
    }
}
