package io.fleetward.manager.monitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Periodic set of health checks against servers and clusters.
 *
 * <p>Instances handed out by the monitor are snapshots including the
 * schedule timestamps. Build new definitions with {@link #builder(String)};
 * the monitor fills in defaults for a missing interval or timeout.</p>
 *
 * @param name unique task name
 * @param description free text
 * @param servers target server names
 * @param clusters target cluster names, resolved at run time
 * @param checks checks run in order on every target
 * @param interval time between runs
 * @param timeout bound on one whole run
 * @param enabled whether the scheduler runs the task
 * @param collectSystemMetrics whether standard OS metrics are collected
 * @param tags free-form labels
 * @param createdAt creation time
 * @param lastRun start of the last run, or null
 * @param nextRun earliest time of the next scheduled run
 */
public record MonitoringTask(
        @Nonnull String name,
        @Nonnull String description,
        @Nonnull List<String> servers,
        @Nonnull List<String> clusters,
        @Nonnull List<HealthCheck> checks,
        @Nullable Duration interval,
        @Nullable Duration timeout,
        boolean enabled,
        boolean collectSystemMetrics,
        @Nonnull Map<String, String> tags,
        @Nullable Instant createdAt,
        @Nullable Instant lastRun,
        @Nullable Instant nextRun
) {

    public MonitoringTask {
        name = name == null ? "" : name;
        description = description == null ? "" : description;
        servers = servers == null ? List.of() : List.copyOf(servers);
        clusters = clusters == null ? List.of() : List.copyOf(clusters);
        checks = checks == null ? List.of() : List.copyOf(checks);
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    @Nonnull
    public static Builder builder(@Nonnull String name) {
        return new Builder(name);
    }

    /**
     * Check whether the scheduler should run the task at {@code now}.
     */
    public boolean isDue(@Nonnull Instant now) {
        return enabled && (nextRun == null || !nextRun.isAfter(now));
    }

    MonitoringTask withSchedule(Instant newLastRun, Instant newNextRun) {
        return new MonitoringTask(name, description, servers, clusters, checks, interval, timeout,
                enabled, collectSystemMetrics, tags, createdAt, newLastRun, newNextRun);
    }

    MonitoringTask withEnabled(boolean newEnabled) {
        return new MonitoringTask(name, description, servers, clusters, checks, interval, timeout,
                newEnabled, collectSystemMetrics, tags, createdAt, lastRun, nextRun);
    }

    MonitoringTask withDefaults(Duration defaultInterval, Duration defaultTimeout, Instant created, Instant next) {
        return new MonitoringTask(name, description, servers, clusters, checks,
                interval != null ? interval : defaultInterval,
                timeout != null ? timeout : defaultTimeout,
                enabled, collectSystemMetrics, tags, created, lastRun, next);
    }

    /**
     * Builder for new task definitions.
     */
    public static final class Builder {

        private final String name;
        private String description = "";
        private final List<String> servers = new ArrayList<>();
        private final List<String> clusters = new ArrayList<>();
        private final List<HealthCheck> checks = new ArrayList<>();
        private Duration interval;
        private Duration timeout;
        private boolean enabled = true;
        private boolean collectSystemMetrics = true;
        private final Map<String, String> tags = new HashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(@Nonnull String description) {
            this.description = description;
            return this;
        }

        public Builder server(@Nonnull String server) {
            servers.add(Objects.requireNonNull(server, "server"));
            return this;
        }

        public Builder servers(@Nonnull List<String> names) {
            servers.addAll(names);
            return this;
        }

        public Builder cluster(@Nonnull String cluster) {
            clusters.add(Objects.requireNonNull(cluster, "cluster"));
            return this;
        }

        public Builder check(@Nonnull HealthCheck check) {
            checks.add(Objects.requireNonNull(check, "check"));
            return this;
        }

        public Builder interval(@Nonnull Duration interval) {
            this.interval = interval;
            return this;
        }

        public Builder timeout(@Nonnull Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder collectSystemMetrics(boolean collectSystemMetrics) {
            this.collectSystemMetrics = collectSystemMetrics;
            return this;
        }

        public Builder tag(@Nonnull String key, @Nonnull String value) {
            tags.put(key, value);
            return this;
        }

        public MonitoringTask build() {
            return new MonitoringTask(name, description, servers, clusters, checks, interval, timeout,
                    enabled, collectSystemMetrics, tags, null, null, null);
        }
    }
}
