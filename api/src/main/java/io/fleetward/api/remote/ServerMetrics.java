package io.fleetward.api.remote;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Latest metrics snapshot for one server.
 *
 * <p>Each collection cycle replaces the previous snapshot; no history is
 * kept. Values that could not be collected are null.</p>
 *
 * @param serverName server the metrics belong to
 * @param status reachability at collection time
 * @param responseTime probe round-trip time
 * @param uptime system uptime, or null
 * @param loadAverage load averages, or null
 * @param cpuPercent CPU usage percentage, or null
 * @param memoryPercent memory usage percentage, or null
 * @param diskPercent root filesystem usage percentage, or null
 * @param processCount number of processes, or null
 * @param custom values reported by health check output
 * @param lastUpdate when the snapshot was taken
 */
public record ServerMetrics(
        @Nonnull String serverName,
        @Nonnull ServerStatus status,
        @Nonnull Duration responseTime,
        @Nullable Duration uptime,
        @Nullable LoadAverage loadAverage,
        @Nullable Double cpuPercent,
        @Nullable Double memoryPercent,
        @Nullable Double diskPercent,
        @Nullable Integer processCount,
        @Nonnull Map<String, Object> custom,
        @Nonnull Instant lastUpdate
) {

    public ServerMetrics {
        custom = Map.copyOf(custom);
    }

    @Nonnull
    public static Builder builder(@Nonnull String serverName) {
        return new Builder(serverName);
    }

    @Nonnull
    public Builder toBuilder() {
        Builder builder = new Builder(serverName)
                .status(status)
                .responseTime(responseTime)
                .uptime(uptime)
                .loadAverage(loadAverage)
                .cpuPercent(cpuPercent)
                .memoryPercent(memoryPercent)
                .diskPercent(diskPercent)
                .processCount(processCount)
                .lastUpdate(lastUpdate);
        builder.custom.putAll(custom);
        return builder;
    }

    /**
     * Builder for {@link ServerMetrics}.
     */
    public static final class Builder {

        private final String serverName;
        private ServerStatus status = ServerStatus.UNKNOWN;
        private Duration responseTime = Duration.ZERO;
        private Duration uptime;
        private LoadAverage loadAverage;
        private Double cpuPercent;
        private Double memoryPercent;
        private Double diskPercent;
        private Integer processCount;
        private final Map<String, Object> custom = new LinkedHashMap<>();
        private Instant lastUpdate = Instant.now();

        private Builder(String serverName) {
            this.serverName = Objects.requireNonNull(serverName, "serverName");
        }

        public Builder status(@Nonnull ServerStatus status) {
            this.status = Objects.requireNonNull(status, "status");
            return this;
        }

        public Builder responseTime(@Nonnull Duration responseTime) {
            this.responseTime = Objects.requireNonNull(responseTime, "responseTime");
            return this;
        }

        public Builder uptime(@Nullable Duration uptime) {
            this.uptime = uptime;
            return this;
        }

        public Builder loadAverage(@Nullable LoadAverage loadAverage) {
            this.loadAverage = loadAverage;
            return this;
        }

        public Builder cpuPercent(@Nullable Double cpuPercent) {
            this.cpuPercent = cpuPercent;
            return this;
        }

        public Builder memoryPercent(@Nullable Double memoryPercent) {
            this.memoryPercent = memoryPercent;
            return this;
        }

        public Builder diskPercent(@Nullable Double diskPercent) {
            this.diskPercent = diskPercent;
            return this;
        }

        public Builder processCount(@Nullable Integer processCount) {
            this.processCount = processCount;
            return this;
        }

        public Builder custom(@Nonnull String key, @Nonnull Object value) {
            custom.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder custom(@Nonnull Map<String, ?> values) {
            custom.putAll(values);
            return this;
        }

        public Builder lastUpdate(@Nonnull Instant lastUpdate) {
            this.lastUpdate = Objects.requireNonNull(lastUpdate, "lastUpdate");
            return this;
        }

        public ServerMetrics build() {
            return new ServerMetrics(serverName, status, responseTime, uptime, loadAverage,
                    cpuPercent, memoryPercent, diskPercent, processCount, custom, lastUpdate);
        }
    }
}
