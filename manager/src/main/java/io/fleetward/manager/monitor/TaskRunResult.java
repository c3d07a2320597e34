package io.fleetward.manager.monitor;

import io.fleetward.api.remote.ServerMetrics;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one run of a monitoring task.
 *
 * @param taskName task that ran
 * @param startedAt run start
 * @param duration wall time of the run
 * @param metrics metrics collected per target server
 * @param alerts alerts raised during the run
 */
public record TaskRunResult(
        @Nonnull String taskName,
        @Nonnull Instant startedAt,
        @Nonnull Duration duration,
        @Nonnull Map<String, ServerMetrics> metrics,
        @Nonnull List<MonitoringAlert> alerts
) {

    public TaskRunResult {
        metrics = Map.copyOf(metrics);
        alerts = List.copyOf(alerts);
    }
}
