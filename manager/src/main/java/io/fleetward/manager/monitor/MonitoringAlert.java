package io.fleetward.manager.monitor;

import io.fleetward.api.remote.HealthLevel;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Map;

/**
 * Alert raised by a failed probe or health check.
 *
 * @param id unique alert id
 * @param level severity
 * @param serverName server the alert is about
 * @param checkName failed check, or {@code connectivity} for a failed probe
 * @param message short description
 * @param timestamp when the alert was raised
 * @param resolved whether the alert has been resolved
 * @param resolvedAt resolution time, or null
 * @param metadata details such as command, expected and actual values
 */
public record MonitoringAlert(
        @Nonnull String id,
        @Nonnull HealthLevel level,
        @Nonnull String serverName,
        @Nonnull String checkName,
        @Nonnull String message,
        @Nonnull Instant timestamp,
        boolean resolved,
        @Nullable Instant resolvedAt,
        @Nonnull Map<String, String> metadata
) {

    public MonitoringAlert {
        metadata = Map.copyOf(metadata);
    }

    MonitoringAlert resolve(Instant at) {
        return new MonitoringAlert(id, level, serverName, checkName, message, timestamp, true, at, metadata);
    }
}
