package io.fleetward.api.remote;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Single-server health report.
 *
 * @param serverName server the report is about
 * @param level overall level
 * @param message short description
 * @param responseTime round-trip time of the probe
 * @param checkedAt when the report was produced
 * @param details extra key/value findings
 */
public record HealthStatus(
        @Nonnull String serverName,
        @Nonnull HealthLevel level,
        @Nonnull String message,
        @Nonnull Duration responseTime,
        @Nonnull Instant checkedAt,
        @Nonnull Map<String, String> details
) {

    public HealthStatus {
        details = Map.copyOf(details);
    }

    public boolean isHealthy() {
        return level == HealthLevel.HEALTHY;
    }
}
