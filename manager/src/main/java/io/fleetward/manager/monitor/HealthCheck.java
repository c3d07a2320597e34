package io.fleetward.manager.monitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Map;

/**
 * A remote command with an expected outcome.
 *
 * @param name check name, used in alerts
 * @param command shell command to run
 * @param expectedExitCode exit code that counts as passing
 * @param expectedOutput substring the output must contain, or null
 * @param timeout per-run timeout, or null for the monitor default
 * @param critical whether a failure raises a critical rather than a warning alert
 * @param tags free-form labels
 */
public record HealthCheck(
        @Nonnull String name,
        @Nonnull String command,
        int expectedExitCode,
        @Nullable String expectedOutput,
        @Nullable Duration timeout,
        boolean critical,
        @Nonnull Map<String, String> tags
) {

    public HealthCheck {
        name = name == null ? "" : name;
        command = command == null ? "" : command;
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    /**
     * Create a non-critical check expecting exit code zero.
     */
    @Nonnull
    public static HealthCheck of(@Nonnull String name, @Nonnull String command) {
        return new HealthCheck(name, command, 0, null, null, false, Map.of());
    }

    @Nonnull
    public HealthCheck asCritical() {
        return new HealthCheck(name, command, expectedExitCode, expectedOutput, timeout, true, tags);
    }

    @Nonnull
    public HealthCheck expectingExit(int exitCode) {
        return new HealthCheck(name, command, exitCode, expectedOutput, timeout, critical, tags);
    }

    @Nonnull
    public HealthCheck expectingOutput(@Nullable String output) {
        return new HealthCheck(name, command, expectedExitCode, output, timeout, critical, tags);
    }

    @Nonnull
    public HealthCheck withTimeout(@Nullable Duration newTimeout) {
        return new HealthCheck(name, command, expectedExitCode, expectedOutput, newTimeout, critical, tags);
    }
}
