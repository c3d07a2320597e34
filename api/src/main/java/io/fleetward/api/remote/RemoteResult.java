package io.fleetward.api.remote;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of running one command on one server.
 *
 * <p>A result is produced for timeouts and for transport failures inside
 * fan-out operations as well, so callers always get one result per target.
 * Those results carry exit code {@code -1}.</p>
 *
 * @param serverName target server
 * @param command the command that was run
 * @param output combined stdout and stderr
 * @param exitCode remote exit status, or -1 if none was received
 * @param duration wall time of the call
 * @param timestamp when the call started
 * @param timedOut whether the deadline expired before the command finished
 * @param error failure message, or null
 */
public record RemoteResult(
        @Nonnull String serverName,
        @Nonnull String command,
        @Nonnull String output,
        int exitCode,
        @Nonnull Duration duration,
        @Nonnull Instant timestamp,
        boolean timedOut,
        @Nullable String error
) {

    public static final int NO_EXIT_CODE = -1;

    /**
     * Create a result for a command that ran to completion.
     */
    @Nonnull
    public static RemoteResult completed(
            @Nonnull String serverName,
            @Nonnull String command,
            @Nonnull String output,
            int exitCode,
            @Nonnull Instant started) {
        return new RemoteResult(serverName, command, output, exitCode,
                Duration.between(started, Instant.now()), started, false, null);
    }

    /**
     * Create a result for a command whose deadline expired.
     */
    @Nonnull
    public static RemoteResult timedOut(
            @Nonnull String serverName,
            @Nonnull String command,
            @Nonnull String partialOutput,
            @Nonnull Instant started) {
        return new RemoteResult(serverName, command, partialOutput, NO_EXIT_CODE,
                Duration.between(started, Instant.now()), started, true, "command timed out");
    }

    /**
     * Create a result for a command that could not be run at all.
     */
    @Nonnull
    public static RemoteResult failed(
            @Nonnull String serverName,
            @Nonnull String command,
            @Nonnull String error,
            @Nonnull Instant started) {
        return new RemoteResult(serverName, command, "", NO_EXIT_CODE,
                Duration.between(started, Instant.now()), started, false, error);
    }

    /**
     * Check whether the command completed with exit code zero.
     *
     * @return true on success
     */
    public boolean success() {
        return !timedOut && error == null && exitCode == 0;
    }
}
