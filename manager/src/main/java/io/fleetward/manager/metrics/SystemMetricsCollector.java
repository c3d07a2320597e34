package io.fleetward.manager.metrics;

import io.fleetward.api.error.RemoteException;
import io.fleetward.api.remote.RemoteManager;
import io.fleetward.api.remote.Platform;
import io.fleetward.api.remote.RemoteResult;
import io.fleetward.api.remote.ServerDetails;
import io.fleetward.api.remote.ServerInfo;
import io.fleetward.api.remote.ServerMetrics;
import io.fleetward.manager.util.Deadline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Collects standard OS metrics and platform facts from a server with a
 * fixed set of shell commands.
 *
 * <p>Every command is best-effort: a failed command or unparseable output
 * leaves the corresponding field untouched.</p>
 */
public class SystemMetricsCollector {

    private static final Logger LOGGER = LoggerFactory.getLogger(SystemMetricsCollector.class);

    static final String LOAD_AVERAGE = "cat /proc/loadavg";
    static final String CPU_IDLE = "top -bn1 | grep 'Cpu(s)' | sed 's/.*, *\\([0-9.]*\\)%* id.*/\\1/'";
    static final String MEMORY = "free | grep Mem | awk '{printf \"%.1f\", $3/$2 * 100.0}'";
    static final String DISK = "df / | tail -1 | awk '{print $5}' | cut -d'%' -f1";
    static final String PROCESSES = "ps aux | wc -l";
    static final String UPTIME = "cat /proc/uptime";
    static final String KERNEL_NAME = "uname -s";
    static final String KERNEL_RELEASE = "uname -r";

    private final Duration commandTimeout;

    /**
     * Create a collector.
     *
     * @param commandTimeout upper bound for each metric command
     */
    public SystemMetricsCollector(@Nonnull Duration commandTimeout) {
        this.commandTimeout = Objects.requireNonNull(commandTimeout, "commandTimeout");
    }

    /**
     * Run the metric commands against a server and fill in the builder.
     *
     * @param remote dispatcher used to run commands
     * @param server server name
     * @param deadline overall deadline; remaining commands are skipped once it passes
     * @param metrics builder to fill in
     */
    public void collect(
            @Nonnull RemoteManager remote,
            @Nonnull String server,
            @Nonnull Deadline deadline,
            @Nonnull ServerMetrics.Builder metrics) {
        run(remote, server, deadline, LOAD_AVERAGE,
                (b, out) -> b.loadAverage(SystemMetricsParser.parseLoadAverage(out)), metrics);
        run(remote, server, deadline, CPU_IDLE,
                (b, out) -> b.cpuPercent(SystemMetricsParser.parseCpuUsageFromIdle(out)), metrics);
        run(remote, server, deadline, MEMORY,
                (b, out) -> b.memoryPercent(SystemMetricsParser.parsePercent(out)), metrics);
        run(remote, server, deadline, DISK,
                (b, out) -> b.diskPercent(SystemMetricsParser.parsePercent(out)), metrics);
        run(remote, server, deadline, PROCESSES,
                (b, out) -> b.processCount(SystemMetricsParser.parseProcessCount(out)), metrics);
        run(remote, server, deadline, UPTIME,
                (b, out) -> b.uptime(SystemMetricsParser.parseUptime(out)), metrics);
    }

    /**
     * Discover the platform and kernel release of a server.
     *
     * @param remote dispatcher used to run commands
     * @param info registry snapshot of the server
     * @param deadline overall deadline
     * @return discovered details; unknown facts keep their defaults
     */
    @Nonnull
    public ServerDetails describe(
            @Nonnull RemoteManager remote,
            @Nonnull ServerInfo info,
            @Nonnull Deadline deadline) {
        String kernelName = query(remote, info.name(), deadline, KERNEL_NAME);
        String release = query(remote, info.name(), deadline, KERNEL_RELEASE);
        return new ServerDetails(
                info,
                Platform.fromKernelName(kernelName),
                release == null || release.isBlank() ? null : release.trim(),
                Instant.now());
    }

    private void run(
            RemoteManager remote,
            String server,
            Deadline deadline,
            String command,
            BiConsumer<ServerMetrics.Builder, String> apply,
            ServerMetrics.Builder metrics) {
        String output = query(remote, server, deadline, command);
        if (output != null) {
            apply.accept(metrics, output);
        }
    }

    @Nullable
    private String query(RemoteManager remote, String server, Deadline deadline, String command) {
        if (deadline.isExpired()) {
            return null;
        }
        try {
            RemoteResult result = remote.executeCommand(server, command, deadline.cap(commandTimeout));
            if (result.success()) {
                return result.output();
            }
            LOGGER.debug("Command on {} exited {}: {}", server, result.exitCode(), command);
        } catch (RemoteException e) {
            LOGGER.debug("Command on {} failed: {}", server, e.getMessage());
        }
        return null;
    }
}
