package io.fleetward.manager.cluster;

import io.fleetward.api.remote.RemoteResult;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of running one command on every member of a cluster.
 *
 * @param clusterName cluster the command ran on
 * @param command the command
 * @param results per-server results, in member order
 * @param successCount servers whose command exited zero
 * @param failureCount all other servers
 * @param successRate share of successful servers, 0 to 100
 * @param startTime when the fan-out started
 * @param duration wall time of the whole fan-out
 * @param averageDuration mean per-server duration
 * @param successfulServers names of successful servers
 * @param failedServers names of failed servers
 */
public record ClusterExecutionResult(
        @Nonnull String clusterName,
        @Nonnull String command,
        @Nonnull Map<String, RemoteResult> results,
        int successCount,
        int failureCount,
        double successRate,
        @Nonnull Instant startTime,
        @Nonnull Duration duration,
        @Nonnull Duration averageDuration,
        @Nonnull List<String> successfulServers,
        @Nonnull List<String> failedServers
) {

    public int totalServers() {
        return results.size();
    }

    static ClusterExecutionResult from(
            String clusterName,
            String command,
            Map<String, RemoteResult> results,
            Instant startTime) {
        List<String> succeeded = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        Duration total = Duration.ZERO;
        for (Map.Entry<String, RemoteResult> entry : results.entrySet()) {
            if (entry.getValue().success()) {
                succeeded.add(entry.getKey());
            } else {
                failed.add(entry.getKey());
            }
            total = total.plus(entry.getValue().duration());
        }

        int count = results.size();
        double rate = count == 0 ? 0.0 : succeeded.size() * 100.0 / count;
        Duration average = count == 0 ? Duration.ZERO : total.dividedBy(count);

        return new ClusterExecutionResult(
                clusterName,
                command,
                Collections.unmodifiableMap(new LinkedHashMap<>(results)),
                succeeded.size(),
                failed.size(),
                rate,
                startTime,
                Duration.between(startTime, Instant.now()),
                average,
                List.copyOf(succeeded),
                List.copyOf(failed));
    }
}
