package io.fleetward.manager.cluster;

import io.fleetward.api.remote.HealthLevel;
import io.fleetward.api.remote.HealthStatus;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Health of a cluster computed from its members' health.
 *
 * @param clusterName cluster the report is about
 * @param level HEALTHY if every member is online, CRITICAL if none is, WARNING otherwise
 * @param totalServers number of members
 * @param onlineServers members that responded
 * @param offlineServers members that did not
 * @param healthyPercent share of online members, 0 to 100
 * @param averageResponseTime mean probe time of online members
 * @param servers per-member health
 * @param checkedAt when the report was produced
 */
public record ClusterHealth(
        @Nonnull String clusterName,
        @Nonnull HealthLevel level,
        int totalServers,
        int onlineServers,
        int offlineServers,
        double healthyPercent,
        @Nonnull Duration averageResponseTime,
        @Nonnull Map<String, HealthStatus> servers,
        @Nonnull Instant checkedAt
) {

    public ClusterHealth {
        servers = Map.copyOf(servers);
    }
}
