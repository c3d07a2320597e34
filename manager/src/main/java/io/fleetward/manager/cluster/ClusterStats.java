package io.fleetward.manager.cluster;

/**
 * Aggregate statistics across all clusters. Health counts use each
 * cluster's last computed health.
 */
public record ClusterStats(
        int totalClusters,
        int totalServers,
        double averageClusterSize,
        int healthyClusters,
        int warningClusters,
        int criticalClusters,
        int uncheckedClusters
) {}
