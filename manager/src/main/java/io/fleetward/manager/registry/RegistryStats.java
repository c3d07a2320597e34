package io.fleetward.manager.registry;

/**
 * Registry statistics.
 */
public record RegistryStats(
        int totalServers,
        int onlineServers,
        int offlineServers,
        int unknownServers,
        int openConnections
) {}
