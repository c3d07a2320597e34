package io.fleetward.manager.sync;

import javax.annotation.Nullable;
import java.time.Instant;

/**
 * Sync statistics over the retained history.
 */
public record SyncStats(
        int totalProfiles,
        int totalServers,
        int historySize,
        int successfulSyncs,
        int failedSyncs,
        @Nullable Instant lastSync
) {}
