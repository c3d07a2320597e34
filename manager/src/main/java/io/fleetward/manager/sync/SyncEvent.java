package io.fleetward.manager.sync;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate outcome of syncing a profile across its servers.
 *
 * @param profileName profile that was synced
 * @param type sync or dry run
 * @param timestamp start time
 * @param servers target servers
 * @param results per-server outcome, in profile order
 * @param successCount servers that succeeded
 * @param failureCount servers that failed
 * @param totalFiles files in the source
 * @param totalBytes bytes in the source
 * @param sourceChecksum source fingerprint
 * @param duration wall time of the whole sync
 * @param error failure that prevented the fan-out, or null
 */
public record SyncEvent(
        @Nonnull String profileName,
        @Nonnull SyncEventType type,
        @Nonnull Instant timestamp,
        @Nonnull List<String> servers,
        @Nonnull Map<String, SyncResult> results,
        int successCount,
        int failureCount,
        int totalFiles,
        long totalBytes,
        @Nullable String sourceChecksum,
        @Nonnull Duration duration,
        @Nullable String error
) {

    public SyncEvent {
        servers = List.copyOf(servers);
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    /**
     * Check whether every server succeeded.
     *
     * @return true if there was no failure
     */
    public boolean isSuccessful() {
        return error == null && failureCount == 0;
    }
}
