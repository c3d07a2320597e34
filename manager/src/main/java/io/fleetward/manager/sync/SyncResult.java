package io.fleetward.manager.sync;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;

/**
 * Outcome of syncing a profile to one server.
 *
 * @param serverName target server
 * @param success whether every mandatory step succeeded
 * @param filesUpdated files written to the server
 * @param filesSkipped files already identical on the server
 * @param bytesTransferred bytes uploaded
 * @param duration wall time for this server
 * @param error failure message, or null
 * @param backupPath backup location created before the transfer, or null
 * @param checksum remote fingerprint computed during validation, or null
 */
public record SyncResult(
        @Nonnull String serverName,
        boolean success,
        int filesUpdated,
        int filesSkipped,
        long bytesTransferred,
        @Nonnull Duration duration,
        @Nullable String error,
        @Nullable String backupPath,
        @Nullable String checksum
) {

    static SyncResult failure(String serverName, String error, Duration duration) {
        return new SyncResult(serverName, false, 0, 0, 0, duration, error, null, null);
    }
}
