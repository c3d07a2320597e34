package io.fleetward.api.remote;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;

/**
 * Snapshot of a registered server handed out to callers.
 *
 * @param config the server's connection definition
 * @param status last observed reachability
 * @param lastChecked time of the last operation against the server, or null
 * @param lastError message of the last transport failure, or null
 * @param connected whether the registry holds an open connection
 */
public record ServerInfo(
        @Nonnull ServerConfig config,
        @Nonnull ServerStatus status,
        @Nullable Instant lastChecked,
        @Nullable String lastError,
        boolean connected
) {

    @Nonnull
    public String name() {
        return config.name();
    }
}
