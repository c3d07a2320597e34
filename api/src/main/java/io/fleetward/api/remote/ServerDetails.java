package io.fleetward.api.remote;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;

/**
 * Registry snapshot of a server plus facts discovered from the server itself.
 *
 * @param info registry snapshot
 * @param platform operating system family, {@link Platform#LINUX} when undetermined
 * @param version kernel release as reported by {@code uname -r}, or null if unknown
 * @param discoveredAt when the facts were collected
 */
public record ServerDetails(
        @Nonnull ServerInfo info,
        @Nonnull Platform platform,
        @Nullable String version,
        @Nonnull Instant discoveredAt
) {

    @Nonnull
    public String name() {
        return info.name();
    }
}
