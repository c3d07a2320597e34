package io.fleetward.manager.event;

import io.fleetward.api.remote.ServerStatus;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Objects;

/**
 * Event fired when the monitor observes a server's reachability change.
 */
public class ServerStatusEvent {

    private final String serverName;
    private final ServerStatus previousStatus;
    private final ServerStatus newStatus;
    private final String message;
    private final Instant timestamp;

    /**
     * Create a server status event.
     *
     * @param serverName the server
     * @param previousStatus previous status
     * @param newStatus new status
     * @param message optional message
     * @param timestamp when the change was observed
     */
    public ServerStatusEvent(
            @Nonnull String serverName,
            @Nonnull ServerStatus previousStatus,
            @Nonnull ServerStatus newStatus,
            @Nullable String message,
            @Nonnull Instant timestamp) {
        this.serverName = Objects.requireNonNull(serverName, "serverName");
        this.previousStatus = Objects.requireNonNull(previousStatus, "previousStatus");
        this.newStatus = Objects.requireNonNull(newStatus, "newStatus");
        this.message = message;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    @Nonnull
    public String getServerName() {
        return serverName;
    }

    @Nonnull
    public ServerStatus getPreviousStatus() {
        return previousStatus;
    }

    @Nonnull
    public ServerStatus getNewStatus() {
        return newStatus;
    }

    /**
     * Get the status change message.
     *
     * @return message, or null
     */
    @Nullable
    public String getMessage() {
        return message;
    }

    @Nonnull
    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * Check if the server became unreachable.
     *
     * @return true if now offline
     */
    public boolean becameUnhealthy() {
        return newStatus == ServerStatus.OFFLINE && previousStatus != ServerStatus.OFFLINE;
    }

    /**
     * Check if the server recovered.
     *
     * @return true if it went from offline to online
     */
    public boolean recovered() {
        return previousStatus == ServerStatus.OFFLINE && newStatus == ServerStatus.ONLINE;
    }
}
