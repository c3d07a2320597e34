package io.fleetward.api.remote;

/**
 * Reachability of a registered server as last observed.
 */
public enum ServerStatus {
    /**
     * No operation has reached the server yet.
     */
    UNKNOWN,

    /**
     * The last operation reached the server.
     */
    ONLINE,

    /**
     * The last operation failed to reach the server.
     */
    OFFLINE;

    /**
     * Check if the server was reachable when last observed.
     *
     * @return true if online
     */
    public boolean isReachable() {
        return this == ONLINE;
    }
}
