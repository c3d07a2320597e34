package io.fleetward.manager.connection;

/**
 * Lifecycle state of a {@link RemoteConnection}.
 */
public enum ConnectionState {
    /**
     * Not yet connected, or closed.
     */
    DISCONNECTED,

    /**
     * Transport established and authenticated.
     */
    CONNECTED
}
