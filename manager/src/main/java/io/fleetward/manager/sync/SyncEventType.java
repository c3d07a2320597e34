package io.fleetward.manager.sync;

/**
 * Kind of sync event.
 */
public enum SyncEventType {
    /**
     * Content was transferred to the target servers.
     */
    SYNC,

    /**
     * Planning only; nothing touched the servers.
     */
    DRY_RUN
}
