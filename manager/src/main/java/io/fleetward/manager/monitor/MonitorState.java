package io.fleetward.manager.monitor;

/**
 * Scheduler state of the cluster monitor.
 */
public enum MonitorState {
    STOPPED,
    RUNNING
}
