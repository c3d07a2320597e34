package io.fleetward.manager.monitor;

import io.fleetward.manager.event.ServerStatusEvent;

import javax.annotation.Nonnull;

/**
 * Receives monitor notifications. Called on monitor worker threads.
 */
public interface MonitorListener {

    default void onAlert(@Nonnull MonitoringAlert alert) {
    }

    default void onStatusChange(@Nonnull ServerStatusEvent event) {
    }
}
