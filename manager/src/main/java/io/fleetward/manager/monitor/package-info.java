/**
 * Scheduled health checks, metrics and alerts.
 *
 * @see io.fleetward.manager.monitor.ClusterMonitor
 */
package io.fleetward.manager.monitor;
