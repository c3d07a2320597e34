/**
 * Remote fleet management for Fleetward.
 *
 * <p>This package wires the components that run commands on, group, watch and
 * push configuration to a fleet of remote servers.</p>
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link io.fleetward.manager.FleetManager} - Main orchestrator</li>
 *   <li>{@link io.fleetward.manager.registry.ServerRegistry} - Server directory and command dispatch</li>
 *   <li>{@link io.fleetward.manager.cluster.ClusterManager} - Named server groups</li>
 *   <li>{@link io.fleetward.manager.monitor.ClusterMonitor} - Scheduled health checks and alerts</li>
 *   <li>{@link io.fleetward.manager.sync.ConfigSyncManager} - File and directory distribution</li>
 * </ul>
 *
 * @see io.fleetward.manager.FleetManager
 */
package io.fleetward.manager;
