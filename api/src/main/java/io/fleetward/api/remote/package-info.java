/**
 * Public contract for remote fleet management.
 *
 * <h2>Key Types</h2>
 * <ul>
 *   <li>{@link io.fleetward.api.remote.RemoteManager} - Server directory and dispatcher</li>
 *   <li>{@link io.fleetward.api.remote.ServerConfig} - Connection definition</li>
 *   <li>{@link io.fleetward.api.remote.RemoteResult} - Command outcome</li>
 *   <li>{@link io.fleetward.api.remote.ServerMetrics} - Latest metrics snapshot</li>
 * </ul>
 */
package io.fleetward.api.remote;
