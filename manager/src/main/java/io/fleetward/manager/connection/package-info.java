/**
 * Connections to a single remote server.
 *
 * <p>{@link io.fleetward.manager.connection.SshConnection} is the SSH
 * implementation; every operation takes a timeout.</p>
 */
package io.fleetward.manager.connection;
