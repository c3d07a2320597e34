/**
 * Configuration distribution to groups of servers.
 *
 * <p>A sync profile names a local source, a remote target and the servers to
 * push to. Each sync is fingerprinted with MD5 and recorded in a bounded
 * history; dry runs are not.</p>
 *
 * @see io.fleetward.manager.sync.ConfigSyncManager
 * @see io.fleetward.manager.sync.SyncProfile
 */
package io.fleetward.manager.sync;
