/**
 * Error taxonomy for fleet operations.
 *
 * <p>Input problems ({@link io.fleetward.api.error.ValidationException},
 * {@link io.fleetward.api.error.NotFoundException}) are unchecked and raised
 * before any I/O. Remote failures are checked subtypes of
 * {@link io.fleetward.api.error.RemoteException}. Inside fan-out operations
 * per-server failures are reported in the result breakdown rather than thrown.</p>
 */
package io.fleetward.api.error;
