package io.fleetward.api.error;

import javax.annotation.Nonnull;

/**
 * Thrown when a remote operation is attempted on a connection that has not
 * been connected, or has already been closed.
 */
public class NotConnectedException extends RemoteException {

    public NotConnectedException(@Nonnull String serverName, @Nonnull String operation) {
        super(serverName, operation, "not connected");
    }
}
