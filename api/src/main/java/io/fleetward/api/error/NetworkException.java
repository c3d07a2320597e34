package io.fleetward.api.error;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Thrown on a transport-level failure: unreachable host, dropped session,
 * broken channel. Considered transient; the caller decides whether to retry.
 */
public class NetworkException extends RemoteException {

    public NetworkException(@Nonnull String serverName, @Nonnull String operation, @Nonnull String message) {
        super(serverName, operation, message);
    }

    public NetworkException(
            @Nonnull String serverName,
            @Nonnull String operation,
            @Nonnull String message,
            @Nullable Throwable cause) {
        super(serverName, operation, message, cause);
    }
}
