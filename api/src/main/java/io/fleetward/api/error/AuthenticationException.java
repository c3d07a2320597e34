package io.fleetward.api.error;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Thrown when the remote host rejects the configured credentials, or the
 * private key cannot be read.
 */
public class AuthenticationException extends RemoteException {

    public AuthenticationException(@Nonnull String serverName, @Nonnull String message, @Nullable Throwable cause) {
        super(serverName, "authenticate", message, cause);
    }
}
