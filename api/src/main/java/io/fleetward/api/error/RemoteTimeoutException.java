package io.fleetward.api.error;

import javax.annotation.Nonnull;
import java.time.Duration;

/**
 * Thrown when a remote operation exceeds its deadline.
 *
 * <p>Command execution does not throw this; it returns a timed-out
 * {@link io.fleetward.api.remote.RemoteResult} instead.</p>
 */
public class RemoteTimeoutException extends NetworkException {

    private final Duration timeout;

    public RemoteTimeoutException(@Nonnull String serverName, @Nonnull String operation, @Nonnull Duration timeout) {
        super(serverName, operation, "timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    @Nonnull
    public Duration getTimeout() {
        return timeout;
    }
}
