package io.fleetward.api.error;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Base type for failures raised by a remote operation against one server.
 *
 * <p>Carries the server the operation targeted and a short operation name
 * ({@code connect}, {@code execute}, {@code upload}, ...). Subclasses
 * distinguish the failure class so callers can decide whether to retry;
 * nothing in this library retries on its own.</p>
 */
public class RemoteException extends Exception {

    private final String serverName;
    private final String operation;

    public RemoteException(@Nonnull String serverName, @Nonnull String operation, @Nonnull String message) {
        this(serverName, operation, message, null);
    }

    public RemoteException(
            @Nonnull String serverName,
            @Nonnull String operation,
            @Nonnull String message,
            @Nullable Throwable cause) {
        super(message, cause);
        this.serverName = Objects.requireNonNull(serverName, "serverName");
        this.operation = Objects.requireNonNull(operation, "operation");
    }

    /**
     * Get the server the failed operation targeted.
     *
     * @return server name
     */
    @Nonnull
    public String getServerName() {
        return serverName;
    }

    /**
     * Get the name of the failed operation.
     *
     * @return operation name
     */
    @Nonnull
    public String getOperation() {
        return operation;
    }

    @Override
    public String getMessage() {
        return "[" + serverName + "] " + operation + ": " + super.getMessage();
    }
}
