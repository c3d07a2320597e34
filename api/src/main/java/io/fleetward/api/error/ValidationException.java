package io.fleetward.api.error;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Thrown when caller input is rejected before any remote activity takes place.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(@Nonnull String message) {
        super(message);
    }

    public ValidationException(@Nonnull String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
