package io.fleetward.api.error;

import javax.annotation.Nonnull;

/**
 * Thrown when content written to a server does not hash to the expected
 * fingerprint.
 */
public class ChecksumMismatchException extends RemoteException {

    private final String expected;
    private final String actual;

    public ChecksumMismatchException(
            @Nonnull String serverName,
            @Nonnull String path,
            @Nonnull String expected,
            @Nonnull String actual) {
        super(serverName, "validate", "checksum mismatch for " + path
                + ": expected " + expected + ", got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    @Nonnull
    public String getExpected() {
        return expected;
    }

    @Nonnull
    public String getActual() {
        return actual;
    }
}
