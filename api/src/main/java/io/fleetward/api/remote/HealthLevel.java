package io.fleetward.api.remote;

import javax.annotation.Nonnull;

/**
 * Severity used by health reports and alerts, from best to worst.
 */
public enum HealthLevel {
    HEALTHY,
    WARNING,
    CRITICAL,
    UNKNOWN;

    /**
     * Check if this level should raise an alert.
     *
     * @return true for warning and critical
     */
    public boolean isAlerting() {
        return this == WARNING || this == CRITICAL;
    }

    /**
     * Return the more severe of two levels. {@code UNKNOWN} ranks below
     * {@code WARNING}.
     */
    @Nonnull
    public static HealthLevel worst(@Nonnull HealthLevel a, @Nonnull HealthLevel b) {
        return rank(a) >= rank(b) ? a : b;
    }

    private static int rank(HealthLevel level) {
        switch (level) {
            case CRITICAL:
                return 3;
            case WARNING:
                return 2;
            case UNKNOWN:
                return 1;
            default:
                return 0;
        }
    }
}
