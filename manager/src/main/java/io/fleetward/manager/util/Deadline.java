package io.fleetward.manager.util;

import javax.annotation.Nonnull;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * A fixed point in time shared by a sequence of remote calls, so that the
 * sequence as a whole respects one timeout.
 */
public final class Deadline {

    private final Clock clock;
    private final Instant expiresAt;

    private Deadline(Clock clock, Instant expiresAt) {
        this.clock = clock;
        this.expiresAt = expiresAt;
    }

    @Nonnull
    public static Deadline after(@Nonnull Duration timeout) {
        return after(Clock.systemUTC(), timeout);
    }

    @Nonnull
    public static Deadline after(@Nonnull Clock clock, @Nonnull Duration timeout) {
        return new Deadline(clock, clock.instant().plus(timeout));
    }

    /**
     * Time left before expiry, never negative.
     */
    @Nonnull
    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * The smaller of {@code timeout} and the time left.
     */
    @Nonnull
    public Duration cap(@Nonnull Duration timeout) {
        Duration left = remaining();
        return timeout.compareTo(left) <= 0 ? timeout : left;
    }

    public boolean isExpired() {
        return remaining().isZero();
    }
}
