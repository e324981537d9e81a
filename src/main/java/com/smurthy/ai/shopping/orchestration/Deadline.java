package com.smurthy.ai.shopping.orchestration;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Absolute point in time by which a handler call (and everything it spawns) must finish.
 */
public record Deadline(Instant expiresAt, Clock clock) {

    private static final Instant FAR_FUTURE = Instant.parse("9999-12-31T23:59:59Z");

    public static Deadline after(Duration timeout) {
        return after(timeout, Clock.systemUTC());
    }

    public static Deadline after(Duration timeout, Clock clock) {
        return new Deadline(clock.instant().plus(timeout), clock);
    }

    public static Deadline none() {
        return new Deadline(FAR_FUTURE, Clock.systemUTC());
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public long remainingMillis() {
        return remaining().toMillis();
    }

    /**
     * The earlier of this deadline and one {@code timeout} from now.
     */
    public Deadline min(Duration timeout) {
        Instant candidate = clock.instant().plus(timeout);
        return candidate.isBefore(expiresAt) ? new Deadline(candidate, clock) : this;
    }
}
