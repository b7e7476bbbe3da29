package com.libragraph.datasink.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Absolute point in time by which a request must finish. Created once per
 * request and passed down into every store call so a slow query cannot hold a
 * worker past the request timeout.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(Instant.MAX, Clock.systemUTC());

    private final Instant expiresAt;
    private final Clock clock;

    private Deadline(Instant expiresAt, Clock clock) {
        this.expiresAt = expiresAt;
        this.clock = clock;
    }

    public static Deadline after(Duration timeout) {
        return after(timeout, Clock.systemUTC());
    }

    public static Deadline after(Duration timeout, Clock clock) {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative: " + timeout);
        }
        return new Deadline(clock.instant().plus(timeout), clock);
    }

    /** A deadline that never expires. */
    public static Deadline none() {
        return NONE;
    }

    public boolean isUnbounded() {
        return expiresAt.equals(Instant.MAX);
    }

    public boolean isExpired() {
        return !isUnbounded() && !clock.instant().isBefore(expiresAt);
    }

    /** Time left, or {@link Duration#ZERO} once expired. Unbounded deadlines return a very long duration. */
    public Duration remaining() {
        if (isUnbounded()) {
            return Duration.ofMillis(Long.MAX_VALUE);
        }
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * Throws if the deadline has passed.
     *
     * @param operation name of the step about to run, used in the message
     */
    public void check(String operation) {
        if (isExpired()) {
            throw new DeadlineExceededException(operation);
        }
    }

    @Override
    public String toString() {
        return isUnbounded() ? "Deadline[none]" : "Deadline[" + expiresAt + "]";
    }
}
