package com.civics.ingest.orchestrator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Run-level deadline. Workers poll it between pages and stop cooperatively.
 */
public final class RunDeadline {

    private final Instant expiresAt;
    private final Clock clock;

    private RunDeadline(Instant expiresAt, Clock clock) {
        this.expiresAt = expiresAt;
        this.clock = clock;
    }

    public static RunDeadline after(Duration timeout, Clock clock) {
        return new RunDeadline(clock.instant().plus(timeout), clock);
    }

    public static RunDeadline none(Clock clock) {
        return new RunDeadline(null, clock);
    }

    public boolean isSet() {
        return expiresAt != null;
    }

    public boolean isExpired() {
        return expiresAt != null && !clock.instant().isBefore(expiresAt);
    }

    /**
     * Time left, zero once expired. Without a deadline, effectively unbounded.
     */
    public Duration remaining() {
        if (expiresAt == null) {
            return Duration.ofDays(365);
        }
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    @Override
    public String toString() {
        return expiresAt != null ? "RunDeadline{" + expiresAt + "}" : "RunDeadline{none}";
    }
}
