package com.myorg.docinsight.service.ranking;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Soft wall-clock budget. Expiry is only ever polled; nothing is interrupted.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(null, null);

    private final Clock clock;
    private final Instant expiresAt;

    private Deadline(Clock clock, Instant expiresAt) {
        this.clock = clock;
        this.expiresAt = expiresAt;
    }

    public static Deadline none() {
        return NONE;
    }

    public static Deadline after(Duration budget, Clock clock) {
        return new Deadline(clock, clock.instant().plus(budget));
    }

    /** Deadline from a millisecond budget; zero or negative means unbounded. */
    public static Deadline ofMillis(long budgetMs, Clock clock) {
        return budgetMs > 0 ? after(Duration.ofMillis(budgetMs), clock) : none();
    }

    public boolean isExpired() {
        return expiresAt != null && !clock.instant().isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return expiresAt == null ? "Deadline[none]" : "Deadline[" + expiresAt + "]";
    }
}
