package com.astradesk.reviewtracker.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Interval during which a ticket held one status. The last period of a
 * reconstruction is still open; its {@code exited} is the instant the
 * reconstruction ran.
 */
public record StatePeriod(String status, Instant entered, Instant exited, double durationHours) {

    public StatePeriod {
        Objects.requireNonNull(entered, "entered must not be null");
        Objects.requireNonNull(exited, "exited must not be null");
        status = status == null ? "" : status;
    }
}
