package com.astradesk.reviewtracker.analysis;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.astradesk.reviewtracker.domain.Hours;
import com.astradesk.reviewtracker.domain.StatePeriod;
import com.astradesk.reviewtracker.domain.Transition;

/**
 * Rebuilds the sequence of statuses a ticket went through, with the time spent
 * in each.
 *
 * <p>The returned periods tile {@code [origin, now]} exactly: each period
 * exits at the instant the next one enters. The origin is the creation instant
 * when it precedes the first transition, otherwise the first transition itself.
 * "Now" is read from the clock once per call.</p>
 */
public class TimeInStateReconstructor {

    private final Clock clock;

    public TimeInStateReconstructor(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public List<StatePeriod> reconstruct(List<Transition> transitions) {
        return reconstruct(transitions, null);
    }

    /**
     * @param transitions status changes, in any order; sorted stably before use
     * @param createdAt   creation instant of the ticket, or {@code null} if unknown
     * @return the periods, oldest first; empty when there are no transitions
     */
    public List<StatePeriod> reconstruct(List<Transition> transitions, Instant createdAt) {
        List<Transition> ordered = Transition.chronological(transitions);
        if (ordered.isEmpty()) {
            return List.of();
        }
        Instant now = clock.instant();

        List<StatePeriod> periods = new ArrayList<>(ordered.size() + 1);
        Transition first = ordered.get(0);
        if (createdAt != null && createdAt.isBefore(first.timestamp())) {
            periods.add(period(first.fromStatus(), createdAt, first.timestamp()));
        }

        for (int i = 0; i < ordered.size(); i++) {
            Transition current = ordered.get(i);
            Instant exited = i + 1 < ordered.size() ? ordered.get(i + 1).timestamp() : now;
            periods.add(period(current.toStatus(), current.timestamp(), exited));
        }
        return List.copyOf(periods);
    }

    static double hoursBetween(Instant entered, Instant exited) {
        return Hours.of(Duration.between(entered, exited));
    }

    private static StatePeriod period(String status, Instant entered, Instant exited) {
        return new StatePeriod(status, entered, exited, hoursBetween(entered, exited));
    }
}
