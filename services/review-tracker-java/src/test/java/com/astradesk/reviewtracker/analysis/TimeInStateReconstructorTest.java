package com.astradesk.reviewtracker.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.astradesk.reviewtracker.domain.StatePeriod;
import com.astradesk.reviewtracker.domain.Transition;

@DisplayName("Time-in-state reconstruction")
class TimeInStateReconstructorTest {

    private static final Instant NOW = Instant.parse("2024-01-16T00:00:00Z");
    private static final Instant T1 = Instant.parse("2024-01-15T10:00:00Z");
    private static final Instant T2 = Instant.parse("2024-01-15T12:30:00Z");
    private static final Instant T3 = Instant.parse("2024-01-15T18:00:00Z");

    private final TimeInStateReconstructor reconstructor =
        new TimeInStateReconstructor(Clock.fixed(NOW, ZoneOffset.UTC));

    private static Transition transition(Instant at, String from, String to) {
        return new Transition(at, from, to, "Dev");
    }

    private static void assertTiles(List<StatePeriod> periods, Instant origin, Instant now) {
        assertThat(periods).isNotEmpty();
        assertThat(periods.get(0).entered()).isEqualTo(origin);
        assertThat(periods.get(periods.size() - 1).exited()).isEqualTo(now);
        for (int i = 0; i + 1 < periods.size(); i++) {
            assertThat(periods.get(i).exited()).isEqualTo(periods.get(i + 1).entered());
        }
    }

    @Nested
    @DisplayName("Origin handling")
    class Origin {

        @Test
        @DisplayName("Creation two hours before the first transition adds a leading period")
        void leadingPeriodFromCreation() {
            Instant created = T1.minus(Duration.ofHours(2));

            List<StatePeriod> periods = reconstructor.reconstruct(
                List.of(transition(T1, "To Do", "In Progress")), created);

            assertThat(periods).containsExactly(
                new StatePeriod("To Do", created, T1, 2.0),
                new StatePeriod("In Progress", T1, NOW, 14.0));
        }

        @Test
        @DisplayName("No creation instant means the first transition is the origin")
        void noCreation() {
            List<StatePeriod> periods = reconstructor.reconstruct(List.of(transition(T1, "To Do", "In Progress")));

            assertThat(periods).extracting(StatePeriod::status).containsExactly("In Progress");
            assertTiles(periods, T1, NOW);
        }

        @Test
        @DisplayName("Creation at or after the first transition is not fabricated into a period")
        void creationNotEarlier() {
            List<Transition> history = List.of(transition(T1, "To Do", "In Progress"));

            assertThat(reconstructor.reconstruct(history, T1)).hasSize(1);
            assertThat(reconstructor.reconstruct(history, T2)).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Periods")
    class Periods {

        @Test
        @DisplayName("Each transition opens a period that closes at the next one")
        void consecutivePeriods() {
            List<StatePeriod> periods = reconstructor.reconstruct(List.of(
                transition(T1, "To Do", "In Progress"),
                transition(T2, "In Progress", "In Review"),
                transition(T3, "In Review", "In Progress")));

            assertThat(periods).containsExactly(
                new StatePeriod("In Progress", T1, T2, 2.5),
                new StatePeriod("In Review", T2, T3, 5.5),
                new StatePeriod("In Progress", T3, NOW, 6.0));
        }

        @Test
        @DisplayName("Simultaneous transitions produce a zero-length period that is kept")
        void zeroLengthKept() {
            List<StatePeriod> periods = reconstructor.reconstruct(List.of(
                transition(T1, "To Do", "In Progress"),
                transition(T1, "In Progress", "In Review")));

            assertThat(periods).hasSize(2);
            assertThat(periods.get(0)).isEqualTo(new StatePeriod("In Progress", T1, T1, 0.0));
            assertThat(periods.get(1).status()).isEqualTo("In Review");
        }

        @Test
        @DisplayName("Unknown statuses pass through unchanged")
        void unknownStatusesKept() {
            List<StatePeriod> periods = reconstructor.reconstruct(List.of(transition(T1, "Triage", "Waiting for Customer")),
                T1.minusSeconds(60));

            assertThat(periods).extracting(StatePeriod::status).containsExactly("Triage", "Waiting for Customer");
        }

        @Test
        @DisplayName("Durations are rounded to two decimals")
        void rounding() {
            Instant entered = T1;
            Instant exited = T1.plusSeconds(100);

            assertThat(TimeInStateReconstructor.hoursBetween(entered, exited)).isEqualTo(0.03);
            assertThat(TimeInStateReconstructor.hoursBetween(entered, T1.plusSeconds(5400))).isEqualTo(1.5);
        }

        @Test
        @DisplayName("Unsorted input is sorted stably before reconstruction")
        void sortsInput() {
            List<StatePeriod> periods = reconstructor.reconstruct(List.of(
                transition(T2, "In Progress", "In Review"),
                transition(T1, "To Do", "In Progress")));

            assertThat(periods).extracting(StatePeriod::status).containsExactly("In Progress", "In Review");
        }
    }

    @Test
    @DisplayName("Empty history yields no periods")
    void emptyHistory() {
        assertThat(reconstructor.reconstruct(List.of(), T1)).isEmpty();
    }

    @Test
    @DisplayName("Clock is read once per call")
    void nowCapturedOnce() {
        Clock ticking = new Clock() {
            private Instant current = NOW;

            @Override
            public ZoneOffset getZone() {
                return ZoneOffset.UTC;
            }

            @Override
            public Clock withZone(ZoneId zone) {
                return this;
            }

            @Override
            public Instant instant() {
                Instant result = current;
                current = current.plusSeconds(3600);
                return result;
            }
        };
        TimeInStateReconstructor tickingReconstructor = new TimeInStateReconstructor(ticking);

        List<StatePeriod> periods = tickingReconstructor.reconstruct(List.of(
            transition(T1, "To Do", "In Progress"),
            transition(T2, "In Progress", "Done")));

        assertTiles(periods, T1, NOW);
    }

    @Test
    @DisplayName("Random histories always tile [origin, now] without gaps or overlaps")
    void tilingHoldsForRandomHistories() {
        Random random = new Random(42);
        String[] statuses = {"To Do", "In Progress", "In Review", "Done", "Blocked", "QA"};

        for (int run = 0; run < 200; run++) {
            List<Transition> history = new ArrayList<>();
            Instant at = Instant.parse("2024-01-01T00:00:00Z");
            int size = 1 + random.nextInt(12);
            for (int i = 0; i < size; i++) {
                // zero gaps on purpose: bulk edits share a timestamp
                at = at.plusSeconds(random.nextInt(4) == 0 ? 0 : random.nextInt(200_000));
                history.add(transition(at, statuses[random.nextInt(statuses.length)], statuses[random.nextInt(statuses.length)]));
            }
            Instant created = random.nextBoolean() ? history.get(0).timestamp().minusSeconds(random.nextInt(100_000)) : null;

            List<StatePeriod> periods = reconstructor.reconstruct(history, created);

            boolean leading = created != null && created.isBefore(history.get(0).timestamp());
            assertTiles(periods, leading ? created : history.get(0).timestamp(), NOW);
            assertThat(periods).hasSize(leading ? size + 1 : size);
            assertThat(reconstructor.reconstruct(history, created)).isEqualTo(periods);
        }
    }
}
