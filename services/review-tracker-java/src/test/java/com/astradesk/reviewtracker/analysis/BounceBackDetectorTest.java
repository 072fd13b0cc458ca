package com.astradesk.reviewtracker.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.astradesk.reviewtracker.domain.BounceBackEvent;
import com.astradesk.reviewtracker.domain.Transition;
import com.astradesk.reviewtracker.domain.WorkflowModel;

@DisplayName("Bounce-back detection")
class BounceBackDetectorTest {

    private static final Instant T1 = Instant.parse("2024-01-15T10:00:00Z");
    private static final Instant T2 = Instant.parse("2024-01-15T12:00:00Z");
    private static final Instant T3 = Instant.parse("2024-01-15T14:00:00Z");

    private final BounceBackDetector detector = new BounceBackDetector(WorkflowModel.defaultModel());

    private static Transition transition(Instant at, String from, String to) {
        return new Transition(at, from, to, "Dev");
    }

    @Nested
    @DisplayName("Backward moves")
    class BackwardMoves {

        @Test
        @DisplayName("Review sent back to In Progress is the only event")
        void reviewBounce() {
            Transition bounce = transition(T3, "In Review", "In Progress");
            List<Transition> history = List.of(
                transition(T1, "To Do", "In Progress"),
                transition(T2, "In Progress", "In Review"),
                bounce);

            assertThat(detector.detect(history)).containsExactly(BounceBackEvent.backward(bounce));
        }

        @Test
        @DisplayName("Jumping back several stages counts once")
        void multiStageBounce() {
            Transition reopened = transition(T1, "Done", "To Do");

            assertThat(detector.detect(List.of(reopened))).containsExactly(BounceBackEvent.backward(reopened));
        }

        @Test
        @DisplayName("Forward and same-stage moves are ignored")
        void forwardMovesIgnored() {
            List<Transition> history = List.of(
                transition(T1, "To Do", "Done"),
                transition(T2, "In Review", "in review"));

            assertThat(detector.detect(history)).isEmpty();
        }

        @Test
        @DisplayName("Unknown stages on either side never count as backward")
        void unclassifiedIgnored() {
            List<Transition> history = List.of(
                transition(T1, "QA", "To Do"),
                transition(T2, "Done", "Ready for QA"),
                transition(T3, "Blocked", "In Progress"));

            assertThat(detector.detect(history)).isEmpty();
        }

        @Test
        @DisplayName("Events follow chronological order even for unsorted input")
        void sortsInput() {
            Transition later = transition(T3, "Done", "In Review");
            Transition earlier = transition(T1, "In Review", "In Progress");

            assertThat(detector.detect(List.of(later, earlier)))
                .extracting(BounceBackEvent::transition)
                .containsExactly(earlier, later);
        }
    }

    @Nested
    @DisplayName("Blocked entries")
    class BlockedEntries {

        @Test
        @DisplayName("Entering Blocked from the first stage is reported")
        void blockedFromFirstStage() {
            Transition blocked = transition(T1, "To Do", "Blocked");

            List<BounceBackEvent> events = detector.detect(List.of(blocked));

            assertThat(events).containsExactly(BounceBackEvent.blockedEntry(blocked));
            assertThat(events.get(0).blocked()).isTrue();
        }

        @Test
        @DisplayName("Entering Blocked from an unknown stage is reported")
        void blockedFromUnknownStage() {
            Transition blocked = transition(T1, "Triage", " blocked ");

            assertThat(detector.detect(List.of(blocked))).containsExactly(BounceBackEvent.blockedEntry(blocked));
        }

        @Test
        @DisplayName("Entering a custom parked stage from a later stage is only a blocked entry")
        void blockedTargetHasNoForwardPosition() {
            WorkflowModel custom = new WorkflowModel(List.of("Open", "Review"), Set.of("Parked"));
            BounceBackDetector customDetector = new BounceBackDetector(custom);
            Transition intoParked = transition(T1, "Review", "Parked");

            assertThat(customDetector.detect(List.of(intoParked)))
                .containsExactly(BounceBackEvent.blockedEntry(intoParked));
        }

        @Test
        @DisplayName("Each blocked entry is reported, including repeats")
        void repeatsReported() {
            List<Transition> history = List.of(
                transition(T1, "In Progress", "Blocked"),
                transition(T2, "Blocked", "In Progress"),
                transition(T3, "In Progress", "Blocked"));

            assertThat(detector.detect(history)).hasSize(2).allMatch(BounceBackEvent::blocked);
        }
    }

    @Test
    @DisplayName("Empty history yields no events")
    void emptyHistory() {
        assertThat(detector.detect(List.of())).isEmpty();
    }

    @Test
    @DisplayName("Detection is idempotent")
    void idempotent() {
        List<Transition> history = List.of(
            transition(T1, "In Review", "Blocked"),
            transition(T2, "Blocked", "In Review"),
            transition(T3, "In Review", "In Progress"));

        assertThat(detector.detect(history)).isEqualTo(detector.detect(history));
    }
}
