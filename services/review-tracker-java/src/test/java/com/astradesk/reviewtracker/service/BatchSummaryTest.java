package com.astradesk.reviewtracker.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.astradesk.reviewtracker.analysis.ReferenceExtractor;
import com.astradesk.reviewtracker.analysis.TransitionAnalyzer;
import com.astradesk.reviewtracker.domain.TicketHistory;
import com.astradesk.reviewtracker.domain.Transition;
import com.astradesk.reviewtracker.domain.TransitionAnalysis;
import com.astradesk.reviewtracker.domain.WorkflowModel;

@DisplayName("Batch summary")
class BatchSummaryTest {

    private static final Instant NOW = Instant.parse("2024-01-16T00:00:00Z");

    private final TransitionAnalyzer analyzer = new TransitionAnalyzer(
        WorkflowModel.defaultModel(), Clock.fixed(NOW, ZoneOffset.UTC), new ReferenceExtractor());

    private TicketReview review(String key, double hoursLogged, Transition... transitions) {
        TransitionAnalysis analysis = analyzer.analyze(new TicketHistory(null, List.of(transitions), null, null));
        return new TicketReview(key, "summary", "In Review", "Ann", hoursLogged, analysis);
    }

    private static Transition at(String time, String from, String to) {
        return new Transition(Instant.parse(time), from, to, "Ann");
    }

    @Test
    @DisplayName("Aggregates over reviewed tickets and counts failures separately")
    void aggregates() {
        // 4h in review, then back to progress for 12h; one backward move
        TicketReview first = review("ABC-1", 2.5,
            at("2024-01-15T08:00:00Z", "In Progress", "In Review"),
            at("2024-01-15T12:00:00Z", "In Review", "In Progress"));
        // 23h in review, one blocked entry for 0h
        TicketReview second = review("ABC-2", 1.25,
            at("2024-01-15T00:00:00Z", "In Progress", "Blocked"),
            at("2024-01-15T00:00:00Z", "Blocked", "In Progress"),
            at("2024-01-15T01:00:00Z", "In Progress", "In Review"));

        BatchSummary summary = BatchSummary.of(List.of(
            ReviewOutcome.success(first),
            ReviewOutcome.failure("ABC-3", "Ticket ABC-3 not found"),
            ReviewOutcome.success(second)));

        assertThat(summary.requested()).isEqualTo(3);
        assertThat(summary.reviewed()).isEqualTo(2);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.bounceBackCount()).isEqualTo(2);
        assertThat(summary.averageBounceBacks()).isEqualTo(1.0);
        assertThat(summary.hoursLogged()).isEqualTo(3.75);
        assertThat(summary.averageStageHours()).contains(
            entry("in review", 13.5),
            entry("in progress", 6.5),
            entry("done", 0.0));
    }

    @Test
    @DisplayName("All-failed or empty batches report zeros")
    void nothingReviewed() {
        BatchSummary summary = BatchSummary.of(List.of(ReviewOutcome.failure("ABC-1", "boom")));

        assertThat(summary.reviewed()).isZero();
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.averageBounceBacks()).isZero();
        assertThat(summary.hoursLogged()).isZero();
        assertThat(summary.averageStageHours()).isEmpty();
        assertThat(BatchSummary.of(List.of()).requested()).isZero();
    }
}
