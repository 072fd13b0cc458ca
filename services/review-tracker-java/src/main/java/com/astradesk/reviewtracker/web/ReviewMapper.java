package com.astradesk.reviewtracker.web;

import java.time.Instant;
import java.util.List;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import com.astradesk.reviewtracker.analysis.TimestampNormalizer;
import com.astradesk.reviewtracker.domain.TicketHistory;
import com.astradesk.reviewtracker.domain.Transition;
import com.astradesk.reviewtracker.domain.TransitionAnalysis;
import com.astradesk.reviewtracker.service.BatchSummary;
import com.astradesk.reviewtracker.service.ReviewOutcome;
import com.astradesk.reviewtracker.service.TicketReview;
import com.astradesk.reviewtracker.web.dto.AnalysisResponse;
import com.astradesk.reviewtracker.web.dto.BatchReviewResponse;
import com.astradesk.reviewtracker.web.dto.HistoryAnalysisRequest;
import com.astradesk.reviewtracker.web.dto.ReviewOutcomeResponse;
import com.astradesk.reviewtracker.web.dto.TicketReviewResponse;
import com.astradesk.reviewtracker.web.dto.TransitionPayload;

/**
 * Centralises conversion between domain objects and API DTOs so the shape of
 * responses stays consistent across endpoints.
 */
@Component
public class ReviewMapper {

    public TicketReviewResponse toResponse(TicketReview review) {
        TransitionAnalysis analysis = review.analysis();
        return new TicketReviewResponse(
            review.issueKey(),
            review.summary(),
            review.currentStatus(),
            review.assignee(),
            review.hoursLogged(),
            analysis.backwardMoveCount(),
            analysis.blockedEntryCount(),
            toResponse(analysis)
        );
    }

    public AnalysisResponse toResponse(TransitionAnalysis analysis) {
        return new AnalysisResponse(
            analysis.transitions().stream()
                .map(t -> new AnalysisResponse.TransitionView(t.timestamp(), t.fromStatus(), t.toStatus(), t.author()))
                .toList(),
            analysis.bounceBacks().stream()
                .map(event -> new AnalysisResponse.BounceBackView(
                    event.transition().timestamp(),
                    event.transition().fromStatus(),
                    event.transition().toStatus(),
                    event.transition().author(),
                    event.blocked()))
                .toList(),
            analysis.timeInStates().stream()
                .map(p -> new AnalysisResponse.PeriodView(p.status(), p.entered(), p.exited(), p.durationHours()))
                .toList(),
            analysis.testReferences(),
            analysis.stageHours()
        );
    }

    public ReviewOutcomeResponse toResponse(ReviewOutcome outcome) {
        return new ReviewOutcomeResponse(
            outcome.issueKey(),
            outcome.isSuccess() ? toResponse(outcome.review()) : null,
            outcome.error()
        );
    }

    public BatchReviewResponse toBatchResponse(List<ReviewOutcome> outcomes) {
        BatchSummary summary = BatchSummary.of(outcomes);
        return new BatchReviewResponse(
            outcomes.stream().map(this::toResponse).toList(),
            new BatchReviewResponse.Summary(
                summary.requested(),
                summary.reviewed(),
                summary.failed(),
                summary.bounceBackCount(),
                summary.averageBounceBacks(),
                summary.hoursLogged(),
                summary.averageStageHours())
        );
    }

    /**
     * Converts a caller-supplied history into typed values. Throws
     * {@link com.astradesk.reviewtracker.analysis.MalformedTimestampException} on
     * the first timestamp that cannot be parsed.
     */
    public TicketHistory toHistory(HistoryAnalysisRequest request) {
        Instant createdAt = StringUtils.hasText(request.getCreatedAt())
            ? TimestampNormalizer.toInstant(request.getCreatedAt())
            : null;
        List<Transition> transitions = request.getTransitions().stream()
            .map(this::toTransition)
            .toList();
        return new TicketHistory(createdAt, transitions, request.getDescription(), request.getComments());
    }

    private Transition toTransition(TransitionPayload payload) {
        return new Transition(
            TimestampNormalizer.toInstant(payload.getTimestamp()),
            payload.getFromStatus(),
            payload.getToStatus(),
            payload.getAuthor()
        );
    }
}
