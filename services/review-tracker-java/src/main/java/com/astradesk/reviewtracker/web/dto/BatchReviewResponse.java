package com.astradesk.reviewtracker.web.dto;

import java.util.List;
import java.util.Map;

/**
 * Batch review result: one outcome per distinct key, in request order, plus
 * aggregate figures over the tickets that could be reviewed.
 */
public class BatchReviewResponse {

    private final List<ReviewOutcomeResponse> outcomes;
    private final Summary summary;

    public BatchReviewResponse(List<ReviewOutcomeResponse> outcomes, Summary summary) {
        this.outcomes = outcomes;
        this.summary = summary;
    }

    public List<ReviewOutcomeResponse> getOutcomes() {
        return outcomes;
    }

    public Summary getSummary() {
        return summary;
    }

    public record Summary(
        int requested,
        int reviewed,
        int failed,
        long bounceBackCount,
        double averageBounceBacks,
        double hoursLogged,
        Map<String, Double> averageStageHours
    ) {
    }
}
