package com.astradesk.reviewtracker.service;

/**
 * Result for one key of a batch review. Exactly one of {@code review} and
 * {@code error} is set.
 */
public record ReviewOutcome(String issueKey, TicketReview review, String error) {

    public static ReviewOutcome success(TicketReview review) {
        return new ReviewOutcome(review.issueKey(), review, null);
    }

    public static ReviewOutcome failure(String issueKey, String error) {
        return new ReviewOutcome(issueKey, null, error);
    }

    public boolean isSuccess() {
        return review != null;
    }
}
