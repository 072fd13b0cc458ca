package com.astradesk.reviewtracker.service;

import com.astradesk.reviewtracker.domain.TransitionAnalysis;

/**
 * Per-ticket summary: issue metadata from Jira next to the lifecycle analysis.
 */
public record TicketReview(
    String issueKey,
    String summary,
    String currentStatus,
    String assignee,
    double hoursLogged,
    TransitionAnalysis analysis
) {
}
