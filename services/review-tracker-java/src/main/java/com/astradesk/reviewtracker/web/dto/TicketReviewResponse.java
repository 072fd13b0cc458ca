package com.astradesk.reviewtracker.web.dto;

/**
 * API response for a single reviewed Jira ticket.
 */
public class TicketReviewResponse {

    private final String issueKey;
    private final String summary;
    private final String currentStatus;
    private final String assignee;
    private final double hoursLogged;
    private final long bounceBackCount;
    private final long blockedCount;
    private final AnalysisResponse analysis;

    public TicketReviewResponse(
        String issueKey,
        String summary,
        String currentStatus,
        String assignee,
        double hoursLogged,
        long bounceBackCount,
        long blockedCount,
        AnalysisResponse analysis
    ) {
        this.issueKey = issueKey;
        this.summary = summary;
        this.currentStatus = currentStatus;
        this.assignee = assignee;
        this.hoursLogged = hoursLogged;
        this.bounceBackCount = bounceBackCount;
        this.blockedCount = blockedCount;
        this.analysis = analysis;
    }

    public String getIssueKey() {
        return issueKey;
    }

    public String getSummary() {
        return summary;
    }

    public String getCurrentStatus() {
        return currentStatus;
    }

    public String getAssignee() {
        return assignee;
    }

    public double getHoursLogged() {
        return hoursLogged;
    }

    public long getBounceBackCount() {
        return bounceBackCount;
    }

    public long getBlockedCount() {
        return blockedCount;
    }

    public AnalysisResponse getAnalysis() {
        return analysis;
    }
}
