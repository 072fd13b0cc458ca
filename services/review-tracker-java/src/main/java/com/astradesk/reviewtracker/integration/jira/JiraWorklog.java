package com.astradesk.reviewtracker.integration.jira;

import java.util.List;

import com.astradesk.reviewtracker.domain.Hours;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A single worklog entry. Only the logged duration is of interest.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JiraWorklog(String id, JiraIssue.User author, long timeSpentSeconds) {

    /**
     * Sum of the logged time in hours, rounded like every other hour figure.
     */
    public static double totalHours(List<JiraWorklog> worklogs) {
        long seconds = worklogs.stream().mapToLong(JiraWorklog::timeSpentSeconds).sum();
        return Hours.ofSeconds(seconds);
    }
}
