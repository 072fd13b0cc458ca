package com.astradesk.reviewtracker.integration.jira;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when a review needs Jira but the integration is switched off.
 */
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class IssueTrackerUnavailableException extends RuntimeException {

    public IssueTrackerUnavailableException(String issueKey) {
        super("Jira integration is disabled; cannot fetch %s".formatted(issueKey));
    }
}
