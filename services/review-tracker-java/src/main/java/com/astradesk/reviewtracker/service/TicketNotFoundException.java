package com.astradesk.reviewtracker.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Exception thrown when Jira does not know the requested issue key. Spring WebFlux
 * maps it to a 404 response via {@link org.springframework.web.bind.annotation.ResponseStatus}.
 */
@ResponseStatus(HttpStatus.NOT_FOUND)
public class TicketNotFoundException extends RuntimeException {

    public TicketNotFoundException(String issueKey) {
        super("Ticket %s not found".formatted(issueKey));
    }
}
