package com.astradesk.reviewtracker.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One entry of a batch review; {@code review} is absent when {@code error} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReviewOutcomeResponse(String issueKey, TicketReviewResponse review, String error) {
}
