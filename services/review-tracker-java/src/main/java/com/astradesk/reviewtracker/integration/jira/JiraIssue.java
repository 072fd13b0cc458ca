package com.astradesk.reviewtracker.integration.jira;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Projection of {@code GET /rest/api/3/issue/{key}} restricted to the fields the
 * tracker requests. Rich-text bodies stay as raw ADF trees; see {@link AdfText}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JiraIssue(String id, String key, Fields fields) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Fields(
        String summary,
        Status status,
        User assignee,
        JsonNode description,
        CommentPage comment,
        String created
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Status(String name) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record User(String accountId, String displayName) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CommentPage(List<Comment> comments) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Comment(String id, User author, JsonNode body, String created) {
    }
}
