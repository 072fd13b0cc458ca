package com.astradesk.reviewtracker.web.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * A ticket history supplied by the caller instead of fetched from Jira.
 * Description and comments must already be plain text.
 */
public class HistoryAnalysisRequest {

    private String createdAt;

    @NotNull
    private List<@NotNull @Valid TransitionPayload> transitions;

    private String description;

    private List<@NotNull String> comments;

    public HistoryAnalysisRequest() {
    }

    public HistoryAnalysisRequest(String createdAt, List<TransitionPayload> transitions, String description, List<String> comments) {
        this.createdAt = createdAt;
        this.transitions = transitions;
        this.description = description;
        this.comments = comments;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(String createdAt) {
        this.createdAt = createdAt;
    }

    public List<TransitionPayload> getTransitions() {
        return transitions;
    }

    public void setTransitions(List<TransitionPayload> transitions) {
        this.transitions = transitions;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<String> getComments() {
        return comments;
    }

    public void setComments(List<String> comments) {
        this.comments = comments;
    }
}
