package com.astradesk.reviewtracker.web.dto;

import java.util.List;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Payload listing the Jira issues to review in one go.
 */
public class BatchReviewRequest {

    public static final String ISSUE_KEY_PATTERN = "[A-Z][A-Z0-9]+-\\d+";

    @NotEmpty
    @Size(max = 200)
    private List<@Pattern(regexp = ISSUE_KEY_PATTERN) String> issueKeys;

    public BatchReviewRequest() {
    }

    public BatchReviewRequest(List<String> issueKeys) {
        this.issueKeys = issueKeys;
    }

    public List<String> getIssueKeys() {
        return issueKeys;
    }

    public void setIssueKeys(List<String> issueKeys) {
        this.issueKeys = issueKeys;
    }
}
