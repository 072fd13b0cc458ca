package com.astradesk.reviewtracker.integration.jira;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One page of {@code GET /rest/api/3/issue/{key}/changelog}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JiraChangelogPage(int startAt, int maxResults, int total, List<History> values) {

    public JiraChangelogPage {
        values = values == null ? List.of() : values;
    }

    /**
     * Whether a request starting after this page would still return entries.
     */
    public boolean hasMore() {
        return !values.isEmpty() && startAt + values.size() < total;
    }

    public int nextStartAt() {
        return startAt + values.size();
    }

    /**
     * A single edit of the issue; one edit can touch several fields at once.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record History(String id, JiraIssue.User author, String created, List<ChangeItem> items) {

        public History {
            items = items == null ? List.of() : items;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChangeItem(
        String field,
        @JsonProperty("fromString") String fromValue,
        @JsonProperty("toString") String toValue
    ) {
    }
}
