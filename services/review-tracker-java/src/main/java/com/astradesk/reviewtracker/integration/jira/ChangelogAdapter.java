package com.astradesk.reviewtracker.integration.jira;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import com.astradesk.reviewtracker.analysis.TimestampNormalizer;
import com.astradesk.reviewtracker.domain.TicketHistory;
import com.astradesk.reviewtracker.domain.Transition;

/**
 * Converts raw Jira records into the typed history the analysis works on.
 *
 * <p>Only status changes survive. A history entry without a {@code created}
 * timestamp is skipped with a warning; one with an unparseable timestamp fails
 * the whole ticket via {@link com.astradesk.reviewtracker.analysis.MalformedTimestampException}.</p>
 */
@Component
public class ChangelogAdapter {

    static final String STATUS_FIELD = "status";

    private static final Logger log = LoggerFactory.getLogger(ChangelogAdapter.class);

    public List<Transition> toTransitions(String issueKey, List<JiraChangelogPage.History> histories) {
        List<Transition> transitions = new ArrayList<>();
        for (JiraChangelogPage.History history : histories) {
            List<JiraChangelogPage.ChangeItem> statusChanges = history.items().stream()
                .filter(item -> STATUS_FIELD.equalsIgnoreCase(item.field()))
                .toList();
            if (statusChanges.isEmpty()) {
                continue;
            }
            if (!StringUtils.hasText(history.created())) {
                log.warn("Skipping changelog entry {} of {}: no timestamp", history.id(), issueKey);
                continue;
            }

            Instant timestamp = TimestampNormalizer.toInstant(history.created());
            String author = history.author() == null ? null : history.author().displayName();
            for (JiraChangelogPage.ChangeItem item : statusChanges) {
                transitions.add(new Transition(timestamp, item.fromValue(), item.toValue(), author));
            }
        }
        return Transition.chronological(transitions);
    }

    public TicketHistory toHistory(JiraIssue issue, List<JiraChangelogPage.History> histories) {
        JiraIssue.Fields fields = issue.fields();
        Instant createdAt = fields == null || !StringUtils.hasText(fields.created())
            ? null
            : TimestampNormalizer.toInstant(fields.created());
        String description = fields == null ? "" : AdfText.flatten(fields.description());

        return new TicketHistory(createdAt, toTransitions(issue.key(), histories), description, commentTexts(fields));
    }

    private List<String> commentTexts(JiraIssue.Fields fields) {
        if (fields == null || fields.comment() == null || fields.comment().comments() == null) {
            return List.of();
        }
        return fields.comment().comments().stream()
            .map(comment -> AdfText.flatten(comment.body()))
            .filter(text -> !text.isEmpty())
            .toList();
    }
}
