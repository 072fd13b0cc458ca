package com.astradesk.reviewtracker.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Everything the analysis needs about one ticket, already converted to typed
 * values. {@code createdAt} may be {@code null} when the tracker did not report
 * it. Missing comment texts are dropped.
 */
public record TicketHistory(
    Instant createdAt,
    List<Transition> transitions,
    String descriptionText,
    List<String> commentTexts
) {

    public TicketHistory {
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
        descriptionText = descriptionText == null ? "" : descriptionText;
        commentTexts = commentTexts == null
            ? List.of()
            : commentTexts.stream().filter(Objects::nonNull).toList();
    }
}
