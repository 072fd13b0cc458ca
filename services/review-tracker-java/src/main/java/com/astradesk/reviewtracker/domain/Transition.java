package com.astradesk.reviewtracker.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * One observed status change of a ticket.
 *
 * <p>Status labels are kept exactly as the tracker reported them (case and
 * whitespace included); classification against the workflow happens later in
 * {@link WorkflowModel#classify(String)}.</p>
 */
public record Transition(Instant timestamp, String fromStatus, String toStatus, String author) {

    public static final String UNKNOWN_AUTHOR = "Unknown";

    public static final Comparator<Transition> CHRONOLOGICAL = Comparator.comparing(Transition::timestamp);

    public Transition {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        fromStatus = fromStatus == null ? "" : fromStatus;
        toStatus = toStatus == null ? "" : toStatus;
        author = author == null || author.isBlank() ? UNKNOWN_AUTHOR : author;
    }

    /**
     * Returns a chronologically ordered copy. {@link List#sort} is stable, so
     * transitions sharing a timestamp keep their input relative order.
     */
    public static List<Transition> chronological(List<Transition> transitions) {
        if (transitions == null || transitions.isEmpty()) {
            return List.of();
        }
        List<Transition> sorted = new ArrayList<>(transitions);
        sorted.sort(CHRONOLOGICAL);
        return List.copyOf(sorted);
    }
}
