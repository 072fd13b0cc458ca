package com.astradesk.reviewtracker.domain;

/**
 * Result of looking a status label up in a {@link WorkflowModel}.
 *
 * <p>{@code position} is only meaningful for {@link Kind#FORWARD}; it is
 * {@code -1} for the other kinds.</p>
 */
public record StageClassification(Kind kind, int position) {

    public enum Kind {
        FORWARD,
        BLOCKED,
        UNCLASSIFIED
    }

    public static final StageClassification BLOCKED = new StageClassification(Kind.BLOCKED, -1);
    public static final StageClassification UNCLASSIFIED = new StageClassification(Kind.UNCLASSIFIED, -1);

    public StageClassification {
        if (kind == Kind.FORWARD && position < 0) {
            throw new IllegalArgumentException("forward position must be >= 0");
        }
    }

    public static StageClassification forward(int position) {
        return new StageClassification(Kind.FORWARD, position);
    }

    public boolean isForward() {
        return kind == Kind.FORWARD;
    }

    public boolean isBlocked() {
        return kind == Kind.BLOCKED;
    }
}
