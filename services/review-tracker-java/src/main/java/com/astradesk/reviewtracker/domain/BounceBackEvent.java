package com.astradesk.reviewtracker.domain;

import java.util.Objects;

/**
 * A transition flagged by the bounce-back detector. {@code blocked} events mark
 * entry into a blocked stage; the others are plain backward moves.
 */
public record BounceBackEvent(Transition transition, boolean blocked) {

    public BounceBackEvent {
        Objects.requireNonNull(transition, "transition must not be null");
    }

    public static BounceBackEvent backward(Transition transition) {
        return new BounceBackEvent(transition, false);
    }

    public static BounceBackEvent blockedEntry(Transition transition) {
        return new BounceBackEvent(transition, true);
    }
}
