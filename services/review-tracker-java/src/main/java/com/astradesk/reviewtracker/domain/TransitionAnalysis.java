package com.astradesk.reviewtracker.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derived view of one ticket's lifecycle. {@code stageHours} maps each
 * configured stage to the total hours spent in it, in workflow order.
 */
public record TransitionAnalysis(
    List<Transition> transitions,
    List<BounceBackEvent> bounceBacks,
    List<StatePeriod> timeInStates,
    List<String> testReferences,
    Map<String, Double> stageHours
) {

    public TransitionAnalysis {
        transitions = List.copyOf(transitions);
        bounceBacks = List.copyOf(bounceBacks);
        timeInStates = List.copyOf(timeInStates);
        testReferences = List.copyOf(testReferences);
        stageHours = Collections.unmodifiableMap(new LinkedHashMap<>(stageHours));
    }

    public long backwardMoveCount() {
        return bounceBacks.stream().filter(event -> !event.blocked()).count();
    }

    /**
     * Total hours in the given stage, zero when the stage is not configured.
     */
    public double hoursIn(String stage) {
        return stageHours.getOrDefault(stage.trim().toLowerCase(Locale.ROOT), 0.0);
    }

    public long blockedEntryCount() {
        return bounceBacks.stream().filter(BounceBackEvent::blocked).count();
    }
}
