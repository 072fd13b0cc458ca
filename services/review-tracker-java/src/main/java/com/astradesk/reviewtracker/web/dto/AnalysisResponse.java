package com.astradesk.reviewtracker.web.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Lifecycle analysis of one ticket as returned over HTTP.
 */
public class AnalysisResponse {

    private final List<TransitionView> transitions;
    private final List<BounceBackView> bounceBacks;
    private final List<PeriodView> timeInStates;
    private final List<String> testReferences;
    private final Map<String, Double> stageHours;

    public AnalysisResponse(
        List<TransitionView> transitions,
        List<BounceBackView> bounceBacks,
        List<PeriodView> timeInStates,
        List<String> testReferences,
        Map<String, Double> stageHours
    ) {
        this.transitions = transitions;
        this.bounceBacks = bounceBacks;
        this.timeInStates = timeInStates;
        this.testReferences = testReferences;
        this.stageHours = stageHours;
    }

    public List<TransitionView> getTransitions() {
        return transitions;
    }

    public List<BounceBackView> getBounceBacks() {
        return bounceBacks;
    }

    public List<PeriodView> getTimeInStates() {
        return timeInStates;
    }

    public List<String> getTestReferences() {
        return testReferences;
    }

    public Map<String, Double> getStageHours() {
        return stageHours;
    }

    public record TransitionView(Instant timestamp, String fromStatus, String toStatus, String author) {
    }

    public record BounceBackView(Instant timestamp, String fromStatus, String toStatus, String author, boolean blocked) {
    }

    public record PeriodView(String status, Instant entered, Instant exited, double durationHours) {
    }
}
