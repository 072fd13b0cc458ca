package com.astradesk.reviewtracker.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Canonical forward order of workflow stages plus the set of stages that mean
 * "parked". The two never share a stage. Labels are matched case-insensitively
 * after trimming; nothing fuzzier than that.
 *
 * <p>Instances are immutable and meant to be built once from configuration and
 * handed to whoever needs them, so several workflows can live side by side in
 * one process.</p>
 */
public final class WorkflowModel {

    public static final List<String> DEFAULT_FORWARD_STAGES = List.of("to do", "in progress", "in review", "done");
    public static final Set<String> DEFAULT_BLOCKED_STAGES = Set.of("blocked");

    private final List<String> forwardStages;
    private final Set<String> blockedStages;

    public WorkflowModel(List<String> forwardStages, Collection<String> blockedStages) {
        if (forwardStages == null || forwardStages.isEmpty()) {
            throw new IllegalArgumentException("at least one forward stage is required");
        }
        List<String> forward = new ArrayList<>(forwardStages.size());
        for (String stage : forwardStages) {
            String normalized = normalizeRequired(stage);
            if (forward.contains(normalized)) {
                throw new IllegalArgumentException("duplicate forward stage '" + stage + "'");
            }
            forward.add(normalized);
        }
        Set<String> blocked = new LinkedHashSet<>();
        if (blockedStages != null) {
            for (String stage : blockedStages) {
                String normalized = normalizeRequired(stage);
                if (forward.contains(normalized)) {
                    throw new IllegalArgumentException("stage '" + stage + "' cannot be both forward and blocked");
                }
                blocked.add(normalized);
            }
        }
        this.forwardStages = List.copyOf(forward);
        this.blockedStages = Set.copyOf(blocked);
    }

    public static WorkflowModel defaultModel() {
        return new WorkflowModel(DEFAULT_FORWARD_STAGES, DEFAULT_BLOCKED_STAGES);
    }

    /**
     * Classifies a status label. Forward and blocked stages are disjoint, so a
     * label falls into exactly one class.
     */
    public StageClassification classify(String label) {
        if (label == null) {
            return StageClassification.UNCLASSIFIED;
        }
        String normalized = normalize(label);
        if (blockedStages.contains(normalized)) {
            return StageClassification.BLOCKED;
        }
        int position = forwardStages.indexOf(normalized);
        return position >= 0 ? StageClassification.forward(position) : StageClassification.UNCLASSIFIED;
    }

    public List<String> getForwardStages() {
        return forwardStages;
    }

    public Set<String> getBlockedStages() {
        return blockedStages;
    }

    @Override
    public String toString() {
        return "WorkflowModel" + forwardStages + " blocked=" + blockedStages;
    }

    private static String normalize(String label) {
        return label.trim().toLowerCase(Locale.ROOT);
    }

    private static String normalizeRequired(String stage) {
        if (stage == null || stage.isBlank()) {
            throw new IllegalArgumentException("stage names must not be blank");
        }
        return normalize(stage);
    }
}
