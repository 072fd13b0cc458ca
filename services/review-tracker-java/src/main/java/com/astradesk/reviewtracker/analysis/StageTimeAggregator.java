package com.astradesk.reviewtracker.analysis;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import com.astradesk.reviewtracker.domain.Hours;
import com.astradesk.reviewtracker.domain.StageClassification;
import com.astradesk.reviewtracker.domain.StatePeriod;
import com.astradesk.reviewtracker.domain.WorkflowModel;

/**
 * Totals the hours spent in each workflow stage across all visits.
 *
 * <p>The result has one entry per configured stage, forward stages in workflow
 * order followed by blocked stages, keyed by the canonical (trimmed,
 * lower-cased) stage name. Stages never visited report zero. Periods in
 * unclassified statuses are left out.</p>
 */
public class StageTimeAggregator {

    private final WorkflowModel workflow;

    public StageTimeAggregator(WorkflowModel workflow) {
        this.workflow = Objects.requireNonNull(workflow, "workflow must not be null");
    }

    public Map<String, Double> totals(List<StatePeriod> periods) {
        Map<String, BigDecimal> sums = new LinkedHashMap<>();
        workflow.getForwardStages().forEach(stage -> sums.put(stage, BigDecimal.ZERO));
        workflow.getBlockedStages().stream().sorted().forEach(stage -> sums.put(stage, BigDecimal.ZERO));

        for (StatePeriod period : periods) {
            StageClassification classification = workflow.classify(period.status());
            String stage;
            if (classification.isForward()) {
                stage = workflow.getForwardStages().get(classification.position());
            } else if (classification.isBlocked()) {
                stage = period.status().trim().toLowerCase(Locale.ROOT);
            } else {
                continue;
            }
            sums.merge(stage, BigDecimal.valueOf(period.durationHours()), BigDecimal::add);
        }

        Map<String, Double> totals = new LinkedHashMap<>();
        sums.forEach((stage, hours) -> totals.put(stage, Hours.round(hours)));
        return Collections.unmodifiableMap(totals);
    }
}
