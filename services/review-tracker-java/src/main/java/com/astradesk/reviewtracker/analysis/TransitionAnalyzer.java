package com.astradesk.reviewtracker.analysis;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.astradesk.reviewtracker.domain.BounceBackEvent;
import com.astradesk.reviewtracker.domain.StatePeriod;
import com.astradesk.reviewtracker.domain.TicketHistory;
import com.astradesk.reviewtracker.domain.Transition;
import com.astradesk.reviewtracker.domain.TransitionAnalysis;
import com.astradesk.reviewtracker.domain.WorkflowModel;

/**
 * Runs bounce-back detection, time-in-state reconstruction, per-stage totals
 * and reference extraction over one ticket history. Holds no mutable state, so one instance
 * can serve any number of tickets concurrently.
 */
public class TransitionAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TransitionAnalyzer.class);

    private final BounceBackDetector detector;
    private final TimeInStateReconstructor reconstructor;
    private final StageTimeAggregator stageTimeAggregator;
    private final ReferenceExtractor referenceExtractor;

    public TransitionAnalyzer(WorkflowModel workflow, Clock clock, ReferenceExtractor referenceExtractor) {
        this(new BounceBackDetector(workflow), new TimeInStateReconstructor(clock),
            new StageTimeAggregator(workflow), referenceExtractor);
    }

    public TransitionAnalyzer(
        BounceBackDetector detector,
        TimeInStateReconstructor reconstructor,
        StageTimeAggregator stageTimeAggregator,
        ReferenceExtractor referenceExtractor
    ) {
        this.detector = detector;
        this.reconstructor = reconstructor;
        this.stageTimeAggregator = stageTimeAggregator;
        this.referenceExtractor = referenceExtractor;
    }

    public TransitionAnalysis analyze(TicketHistory history) {
        List<Transition> transitions = Transition.chronological(history.transitions());
        List<BounceBackEvent> bounceBacks = detector.detect(transitions);
        List<StatePeriod> periods = reconstructor.reconstruct(transitions, history.createdAt());
        Map<String, Double> stageHours = stageTimeAggregator.totals(periods);
        List<String> references = referenceExtractor.extract(history.descriptionText(), history.commentTexts());

        log.debug("Analysed {} transitions: {} bounce-back events, {} periods, {} references",
            transitions.size(), bounceBacks.size(), periods.size(), references.size());
        return new TransitionAnalysis(transitions, bounceBacks, periods, references, stageHours);
    }
}
