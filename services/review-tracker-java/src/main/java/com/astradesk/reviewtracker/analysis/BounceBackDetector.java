package com.astradesk.reviewtracker.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.astradesk.reviewtracker.domain.BounceBackEvent;
import com.astradesk.reviewtracker.domain.StageClassification;
import com.astradesk.reviewtracker.domain.Transition;
import com.astradesk.reviewtracker.domain.WorkflowModel;

/**
 * Finds backward workflow moves and entries into blocked stages.
 *
 * <p>The two checks are independent: a transition that goes backward and also
 * lands in a blocked stage yields two events. Labels the workflow does not know
 * never count as a backward move.</p>
 */
public class BounceBackDetector {

    private final WorkflowModel workflow;

    public BounceBackDetector(WorkflowModel workflow) {
        this.workflow = Objects.requireNonNull(workflow, "workflow must not be null");
    }

    public List<BounceBackEvent> detect(List<Transition> transitions) {
        List<BounceBackEvent> events = new ArrayList<>();
        for (Transition transition : Transition.chronological(transitions)) {
            StageClassification from = workflow.classify(transition.fromStatus());
            StageClassification to = workflow.classify(transition.toStatus());

            // position 0 has nothing earlier to fall back to
            if (from.isForward() && from.position() > 0
                && to.isForward() && to.position() < from.position()) {
                events.add(BounceBackEvent.backward(transition));
            }
            if (to.isBlocked()) {
                events.add(BounceBackEvent.blockedEntry(transition));
            }
        }
        return List.copyOf(events);
    }
}
