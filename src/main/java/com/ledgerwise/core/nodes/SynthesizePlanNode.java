package com.ledgerwise.core.nodes;

import com.ledgerwise.core.model.Classification;
import com.ledgerwise.core.model.InternalFaultException;
import com.ledgerwise.core.model.Plan;
import com.ledgerwise.core.model.RequestStatus;
import com.ledgerwise.core.planner.PlanSynthesizer;
import com.ledgerwise.core.state.AssistantState;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Builds the draft plan from the classification.
 */
@Component
public class SynthesizePlanNode {

    private final PlanSynthesizer synthesizer;

    public SynthesizePlanNode(PlanSynthesizer synthesizer) {
        this.synthesizer = synthesizer;
    }

    public Map<String, Object> apply(AssistantState state) {
        Classification classification = state.classification()
                .orElseThrow(() -> new InternalFaultException("No classification for request " + state.requestId()));
        Plan plan = synthesizer.synthesize(classification);
        return Map.of(
                "plan", plan,
                "status", RequestStatus.PLANNED.name()
        );
    }
}
