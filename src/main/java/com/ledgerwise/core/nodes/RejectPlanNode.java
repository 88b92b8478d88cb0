package com.ledgerwise.core.nodes;

import com.ledgerwise.core.aggregate.ResultAggregator;
import com.ledgerwise.core.model.Classification;
import com.ledgerwise.core.model.Intent;
import com.ledgerwise.core.model.RequestStatus;
import com.ledgerwise.core.state.AssistantState;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Terminal node for rejected plans. No tool has run.
 */
@Component
public class RejectPlanNode {

    private final ResultAggregator aggregator;

    public RejectPlanNode(ResultAggregator aggregator) {
        this.aggregator = aggregator;
    }

    public Map<String, Object> apply(AssistantState state) {
        Intent intent = state.classification().map(Classification::intent).orElse(Intent.COMPOSITE_TASK);
        String reason = state.rejectionReason().isBlank() ? "the request could not be planned" : state.rejectionReason();
        return Map.of(
                "answer", aggregator.rejection(state.requestId(), intent, reason),
                "status", RequestStatus.REJECTED.name()
        );
    }
}
