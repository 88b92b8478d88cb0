package com.ledgerwise.core.nodes;

import com.ledgerwise.core.aggregate.ResultAggregator;
import com.ledgerwise.core.model.AggregatedAnswer;
import com.ledgerwise.core.model.Classification;
import com.ledgerwise.core.model.Intent;
import com.ledgerwise.core.model.RequestStatus;
import com.ledgerwise.core.state.AssistantState;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class AggregateResultsNode {

    private final ResultAggregator aggregator;

    public AggregateResultsNode(ResultAggregator aggregator) {
        this.aggregator = aggregator;
    }

    public Map<String, Object> apply(AssistantState state) {
        Intent intent = state.classification().map(Classification::intent).orElse(Intent.COMPOSITE_TASK);
        AggregatedAnswer answer = aggregator.aggregate(state.requestId(), state.request(), intent,
                state.plan(), state.stepResults(), state.executionCancelled(), state.stepLimitReached());
        return Map.of(
                "answer", answer,
                "status", RequestStatus.AGGREGATED.name()
        );
    }
}
