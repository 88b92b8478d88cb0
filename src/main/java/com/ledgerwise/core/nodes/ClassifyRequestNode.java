package com.ledgerwise.core.nodes;

import com.ledgerwise.core.classify.IntentClassifier;
import com.ledgerwise.core.metrics.AssistantMetrics;
import com.ledgerwise.core.model.Classification;
import com.ledgerwise.core.model.RequestStatus;
import com.ledgerwise.core.state.AssistantState;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Classifies the request into intent, facets and entities.
 */
@Component
public class ClassifyRequestNode {

    private final IntentClassifier classifier;
    private final AssistantMetrics metrics;

    public ClassifyRequestNode(IntentClassifier classifier,
                               @Autowired(required = false) AssistantMetrics metrics) {
        this.classifier = classifier;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(AssistantState state) {
        Classification classification = classifier.classify(state.request());
        if (metrics != null) {
            metrics.recordClassification(classification.intent().name());
        }
        return Map.of(
                "classification", classification,
                "status", RequestStatus.CLASSIFIED.name()
        );
    }
}
