package com.ledgerwise.core.nodes;

import com.ledgerwise.core.events.AssistantEvent;
import com.ledgerwise.core.events.EventBus;
import com.ledgerwise.core.metrics.AssistantMetrics;
import com.ledgerwise.core.model.EntityBag;
import com.ledgerwise.core.model.Plan;
import com.ledgerwise.core.model.RequestStatus;
import com.ledgerwise.core.model.Classification;
import com.ledgerwise.core.planner.DependencyResolver;
import com.ledgerwise.core.planner.PlanRejectedException;
import com.ledgerwise.core.state.AssistantState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Resolves step dependencies. A rejected plan sets status REJECTED with the
 * reason; the graph then routes to {@code reject_plan}.
 */
@Component
public class ResolveDependenciesNode {

    private static final Logger log = LoggerFactory.getLogger(ResolveDependenciesNode.class);

    private final DependencyResolver resolver;
    private final EventBus eventBus;
    private final AssistantMetrics metrics;

    public ResolveDependenciesNode(DependencyResolver resolver, EventBus eventBus,
                                   @Autowired(required = false) AssistantMetrics metrics) {
        this.resolver = resolver;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(AssistantState state) {
        EntityBag entities = state.classification().map(Classification::entities).orElse(EntityBag.empty());
        try {
            Plan plan = resolver.resolve(state.plan(), entities);
            if (metrics != null) {
                metrics.recordPlanSize(plan.size());
            }
            eventBus.publish(AssistantEvent.of("plan.resolved", state.requestId(), null,
                    Map.of("steps", plan.toolNames())));
            return Map.of(
                    "plan", plan,
                    "status", RequestStatus.RESOLVED.name()
            );
        } catch (PlanRejectedException e) {
            log.warn("Plan for request {} rejected: {}", state.requestId(), e.getMessage());
            eventBus.publish(AssistantEvent.of("plan.rejected", state.requestId(), null,
                    Map.of("reason", e.getMessage())));
            return Map.of(
                    "plan", e.plan(),
                    "status", RequestStatus.REJECTED.name(),
                    "rejectionReason", e.getMessage()
            );
        }
    }
}
