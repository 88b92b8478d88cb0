package com.ledgerwise.core.nodes;

import com.ledgerwise.core.engine.CancellationRegistry;
import com.ledgerwise.core.engine.EngineProperties;
import com.ledgerwise.core.events.AssistantEvent;
import com.ledgerwise.core.events.EventBus;
import com.ledgerwise.core.executor.StepExecutor;
import com.ledgerwise.core.executor.StepOutcome;
import com.ledgerwise.core.logging.MdcContext;
import com.ledgerwise.core.model.Classification;
import com.ledgerwise.core.model.EntityBag;
import com.ledgerwise.core.model.Plan;
import com.ledgerwise.core.model.PlanStep;
import com.ledgerwise.core.model.RequestStatus;
import com.ledgerwise.core.model.StepResult;
import com.ledgerwise.core.state.AssistantState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes the resolved plan one step at a time, in plan order.
 * <p>
 * Before each step the node checks for cancellation and for the per-request
 * step limit; either stops execution, and the remaining steps are reported
 * as not attempted. A failed step does not stop execution: later steps that
 * depend on it fail their precondition, independent ones still run.
 */
@Component
public class ExecutePlanNode {

    private static final Logger log = LoggerFactory.getLogger(ExecutePlanNode.class);

    private final StepExecutor stepExecutor;
    private final CancellationRegistry cancellations;
    private final EngineProperties properties;
    private final EventBus eventBus;

    public ExecutePlanNode(StepExecutor stepExecutor, CancellationRegistry cancellations,
                           EngineProperties properties, EventBus eventBus) {
        this.stepExecutor = stepExecutor;
        this.cancellations = cancellations;
        this.properties = properties;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(AssistantState state) {
        String requestId = state.requestId();
        MdcContext.setRequest(requestId);
        EntityBag entities = state.classification().map(Classification::entities).orElse(EntityBag.empty());
        List<PlanStep> steps = new ArrayList<>(state.plan().steps());
        Map<String, StepResult> results = new LinkedHashMap<>();

        boolean cancelled = false;
        boolean limitReached = false;
        for (int i = 0; i < steps.size(); i++) {
            if (cancellations.isCancelled(requestId)) {
                cancelled = true;
                log.info("Request {} cancelled; {} of {} steps not attempted", requestId, steps.size() - i, steps.size());
                eventBus.publish(AssistantEvent.of("request.cancelled", requestId, null,
                        Map.of("notAttempted", steps.size() - i)));
                break;
            }
            if (i >= properties.getMaxSteps()) {
                limitReached = true;
                log.warn("Request {} reached the limit of {} steps; {} not attempted",
                        requestId, properties.getMaxSteps(), steps.size() - i);
                break;
            }
            PlanStep step = steps.get(i);
            StepOutcome outcome = stepExecutor.execute(requestId, step, entities, results);
            steps.set(i, outcome.step());
            results.put(step.id(), outcome.result());
        }

        return Map.of(
                "plan", Plan.of(steps),
                "stepResults", new ArrayList<>(results.values()),
                "executionCancelled", cancelled,
                "stepLimitReached", limitReached,
                "status", RequestStatus.EXECUTING.name()
        );
    }
}
