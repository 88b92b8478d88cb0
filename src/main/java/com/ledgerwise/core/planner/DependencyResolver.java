package com.ledgerwise.core.planner;

import com.ledgerwise.core.model.ArgumentValue;
import com.ledgerwise.core.model.EntityBag;
import com.ledgerwise.core.model.ErrorKind;
import com.ledgerwise.core.model.InternalFaultException;
import com.ledgerwise.core.model.Plan;
import com.ledgerwise.core.model.PlanStep;
import com.ledgerwise.core.model.StepError;
import com.ledgerwise.core.model.StepStatus;
import com.ledgerwise.core.model.ToolSpec;
import com.ledgerwise.core.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.stream.Collectors;

/**
 * Makes a draft plan executable.
 * <p>
 * For every required parameter that is still unbound, the resolver points it
 * at an existing step that exports the parameter, or inserts a producer step
 * right before the consumer. It then orders the steps so that every
 * back-reference points at an earlier step, keeping the original relative
 * order wherever the references allow it.
 * <p>
 * Resolving an already resolved plan returns an equal plan.
 */
@Component
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    private final ToolRegistry registry;

    public DependencyResolver(ToolRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param draft    plan to resolve
     * @param entities request entities, used to bind inserted producer steps
     * @return the resolved plan
     * @throws PlanRejectedException if some required parameter has no producer,
     *                               the references form a cycle, or more producer
     *                               steps would be needed than there are tools
     */
    public Plan resolve(Plan draft, EntityBag entities) throws PlanRejectedException {
        List<PlanStep> steps = new ArrayList<>(draft.steps());
        int insertionLimit = registry.size();
        int insertions = 0;
        int nextId = nextStepNumber(steps);

        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = 0; i < steps.size() && !changed; i++) {
                PlanStep step = steps.get(i);
                if (step.status() == StepStatus.FAILED_TERMINAL) {
                    continue;
                }
                ToolSpec spec = specOf(step);
                for (String parameter : spec.requiredParameters()) {
                    if (step.argument(parameter).isBound()) {
                        continue;
                    }
                    Optional<PlanStep> existing = existingProducer(steps, step, parameter);
                    if (existing.isPresent()) {
                        step = step.withArgument(parameter, ArgumentValue.reference(existing.get().id(), parameter));
                        steps.set(i, step);
                        continue;
                    }
                    Optional<ToolSpec> producer = defaultProducer(parameter, spec.name());
                    if (producer.isEmpty()) {
                        log.warn("No tool exports '{}' required by {} ({})", parameter, spec.name(), step.id());
                        step = step.failed(new StepError(ErrorKind.DEPENDENCY_UNSATISFIABLE,
                                "No available tool can supply '" + parameter + "' for " + spec.title(),
                                parameter), 0);
                        steps.set(i, step);
                        break;
                    }
                    if (++insertions > insertionLimit) {
                        throw new PlanRejectedException("Dependency resolution did not converge after "
                                + insertionLimit + " inserted steps", Plan.of(steps));
                    }
                    PlanStep inserted = PlanStep.pending("step-" + nextId++, producer.get().name(),
                            ArgumentBinding.fromEntities(producer.get(), entities));
                    log.debug("Inserted {} ({}) to supply '{}' for {}", inserted.id(), inserted.toolName(),
                            parameter, step.id());
                    steps.add(i, inserted);
                    steps.set(i + 1, step.withArgument(parameter, ArgumentValue.reference(inserted.id(), parameter)));
                    changed = true;
                    break;
                }
            }
        }

        Plan resolved = Plan.of(orderByReferences(steps));
        List<PlanStep> unsatisfiable = resolved.steps().stream()
                .filter(s -> s.error() != null && s.error().kind() == ErrorKind.DEPENDENCY_UNSATISFIABLE)
                .toList();
        if (!unsatisfiable.isEmpty()) {
            throw new PlanRejectedException(unsatisfiable.stream()
                    .map(s -> s.error().message())
                    .collect(Collectors.joining("; ")), resolved);
        }
        log.info("Resolved plan: {} steps, {} inserted: {}", resolved.size(), insertions, resolved.toolNames());
        return resolved;
    }

    private ToolSpec specOf(PlanStep step) {
        return registry.lookup(step.toolName())
                .orElseThrow(() -> new InternalFaultException("Plan step " + step.id()
                        + " references unregistered tool " + step.toolName()));
    }

    private Optional<PlanStep> existingProducer(List<PlanStep> steps, PlanStep consumer, String parameter) {
        return steps.stream()
                .filter(s -> !s.id().equals(consumer.id()))
                .filter(s -> s.status() != StepStatus.FAILED_TERMINAL)
                .filter(s -> specOf(s).exportsParameter(parameter))
                .findFirst();
    }

    private Optional<ToolSpec> defaultProducer(String parameter, String consumerTool) {
        return registry.toolsExporting(parameter).stream()
                .filter(spec -> !spec.name().equals(consumerTool))
                .findFirst();
    }

    /**
     * Stable topological order: among the steps whose prerequisites are all
     * placed, the one that came first in the input goes next.
     */
    private List<PlanStep> orderByReferences(List<PlanStep> steps) throws PlanRejectedException {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < steps.size(); i++) {
            index.put(steps.get(i).id(), i);
        }
        int[] pendingPrerequisites = new int[steps.size()];
        List<List<Integer>> dependents = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            dependents.add(new ArrayList<>());
        }
        for (int i = 0; i < steps.size(); i++) {
            for (String prerequisite : steps.get(i).prerequisites()) {
                Integer j = index.get(prerequisite);
                if (j == null) {
                    throw new InternalFaultException("Step " + steps.get(i).id()
                            + " references unknown step " + prerequisite);
                }
                pendingPrerequisites[i]++;
                dependents.get(j).add(i);
            }
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < steps.size(); i++) {
            if (pendingPrerequisites[i] == 0) {
                ready.add(i);
            }
        }
        List<PlanStep> ordered = new ArrayList<>();
        while (!ready.isEmpty()) {
            int next = ready.poll();
            ordered.add(steps.get(next));
            for (int dependent : dependents.get(next)) {
                if (--pendingPrerequisites[dependent] == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (ordered.size() < steps.size()) {
            String cyclic = steps.stream()
                    .filter(s -> !ordered.contains(s))
                    .map(PlanStep::id)
                    .collect(Collectors.joining(", "));
            throw new PlanRejectedException("Steps " + cyclic + " depend on each other in a cycle", Plan.of(steps));
        }
        return ordered;
    }

    private static int nextStepNumber(List<PlanStep> steps) {
        int max = 0;
        for (PlanStep step : steps) {
            if (step.id().startsWith("step-")) {
                try {
                    max = Math.max(max, Integer.parseInt(step.id().substring(5)));
                } catch (NumberFormatException e) {
                    log.debug("Step id {} is not numbered", step.id());
                }
            }
        }
        return Math.max(max, steps.size()) + 1;
    }
}
