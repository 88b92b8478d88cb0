package com.ledgerwise.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered list of plan steps. Step sequences always follow list position,
 * starting at 1.
 *
 * @param steps steps in execution order
 */
public record Plan(List<PlanStep> steps) implements Serializable {

    public Plan {
        var numbered = new ArrayList<PlanStep>();
        if (steps != null) {
            for (PlanStep step : steps) {
                int position = numbered.size() + 1;
                numbered.add(step.sequence() == position ? step : step.withSequence(position));
            }
        }
        steps = List.copyOf(numbered);
    }

    public static Plan of(List<PlanStep> steps) {
        return new Plan(steps);
    }

    public static Plan empty() {
        return new Plan(List.of());
    }

    public Optional<PlanStep> step(String id) {
        return steps.stream().filter(s -> s.id().equals(id)).findFirst();
    }

    public int size() {
        return steps.size();
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    /**
     * True when every back-reference points at a step placed strictly
     * earlier in the plan.
     */
    public boolean isOrdered() {
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < steps.size(); i++) {
            positions.put(steps.get(i).id(), i);
        }
        for (int i = 0; i < steps.size(); i++) {
            for (String prerequisite : steps.get(i).prerequisites()) {
                Integer position = positions.get(prerequisite);
                if (position == null || position >= i) {
                    return false;
                }
            }
        }
        return true;
    }

    public List<String> toolNames() {
        return steps.stream().map(PlanStep::toolName).toList();
    }
}
