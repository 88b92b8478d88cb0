package com.ledgerwise.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One tool invocation in a plan.
 *
 * @param id        stable identifier, unique within the plan
 * @param sequence  1-based position in the plan
 * @param toolName  registered tool to invoke
 * @param arguments argument bindings by parameter name
 * @param status    lifecycle status
 * @param retries   re-invocations performed so far
 * @param error     last failure; null unless the step failed or is awaiting a retry
 */
public record PlanStep(
    String id,
    int sequence,
    String toolName,
    Map<String, ArgumentValue> arguments,
    StepStatus status,
    int retries,
    StepError error
) implements Serializable {

    public PlanStep {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Step id must not be blank");
        }
        arguments = arguments == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        if (status == null) {
            status = StepStatus.PENDING;
        }
    }

    public static PlanStep pending(String id, String toolName, Map<String, ArgumentValue> arguments) {
        return new PlanStep(id, 0, toolName, arguments, StepStatus.PENDING, 0, null);
    }

    public PlanStep withSequence(int newSequence) {
        return new PlanStep(id, newSequence, toolName, arguments, status, retries, error);
    }

    public PlanStep withArgument(String parameter, ArgumentValue value) {
        var copy = new LinkedHashMap<>(arguments);
        copy.put(parameter, value);
        return new PlanStep(id, sequence, toolName, copy, status, retries, error);
    }

    public PlanStep withStatus(StepStatus newStatus) {
        return new PlanStep(id, sequence, toolName, arguments, newStatus, retries, error);
    }

    public PlanStep succeeded(int retryCount) {
        return new PlanStep(id, sequence, toolName, arguments, StepStatus.SUCCEEDED, retryCount, null);
    }

    /** Failed an attempt that will be retried. */
    public PlanStep retrying(StepError failure, int retryCount) {
        return new PlanStep(id, sequence, toolName, arguments, StepStatus.FAILED_RETRYABLE, retryCount, failure);
    }

    public PlanStep failed(StepError failure, int retryCount) {
        return new PlanStep(id, sequence, toolName, arguments, StepStatus.FAILED_TERMINAL, retryCount, failure);
    }

    /** Ids of the steps this step back-references, in argument order. */
    public Set<String> prerequisites() {
        var ids = new LinkedHashSet<String>();
        for (ArgumentValue value : arguments.values()) {
            if (value instanceof ArgumentValue.BackReference ref) {
                ids.add(ref.stepId());
            }
        }
        return ids;
    }

    public ArgumentValue argument(String parameter) {
        return arguments.getOrDefault(parameter, ArgumentValue.UNBOUND);
    }

    public List<String> unboundParameters() {
        var unbound = new ArrayList<String>();
        arguments.forEach((name, value) -> {
            if (!value.isBound()) {
                unbound.add(name);
            }
        });
        return unbound;
    }
}
