package com.ledgerwise.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * Outcome of executing one plan step.
 *
 * @param stepId   the step this result belongs to
 * @param toolName tool that was invoked
 * @param success  whether the step succeeded
 * @param output   tool output; null on failure
 * @param error    classified failure; null on success
 * @param retries  re-invocations performed
 */
public record StepResult(
    String stepId,
    String toolName,
    boolean success,
    ToolOutput output,
    StepError error,
    int retries
) implements Serializable {

    public static StepResult succeeded(PlanStep step, ToolOutput output, int retries) {
        return new StepResult(step.id(), step.toolName(), true, output, null, retries);
    }

    public static StepResult failed(PlanStep step, StepError error, int retries) {
        return new StepResult(step.id(), step.toolName(), false, null, error, retries);
    }

    public Map<String, Object> exports() {
        return output == null ? Map.of() : output.exports();
    }
}
