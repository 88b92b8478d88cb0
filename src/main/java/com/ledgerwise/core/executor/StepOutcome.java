package com.ledgerwise.core.executor;

import com.ledgerwise.core.model.PlanStep;
import com.ledgerwise.core.model.StepResult;

/**
 * A step after execution, together with its result.
 *
 * @param step   the step with its terminal status, retry count and error
 * @param result the result passed on to later steps and the aggregator
 */
public record StepOutcome(PlanStep step, StepResult result) {}
